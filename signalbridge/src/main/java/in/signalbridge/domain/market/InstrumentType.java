package in.signalbridge.domain.market;

public enum InstrumentType {
    FOREX,
    INDEX
}
