package in.signalbridge.domain.signal;

/**
 * Whether a signal targets the live or the demo trading environment.
 */
public enum MarketMode {
    LIVE,
    DEMO;

    /**
     * Alert payloads send {@code r=1} for live, anything else means demo.
     */
    public static MarketMode fromFlag(String flag) {
        return "1".equals(flag == null ? null : flag.trim()) ? LIVE : DEMO;
    }

    /**
     * Name the broker REST API expects in its "reality" field.
     */
    public String brokerReality() {
        return name();
    }
}
