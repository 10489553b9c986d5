package in.signalbridge.service.marketdata;

/**
 * No quote fit for pricing an execution could be obtained. Always transient:
 * the next attempt may succeed once the feed recovers.
 */
public class QuoteUnavailableException extends RuntimeException {

    private final String instrument;

    public QuoteUnavailableException(String instrument, String message) {
        super(String.format("[QUOTES:%s] %s", instrument, message));
        this.instrument = instrument;
    }

    public QuoteUnavailableException(String instrument, String message, Throwable cause) {
        super(String.format("[QUOTES:%s] %s", instrument, message), cause);
        this.instrument = instrument;
    }

    public String getInstrument() {
        return instrument;
    }
}
