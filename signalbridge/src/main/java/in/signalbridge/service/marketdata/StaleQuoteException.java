package in.signalbridge.service.marketdata;

import java.time.Duration;

/**
 * The best available quote is older than the freshness threshold.
 */
public class StaleQuoteException extends QuoteUnavailableException {

    private final Duration age;

    public StaleQuoteException(String instrument, Duration age, Duration threshold) {
        super(instrument, "Quote is " + age.toMillis() + "ms old, threshold " + threshold.toMillis() + "ms");
        this.age = age;
    }

    public Duration getAge() {
        return age;
    }
}
