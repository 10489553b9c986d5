package in.signalbridge.service.marketdata;

import java.time.Duration;

/**
 * No quote arrived within the requested wait.
 */
public class QuoteTimeoutException extends QuoteUnavailableException {

    public QuoteTimeoutException(String instrument, Duration timeout) {
        super(instrument, "No quote received within " + timeout.toMillis() + "ms");
    }
}
