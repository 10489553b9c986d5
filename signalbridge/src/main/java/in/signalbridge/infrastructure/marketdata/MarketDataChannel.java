package in.signalbridge.infrastructure.marketdata;

import in.signalbridge.domain.market.Quote;

/**
 * One open duplex market-data stream.
 */
public interface MarketDataChannel {

    /**
     * Start streaming quote updates for the instrument.
     */
    void subscribe(String instrument, long requestId);

    /**
     * Ask the feed to push the latest known price for the instrument once.
     */
    void requestLastPrice(String instrument, long requestId);

    boolean isOpen();

    void close();

    /**
     * Callbacks from the stream. Invoked on the transport's I/O thread.
     */
    interface Listener {

        void onQuote(Quote quote);

        void onClosed(int statusCode, String reason);

        void onError(Throwable error);
    }
}
