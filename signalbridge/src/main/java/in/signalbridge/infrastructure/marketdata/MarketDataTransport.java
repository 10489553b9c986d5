package in.signalbridge.infrastructure.marketdata;

import java.util.concurrent.CompletableFuture;

/**
 * Factory for market-data streams.
 */
public interface MarketDataTransport {

    /**
     * Open a new stream. The future completes once the handshake succeeded and
     * completes exceptionally if it failed.
     */
    CompletableFuture<MarketDataChannel> open(MarketDataChannel.Listener listener);
}
