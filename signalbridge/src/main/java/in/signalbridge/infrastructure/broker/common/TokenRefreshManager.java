package in.signalbridge.infrastructure.broker.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Caches a broker access token and fetches a new one on demand.
 *
 * A token is reused until {@code expiresAt - refreshMargin}. Callers that get
 * HTTP 401 call {@link #forceRefresh()} and retry once.
 *
 * Usage:
 * <pre>
 * TokenRefreshManager tokens = new TokenRefreshManager(
 *     "SIMPLEFX", "primary", () -> fetchTokenFromBroker(), Duration.ofMinutes(1));
 *
 * String token = tokens.getToken();      // fetches on first use
 * ...
 * String fresh = tokens.forceRefresh();  // after a 401
 * </pre>
 */
public class TokenRefreshManager {

    private static final Logger log = LoggerFactory.getLogger(TokenRefreshManager.class);

    private final String brokerCode;
    private final String credentialName;
    private final Supplier<TokenInfo> tokenFetcher;
    private final Duration refreshMargin;
    private final Clock clock;

    private volatile TokenInfo currentToken;

    public TokenRefreshManager(String brokerCode, String credentialName,
                               Supplier<TokenInfo> tokenFetcher, Duration refreshMargin) {
        this(brokerCode, credentialName, tokenFetcher, refreshMargin, Clock.systemUTC());
    }

    public TokenRefreshManager(String brokerCode, String credentialName,
                               Supplier<TokenInfo> tokenFetcher, Duration refreshMargin, Clock clock) {
        this.brokerCode = brokerCode;
        this.credentialName = credentialName;
        this.tokenFetcher = tokenFetcher;
        this.refreshMargin = refreshMargin;
        this.clock = clock;
    }

    /**
     * Get a usable access token, fetching one if none is cached or the cached one
     * is about to expire.
     *
     * @throws TokenRefreshException if the fetch fails
     */
    public String getToken() {
        TokenInfo token = currentToken;
        if (token != null && !isExpiring(token)) {
            return token.accessToken();
        }
        synchronized (this) {
            token = currentToken;
            if (token == null || isExpiring(token)) {
                token = refreshToken();
            }
            return token.accessToken();
        }
    }

    /**
     * Discard the cached token and fetch a new one.
     *
     * @return the new access token
     * @throws TokenRefreshException if the fetch fails
     */
    public synchronized String forceRefresh() {
        log.info("[{}:{}] Forcing token refresh", brokerCode, credentialName);
        currentToken = null;
        return refreshToken().accessToken();
    }

    /**
     * Drop the cached token without fetching.
     */
    public synchronized void invalidate() {
        currentToken = null;
    }

    public boolean hasValidToken() {
        TokenInfo token = currentToken;
        return token != null && !isExpiring(token);
    }

    public TokenInfo getTokenInfo() {
        return currentToken;
    }

    private TokenInfo refreshToken() {
        log.debug("[{}:{}] Fetching token", brokerCode, credentialName);
        TokenInfo newToken;
        try {
            newToken = tokenFetcher.get();
        } catch (TokenRefreshException e) {
            throw e;
        } catch (Exception e) {
            log.error("[{}:{}] Token fetch failed: {}", brokerCode, credentialName, e.getMessage());
            throw new TokenRefreshException(brokerCode, credentialName, "Token fetch failed", e);
        }
        if (newToken == null) {
            throw new TokenRefreshException(brokerCode, credentialName, "Token fetcher returned null");
        }
        currentToken = newToken;
        log.info("[{}:{}] Token refreshed, expires at {}", brokerCode, credentialName, newToken.expiresAt());
        return newToken;
    }

    private boolean isExpiring(TokenInfo token) {
        return !clock.instant().isBefore(token.expiresAt().minus(refreshMargin));
    }

    /**
     * Token information record.
     */
    public record TokenInfo(String accessToken, Instant expiresAt) {
        public TokenInfo {
            if (accessToken == null || accessToken.isEmpty()) {
                throw new IllegalArgumentException("accessToken cannot be empty");
            }
            if (expiresAt == null) {
                throw new IllegalArgumentException("expiresAt cannot be null");
            }
        }
    }

    /**
     * Exception thrown when a token cannot be obtained.
     */
    public static class TokenRefreshException extends RuntimeException {
        private final String brokerCode;
        private final String credentialName;

        public TokenRefreshException(String brokerCode, String credentialName, String message) {
            super(String.format("[%s:%s] %s", brokerCode, credentialName, message));
            this.brokerCode = brokerCode;
            this.credentialName = credentialName;
        }

        public TokenRefreshException(String brokerCode, String credentialName,
                                     String message, Throwable cause) {
            super(String.format("[%s:%s] %s", brokerCode, credentialName, message), cause);
            this.brokerCode = brokerCode;
            this.credentialName = credentialName;
        }

        public String getBrokerCode() {
            return brokerCode;
        }

        public String getCredentialName() {
            return credentialName;
        }
    }
}
