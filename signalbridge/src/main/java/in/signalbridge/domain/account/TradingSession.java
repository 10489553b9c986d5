package in.signalbridge.domain.account;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Four non-overlapping wall-clock session windows, defined in New York local time
 * (the zone is configurable so tests and other desks can pin it).
 *
 * <pre>
 * ASIA      17:00 - 01:00  (crosses midnight)
 * LONDON    01:00 - 06:00
 * NEW_YORK  06:00 - 14:00
 * LIMBO     14:00 - 17:00
 * </pre>
 *
 * This is the only session definition in the codebase. Live gating and any
 * reporting classify timestamps through {@link #at(Instant, ZoneId)}.
 */
public enum TradingSession {
    ASIA("asia_session", 17, 1),
    LONDON("london_session", 1, 6),
    NEW_YORK("new_york_session", 6, 14),
    LIMBO("limbo_session", 14, 17);

    public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/New_York");

    private final String columnName;
    private final int startHour;
    private final int endHour;

    TradingSession(String columnName, int startHour, int endHour) {
        this.columnName = columnName;
        this.startHour = startHour;
        this.endHour = endHour;
    }

    /**
     * Column of the account_settings table holding the enabled flag.
     */
    public String columnName() {
        return columnName;
    }

    public boolean contains(int hour) {
        if (startHour < endHour) {
            return hour >= startHour && hour < endHour;
        }
        return hour >= startHour || hour < endHour;
    }

    public static TradingSession at(Instant instant, ZoneId zone) {
        int hour = ZonedDateTime.ofInstant(instant, zone).getHour();
        for (TradingSession session : values()) {
            if (session.contains(hour)) {
                return session;
            }
        }
        // Unreachable: the windows cover all 24 hours
        throw new IllegalStateException("No session covers hour " + hour);
    }
}
