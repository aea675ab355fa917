package com.warmlead.crm.sync.search;

import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.error.SyncException;
import com.warmlead.crm.sync.config.SearchProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request limit per user.
 */
@Component
public class SearchRateLimiter {

    private static final int CLEANUP_THRESHOLD = 1000;

    private final Clock clock;
    private final int maxRequests;
    private final long windowMs;
    private final Map<UUID, Window> windows = new ConcurrentHashMap<>();

    @Autowired
    public SearchRateLimiter(SearchProperties properties, Clock clock) {
        this(clock, properties.getRateLimitMaxRequests(), properties.getRateLimitWindow().toMillis());
    }

    SearchRateLimiter(Clock clock, int maxRequests, long windowMs) {
        this.clock = clock;
        this.maxRequests = maxRequests;
        this.windowMs = windowMs;
    }

    /**
     * Count one request for the user.
     *
     * @throws SyncException of kind RATE_LIMIT when the user's window is exhausted
     */
    public void acquire(UUID userId) {
        long now = clock.millis();
        if (windows.size() > CLEANUP_THRESHOLD) {
            windows.values().removeIf(window -> window.resetAtMs() <= now);
        }
        Window window = windows.compute(userId, (id, current) -> {
            if (current == null || current.resetAtMs() <= now) {
                return new Window(1, now + windowMs);
            }
            return new Window(current.count() + 1, current.resetAtMs());
        });
        if (window.count() > maxRequests) {
            long retryAfterSeconds = Math.max(1, (window.resetAtMs() - now + 999) / 1000);
            throw new SyncException(ErrorKind.RATE_LIMIT,
                "Search rate limit exceeded. Try again in " + retryAfterSeconds + " seconds");
        }
    }

    private record Window(int count, long resetAtMs) {
    }
}
