package com.khaounen.registrationpolicy.security.policy.reputation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process tracker backed by a Caffeine cache. Increments go through the
 * map's atomic {@code compute}, so concurrent callers never lose a count.
 * Elapsed windows are reset lazily on access; an optional background sweep
 * reclaims entries nobody touches anymore.
 * <p>
 * The cache's ticker follows the latest instant callers pass in rather than
 * the system clock, so eviction and window checks share one time line.
 */
@Slf4j
public class LocalReputationTracker implements ReputationTracker, AutoCloseable {

    private final AtomicLong tickerNanos = new AtomicLong();

    private final Cache<String, Entry> counters = Caffeine.newBuilder()
            .ticker(tickerNanos::get)
            .expireAfter(new EntryExpiry())
            .build();

    private final ScheduledExecutorService sweeper;

    public LocalReputationTracker() {
        this(null, Clock.systemUTC());
    }

    public LocalReputationTracker(Duration sweepInterval, Clock clock) {
        if (sweepInterval == null || sweepInterval.isZero() || sweepInterval.isNegative()) {
            this.sweeper = null;
            return;
        }
        this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "registration-policy-reputation-sweep");
            thread.setDaemon(true);
            return thread;
        });
        long periodMillis = sweepInterval.toMillis();
        sweeper.scheduleAtFixedRate(() -> sweepQuietly(clock), periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public long incrementAndCheck(String key, Duration window, Instant now) {
        Duration safeWindow = window == null || window.isNegative() || window.isZero()
                ? Duration.ofSeconds(1)
                : window;
        advanceTicker(now);
        Entry entry = counters.asMap().compute(key, (k, existing) -> {
            if (existing == null || !existing.activeAt(now)) {
                return new Entry(1, now, now.plus(safeWindow), safeWindow);
            }
            return existing.increment();
        });
        return entry.count();
    }

    /**
     * Removes every entry whose window has ended at {@code now}. An entry
     * updated concurrently is left in place.
     *
     * @return number of entries removed by this call, not counting entries the
     * cache had already expired
     */
    public int sweep(Instant now) {
        int removed = 0;
        Map<String, Entry> view = counters.asMap();
        for (Map.Entry<String, Entry> candidate : view.entrySet()) {
            if (!candidate.getValue().activeAt(now) && view.remove(candidate.getKey(), candidate.getValue())) {
                removed++;
            }
        }
        advanceTicker(now);
        counters.cleanUp();
        return removed;
    }

    public long size() {
        counters.cleanUp();
        return counters.estimatedSize();
    }

    private void advanceTicker(Instant now) {
        tickerNanos.accumulateAndGet(epochNanos(now), Math::max);
    }

    private static long epochNanos(Instant instant) {
        return TimeUnit.SECONDS.toNanos(instant.getEpochSecond()) + instant.getNano();
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    private void sweepQuietly(Clock clock) {
        try {
            int removed = sweep(clock.instant());
            if (removed > 0) {
                log.debug("reputation sweep removed {} stale entries", removed);
            }
        } catch (RuntimeException ex) {
            log.warn("reputation sweep failed: {}", ex.getMessage());
        }
    }

    private record Entry(long count, Instant windowStart, Instant windowEnd, Duration window) {

        private boolean activeAt(Instant now) {
            return now.isBefore(windowEnd);
        }

        private Entry increment() {
            return new Entry(count + 1, windowStart, windowEnd, window);
        }
    }

    private static class EntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return remaining(value, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return remaining(value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long remaining(Entry value, long currentTime) {
            return Math.max(0, epochNanos(value.windowEnd()) - currentTime);
        }
    }
}
