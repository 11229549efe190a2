package com.khaounen.registrationpolicy.security.policy.reputation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.serializer.GenericToStringSerializer;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracker shared between instances through Redis. Increment and TTL are set
 * by one Lua script, so a key never outlives its window even when the caller
 * gives up mid-call. The window is measured by Redis and {@code now} is not
 * consulted.
 * <p>
 * Every call is bounded by {@code timeout}. A slow, failing or saturated
 * store surfaces as {@link ReputationUnavailableException}.
 */
@Slf4j
public class RedisReputationTracker implements ReputationTracker, AutoCloseable {

    // PTTL < 0 re-arms a key that lost its TTL, e.g. one written by a plain INCR
    static final RedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>(
            "local count = redis.call('INCR', KEYS[1]) "
                    + "if count == 1 or redis.call('PTTL', KEYS[1]) < 0 then "
                    + "  redis.call('PEXPIRE', KEYS[1], ARGV[1]) "
                    + "end "
                    + "return count",
            Long.class
    );

    private static final RedisSerializer<String> ARGS_SERIALIZER = StringRedisSerializer.UTF_8;
    private static final RedisSerializer<Long> RESULT_SERIALIZER = new GenericToStringSerializer<>(Long.class);

    private final RedisTemplate<String, Long> redis;
    private final String keyPrefix;
    private final Duration timeout;
    private final ThreadPoolExecutor executor;

    public RedisReputationTracker(RedisTemplate<String, Long> redis, String keyPrefix, Duration timeout, int maxConcurrentCalls) {
        this.redis = redis;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.timeout = timeout == null || timeout.isNegative() || timeout.isZero() ? Duration.ofMillis(250) : timeout;
        int threads = Math.max(1, maxConcurrentCalls);
        AtomicInteger sequence = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                30,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(threads * 4),
                runnable -> {
                    Thread thread = new Thread(runnable, "registration-policy-redis-" + sequence.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
        this.executor.allowCoreThreadTimeOut(true);
    }

    @Override
    public long incrementAndCheck(String key, Duration window, Instant now) {
        String countKey = countKey(key);
        long windowMillis = window == null ? 1000 : Math.max(1, window.toMillis());
        Future<Long> pending;
        try {
            pending = executor.submit(() -> increment(countKey, windowMillis));
        } catch (RejectedExecutionException ex) {
            throw new ReputationUnavailableException("reputation store saturated", ex);
        }
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            pending.cancel(true);
            log.debug("reputation call for {} abandoned after {}ms", countKey, timeout.toMillis());
            throw new ReputationUnavailableException("reputation store timed out after " + timeout.toMillis() + "ms", ex);
        } catch (InterruptedException ex) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new ReputationUnavailableException("interrupted while waiting for reputation store", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new ReputationUnavailableException("reputation store failed: " + cause.getMessage(), cause);
        }
    }

    private long increment(String countKey, long windowMillis) {
        Long count = redis.execute(
                INCREMENT_SCRIPT,
                ARGS_SERIALIZER,
                RESULT_SERIALIZER,
                List.of(countKey),
                String.valueOf(windowMillis)
        );
        if (count == null) {
            throw new IllegalStateException("INCR returned no value for " + countKey);
        }
        return count;
    }

    private String countKey(String key) {
        return keyPrefix + key;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
