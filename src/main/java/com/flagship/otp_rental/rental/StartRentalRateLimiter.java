package com.flagship.otp_rental.rental;

import com.flagship.otp_rental.config.RentalProperties;
import com.flagship.otp_rental.exception.RateLimitedException;
import com.flagship.otp_rental.observability.RentalMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Per-user throttle on starting rentals, protecting the shared upstream accounts.
 *
 * Two rules:
 * 1. At least {@code min-spacing} between two starts
 * 2. At most {@code max-starts-per-window} starts per {@code window}
 *
 * Redis fast path so the limits hold across instances; any Redis failure
 * falls back to an in-memory limiter for this instance.
 */
@Service
@Slf4j
public class StartRentalRateLimiter {

    static final String SPACING_RULE = "min_spacing";
    static final String WINDOW_RULE = "max_per_window";

    private static final String SPACING_KEY_PREFIX = "rental:start:spacing:";
    private static final String WINDOW_KEY_PREFIX = "rental:start:window:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final RentalProperties.RateLimit limits;
    private final RentalMetrics metrics;
    private final Clock clock;

    private final Map<Long, Deque<Instant>> localStarts = new ConcurrentHashMap<>();

    public StartRentalRateLimiter(Optional<StringRedisTemplate> redisTemplate,
                                  RentalProperties properties,
                                  RentalMetrics metrics,
                                  Clock clock) {
        this.redisTemplate = redisTemplate;
        this.limits = properties.getRateLimit();
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Records a start attempt for the user.
     *
     * @throws RateLimitedException if either rule is violated
     */
    public void acquire(Long userId) {
        if (!limits.isEnabled()) {
            return;
        }

        if (redisTemplate.isPresent()) {
            try {
                acquireWithRedis(redisTemplate.get(), userId);
                return;
            } catch (RateLimitedException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Redis rate limit check failed for user {}, using local limiter: {}",
                        userId, e.getMessage());
            }
        }

        acquireLocally(userId);
    }

    private void acquireWithRedis(StringRedisTemplate redis, Long userId) {
        if (!limits.getMinSpacing().isZero()) {
            String spacingKey = SPACING_KEY_PREFIX + userId;
            Boolean claimed = redis.opsForValue().setIfAbsent(spacingKey, "1", limits.getMinSpacing());
            if (!Boolean.TRUE.equals(claimed)) {
                Long remainingMs = redis.getExpire(spacingKey, TimeUnit.MILLISECONDS);
                throw rejected(userId, SPACING_RULE, remaining(remainingMs, limits.getMinSpacing()));
            }
        }

        String windowKey = WINDOW_KEY_PREFIX + userId;
        Long count = redis.opsForValue().increment(windowKey);
        if (count != null && count == 1L) {
            redis.expire(windowKey, limits.getWindow());
        }
        if (count != null && count > limits.getMaxStartsPerWindow()) {
            Long remainingMs = redis.getExpire(windowKey, TimeUnit.MILLISECONDS);
            throw rejected(userId, WINDOW_RULE, remaining(remainingMs, limits.getWindow()));
        }
    }

    private void acquireLocally(Long userId) {
        Instant now = clock.instant();

        // compute() runs atomically per key; a rejection leaves the map unchanged
        localStarts.compute(userId, (id, existing) -> {
            Deque<Instant> starts = existing != null ? existing : new ArrayDeque<>();
            dropExpired(starts, now);

            Instant last = starts.peekLast();
            if (last != null) {
                Duration sinceLast = Duration.between(last, now);
                if (sinceLast.compareTo(limits.getMinSpacing()) < 0) {
                    throw rejected(userId, SPACING_RULE, limits.getMinSpacing().minus(sinceLast));
                }
            }

            if (starts.size() >= limits.getMaxStartsPerWindow()) {
                Instant oldest = starts.peekFirst();
                Duration untilOldestLeaves = oldest != null
                        ? Duration.between(now, oldest.plus(limits.getWindow()))
                        : limits.getWindow();
                throw rejected(userId, WINDOW_RULE, untilOldestLeaves);
            }

            starts.addLast(now);
            return starts;
        });
    }

    /**
     * Forgets users with no start inside the window, so the local limiter only
     * holds recently active users.
     */
    @Scheduled(fixedDelayString = "${rental.rate-limit.eviction-interval-ms:60000}")
    public void evictIdleUsers() {
        Instant now = clock.instant();
        for (Long userId : localStarts.keySet()) {
            localStarts.computeIfPresent(userId, (id, starts) -> {
                dropExpired(starts, now);
                return starts.isEmpty() ? null : starts;
            });
        }
    }

    int trackedUserCount() {
        return localStarts.size();
    }

    private void dropExpired(Deque<Instant> starts, Instant now) {
        Instant cutoff = now.minus(limits.getWindow());
        while (!starts.isEmpty() && !starts.peekFirst().isAfter(cutoff)) {
            starts.pollFirst();
        }
    }

    private RateLimitedException rejected(Long userId, String rule, Duration retryAfter) {
        metrics.recordRateLimited(rule);
        log.info("Start rental rate limited: userId={}, rule={}, retryAfter={}", userId, rule, retryAfter);
        return new RateLimitedException(userId, retryAfter, rule);
    }

    // Redis reports -1/-2 for keys without TTL or already gone
    private static Duration remaining(Long remainingMs, Duration fallback) {
        return remainingMs != null && remainingMs > 0 ? Duration.ofMillis(remainingMs) : fallback;
    }
}
