package com.flagship.otp_rental.rental;

import com.flagship.otp_rental.config.RentalProperties;
import com.flagship.otp_rental.exception.RateLimitedException;
import com.flagship.otp_rental.observability.RentalMetrics;
import com.flagship.otp_rental.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class StartRentalRateLimiterTest {

    private RentalProperties properties;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        properties = new RentalProperties();
        properties.getRateLimit().setMinSpacing(Duration.ofSeconds(3));
        properties.getRateLimit().setWindow(Duration.ofMinutes(6));
        properties.getRateLimit().setMaxStartsPerWindow(3);
        clock = new MutableClock();
        meterRegistry = new SimpleMeterRegistry();
    }

    private StartRentalRateLimiter limiter(Optional<StringRedisTemplate> redis) {
        return new StartRentalRateLimiter(redis, properties, new RentalMetrics(meterRegistry), clock);
    }

    @Nested
    @DisplayName("In-memory limiter")
    class LocalTests {

        @Test
        @DisplayName("Second start within the spacing is rejected with the remaining wait")
        void spacingEnforced() {
            StartRentalRateLimiter limiter = limiter(Optional.empty());
            limiter.acquire(1L);
            clock.advance(Duration.ofSeconds(1));

            RateLimitedException e = assertThrows(RateLimitedException.class, () -> limiter.acquire(1L));

            assertEquals(Duration.ofSeconds(2), e.getRetryAfter());
            assertEquals(2, e.getRetryAfterSeconds());
            assertEquals(1.0, meterRegistry.counter("rental.rate_limited", "rule", "min_spacing").count());
        }

        @Test
        @DisplayName("Start after the spacing has passed is allowed")
        void spacingElapsed() {
            StartRentalRateLimiter limiter = limiter(Optional.empty());
            limiter.acquire(1L);
            clock.advance(Duration.ofSeconds(3));

            assertDoesNotThrow(() -> limiter.acquire(1L));
        }

        @Test
        @DisplayName("Window cap applies until the oldest start leaves the window")
        void windowCap() {
            StartRentalRateLimiter limiter = limiter(Optional.empty());
            for (int i = 0; i < 3; i++) {
                limiter.acquire(1L);
                clock.advance(Duration.ofSeconds(10));
            }

            RateLimitedException e = assertThrows(RateLimitedException.class, () -> limiter.acquire(1L));
            assertTrue(e.getRetryAfter().compareTo(Duration.ofMinutes(6)) < 0);

            clock.advance(Duration.ofMinutes(6));
            assertDoesNotThrow(() -> limiter.acquire(1L));
        }

        @Test
        @DisplayName("Users are limited independently")
        void perUser() {
            StartRentalRateLimiter limiter = limiter(Optional.empty());
            limiter.acquire(1L);

            assertDoesNotThrow(() -> limiter.acquire(2L));
        }

        @Test
        @DisplayName("Idle users are forgotten once their starts leave the window")
        void idleUsersEvicted() {
            StartRentalRateLimiter limiter = limiter(Optional.empty());
            limiter.acquire(1L);
            clock.advance(Duration.ofMinutes(3));
            limiter.acquire(2L);

            // Given user 1's only start is now outside the window
            clock.advance(Duration.ofMinutes(3));

            // When
            limiter.evictIdleUsers();

            // Then only user 2 is still tracked
            assertEquals(1, limiter.trackedUserCount());

            clock.advance(Duration.ofMinutes(3));
            limiter.evictIdleUsers();
            assertEquals(0, limiter.trackedUserCount());
        }

        @Test
        @DisplayName("A rejected first attempt does not leave an entry behind")
        void rejectedAttemptLeavesNoEntry() {
            properties.getRateLimit().setMaxStartsPerWindow(0);
            StartRentalRateLimiter limiter = limiter(Optional.empty());

            assertThrows(RateLimitedException.class, () -> limiter.acquire(1L));

            assertEquals(0, limiter.trackedUserCount());
        }

        @Test
        @DisplayName("Disabled limiter lets everything through")
        void disabled() {
            properties.getRateLimit().setEnabled(false);
            StartRentalRateLimiter limiter = limiter(Optional.empty());

            for (int i = 0; i < 10; i++) {
                limiter.acquire(1L);
            }
        }
    }

    @Nested
    @DisplayName("Redis limiter")
    class RedisTests {

        @Test
        @DisplayName("Spacing key already present means rejected, using the key TTL as retry-after")
        @SuppressWarnings("unchecked")
        void redisSpacing() {
            StringRedisTemplate redis = mock(StringRedisTemplate.class);
            ValueOperations<String, String> ops = mock(ValueOperations.class);
            when(redis.opsForValue()).thenReturn(ops);
            when(ops.setIfAbsent(eq("rental:start:spacing:1"), eq("1"), any(Duration.class))).thenReturn(false);
            when(redis.getExpire("rental:start:spacing:1", TimeUnit.MILLISECONDS)).thenReturn(1500L);

            RateLimitedException e = assertThrows(RateLimitedException.class, () -> limiter(Optional.of(redis)).acquire(1L));

            assertEquals(Duration.ofMillis(1500), e.getRetryAfter());
            assertEquals(2, e.getRetryAfterSeconds());
        }

        @Test
        @DisplayName("First start in a window sets the window expiry")
        @SuppressWarnings("unchecked")
        void redisWindowStarts() {
            StringRedisTemplate redis = mock(StringRedisTemplate.class);
            ValueOperations<String, String> ops = mock(ValueOperations.class);
            when(redis.opsForValue()).thenReturn(ops);
            when(ops.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
            when(ops.increment("rental:start:window:1")).thenReturn(1L);

            limiter(Optional.of(redis)).acquire(1L);

            verify(redis).expire("rental:start:window:1", Duration.ofMinutes(6));
        }

        @Test
        @DisplayName("Redis outage falls back to the in-memory limiter")
        void redisOutageFallsBack() {
            StringRedisTemplate redis = mock(StringRedisTemplate.class);
            when(redis.opsForValue()).thenThrow(new RedisConnectionFailureException("down"));
            StartRentalRateLimiter limiter = limiter(Optional.of(redis));

            limiter.acquire(1L);

            assertThrows(RateLimitedException.class, () -> limiter.acquire(1L));
        }
    }
}
