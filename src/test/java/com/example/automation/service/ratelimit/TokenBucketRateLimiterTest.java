package com.example.automation.service.ratelimit;

import com.example.automation.domain.entity.RateLimitBucket;
import com.example.automation.domain.repository.RateLimitBucketRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TokenBucketRateLimiter Tests")
class TokenBucketRateLimiterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private RateLimitBucketRepository bucketRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private Clock clock;

    private final Map<String, RateLimitBucket> buckets = new HashMap<>();
    private TokenBucketRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        rateLimiter = new TokenBucketRateLimiter(bucketRepository, transactionManager, clock);
        lenient().when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        lenient().when(bucketRepository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(buckets.get(inv.<String>getArgument(0))));
        lenient().when(bucketRepository.saveAndFlush(any(RateLimitBucket.class))).thenAnswer(inv -> {
            RateLimitBucket bucket = inv.getArgument(0);
            buckets.put(bucket.getBucketKey(), bucket);
            return bucket;
        });
    }

    @Test
    @DisplayName("Should allow a burst up to capacity then deny with a wait hint")
    void shouldAllowBurstThenDeny() {
        // Given
        when(clock.instant()).thenReturn(T0);

        // When
        var first = rateLimiter.tryAcquire("webhook:1", 3, 1);
        var second = rateLimiter.tryAcquire("webhook:1", 3, 1);
        var third = rateLimiter.tryAcquire("webhook:1", 3, 1);
        var fourth = rateLimiter.tryAcquire("webhook:1", 3, 1);

        // Then
        assertThat(first.isAllowed()).isTrue();
        assertThat(second.isAllowed()).isTrue();
        assertThat(third.isAllowed()).isTrue();
        assertThat(fourth.isAllowed()).isFalse();
        assertThat(fourth.getWaitMs()).isEqualTo(1000);
    }

    @Test
    @DisplayName("Should refill by elapsed time without exceeding capacity")
    void shouldRefillOverTime() {
        // Given
        when(clock.instant()).thenReturn(T0, T0, T0.plusMillis(500), T0.plusSeconds(3600));
        rateLimiter.tryAcquire("k", 2, 1);
        rateLimiter.tryAcquire("k", 2, 1);

        // When
        var halfRefilled = rateLimiter.tryAcquire("k", 2, 1);
        var afterLongIdle = rateLimiter.tryAcquire("k", 2, 1);

        // Then
        assertThat(halfRefilled.isAllowed()).isFalse();
        assertThat(halfRefilled.getWaitMs()).isEqualTo(500);
        assertThat(afterLongIdle.isAllowed()).isTrue();
        assertThat(buckets.get("k").getTokens()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep separate buckets per key")
    void shouldIsolateKeys() {
        when(clock.instant()).thenReturn(T0);

        assertThat(rateLimiter.tryAcquire("a", 1, 1).isAllowed()).isTrue();
        assertThat(rateLimiter.tryAcquire("a", 1, 1).isAllowed()).isFalse();
        assertThat(rateLimiter.tryAcquire("b", 1, 1).isAllowed()).isTrue();
    }

    @Test
    @DisplayName("Should retry on a concurrent update and deny when contention persists")
    void shouldDenyUnderPersistentContention() {
        // Given
        when(clock.instant()).thenReturn(T0);
        buckets.put("hot", RateLimitBucket.builder().bucketKey("hot").tokens(5).lastRefillAt(T0).version(1L).build());
        doThrow(new ObjectOptimisticLockingFailureException(RateLimitBucket.class, "hot"))
                .when(bucketRepository).saveAndFlush(any(RateLimitBucket.class));

        // When
        var decision = rateLimiter.tryAcquire("hot", 5, 2);

        // Then
        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.getWaitMs()).isEqualTo(500);
        verify(bucketRepository, times(TokenBucketRateLimiter.MAX_ATTEMPTS)).saveAndFlush(any(RateLimitBucket.class));
    }

    @Test
    @DisplayName("Should reject a non-positive rate")
    void shouldRejectInvalidRate() {
        assertThatThrownBy(() -> rateLimiter.tryAcquire("k", 0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> rateLimiter.tryAcquire("k", 1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
