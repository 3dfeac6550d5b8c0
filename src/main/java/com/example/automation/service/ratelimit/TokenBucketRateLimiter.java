package com.example.automation.service.ratelimit;

import com.example.automation.domain.entity.RateLimitBucket;
import com.example.automation.domain.repository.RateLimitBucketRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Token bucket whose state lives in the database, so every worker shares one allowance
 * per key and adding workers does not multiply the effective rate.
 * <p>
 * Each attempt reads the bucket, refills it by elapsed time, takes a token and writes it
 * back in its own transaction. A concurrent writer makes the version check fail and the
 * attempt is repeated against fresh state.
 */
@Slf4j
@Service
public class TokenBucketRateLimiter {

    static final int MAX_ATTEMPTS = 5;

    private final RateLimitBucketRepository bucketRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public TokenBucketRateLimiter(RateLimitBucketRepository bucketRepository, PlatformTransactionManager transactionManager, Clock clock) {
        this.bucketRepository = bucketRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Take one token from the bucket named {@code key}.
     *
     * @param capacity        bucket size, also the burst allowance
     * @param refillPerSecond tokens added per second
     */
    public RateLimitDecision tryAcquire(String key, double capacity, double refillPerSecond) {
        if (capacity <= 0 || refillPerSecond <= 0) {
            throw new IllegalArgumentException("Token bucket " + key + " needs positive capacity and refill rate");
        }

        for (var attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                var decision = transactionTemplate.execute(status -> consume(key, capacity, refillPerSecond));
                if (decision != null) {
                    return decision;
                }
            } catch (ObjectOptimisticLockingFailureException | DataIntegrityViolationException e) {
                log.debug("Concurrent update on rate limit bucket {} (attempt {}/{})", key, attempt, MAX_ATTEMPTS);
            }
        }

        // heavy contention means the bucket is being drained; treat as empty
        log.warn("Rate limit bucket {} still contended after {} attempts, denying", key, MAX_ATTEMPTS);
        return RateLimitDecision.deny((long) Math.ceil(1000 / refillPerSecond));
    }

    private RateLimitDecision consume(String key, double capacity, double refillPerSecond) {
        var now = clock.instant();
        var bucket = bucketRepository.findById(key).orElse(null);
        if (bucket == null) {
            bucketRepository.saveAndFlush(RateLimitBucket.builder()
                    .bucketKey(key)
                    .tokens(capacity - 1)
                    .lastRefillAt(now)
                    .build());
            return RateLimitDecision.allow();
        }

        var elapsedMs = Math.max(0, now.toEpochMilli() - bucket.getLastRefillAt().toEpochMilli());
        var tokens = Math.min(capacity, bucket.getTokens() + elapsedMs * refillPerSecond / 1000.0);

        if (tokens >= 1) {
            bucket.setTokens(tokens - 1);
            bucket.setLastRefillAt(now);
            bucketRepository.saveAndFlush(bucket);
            return RateLimitDecision.allow();
        }

        bucket.setTokens(tokens);
        bucket.setLastRefillAt(now);
        bucketRepository.saveAndFlush(bucket);
        var waitMs = (long) Math.ceil((1 - tokens) * 1000 / refillPerSecond);
        return RateLimitDecision.deny(waitMs);
    }
}
