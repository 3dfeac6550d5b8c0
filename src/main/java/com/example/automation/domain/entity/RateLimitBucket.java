package com.example.automation.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Persisted token bucket so every worker draws from the same allowance.
 * Updates are optimistic on {@code version}.
 */
@Entity
@Table(name = "rate_limit_buckets")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RateLimitBucket {

    /**
     * e.g. integration:{id} or webhook:{id}
     */
    @Id
    @Column(name = "bucket_key", length = 120)
    private String bucketKey;

    @Column(name = "tokens", nullable = false)
    private double tokens;

    @Column(name = "last_refill_at", nullable = false)
    private Instant lastRefillAt;

    @Version
    @Column(name = "version")
    private Long version;
}
