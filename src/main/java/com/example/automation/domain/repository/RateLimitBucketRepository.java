package com.example.automation.domain.repository;

import com.example.automation.domain.entity.RateLimitBucket;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RateLimitBucketRepository extends JpaRepository<RateLimitBucket, String> {
}
