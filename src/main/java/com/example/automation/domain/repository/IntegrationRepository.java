package com.example.automation.domain.repository;

import com.example.automation.domain.entity.Integration;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface IntegrationRepository extends JpaRepository<Integration, UUID> {

    @Query("""
            SELECT i FROM Integration i
            WHERE i.active = true
              AND i.nextSync IS NOT NULL
              AND i.nextSync <= :now
            ORDER BY i.nextSync ASC
            """)
    List<Integration> findDueIntegrations(@Param("now") Instant now, Pageable pageable);

    /**
     * Lease an integration by pushing next_sync to the lease expiry. If the worker dies
     * the integration becomes due again once the lease runs out.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Integration i
            SET i.nextSync = :leaseUntil,
                i.version = i.version + 1,
                i.updatedAt = :now
            WHERE i.id = :integrationId
              AND i.active = true
              AND i.nextSync = :expectedNextSync
            """)
    int claimSync(
            @Param("integrationId") UUID integrationId,
            @Param("expectedNextSync") Instant expectedNextSync,
            @Param("leaseUntil") Instant leaseUntil,
            @Param("now") Instant now);

    Page<Integration> findByTenantId(String tenantId, Pageable pageable);

    long countByActiveTrue();
}
