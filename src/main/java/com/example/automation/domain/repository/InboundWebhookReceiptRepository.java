package com.example.automation.domain.repository;

import com.example.automation.domain.entity.InboundWebhookReceipt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface InboundWebhookReceiptRepository extends JpaRepository<InboundWebhookReceipt, UUID> {

    boolean existsByWebhookIdAndProviderEventId(UUID webhookId, String providerEventId);

    @Transactional
    @Modifying
    @Query("DELETE FROM InboundWebhookReceipt r WHERE r.receivedAt < :cutoff")
    int deleteReceivedBefore(@Param("cutoff") Instant cutoff);
}
