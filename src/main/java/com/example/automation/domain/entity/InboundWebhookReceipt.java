package com.example.automation.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Dedup ledger for inbound webhooks. The unique key makes a second receipt of the
 * same provider event fail at insert time.
 */
@Entity
@Table(name = "inbound_webhook_receipts",
        uniqueConstraints = @UniqueConstraint(name = "uk_receipt_webhook_event", columnNames = {"webhook_id", "provider_event_id"}),
        indexes = @Index(name = "idx_receipt_received", columnList = "received_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InboundWebhookReceipt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "webhook_id", nullable = false)
    private UUID webhookId;

    @Column(name = "provider_event_id", nullable = false, length = 200)
    private String providerEventId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "event_type", length = 100)
    private String eventType;

    @Column(name = "payload_hash", length = 64)
    private String payloadHash;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;
}
