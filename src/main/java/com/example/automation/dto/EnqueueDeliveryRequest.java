package com.example.automation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnqueueDeliveryRequest {

    @NotBlank(message = "Event type is required")
    @Size(max = 100)
    private String eventType;

    @NotNull(message = "Payload is required")
    private Map<String, Object> payload;

    /**
     * Idempotency key; repeating a request with the same key returns the existing delivery
     */
    @Size(max = 100)
    private String deliveryId;
}
