package com.example.automation.service.integration;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One item reported by an external service, identified by the service's own id.
 */
@Value
@Builder
public class ExternalItem {

    String id;
    Map<String, Object> data;
}
