package com.example.automation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Name of this process as written to lease owners and execution records.
 */
@Slf4j
@Component
public class InstanceIdentity {

    private final String instanceId;

    public InstanceIdentity(@Value("${HOSTNAME:unknown}") String hostname) {
        String id;
        try {
            id = InetAddress.getLocalHost().getHostName() + "-" + ProcessHandle.current().pid();
        } catch (UnknownHostException e) {
            id = hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
        this.instanceId = id;
        log.info("Worker instance id: {}", instanceId);
    }

    public String getInstanceId() {
        return instanceId;
    }
}
