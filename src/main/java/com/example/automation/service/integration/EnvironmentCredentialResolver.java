package com.example.automation.service.integration;

import com.example.automation.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Resolves credential references against the application environment, so secrets can be
 * supplied as environment variables or mounted configuration without being stored in
 * the database. Reference {@code github-acme} is looked up as
 * {@code automation.credentials.github-acme} (env var {@code AUTOMATION_CREDENTIALS_GITHUBACME}).
 */
@Component
@RequiredArgsConstructor
public class EnvironmentCredentialResolver implements CredentialResolver {

    static final String PREFIX = "automation.credentials.";

    private final Environment environment;

    @Override
    public CredentialHandle resolve(String tenantId, String credentialsRef) {
        if (credentialsRef == null || credentialsRef.isBlank()) {
            return CredentialHandle.none();
        }
        var value = environment.getProperty(PREFIX + credentialsRef);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Credential reference '" + credentialsRef + "' of tenant " + tenantId + " cannot be resolved");
        }
        return CredentialHandle.of(value);
    }
}
