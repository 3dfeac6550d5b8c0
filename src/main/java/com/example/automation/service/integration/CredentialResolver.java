package com.example.automation.service.integration;

/**
 * Turns the opaque {@code credentials_ref} stored on an integration into a usable secret.
 */
public interface CredentialResolver {

    /**
     * @return the credential, or {@link CredentialHandle#none()} when {@code credentialsRef} is null
     * @throws com.example.automation.exception.ConfigurationException if the reference cannot be resolved
     */
    CredentialHandle resolve(String tenantId, String credentialsRef);
}
