package com.williamcallahan.movie_discovery_engine.service.credentials;

import java.util.Optional;

/**
 * Secure key-value store for secrets such as the catalog API key
 */
public interface CredentialStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void delete(String key);
}
