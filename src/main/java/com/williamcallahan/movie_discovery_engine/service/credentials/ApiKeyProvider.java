/**
 * Resolves the catalog API key for outgoing requests
 *
 * @author William Callahan
 *
 * Features:
 * - Reads the key from the secure credential store
 * - Falls back to the plaintext tmdb.api.key property (or TMDB_API_KEY) on first run
 * - Migrates a valid fallback key into the credential store
 * - Caches the resolved key in memory
 */
package com.williamcallahan.movie_discovery_engine.service.credentials;

import com.williamcallahan.movie_discovery_engine.config.TmdbConfigurationProperties;
import com.williamcallahan.movie_discovery_engine.exception.CredentialStoreException;
import com.williamcallahan.movie_discovery_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

@Slf4j
@Service
public class ApiKeyProvider {

    public static final String API_KEY_ENTRY = "tmdb.api.key";
    private static final Pattern KEY_FORMAT = Pattern.compile("^[A-Za-z0-9]{32,}$");

    private final CredentialStore credentialStore;
    private final String fallbackKey;
    private final AtomicReference<String> cachedKey = new AtomicReference<>();

    public ApiKeyProvider(CredentialStore credentialStore, TmdbConfigurationProperties properties) {
        this.credentialStore = credentialStore;
        this.fallbackKey = properties.getApi().getKey();
    }

    /**
     * @return the API key, or empty when none is configured anywhere
     */
    public Optional<String> getApiKey() {
        String cached = cachedKey.get();
        if (cached != null) {
            return Optional.of(cached);
        }

        Optional<String> stored = readStore();
        if (stored.isPresent()) {
            cachedKey.set(stored.get());
            return stored;
        }

        if (fallbackKey == null || fallbackKey.isBlank()) {
            return Optional.empty();
        }
        String key = fallbackKey.trim();
        migrate(key);
        cachedKey.set(key);
        return Optional.of(key);
    }

    /**
     * Validates and stores a new API key
     *
     * @throws IllegalArgumentException when the key is not at least 32 alphanumeric characters
     */
    public void setApiKey(String apiKey) {
        if (!isValidFormat(apiKey)) {
            throw new IllegalArgumentException("API key must be at least 32 alphanumeric characters");
        }
        credentialStore.set(API_KEY_ENTRY, apiKey.trim());
        cachedKey.set(apiKey.trim());
        log.info("Catalog API key updated");
    }

    public void clearApiKey() {
        credentialStore.delete(API_KEY_ENTRY);
        cachedKey.set(null);
        log.info("Catalog API key removed from credential store");
    }

    public boolean isConfigured() {
        return getApiKey().isPresent();
    }

    public static boolean isValidFormat(String apiKey) {
        return apiKey != null && KEY_FORMAT.matcher(apiKey.trim()).matches();
    }

    private Optional<String> readStore() {
        try {
            return credentialStore.get(API_KEY_ENTRY);
        } catch (CredentialStoreException e) {
            LoggingUtils.warn(log, e, "Credential store unavailable; falling back to configured API key");
            return Optional.empty();
        }
    }

    private void migrate(String key) {
        if (!isValidFormat(key)) {
            log.warn("Configured API key has an unexpected format; using it without migrating to the credential store");
            return;
        }
        try {
            credentialStore.set(API_KEY_ENTRY, key);
            log.info("Migrated configured API key into the credential store");
        } catch (CredentialStoreException e) {
            LoggingUtils.warn(log, e, "Failed to migrate API key into the credential store");
        }
    }
}
