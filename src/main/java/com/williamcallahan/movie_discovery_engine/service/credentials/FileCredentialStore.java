/**
 * Credential store backed by a local properties file
 *
 * @author William Callahan
 *
 * Features:
 * - Owner-only file permissions where the file system supports POSIX attributes
 * - Atomic replace on every write
 * - Reads go through an in-memory copy loaded lazily on first use
 */
package com.williamcallahan.movie_discovery_engine.service.credentials;

import com.williamcallahan.movie_discovery_engine.exception.CredentialStoreException;
import com.williamcallahan.movie_discovery_engine.util.AtomicFiles;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Properties;

@Slf4j
@Component
public class FileCredentialStore implements CredentialStore {

    private final Path file;
    private Properties entries;

    @Autowired
    public FileCredentialStore(@Value("${app.credentials.file:${user.home}/.movie-discovery/credentials.properties}") String file) {
        this(Paths.get(file));
    }

    public FileCredentialStore(Path file) {
        this.file = file;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(load().getProperty(key)).filter(value -> !value.isBlank());
    }

    @Override
    public synchronized void set(String key, String value) {
        Properties updated = copyOf(load());
        updated.setProperty(key, value);
        persist(updated);
        entries = updated;
    }

    @Override
    public synchronized void delete(String key) {
        Properties current = load();
        if (!current.containsKey(key)) {
            return;
        }
        Properties updated = copyOf(current);
        updated.remove(key);
        persist(updated);
        entries = updated;
    }

    private Properties load() {
        if (entries != null) {
            return entries;
        }
        Properties loaded = new Properties();
        if (Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                loaded.load(in);
            } catch (IOException e) {
                throw new CredentialStoreException("Unable to read credential store " + file, e);
            }
        }
        entries = loaded;
        return loaded;
    }

    private void persist(Properties properties) {
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            properties.store(buffer, "movie-discovery credentials");
            AtomicFiles.writeBytes(file, buffer.toByteArray());
            restrictPermissions();
            log.debug("Credential store written to {}", file);
        } catch (IOException e) {
            throw new CredentialStoreException("Unable to write credential store " + file, e);
        }
    }

    private void restrictPermissions() throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }

    private static Properties copyOf(Properties source) {
        Properties copy = new Properties();
        copy.putAll(source);
        return copy;
    }
}
