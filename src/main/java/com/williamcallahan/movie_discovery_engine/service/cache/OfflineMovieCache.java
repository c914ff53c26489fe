/**
 * Longer-lived, disk-backed, category-indexed cache of movies
 *
 * @author William Callahan
 *
 * Features:
 * - Per-category TTLs; uncategorized entries live for 24 hours
 * - Category index preserves the order movies were listed in
 * - Bounded memory tier evicting the oldest cachedAt first
 * - Persists movies.json and index.json with atomic replace, only at explicit save points
 * - Drops disk entries older than the retention window at load time
 * - Never throws on missing, stale or unreadable data
 */
package com.williamcallahan.movie_discovery_engine.service.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.movie_discovery_engine.model.CacheCategory;
import com.williamcallahan.movie_discovery_engine.model.CacheStats;
import com.williamcallahan.movie_discovery_engine.model.CachedMovie;
import com.williamcallahan.movie_discovery_engine.model.Movie;
import com.williamcallahan.movie_discovery_engine.util.AtomicFiles;
import com.williamcallahan.movie_discovery_engine.util.LoggingUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

@Slf4j
@Service
public class OfflineMovieCache {

    static final String MOVIES_FILE = "movies.json";
    static final String INDEX_FILE = "index.json";

    private static final TypeReference<Map<Integer, CachedMovie>> MOVIES_TYPE = new TypeReference<>() { };
    private static final TypeReference<Map<CacheCategory, List<Integer>>> INDEX_TYPE = new TypeReference<>() { };

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Path directory;
    private final int maxMemoryEntries;
    private final Duration maxDiskAge;

    // Held across snapshot and write so saves reach disk in the order their snapshots were taken
    private final Object saveLock = new Object();

    // Both maps are guarded by this
    private final Map<Integer, CachedMovie> movies = new HashMap<>();
    private final Map<CacheCategory, List<Integer>> categoryIndex = new EnumMap<>(CacheCategory.class);

    public OfflineMovieCache(ObjectMapper objectMapper,
                             Clock clock,
                             @Value("${app.offline-cache.directory:${user.home}/.movie-discovery/offline-cache}") String directory,
                             @Value("${app.offline-cache.max-memory-entries:200}") int maxMemoryEntries,
                             @Value("${app.offline-cache.max-disk-age:7d}") Duration maxDiskAge) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = Paths.get(directory);
        this.maxMemoryEntries = maxMemoryEntries;
        this.maxDiskAge = maxDiskAge;
    }

    /**
     * Loads persisted entries, dropping anything cached longer ago than the disk retention window
     */
    @PostConstruct
    public void loadFromDisk() {
        Map<Integer, CachedMovie> loadedMovies = readFile(directory.resolve(MOVIES_FILE), MOVIES_TYPE).orElse(Map.of());
        Map<CacheCategory, List<Integer>> loadedIndex = readFile(directory.resolve(INDEX_FILE), INDEX_TYPE).orElse(Map.of());
        Instant cutoff = clock.instant().minus(maxDiskAge);

        synchronized (this) {
            movies.clear();
            categoryIndex.clear();
            loadedMovies.forEach((id, cached) -> {
                if (id != null && cached != null && cached.movie() != null && cached.cachedAt() != null
                        && cached.expiresAt() != null && cached.cachedAt().isAfter(cutoff)) {
                    movies.put(id, cached);
                }
            });
            loadedIndex.forEach((category, ids) -> {
                if (category != null && ids != null) {
                    categoryIndex.put(category, new ArrayList<>(ids));
                }
            });
            trimToCapacity();
        }
        log.info("Offline movie cache loaded {} of {} persisted movie(s) from {}",
            size(), loadedMovies.size(), directory);
    }

    /**
     * Adds or replaces one movie and appends it to the category index if absent
     * Not persisted until the next save point
     */
    public void cache(Movie movie, CacheCategory category) {
        if (movie == null) {
            return;
        }
        Instant now = clock.instant();
        synchronized (this) {
            movies.put(movie.id(), CachedMovie.of(movie, now, CacheCategory.ttlFor(category)));
            if (category != null) {
                List<Integer> ids = categoryIndex.computeIfAbsent(category, c -> new ArrayList<>());
                if (!ids.contains(movie.id())) {
                    ids.add(movie.id());
                }
            }
            trimToCapacity();
        }
    }

    public void cache(Movie movie) {
        cache(movie, null);
    }

    /**
     * Caches a full list for a category; the category index becomes exactly these ids, in order
     */
    public void cacheMovies(List<Movie> newMovies, CacheCategory category) {
        Instant now = clock.instant();
        Duration ttl = CacheCategory.ttlFor(category);
        synchronized (this) {
            LinkedHashSet<Integer> ids = new LinkedHashSet<>();
            for (Movie movie : newMovies) {
                if (movie == null) {
                    continue;
                }
                movies.put(movie.id(), CachedMovie.of(movie, now, ttl));
                ids.add(movie.id());
            }
            if (category != null) {
                categoryIndex.put(category, new ArrayList<>(ids));
            }
            trimToCapacity();
        }
        log.debug("Cached {} movie(s) for category {}", newMovies.size(), category);
        saveToDisk();
    }

    /**
     * @return the movie when present and fresh; an expired entry is evicted on the way out
     */
    public Optional<Movie> get(int movieId) {
        Instant now = clock.instant();
        synchronized (this) {
            CachedMovie cached = movies.get(movieId);
            if (cached == null) {
                return Optional.empty();
            }
            if (cached.isExpired(now)) {
                movies.remove(movieId);
                return Optional.empty();
            }
            return Optional.of(cached.movie());
        }
    }

    /**
     * @return fresh movies for the category in index order, skipping expired or missing ones
     */
    public List<Movie> getMovies(CacheCategory category) {
        Instant now = clock.instant();
        synchronized (this) {
            List<Integer> ids = categoryIndex.getOrDefault(category, List.of());
            List<Movie> result = new ArrayList<>(ids.size());
            for (Integer id : ids) {
                CachedMovie cached = movies.get(id);
                if (cached != null && !cached.isExpired(now)) {
                    result.add(cached.movie());
                }
            }
            return result;
        }
    }

    /**
     * True only when more than half of the indexed ids for the category are still fresh
     */
    public boolean hasCachedData(CacheCategory category) {
        Instant now = clock.instant();
        synchronized (this) {
            List<Integer> ids = categoryIndex.getOrDefault(category, List.of());
            if (ids.isEmpty()) {
                return false;
            }
            long valid = ids.stream()
                .map(movies::get)
                .filter(cached -> cached != null && !cached.isExpired(now))
                .count();
            return valid * 2 > ids.size();
        }
    }

    public CacheStats getStats() {
        Instant now = clock.instant();
        synchronized (this) {
            int expired = (int) movies.values().stream().filter(cached -> cached.isExpired(now)).count();
            Map<CacheCategory, Integer> counts = new EnumMap<>(CacheCategory.class);
            categoryIndex.forEach((category, ids) -> counts.put(category, ids.size()));
            return new CacheStats(movies.size(), movies.size() - expired, expired, counts);
        }
    }

    /**
     * Removes expired entries, rebuilds the category indices without them, then persists
     *
     * @return number of entries removed
     */
    public int clearExpired() {
        Instant now = clock.instant();
        int removed;
        synchronized (this) {
            int before = movies.size();
            movies.values().removeIf(cached -> cached.isExpired(now));
            removed = before - movies.size();
            categoryIndex.values().forEach(ids -> ids.removeIf(id -> !movies.containsKey(id)));
        }
        if (removed > 0) {
            log.info("Removed {} expired movie(s) from offline cache", removed);
        }
        saveToDisk();
        return removed;
    }

    /**
     * Empties memory and deletes the on-disk cache directory
     */
    public void clearAll() {
        synchronized (saveLock) {
            synchronized (this) {
                movies.clear();
                categoryIndex.clear();
            }
            deleteDirectory();
        }
        log.info("Offline movie cache cleared");
    }

    @PreDestroy
    public void forceSave() {
        saveToDisk();
    }

    public synchronized int size() {
        return movies.size();
    }

    private void saveToDisk() {
        synchronized (saveLock) {
            Map<Integer, CachedMovie> moviesSnapshot;
            Map<CacheCategory, List<Integer>> indexSnapshot = new EnumMap<>(CacheCategory.class);
            synchronized (this) {
                moviesSnapshot = new HashMap<>(movies);
                categoryIndex.forEach((category, ids) -> indexSnapshot.put(category, List.copyOf(ids)));
            }
            try {
                AtomicFiles.writeJson(objectMapper, directory.resolve(MOVIES_FILE), moviesSnapshot);
                AtomicFiles.writeJson(objectMapper, directory.resolve(INDEX_FILE), indexSnapshot);
                log.debug("Persisted {} offline movie(s) to {}", moviesSnapshot.size(), directory);
            } catch (IOException e) {
                LoggingUtils.warn(log, e, "Failed to persist offline movie cache to {}", directory);
            }
        }
    }

    private <T> Optional<T> readFile(Path file, TypeReference<T> type) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            LoggingUtils.warn(log, e, "Ignoring unreadable offline cache file {}", file);
            return Optional.empty();
        }
    }

    private void deleteDirectory() {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            LoggingUtils.warn(log, e, "Failed to delete offline cache directory {}", directory);
        }
    }

    // Caller holds the monitor
    private void trimToCapacity() {
        int overflow = movies.size() - maxMemoryEntries;
        if (overflow <= 0) {
            return;
        }
        List<Integer> oldest = movies.entrySet().stream()
            .sorted(Comparator.comparing(entry -> entry.getValue().cachedAt()))
            .limit(overflow)
            .map(Map.Entry::getKey)
            .toList();
        oldest.forEach(movies::remove);
        log.debug("Evicted {} oldest movie(s) from offline cache", oldest.size());
    }
}
