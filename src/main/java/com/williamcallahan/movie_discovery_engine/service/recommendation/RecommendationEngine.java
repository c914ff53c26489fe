/**
 * Personalized movie scoring driven by the user's interaction history
 *
 * @author William Callahan
 *
 * Features:
 * - Append-only interaction log bounded by a retention window and a maximum size
 * - Incremental genre, decade, cast and director weights plus a preferred rating range
 * - 0-100 score where genre match dominates and already-seen movies are suppressed
 * - Single JSON profile persisted every few writes and on flush, never on each write
 * - Startup load merges with anything recorded before it finished; malformed files reset to defaults
 * - Quick filters derived from the strongest genres and the preferred rating
 */
package com.williamcallahan.movie_discovery_engine.service.recommendation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.movie_discovery_engine.model.InteractionAction;
import com.williamcallahan.movie_discovery_engine.model.InteractionEvent;
import com.williamcallahan.movie_discovery_engine.model.Movie;
import com.williamcallahan.movie_discovery_engine.model.PersonalizedFilter;
import com.williamcallahan.movie_discovery_engine.model.PreferenceProfile;
import com.williamcallahan.movie_discovery_engine.model.TasteProfile;
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
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
public class RecommendationEngine {

    static final double BASE_SCORE = 50.0;
    static final double ALREADY_INTERACTED_PENALTY = 50.0;
    static final double HIGH_RATING_THRESHOLD = 7.5;

    private static final double CAST_LIKE_WEIGHT = 1.0;
    private static final double CAST_DISLIKE_WEIGHT = -0.3;
    private static final double DIRECTOR_LIKE_WEIGHT = 1.5;
    private static final double DIRECTOR_DISLIKE_WEIGHT = -0.5;
    private static final double DECADE_DAMPING = 0.3;
    private static final double FAVORITE_DECADE_THRESHOLD = 0.5;
    private static final int QUICK_FILTER_GENRES = 3;

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Path storageFile;
    private final int maxHistory;
    private final Duration retention;
    private final int saveEvery;

    private final Object lock = new Object();
    // Guarded by lock
    private PreferenceProfile profile = new PreferenceProfile();
    // Cast and director weights recorded since the last successful save
    private final Map<Integer, Double> unsavedActorWeights = new HashMap<>();
    private final Map<Integer, Double> unsavedDirectorWeights = new HashMap<>();
    private int unsavedWrites;
    private boolean dirty;

    public RecommendationEngine(ObjectMapper objectMapper,
                                Clock clock,
                                @Value("${app.recommendation.storage-file:${user.home}/.movie-discovery/recommendation_preferences.json}") String storageFile,
                                @Value("${app.recommendation.max-history:500}") int maxHistory,
                                @Value("${app.recommendation.retention-days:90}") int retentionDays,
                                @Value("${app.recommendation.save-every:10}") int saveEvery) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.storageFile = Paths.get(storageFile);
        this.maxHistory = maxHistory;
        this.retention = Duration.ofDays(retentionDays);
        this.saveEvery = Math.max(1, saveEvery);
    }

    /**
     * Reads the persisted profile and merges it with anything recorded before the load completed
     */
    @PostConstruct
    public void load() {
        Optional<PreferenceProfile> persisted = readProfile();
        if (persisted.isEmpty()) {
            return;
        }
        synchronized (lock) {
            profile = merge(persisted.get(), profile, unsavedActorWeights, unsavedDirectorWeights);
            trimHistory();
        }
        log.info("Loaded recommendation profile with {} interaction(s) from {}", historySize(), storageFile);
    }

    // ==================== Recording ====================

    public void recordInteraction(Movie movie, InteractionAction action) {
        recordInteraction(InteractionEvent.of(movie, action, clock.instant()));
    }

    /**
     * Appends an event, updates every derived weight and trims the history
     */
    public void recordInteraction(InteractionEvent event) {
        if (event == null || event.action() == null || event.timestamp() == null) {
            throw new IllegalArgumentException("Interaction event requires an action and a timestamp");
        }
        boolean save;
        synchronized (lock) {
            profile.getHistory().add(event);
            applyWeights(profile, event);
            trimHistory();
            save = markWritten();
        }
        log.debug("Recorded {} for movie {}", event.action(), event.movieId());
        if (save) {
            flush();
        }
    }

    public void recordCastInteraction(int actorId, boolean liked) {
        boolean save;
        synchronized (lock) {
            double weight = liked ? CAST_LIKE_WEIGHT : CAST_DISLIKE_WEIGHT;
            profile.getActorWeights().merge(actorId, weight, Double::sum);
            unsavedActorWeights.merge(actorId, weight, Double::sum);
            save = markWritten();
        }
        if (save) {
            flush();
        }
    }

    public void recordDirectorInteraction(int directorId, boolean liked) {
        boolean save;
        synchronized (lock) {
            double weight = liked ? DIRECTOR_LIKE_WEIGHT : DIRECTOR_DISLIKE_WEIGHT;
            profile.getDirectorWeights().merge(directorId, weight, Double::sum);
            unsavedDirectorWeights.merge(directorId, weight, Double::sum);
            save = markWritten();
        }
        if (save) {
            flush();
        }
    }

    // ==================== Scoring ====================

    /**
     * Scores a movie against the current profile
     *
     * @return a value in [0, 100]; higher means a better match
     */
    public double score(Movie movie) {
        synchronized (lock) {
            return scoreLocked(movie, interactedIds());
        }
    }

    /**
     * Stable sort, best match first
     */
    public List<Movie> sortByRecommendation(List<Movie> movies) {
        Map<Movie, Double> scores = new LinkedHashMap<>();
        synchronized (lock) {
            Set<Integer> interacted = interactedIds();
            for (Movie movie : movies) {
                scores.putIfAbsent(movie, scoreLocked(movie, interacted));
            }
        }
        List<Movie> sorted = new ArrayList<>(movies);
        sorted.sort(Comparator.comparingDouble((Movie movie) -> scores.get(movie)).reversed());
        return sorted;
    }

    public List<Movie> filterInteracted(List<Movie> movies) {
        Set<Integer> interacted;
        synchronized (lock) {
            interacted = interactedIds();
        }
        return movies.stream().filter(movie -> !interacted.contains(movie.id())).toList();
    }

    /**
     * Movies not yet interacted with, best match first
     */
    public List<Movie> getRecommendations(List<Movie> candidates, int limit) {
        return sortByRecommendation(filterInteracted(candidates)).stream().limit(Math.max(0, limit)).toList();
    }

    private double scoreLocked(Movie movie, Set<Integer> interacted) {
        double score = BASE_SCORE;

        List<Integer> genres = movie.genreIds();
        if (!genres.isEmpty()) {
            double average = genres.stream()
                .mapToDouble(genreId -> profile.getGenreWeights().getOrDefault(genreId, 0.0))
                .average()
                .orElse(0.0);
            score += clamp(average * 6, -25, 30);
        }

        double rating = movie.voteAverage();
        double low = profile.getPreferredRatingMin();
        double high = profile.getPreferredRatingMax();
        if (rating >= low && rating <= high) {
            score += 15;
        } else {
            score -= 2 * Math.min(Math.abs(rating - low), Math.abs(rating - high));
        }

        if (rating >= HIGH_RATING_THRESHOLD) {
            score += (rating - HIGH_RATING_THRESHOLD) * 4;
        }

        if (movie.voteCount() > 1000) {
            score += Math.min(5, movie.voteCount() / 2000.0);
        }

        Optional<Integer> year = movie.releaseYear();
        if (year.isPresent()) {
            int currentYear = clock.instant().atZone(ZoneOffset.UTC).getYear();
            if (year.get() >= currentYear - 1) {
                score += 10;
            } else if (year.get() >= currentYear - 3) {
                score += 5;
            }
            Double decadeWeight = profile.getDecadeWeights().get(decadeOf(year.get()));
            if (decadeWeight != null) {
                score += clamp(decadeWeight * 5, -5, 5);
            }
        }

        if (interacted.contains(movie.id())) {
            score -= ALREADY_INTERACTED_PENALTY;
        }

        return clamp(score, 0, 100);
    }

    // ==================== Profile queries ====================

    public List<Integer> getTopGenres(int limit) {
        synchronized (lock) {
            return topPositive(profile.getGenreWeights(), limit);
        }
    }

    /**
     * At most three genres with a weight below -1, most disliked first
     */
    public List<Integer> getDislikedGenres() {
        synchronized (lock) {
            return profile.getGenreWeights().entrySet().stream()
                .filter(entry -> entry.getValue() < -1)
                .sorted(Map.Entry.comparingByValue())
                .limit(3)
                .map(Map.Entry::getKey)
                .toList();
        }
    }

    public List<Integer> getTopActors(int limit) {
        synchronized (lock) {
            return topPositive(profile.getActorWeights(), limit);
        }
    }

    public List<Integer> getTopDirectors(int limit) {
        synchronized (lock) {
            return topPositive(profile.getDirectorWeights(), limit);
        }
    }

    public TasteProfile getTasteProfile() {
        synchronized (lock) {
            List<Integer> topGenres = topPositive(profile.getGenreWeights(), 5);
            List<String> names = topGenres.stream()
                .map(GenreCatalog::name)
                .flatMap(Optional::stream)
                .toList();
            List<InteractionEvent> history = profile.getHistory();
            List<InteractionEvent> liked = history.stream().filter(event -> event.action().isPositive()).toList();
            double averageLiked = averageLikedRating();
            double likeRate = (double) liked.size() / Math.max(1, history.size());
            List<String> decades = profile.getDecadeWeights().entrySet().stream()
                .filter(entry -> entry.getValue() > FAVORITE_DECADE_THRESHOLD)
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .map(Map.Entry::getKey)
                .toList();
            return new TasteProfile(topGenres, names, averageLiked, history.size(), likeRate, decades);
        }
    }

    /**
     * Shortcut filters for browsing: one per top genre, "Critically Acclaimed" when the user
     * favours highly rated movies, and always the releases of the last two years
     */
    public List<PersonalizedFilter> getQuickFilters() {
        List<PersonalizedFilter> filters = new ArrayList<>();
        double averageLiked;
        synchronized (lock) {
            for (Integer genreId : topPositive(profile.getGenreWeights(), QUICK_FILTER_GENRES)) {
                GenreCatalog.name(genreId).ifPresent(name -> filters.add(PersonalizedFilter.genre(genreId, name)));
            }
            averageLiked = averageLikedRating();
        }
        if (averageLiked >= HIGH_RATING_THRESHOLD) {
            filters.add(PersonalizedFilter.minRating("high_rated", "Critically Acclaimed", HIGH_RATING_THRESHOLD));
        }
        int currentYear = clock.instant().atZone(ZoneOffset.UTC).getYear();
        filters.add(PersonalizedFilter.yearRange("new_releases", "New Releases", currentYear - 1, currentYear));
        return filters;
    }

    /**
     * @return a deep copy of the current profile
     */
    public PreferenceProfile snapshot() {
        synchronized (lock) {
            return profile.copy();
        }
    }

    public int historySize() {
        synchronized (lock) {
            return profile.getHistory().size();
        }
    }

    // ==================== Persistence ====================

    /**
     * Writes the profile if anything changed since the last write
     */
    @PreDestroy
    public void flush() {
        PreferenceProfile toSave;
        Map<Integer, Double> savedActorWeights;
        Map<Integer, Double> savedDirectorWeights;
        synchronized (lock) {
            if (!dirty) {
                return;
            }
            toSave = profile.copy();
            savedActorWeights = new HashMap<>(unsavedActorWeights);
            savedDirectorWeights = new HashMap<>(unsavedDirectorWeights);
            unsavedActorWeights.clear();
            unsavedDirectorWeights.clear();
            dirty = false;
            unsavedWrites = 0;
        }
        try {
            AtomicFiles.writeJson(objectMapper, storageFile, toSave);
            log.debug("Saved recommendation profile ({} interaction(s)) to {}", toSave.getHistory().size(), storageFile);
        } catch (IOException e) {
            synchronized (lock) {
                dirty = true;
                savedActorWeights.forEach((id, weight) -> unsavedActorWeights.merge(id, weight, Double::sum));
                savedDirectorWeights.forEach((id, weight) -> unsavedDirectorWeights.merge(id, weight, Double::sum));
            }
            LoggingUtils.warn(log, e, "Failed to save recommendation profile to {}", storageFile);
        }
    }

    /**
     * Clears every weight, the history and the persisted file
     */
    public void reset() {
        synchronized (lock) {
            profile = new PreferenceProfile();
            unsavedActorWeights.clear();
            unsavedDirectorWeights.clear();
            dirty = false;
            unsavedWrites = 0;
        }
        try {
            Files.deleteIfExists(storageFile);
        } catch (IOException e) {
            LoggingUtils.warn(log, e, "Failed to delete recommendation profile {}", storageFile);
        }
        log.info("Recommendation profile reset");
    }

    private Optional<PreferenceProfile> readProfile() {
        if (!Files.exists(storageFile)) {
            return Optional.empty();
        }
        try {
            PreferenceProfile loaded = objectMapper.readValue(storageFile.toFile(), PreferenceProfile.class);
            return Optional.ofNullable(loaded).map(PreferenceProfile::normalized);
        } catch (IOException e) {
            LoggingUtils.warn(log, e, "Ignoring malformed recommendation profile {}; starting from defaults", storageFile);
            return Optional.empty();
        }
    }

    // ==================== Internals (caller holds the lock) ====================

    private boolean markWritten() {
        dirty = true;
        unsavedWrites++;
        return unsavedWrites >= saveEvery;
    }

    private void trimHistory() {
        Instant cutoff = clock.instant().minus(retention);
        List<InteractionEvent> history = profile.getHistory();
        history.removeIf(event -> !event.timestamp().isAfter(cutoff));
        if (history.size() > maxHistory) {
            history.sort(Comparator.comparing(InteractionEvent::timestamp));
            history.subList(0, history.size() - maxHistory).clear();
        }
    }

    private double averageLikedRating() {
        return profile.getHistory().stream()
            .filter(event -> event.action().isPositive())
            .mapToDouble(InteractionEvent::rating)
            .average()
            .orElse(PreferenceProfile.DEFAULT_AVERAGE_RATING);
    }

    private Set<Integer> interactedIds() {
        Set<Integer> ids = new HashSet<>();
        profile.getHistory().forEach(event -> ids.add(event.movieId()));
        return ids;
    }

    /**
     * Loaded state first, then only what it does not already contain: events whose id is new
     * and cast or director weights recorded since the last save.
     * History stays in timestamp order.
     */
    private static PreferenceProfile merge(PreferenceProfile loaded,
                                           PreferenceProfile recorded,
                                           Map<Integer, Double> unsavedActorWeights,
                                           Map<Integer, Double> unsavedDirectorWeights) {
        PreferenceProfile merged = loaded.copy();
        unsavedActorWeights.forEach((id, weight) -> merged.getActorWeights().merge(id, weight, Double::sum));
        unsavedDirectorWeights.forEach((id, weight) -> merged.getDirectorWeights().merge(id, weight, Double::sum));

        Set<String> seen = new HashSet<>();
        merged.getHistory().forEach(event -> seen.add(event.id()));
        for (InteractionEvent event : recorded.getHistory()) {
            if (seen.add(event.id())) {
                merged.getHistory().add(event);
                applyWeights(merged, event);
            }
        }
        merged.getHistory().sort(Comparator.comparing(InteractionEvent::timestamp));
        return merged;
    }

    private static void applyWeights(PreferenceProfile target, InteractionEvent event) {
        double weight = event.action().getWeight();
        for (Integer genreId : event.genreIds()) {
            target.getGenreWeights().merge(genreId, weight, Double::sum);
        }
        if (event.action().isPositive()) {
            widenRatingRange(target, event.rating());
        }
        if (event.releaseYear() != null) {
            target.getDecadeWeights().merge(decadeOf(event.releaseYear()), weight * DECADE_DAMPING, Double::sum);
        }
    }

    private static void widenRatingRange(PreferenceProfile target, double rating) {
        target.setPreferredRatingMin(Math.max(0, Math.min(target.getPreferredRatingMin(), rating - 0.5)));
        target.setPreferredRatingMax(Math.min(10, Math.max(target.getPreferredRatingMax(), rating + 0.5)));
        target.setAveragePreferredRating(target.getAveragePreferredRating() * 0.9 + rating * 0.1);
    }

    private static List<Integer> topPositive(Map<Integer, Double> weights, int limit) {
        return weights.entrySet().stream()
            .filter(entry -> entry.getValue() > 0)
            .sorted(Map.Entry.<Integer, Double>comparingByValue().reversed())
            .limit(Math.max(0, limit))
            .map(Map.Entry::getKey)
            .toList();
    }

    static String decadeOf(int year) {
        return (year / 10 * 10) + "s";
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
