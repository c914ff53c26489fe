/**
 * Persisted form of the user's learned preferences
 *
 * @author William Callahan
 *
 * Features:
 * - Interaction history plus every weight derived from it
 * - Serialized as a single JSON document
 * - Mutable bean so the recommendation engine can update it under its own lock
 */
package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PreferenceProfile {

    public static final double DEFAULT_MIN_RATING = 6.0;
    public static final double DEFAULT_MAX_RATING = 10.0;
    public static final double DEFAULT_AVERAGE_RATING = 7.0;

    private Map<Integer, Double> genreWeights = new HashMap<>();
    private Map<Integer, Double> actorWeights = new HashMap<>();
    private Map<Integer, Double> directorWeights = new HashMap<>();
    private Map<String, Double> decadeWeights = new HashMap<>();
    private double preferredRatingMin = DEFAULT_MIN_RATING;
    private double preferredRatingMax = DEFAULT_MAX_RATING;
    private double averagePreferredRating = DEFAULT_AVERAGE_RATING;
    private List<InteractionEvent> history = new ArrayList<>();

    /**
     * Deep copy so callers can persist a snapshot outside the owner's lock
     */
    public PreferenceProfile copy() {
        PreferenceProfile copy = new PreferenceProfile();
        copy.setGenreWeights(new HashMap<>(genreWeights));
        copy.setActorWeights(new HashMap<>(actorWeights));
        copy.setDirectorWeights(new HashMap<>(directorWeights));
        copy.setDecadeWeights(new HashMap<>(decadeWeights));
        copy.setPreferredRatingMin(preferredRatingMin);
        copy.setPreferredRatingMax(preferredRatingMax);
        copy.setAveragePreferredRating(averagePreferredRating);
        copy.setHistory(new ArrayList<>(history));
        return copy;
    }

    /**
     * Replaces null collections left behind by partial JSON documents
     */
    public PreferenceProfile normalized() {
        if (genreWeights == null) genreWeights = new HashMap<>();
        if (actorWeights == null) actorWeights = new HashMap<>();
        if (directorWeights == null) directorWeights = new HashMap<>();
        if (decadeWeights == null) decadeWeights = new HashMap<>();
        if (history == null) history = new ArrayList<>();
        history.removeIf(event -> event == null || event.action() == null || event.timestamp() == null);
        return this;
    }
}
