package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only record of one user interaction with a movie
 *
 * @param id unique event id, used to deduplicate when merging persisted history
 * @param movieId catalog id of the movie
 * @param action what the user did
 * @param genreIds genres of the movie at the time of the interaction
 * @param rating catalog rating (0-10) at the time of the interaction
 * @param releaseYear release year, or null when unknown
 * @param timestamp when the interaction happened
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InteractionEvent(
    String id,
    int movieId,
    InteractionAction action,
    List<Integer> genreIds,
    double rating,
    Integer releaseYear,
    Instant timestamp
) {
    public InteractionEvent {
        id = id == null ? UUID.randomUUID().toString() : id;
        genreIds = genreIds == null ? List.of() : List.copyOf(genreIds);
    }

    public static InteractionEvent of(Movie movie, InteractionAction action, Instant timestamp) {
        return new InteractionEvent(
            UUID.randomUUID().toString(),
            movie.id(),
            action,
            movie.genreIds(),
            movie.voteAverage(),
            movie.releaseYear().orElse(null),
            timestamp);
    }
}
