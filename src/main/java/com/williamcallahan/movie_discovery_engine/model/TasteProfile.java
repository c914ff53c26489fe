package com.williamcallahan.movie_discovery_engine.model;

import java.util.List;

/**
 * Read-only summary of what the user seems to like
 *
 * @param topGenreIds strongest positive genres, best first
 * @param topGenreNames display names for {@code topGenreIds}
 * @param averagePreferredRating mean catalog rating of liked movies, 7.0 when nothing is liked yet
 * @param totalMoviesRated number of recorded interactions
 * @param likeRate share of interactions that were likes or super likes
 * @param favoriteDecades decades (e.g. "1990s") with a clearly positive weight
 */
public record TasteProfile(
    List<Integer> topGenreIds,
    List<String> topGenreNames,
    double averagePreferredRating,
    int totalMoviesRated,
    double likeRate,
    List<String> favoriteDecades
) {
    public TasteProfile {
        topGenreIds = List.copyOf(topGenreIds);
        topGenreNames = List.copyOf(topGenreNames);
        favoriteDecades = List.copyOf(favoriteDecades);
    }
}
