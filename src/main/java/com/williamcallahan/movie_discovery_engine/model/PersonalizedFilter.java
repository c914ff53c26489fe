package com.williamcallahan.movie_discovery_engine.model;

/**
 * Browsing shortcut suggested from the user's taste
 *
 * @param id stable identifier, e.g. "genre_28" or "new_releases"
 * @param name display label
 * @param kind which criterion applies
 * @param genreId genre to match, for {@link Kind#GENRE}
 * @param minRating lowest catalog rating, for {@link Kind#MIN_RATING}
 * @param fromYear first release year, inclusive, for {@link Kind#YEAR_RANGE}
 * @param toYear last release year, inclusive, for {@link Kind#YEAR_RANGE}
 */
public record PersonalizedFilter(
    String id,
    String name,
    Kind kind,
    Integer genreId,
    Double minRating,
    Integer fromYear,
    Integer toYear
) {

    public enum Kind {
        GENRE,
        MIN_RATING,
        YEAR_RANGE
    }

    public static PersonalizedFilter genre(int genreId, String name) {
        return new PersonalizedFilter("genre_" + genreId, name, Kind.GENRE, genreId, null, null, null);
    }

    public static PersonalizedFilter minRating(String id, String name, double minRating) {
        return new PersonalizedFilter(id, name, Kind.MIN_RATING, null, minRating, null, null);
    }

    public static PersonalizedFilter yearRange(String id, String name, int fromYear, int toYear) {
        return new PersonalizedFilter(id, name, Kind.YEAR_RANGE, null, null, fromYear, toYear);
    }

    public boolean matches(Movie movie) {
        return switch (kind) {
            case GENRE -> movie.genreIds().contains(genreId);
            case MIN_RATING -> movie.voteAverage() >= minRating;
            case YEAR_RANGE -> movie.releaseYear().map(year -> year >= fromYear && year <= toYear).orElse(false);
        };
    }
}
