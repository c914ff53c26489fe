package com.williamcallahan.movie_discovery_engine.service.recommendation;

import com.williamcallahan.movie_discovery_engine.model.Genre;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static id-to-name table for the standard catalog movie genres
 */
public final class GenreCatalog {

    private static final Map<Integer, String> GENRES = new LinkedHashMap<>();

    static {
        GENRES.put(28, "Action");
        GENRES.put(12, "Adventure");
        GENRES.put(16, "Animation");
        GENRES.put(35, "Comedy");
        GENRES.put(80, "Crime");
        GENRES.put(99, "Documentary");
        GENRES.put(18, "Drama");
        GENRES.put(10751, "Family");
        GENRES.put(14, "Fantasy");
        GENRES.put(36, "History");
        GENRES.put(27, "Horror");
        GENRES.put(10402, "Music");
        GENRES.put(9648, "Mystery");
        GENRES.put(10749, "Romance");
        GENRES.put(878, "Science Fiction");
        GENRES.put(10770, "TV Movie");
        GENRES.put(53, "Thriller");
        GENRES.put(10752, "War");
        GENRES.put(37, "Western");
    }

    private GenreCatalog() {
    }

    public static Optional<String> name(int genreId) {
        return Optional.ofNullable(GENRES.get(genreId));
    }

    public static List<Genre> all() {
        return GENRES.entrySet().stream()
            .map(entry -> new Genre(entry.getKey(), entry.getValue()))
            .toList();
    }
}
