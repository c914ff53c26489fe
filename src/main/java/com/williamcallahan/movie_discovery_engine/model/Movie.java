/**
 * Catalog item as returned by the movie catalog API
 *
 * @author William Callahan
 *
 * Features:
 * - Immutable record decoded directly from the catalog's snake_case JSON
 * - Missing optional fields fall back to empty/zero defaults
 * - Identity is the catalog id alone; two instances with the same id are the same movie
 * - Derived helpers for release year and image URLs
 */
package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.Optional;

@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Movie(
    int id,
    String title,
    String overview,

    @JsonProperty("poster_path")
    String posterPath,

    @JsonProperty("backdrop_path")
    String backdropPath,

    @JsonProperty("release_date")
    String releaseDate,

    @JsonProperty("vote_average")
    double voteAverage,

    @JsonProperty("vote_count")
    int voteCount,

    double popularity,

    @JsonProperty("genre_ids")
    List<Integer> genreIds,

    boolean adult,

    @JsonProperty("original_language")
    String originalLanguage,

    @JsonProperty("original_title")
    String originalTitle,

    boolean video
) {
    private static final String IMAGE_BASE_URL = "https://image.tmdb.org/t/p/";

    public Movie {
        title = title == null ? "" : title;
        overview = overview == null ? "" : overview;
        genreIds = genreIds == null ? List.of() : List.copyOf(genreIds);
        originalLanguage = originalLanguage == null ? "" : originalLanguage;
        originalTitle = originalTitle == null ? title : originalTitle;
    }

    /**
     * Year portion of the release date, when the date is present and well formed
     */
    public Optional<Integer> releaseYear() {
        if (releaseDate == null || releaseDate.isBlank()) {
            return Optional.empty();
        }
        String year = releaseDate.split("-", 2)[0];
        try {
            return Optional.of(Integer.parseInt(year));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public Optional<String> posterUrl() {
        return imageUrl("w500", posterPath);
    }

    public Optional<String> backdropUrl() {
        return imageUrl("original", backdropPath);
    }

    public int ratingPercentage() {
        return (int) Math.round(voteAverage * 10);
    }

    private static Optional<String> imageUrl(String size, String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(IMAGE_BASE_URL + size + path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Movie other)) return false;
        return id == other.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }
}
