/**
 * Typed description of one GET request against the movie catalog API
 *
 * @author William Callahan
 *
 * Features:
 * - Path, query parameters and the expected response type in one value
 * - Factories for every catalog endpoint the application uses
 * - Never carries the API key; the client appends it when building the URI
 */
package com.williamcallahan.movie_discovery_engine.service;

import com.williamcallahan.movie_discovery_engine.model.Credits;
import com.williamcallahan.movie_discovery_engine.model.Genre;
import com.williamcallahan.movie_discovery_engine.model.Movie;
import com.williamcallahan.movie_discovery_engine.model.MovieResponse;
import com.williamcallahan.movie_discovery_engine.model.Person;
import com.williamcallahan.movie_discovery_engine.model.VideoResponse;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class CatalogEndpoint<T> {

    private final String path;
    private final Map<String, String> queryParams;
    private final Class<T> responseType;
    private final String description;
    private final boolean search;

    private CatalogEndpoint(String path, Map<String, String> queryParams, Class<T> responseType,
                            String description, boolean search) {
        this.path = path;
        this.queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        this.responseType = responseType;
        this.description = description;
        this.search = search;
    }

    public static CatalogEndpoint<MovieResponse> trending(int page) {
        return list("/trending/movie/day", page, "Trending movies");
    }

    public static CatalogEndpoint<MovieResponse> popular(int page) {
        return list("/movie/popular", page, "Popular movies");
    }

    public static CatalogEndpoint<MovieResponse> topRated(int page) {
        return list("/movie/top_rated", page, "Top rated movies");
    }

    public static CatalogEndpoint<MovieResponse> nowPlaying(int page) {
        return list("/movie/now_playing", page, "Now playing movies");
    }

    public static CatalogEndpoint<MovieResponse> upcoming(int page) {
        return list("/movie/upcoming", page, "Upcoming movies");
    }

    /**
     * Movies released during the six months before {@code today}, most popular first
     */
    public static CatalogEndpoint<MovieResponse> discoverRecent(int page, LocalDate today) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("page", String.valueOf(page));
        params.put("sort_by", "popularity.desc");
        params.put("include_adult", "false");
        params.put("include_video", "true");
        params.put("primary_release_date.gte", today.minusMonths(6).format(DateTimeFormatter.ISO_LOCAL_DATE));
        params.put("primary_release_date.lte", today.format(DateTimeFormatter.ISO_LOCAL_DATE));
        params.put("vote_count.gte", "50");
        return new CatalogEndpoint<>("/discover/movie", params, MovieResponse.class, "Recent movies", false);
    }

    public static CatalogEndpoint<MovieResponse> search(String query, int page) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("page", String.valueOf(page));
        params.put("include_adult", "false");
        return new CatalogEndpoint<>("/search/movie", params, MovieResponse.class, "Search: " + query, true);
    }

    public static CatalogEndpoint<Movie> movieDetails(int movieId) {
        return new CatalogEndpoint<>("/movie/" + movieId, Map.of(), Movie.class, "Movie details: " + movieId, false);
    }

    public static CatalogEndpoint<VideoResponse> videos(int movieId) {
        return new CatalogEndpoint<>("/movie/" + movieId + "/videos", Map.of(), VideoResponse.class,
            "Movie videos: " + movieId, false);
    }

    public static CatalogEndpoint<Credits> credits(int movieId) {
        return new CatalogEndpoint<>("/movie/" + movieId + "/credits", Map.of(), Credits.class,
            "Movie credits: " + movieId, false);
    }

    public static CatalogEndpoint<Person> person(int personId) {
        return new CatalogEndpoint<>("/person/" + personId, Map.of(), Person.class, "Person: " + personId, false);
    }

    public static CatalogEndpoint<Genre.GenreList> genres() {
        return new CatalogEndpoint<>("/genre/movie/list", Map.of(), Genre.GenreList.class, "Movie genres", false);
    }

    public static CatalogEndpoint<MovieResponse> similar(int movieId, int page) {
        return list("/movie/" + movieId + "/similar", page, "Similar movies: " + movieId);
    }

    public static CatalogEndpoint<MovieResponse> recommendations(int movieId, int page) {
        return list("/movie/" + movieId + "/recommendations", page, "Recommendations: " + movieId);
    }

    private static CatalogEndpoint<MovieResponse> list(String path, int page, String description) {
        return new CatalogEndpoint<>(path, Map.of("page", String.valueOf(page)), MovieResponse.class,
            description + " (page " + page + ")", false);
    }

    public String getPath() {
        return path;
    }

    public Map<String, String> getQueryParams() {
        return queryParams;
    }

    public Class<T> getResponseType() {
        return responseType;
    }

    public String getDescription() {
        return description;
    }

    public boolean isSearch() {
        return search;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CatalogEndpoint<?> other)) return false;
        return path.equals(other.path) && queryParams.equals(other.queryParams)
            && responseType.equals(other.responseType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, queryParams, responseType);
    }

    @Override
    public String toString() {
        return "CatalogEndpoint{" + path + " " + queryParams + "}";
    }
}
