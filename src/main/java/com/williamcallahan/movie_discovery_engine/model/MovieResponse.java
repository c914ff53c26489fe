package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Page wrapper shared by every list endpoint of the catalog API
 *
 * @param page 1-based page number
 * @param results movies on this page
 * @param totalPages total number of pages available
 * @param totalResults total number of matching movies
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MovieResponse(
    int page,
    List<Movie> results,

    @JsonProperty("total_pages")
    int totalPages,

    @JsonProperty("total_results")
    int totalResults
) {
    public MovieResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static MovieResponse empty() {
        return new MovieResponse(1, List.of(), 0, 0);
    }

    /**
     * Wraps already-known movies as a single first page
     */
    public static MovieResponse singlePage(List<Movie> movies) {
        return new MovieResponse(1, movies, 1, movies == null ? 0 : movies.size());
    }

    @JsonIgnore
    public boolean hasMorePages() {
        return page < totalPages;
    }

    @JsonIgnore
    public int nextPage() {
        return hasMorePages() ? page + 1 : page;
    }

    @JsonIgnore
    public boolean isFirstPage() {
        return page == 1;
    }

    @JsonIgnore
    public boolean isLastPage() {
        return page >= totalPages;
    }
}
