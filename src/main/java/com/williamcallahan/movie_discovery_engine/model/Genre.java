package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Genre id and display name as published by the catalog
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Genre(int id, String name) {

    /**
     * Body of the genre list endpoint
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GenreList(List<Genre> genres) {
        public GenreList {
            genres = genres == null ? List.of() : List.copyOf(genres);
        }
    }
}
