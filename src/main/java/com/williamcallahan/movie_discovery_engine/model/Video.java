package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Video attached to a movie (trailer, teaser, clip)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Video(
    String id,
    String key,
    String name,
    String site,
    String type,
    boolean official,

    @JsonProperty("published_at")
    String publishedAt
) {
    @JsonIgnore
    public boolean isYouTube() {
        return "YouTube".equalsIgnoreCase(site);
    }

    @JsonIgnore
    public boolean isTrailer() {
        return "Trailer".equalsIgnoreCase(type);
    }

    public Optional<String> youTubeUrl() {
        return isYouTube() && key != null ? Optional.of("https://www.youtube.com/watch?v=" + key) : Optional.empty();
    }
}
