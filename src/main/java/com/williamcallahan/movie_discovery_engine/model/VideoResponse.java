package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Videos available for one movie
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VideoResponse(int id, List<Video> results) {

    public VideoResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }

    /**
     * Official YouTube trailers in the order the catalog returned them
     */
    public List<Video> officialTrailers() {
        return results.stream()
            .filter(Video::isYouTube)
            .filter(Video::isTrailer)
            .filter(Video::official)
            .toList();
    }

    /**
     * Best trailer to play: an official trailer first, then any YouTube trailer, then any YouTube video
     */
    public Optional<Video> primaryTrailer() {
        List<Video> official = officialTrailers();
        if (!official.isEmpty()) {
            return Optional.of(official.get(0));
        }
        return results.stream()
            .filter(Video::isYouTube)
            .min(Comparator.comparing((Video v) -> !v.isTrailer()));
    }
}
