package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Cast and crew for one movie
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Credits(int id, List<CastMember> cast, List<CrewMember> crew) {

    public Credits {
        cast = cast == null ? List.of() : List.copyOf(cast);
        crew = crew == null ? List.of() : List.copyOf(crew);
    }

    public List<CastMember> topBilled(int limit) {
        return cast.stream().limit(Math.max(0, limit)).toList();
    }

    public Optional<CrewMember> director() {
        return crew.stream().filter(member -> "Director".equalsIgnoreCase(member.job())).findFirst();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CastMember(
        int id,
        String name,
        String character,
        int order,

        @JsonProperty("profile_path")
        String profilePath
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CrewMember(
        int id,
        String name,
        String job,
        String department,

        @JsonProperty("profile_path")
        String profilePath
    ) {
    }
}
