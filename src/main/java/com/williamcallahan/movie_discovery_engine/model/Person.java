package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Actor or crew member details from the person endpoint
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Person(
    int id,
    String name,
    String biography,
    String birthday,

    @JsonProperty("place_of_birth")
    String placeOfBirth,

    @JsonProperty("known_for_department")
    String knownForDepartment,

    @JsonProperty("profile_path")
    String profilePath,

    double popularity
) {
}
