package com.centinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Country-subdivision code and display name of a snapshot.
 */
public record Geography(
        @JsonProperty("code") String code,
        @JsonProperty("name") String name
) {

    public static final String NATIONAL_CODE = "00";
    public static final String NATIONAL_NAME = "NACIONAL";

    public Geography {
        Objects.requireNonNull(code, "Geography code cannot be null");
        Objects.requireNonNull(name, "Geography name cannot be null");
    }

    public static Geography national() {
        return new Geography(NATIONAL_CODE, NATIONAL_NAME);
    }
}
