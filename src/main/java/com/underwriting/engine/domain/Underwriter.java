package com.underwriting.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.Objects;

/**
 * Identity of the underwriter who made an override.
 */
public final class Underwriter {

    @NotBlank
    private final String id;

    @NotBlank
    private final String name;

    private final String role;

    @PositiveOrZero
    private final int experienceYears;

    @JsonCreator
    public Underwriter(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("role") String role,
            @JsonProperty("experienceYears") int experienceYears) {
        this.id = id;
        this.name = name;
        this.role = role;
        this.experienceYears = experienceYears;
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("role")
    public String getRole() {
        return role;
    }

    @JsonProperty("experienceYears")
    public int getExperienceYears() {
        return experienceYears;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Underwriter that = (Underwriter) o;
        return experienceYears == that.experienceYears &&
               Objects.equals(id, that.id) &&
               Objects.equals(name, that.name) &&
               Objects.equals(role, that.role);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, role, experienceYears);
    }

    @Override
    public String toString() {
        return name + " (" + id + ")";
    }
}
