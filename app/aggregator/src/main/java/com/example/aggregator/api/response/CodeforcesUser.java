package com.example.aggregator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CodeforcesUser(
    String handle,
    @Nullable String firstName,
    @Nullable String lastName,
    @Nullable String country,
    @Nullable String organization,
    @Nullable Integer rating,
    @Nullable Integer maxRating,
    @Nullable String rank,
    @Nullable String maxRank,
    @Nullable String lastOnline,
    String profileLink) {}
