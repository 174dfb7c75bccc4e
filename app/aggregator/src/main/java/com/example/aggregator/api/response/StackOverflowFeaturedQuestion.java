package com.example.aggregator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StackOverflowFeaturedQuestion(
    String title,
    String link,
    long bountyAmount,
    long answerCount,
    @Nullable String ownerDisplayName) {}
