package com.example.aggregator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HackerNewsStory(
    long id,
    String title,
    @Nullable String url,
    String by,
    long score,
    long time,
    String type,
    long descendants) {}
