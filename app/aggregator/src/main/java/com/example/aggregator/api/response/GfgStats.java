package com.example.aggregator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GfgStats(
    @Nullable Integer totalSolved,
    @Nullable Integer easy,
    @Nullable Integer medium,
    @Nullable Integer hard) {}
