package com.example.aggregator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** One recent pipeline run of one of the caller's most recently active projects. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GitlabPipeline(String project, long pipelineId, String status, String url) {}
