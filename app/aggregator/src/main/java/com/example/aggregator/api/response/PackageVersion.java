package com.example.aggregator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Latest published version of a registry package, shared by the PyPI and npm routes. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PackageVersion(String packageName, String latestVersion) {}
