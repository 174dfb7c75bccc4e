package com.example.aggregator.routing;

/** {@code prefix} is the bare path segment, e.g. {@code github}. */
public record SourceDescriptor(String prefix, String exampleEndpoint, String description) {}
