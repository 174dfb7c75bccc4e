package com.example.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sources.npm")
public record NpmProperties(String baseUrl) {

  public NpmProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://registry.npmjs.org" : baseUrl;
  }
}
