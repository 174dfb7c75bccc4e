package com.example.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sources.devto")
public record DevtoProperties(String baseUrl, String apiKey) {

  public DevtoProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://dev.to/api" : baseUrl;
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
