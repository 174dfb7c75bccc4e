package com.example.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sources.kaggle")
public record KaggleProperties(String baseUrl, String username, String key) {

  public KaggleProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://www.kaggle.com/api/v1" : baseUrl;
  }

  public boolean hasCredentials() {
    return username != null && !username.isBlank() && key != null && !key.isBlank();
  }
}
