package com.example.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sources.github")
public record GithubProperties(String baseUrl, String token) {

  public GithubProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.github.com" : baseUrl;
  }

  public boolean hasToken() {
    return token != null && !token.isBlank();
  }
}
