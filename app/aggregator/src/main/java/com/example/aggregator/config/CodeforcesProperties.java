package com.example.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sources.codeforces")
public record CodeforcesProperties(String baseUrl, String defaultHandle) {

  public CodeforcesProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://codeforces.com/api" : baseUrl;
  }
}
