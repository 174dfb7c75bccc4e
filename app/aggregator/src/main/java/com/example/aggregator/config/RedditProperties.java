package com.example.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sources.reddit")
public record RedditProperties(String baseUrl, String userAgent) {

  public RedditProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://www.reddit.com" : baseUrl;
    userAgent =
        userAgent == null || userAgent.isBlank() ? "dev-aggregator/0.1 (gateway)" : userAgent;
  }
}
