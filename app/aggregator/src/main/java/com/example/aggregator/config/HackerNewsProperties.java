package com.example.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sources.hackernews")
public record HackerNewsProperties(String itemBaseUrl, String searchBaseUrl) {

  public HackerNewsProperties {
    itemBaseUrl =
        itemBaseUrl == null || itemBaseUrl.isBlank()
            ? "https://hacker-news.firebaseio.com/v0"
            : itemBaseUrl;
    searchBaseUrl =
        searchBaseUrl == null || searchBaseUrl.isBlank()
            ? "https://hn.algolia.com/api/v1"
            : searchBaseUrl;
  }
}
