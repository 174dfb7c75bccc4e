package com.example.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** {@code baseUrl} is the instance root, e.g. a self-hosted GitLab; the REST API lives below it. */
@ConfigurationProperties(prefix = "sources.gitlab")
public record GitlabProperties(String baseUrl, String token) {

  public GitlabProperties {
    baseUrl =
        baseUrl == null || baseUrl.isBlank() ? "https://gitlab.com" : stripTrailingSlash(baseUrl);
  }

  public String apiBaseUrl() {
    return baseUrl + "/api/v4";
  }

  public boolean hasToken() {
    return token != null && !token.isBlank();
  }

  private static String stripTrailingSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }
}
