package com.example.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Stack Exchange API settings.
 *
 * <p>{@code defaultUserId} is kept as text so that a malformed environment value surfaces as a
 * configuration error on the request that needs it rather than failing startup.
 */
@ConfigurationProperties(prefix = "sources.stackoverflow")
public record StackOverflowProperties(
    String baseUrl, String site, String defaultUserId, String defaultUsername) {

  public StackOverflowProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.stackexchange.com/2.3" : baseUrl;
    site = site == null || site.isBlank() ? "stackoverflow" : site;
  }
}
