package com.example.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sources.pypi")
public record PypiProperties(String baseUrl) {

  public PypiProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://pypi.org/pypi" : baseUrl;
  }
}
