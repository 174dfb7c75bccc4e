package com.example.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sources.gfg")
public record GfgProperties(String statsBaseUrl, String potdUrl, String userAgent) {

  public GfgProperties {
    statsBaseUrl =
        statsBaseUrl == null || statsBaseUrl.isBlank()
            ? "https://geeks-for-geeks-stats-api.vercel.app"
            : statsBaseUrl;
    potdUrl =
        potdUrl == null || potdUrl.isBlank()
            ? "https://www.geeksforgeeks.org/problem-of-the-day"
            : potdUrl;
    userAgent =
        userAgent == null || userAgent.isBlank()
            ? "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko)"
                + " Chrome/91.0.4472.124 Safari/537.36"
            : userAgent;
  }
}
