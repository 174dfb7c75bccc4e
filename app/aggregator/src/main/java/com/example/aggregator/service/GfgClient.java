/*
 * どこで: Aggregator サービス層
 * 何を: GeeksforGeeks の統計 API 呼び出しと「今日の問題」ページのスクレイピングを行う
 * なぜ: GFG は公式 API を持たないため、POTD は HTML から抽出するしかない
 */
package com.example.aggregator.service;

import com.example.aggregator.api.response.GfgProblemOfTheDay;
import com.example.aggregator.api.response.GfgStats;
import com.example.aggregator.config.GfgProperties;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class GfgClient {

  private static final Logger logger = LoggerFactory.getLogger(GfgClient.class);

  static final String SOURCE = "GFG";
  static final String POTD_FAILURE = "Failed to fetch or parse the GFG POTD page.";

  private static final String POTD_CONTAINER = "div[class*=POTD_header-main]";

  private final RestClient gfgRestClient;
  private final GfgProperties properties;
  private final UpstreamExchange upstreamExchange;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public GfgClient(
      RestClient gfgRestClient, GfgProperties properties, UpstreamExchange upstreamExchange) {
    this.gfgRestClient = gfgRestClient;
    this.properties = properties;
    this.upstreamExchange = upstreamExchange;
  }

  public GfgStats getStats(String username) {
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "GFG stats fetch failed for user '" + username + "'",
            "GFG user '" + username + "' not found.",
            () ->
                gfgRestClient
                    .get()
                    .uri("/?raw=y&userName={username}", username)
                    .retrieve()
                    .body(JsonNode.class));
    return new GfgStats(
        JsonFields.optionalInt(body, "totalProblemsSolved"),
        JsonFields.optionalInt(body, "easy"),
        JsonFields.optionalInt(body, "medium"),
        JsonFields.optionalInt(body, "hard"));
  }

  /** Any failure, from transport to a page layout change, is reported the same way. */
  public GfgProblemOfTheDay getProblemOfTheDay() {
    try {
      final String html =
          upstreamExchange.exchange(
              SOURCE,
              POTD_FAILURE,
              () ->
                  gfgRestClient
                      .get()
                      .uri(URI.create(properties.potdUrl()))
                      .header(HttpHeaders.USER_AGENT, properties.userAgent())
                      .retrieve()
                      .body(String.class));
      return parseProblemOfTheDay(html == null ? "" : html, properties.potdUrl());
    } catch (RuntimeException ex) {
      logger.warn("GFG POTD scrape failed: {}", ex.getMessage());
      throw new SourceIntegrationException(
          SourceIntegrationException.Reason.INVALID_RESPONSE, SOURCE, POTD_FAILURE, 0, ex);
    }
  }

  static GfgProblemOfTheDay parseProblemOfTheDay(String html, String pageUrl) {
    final Document document = Jsoup.parse(html, pageUrl);
    final Element container = document.selectFirst(POTD_CONTAINER);
    final Element anchor = container == null ? null : container.selectFirst("a[href]");
    if (anchor == null) {
      throw SourceIntegrationException.invalidResponse(SOURCE, "POTD link not found on page.");
    }
    final String link = anchor.absUrl("href");
    return new GfgProblemOfTheDay(
        anchor.text().trim(), link.isEmpty() ? anchor.attr("href") : link);
  }
}
