package com.example.aggregator.service;

import com.example.aggregator.api.response.DevtoArticle;
import com.example.aggregator.config.DevtoProperties;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class DevtoClient {

  static final String SOURCE = "DEV.to";

  private static final String API_KEY_HEADER = "api-key";
  private static final int ARTICLE_LIMIT = 10;

  private final RestClient devtoRestClient;
  private final DevtoProperties properties;
  private final UpstreamExchange upstreamExchange;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public DevtoClient(
      RestClient devtoRestClient, DevtoProperties properties, UpstreamExchange upstreamExchange) {
    this.devtoRestClient = devtoRestClient;
    this.properties = properties;
    this.upstreamExchange = upstreamExchange;
  }

  public List<DevtoArticle> listLatestArticles() {
    final String apiKey = requireApiKey();
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Error fetching articles",
            () ->
                devtoRestClient
                    .get()
                    .uri("/articles/latest?per_page={perPage}", ARTICLE_LIMIT)
                    .header(API_KEY_HEADER, apiKey)
                    .retrieve()
                    .body(JsonNode.class));
    return JsonFields.elements(JsonFields.requireArray(body, SOURCE)).stream()
        .limit(ARTICLE_LIMIT)
        .map(DevtoClient::toArticle)
        .toList();
  }

  public DevtoArticle getArticle(long articleId) {
    final String apiKey = requireApiKey();
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Error fetching article",
            "Article with ID " + articleId + " not found.",
            () ->
                devtoRestClient
                    .get()
                    .uri("/articles/{id}", articleId)
                    .header(API_KEY_HEADER, apiKey)
                    .retrieve()
                    .body(JsonNode.class));
    if (body == null || !body.isObject()) {
      throw SourceIntegrationException.invalidResponse(SOURCE, "DEV.to article is not an object.");
    }
    return toArticle(body);
  }

  private String requireApiKey() {
    if (!properties.hasApiKey()) {
      throw SourceIntegrationException.misconfigured(SOURCE, "DEVTO_API_KEY");
    }
    return properties.apiKey();
  }

  private static DevtoArticle toArticle(JsonNode article) {
    return new DevtoArticle(
        JsonFields.requiredLong(article, "id", SOURCE),
        JsonFields.text(article, "title", "No Title"),
        JsonFields.text(article, "url", ""),
        JsonFields.optionalText(article.path("user"), "name"),
        joinTags(article.get("tag_list")));
  }

  // The list endpoint sends tag_list as an array, the single-article endpoint as a string.
  static String joinTags(@Nullable JsonNode tagList) {
    if (tagList == null) {
      return "";
    }
    if (tagList.isArray()) {
      return String.join(
          ", ", JsonFields.elements(tagList).stream().map(JsonNode::asText).toList());
    }
    if (tagList.isTextual()) {
      return tagList.asText();
    }
    return "";
  }
}
