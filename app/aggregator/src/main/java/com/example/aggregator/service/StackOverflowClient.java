package com.example.aggregator.service;

import com.example.aggregator.api.response.StackOverflowAnswer;
import com.example.aggregator.api.response.StackOverflowFeaturedQuestion;
import com.example.aggregator.api.response.StackOverflowQuestion;
import com.example.aggregator.api.response.StackOverflowSearchQuestion;
import com.example.aggregator.config.StackOverflowProperties;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class StackOverflowClient {

  private static final Logger logger = LoggerFactory.getLogger(StackOverflowClient.class);

  static final String SOURCE = "Stack Exchange";

  private static final int FEATURED_LIMIT = 15;
  private static final int USER_POSTS_LIMIT = 10;

  private final RestClient stackOverflowRestClient;
  private final StackOverflowProperties properties;
  private final UpstreamExchange upstreamExchange;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public StackOverflowClient(
      RestClient stackOverflowRestClient,
      StackOverflowProperties properties,
      UpstreamExchange upstreamExchange) {
    this.stackOverflowRestClient = stackOverflowRestClient;
    this.properties = properties;
    this.upstreamExchange = upstreamExchange;
  }

  public List<StackOverflowFeaturedQuestion> listFeaturedQuestions() {
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch featured questions",
            () ->
                stackOverflowRestClient
                    .get()
                    .uri(
                        "/questions/featured?order=desc&sort=activity&site={site}",
                        properties.site())
                    .retrieve()
                    .body(JsonNode.class));
    return JsonFields.arrayAt(body, "items").stream()
        .limit(FEATURED_LIMIT)
        .map(
            item ->
                new StackOverflowFeaturedQuestion(
                    JsonFields.requiredText(item, "title", SOURCE),
                    JsonFields.requiredText(item, "link", SOURCE),
                    JsonFields.longValue(item, "bounty_amount", 0),
                    JsonFields.longValue(item, "answer_count", 0),
                    JsonFields.optionalText(item.path("owner"), "display_name")))
        .toList();
  }

  public List<StackOverflowQuestion> listUserQuestions(
      @Nullable Long userId, @Nullable String username) {
    final long resolvedUserId = resolveUserId(userId, username);
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch questions",
            () ->
                stackOverflowRestClient
                    .get()
                    .uri(
                        "/users/{id}/questions?order=desc&sort=creation&site={site}",
                        resolvedUserId,
                        properties.site())
                    .retrieve()
                    .body(JsonNode.class));
    return JsonFields.arrayAt(body, "items").stream()
        .limit(USER_POSTS_LIMIT)
        .map(
            question ->
                new StackOverflowQuestion(
                    JsonFields.requiredLong(question, "question_id", SOURCE),
                    JsonFields.requiredText(question, "title", SOURCE),
                    JsonFields.requiredText(question, "link", SOURCE)))
        .toList();
  }

  public List<StackOverflowAnswer> listUserAnswers(
      @Nullable Long userId, @Nullable String username) {
    final long resolvedUserId = resolveUserId(userId, username);
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch answers",
            () ->
                stackOverflowRestClient
                    .get()
                    .uri(
                        "/users/{id}/answers?order=desc&sort=creation&site={site}",
                        resolvedUserId,
                        properties.site())
                    .retrieve()
                    .body(JsonNode.class));
    return JsonFields.arrayAt(body, "items").stream()
        .limit(USER_POSTS_LIMIT)
        .map(
            answer -> {
              final long answerId = JsonFields.requiredLong(answer, "answer_id", SOURCE);
              return new StackOverflowAnswer(
                  answerId,
                  JsonFields.requiredLong(answer, "question_id", SOURCE),
                  "https://stackoverflow.com/a/" + answerId);
            })
        .toList();
  }

  public List<StackOverflowSearchQuestion> search(String query, String tagged) {
    if (query == null || query.isBlank()) {
      throw SourceIntegrationException.badRequest(SOURCE, "Query parameter 'q' must not be blank.");
    }
    if (tagged == null || tagged.isBlank()) {
      throw SourceIntegrationException.badRequest(
          SOURCE, "Query parameter 'tagged' must not be blank.");
    }
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Error searching Stack Overflow",
            () ->
                stackOverflowRestClient
                    .get()
                    .uri(
                        "/search?intitle={query}&tagged={tagged}&sort=relevance&order=desc"
                            + "&site={site}",
                        query,
                        tagged,
                        properties.site())
                    .retrieve()
                    .body(JsonNode.class));
    return JsonFields.arrayAt(body, "items").stream()
        .map(
            item ->
                new StackOverflowSearchQuestion(
                    JsonFields.requiredLong(item, "question_id", SOURCE),
                    JsonFields.requiredText(item, "title", SOURCE),
                    JsonFields.requiredText(item, "link", SOURCE),
                    new StackOverflowSearchQuestion.Owner(
                        JsonFields.optionalText(item.path("owner"), "display_name")),
                    JsonFields.textList(item, "tags"),
                    JsonFields.longValue(item, "score", 0),
                    JsonFields.bool(item, "is_answered", false)))
        .toList();
  }

  /**
   * Resolves the account to read from, first match wins: explicit id, configured id, explicit
   * name, configured name. Names are looked up on every call.
   */
  long resolveUserId(@Nullable Long userId, @Nullable String username) {
    if (userId != null) {
      return userId;
    }
    if (hasText(properties.defaultUserId())) {
      return parseDefaultUserId(properties.defaultUserId());
    }
    if (hasText(username)) {
      return lookupUserId(username.trim());
    }
    if (hasText(properties.defaultUsername())) {
      return lookupUserId(properties.defaultUsername().trim());
    }
    throw SourceIntegrationException.badRequest(
        SOURCE, "A Stack Overflow user_id or username must be provided.");
  }

  private long lookupUserId(String username) {
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch user ID",
            () ->
                stackOverflowRestClient
                    .get()
                    .uri(
                        "/users?order=desc&sort=reputation&inname={name}&site={site}",
                        username,
                        properties.site())
                    .retrieve()
                    .body(JsonNode.class));
    final List<JsonNode> users = JsonFields.arrayAt(body, "items");
    if (users.isEmpty()) {
      throw SourceIntegrationException.notFound(
          SOURCE, "Stack Overflow user '" + username + "' not found");
    }
    return JsonFields.requiredLong(users.get(0), "user_id", SOURCE);
  }

  private long parseDefaultUserId(String configured) {
    try {
      return Long.parseLong(configured.trim());
    } catch (NumberFormatException ex) {
      logger.warn("STACKOVERFLOW_USER_ID is not numeric: {}", configured);
      throw new SourceIntegrationException(
          SourceIntegrationException.Reason.MISCONFIGURED,
          SOURCE,
          "STACKOVERFLOW_USER_ID must be a numeric user id.",
          0,
          ex);
    }
  }

  private static boolean hasText(@Nullable String value) {
    return value != null && !value.isBlank();
  }
}
