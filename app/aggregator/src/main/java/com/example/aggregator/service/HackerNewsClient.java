/*
 * どこで: Aggregator サービス層
 * 何を: Hacker News の Firebase API と Algolia 検索 API を呼び出す
 * なぜ: ID 一覧 → 個別アイテム取得の 2 段構成を fan-out で並列化し、固定スキーマで返すため
 */
package com.example.aggregator.service;

import com.example.aggregator.api.response.HackerNewsSearchHit;
import com.example.aggregator.api.response.HackerNewsStory;
import com.example.aggregator.api.response.HackerNewsUser;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class HackerNewsClient {

  static final String SOURCE = "Hacker News";

  private static final int FEED_LIMIT = 10;

  public enum StoryFeed {
    TOP("top"),
    NEW("new"),
    BEST("best");

    private final String path;

    StoryFeed(String path) {
      this.path = path;
    }

    public String path() {
      return path;
    }
  }

  private final RestClient hackerNewsItemRestClient;
  private final RestClient hackerNewsSearchRestClient;
  private final UpstreamExchange upstreamExchange;
  private final FanOutCoordinator fanOutCoordinator;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public HackerNewsClient(
      RestClient hackerNewsItemRestClient,
      RestClient hackerNewsSearchRestClient,
      UpstreamExchange upstreamExchange,
      FanOutCoordinator fanOutCoordinator) {
    this.hackerNewsItemRestClient = hackerNewsItemRestClient;
    this.hackerNewsSearchRestClient = hackerNewsSearchRestClient;
    this.upstreamExchange = upstreamExchange;
    this.fanOutCoordinator = fanOutCoordinator;
  }

  /**
   * First {@value #FEED_LIMIT} entries of a feed, in feed order.
   *
   * <p>Items that fail to load are skipped, as are entries that are not stories (jobs, polls).
   */
  public List<HackerNewsStory> listStories(StoryFeed feed) {
    final JsonNode ids =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch " + feed.path() + " stories",
            () ->
                hackerNewsItemRestClient
                    .get()
                    .uri("/{feed}stories.json", feed.path())
                    .retrieve()
                    .body(JsonNode.class));
    final List<Supplier<HackerNewsStory>> tasks = new ArrayList<>();
    for (JsonNode id : JsonFields.elements(JsonFields.requireArray(ids, SOURCE))) {
      if (tasks.size() == FEED_LIMIT) {
        break;
      }
      if (id.canConvertToLong()) {
        final long itemId = id.asLong();
        tasks.add(() -> fetchItem(itemId));
      }
    }
    return fanOutCoordinator.gather(SOURCE, tasks).stream()
        .filter(story -> "story".equals(story.type()))
        .toList();
  }

  public HackerNewsStory getItem(long itemId) {
    final HackerNewsStory story = fetchItem(itemId);
    if (story == null) {
      throw SourceIntegrationException.notFound(SOURCE, notFoundItemMessage(itemId));
    }
    return story;
  }

  public HackerNewsUser getUser(String userId) {
    final JsonNode user =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch user",
            "User '" + userId + "' not found",
            () ->
                hackerNewsItemRestClient
                    .get()
                    .uri("/user/{id}.json", userId)
                    .retrieve()
                    .body(JsonNode.class));
    if (user == null || !user.isObject()) {
      throw SourceIntegrationException.notFound(SOURCE, "User '" + userId + "' not found");
    }
    final List<Long> submitted = new ArrayList<>();
    for (JsonNode id : JsonFields.arrayAt(user, "submitted")) {
      if (id.canConvertToLong()) {
        submitted.add(id.asLong());
      }
    }
    return new HackerNewsUser(
        JsonFields.requiredText(user, "id", SOURCE),
        JsonFields.requiredLong(user, "created", SOURCE),
        JsonFields.requiredLong(user, "karma", SOURCE),
        JsonFields.optionalText(user, "about"),
        submitted);
  }

  public List<HackerNewsSearchHit> search(String query) {
    if (query == null || query.isBlank()) {
      throw SourceIntegrationException.badRequest(
          SOURCE, "Query parameter 'query' must not be blank.");
    }
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Error searching Hacker News",
            () ->
                hackerNewsSearchRestClient
                    .get()
                    .uri("/search?query={query}&tags=story", query)
                    .retrieve()
                    .body(JsonNode.class));
    return JsonFields.arrayAt(body, "hits").stream()
        .filter(hit -> !JsonFields.text(hit, "title", "").isBlank())
        .map(
            hit ->
                new HackerNewsSearchHit(
                    JsonFields.requiredText(hit, "objectID", SOURCE),
                    JsonFields.requiredText(hit, "title", SOURCE),
                    JsonFields.optionalText(hit, "url"),
                    JsonFields.longValue(hit, "points", 0),
                    JsonFields.text(hit, "author", "No Author")))
        .toList();
  }

  // Firebase answers an unknown item with 200 and a literal null body.
  @Nullable
  private HackerNewsStory fetchItem(long itemId) {
    final JsonNode item =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch item " + itemId,
            notFoundItemMessage(itemId),
            () ->
                hackerNewsItemRestClient
                    .get()
                    .uri("/item/{id}.json", itemId)
                    .retrieve()
                    .body(JsonNode.class));
    if (item == null || !item.isObject()) {
      return null;
    }
    return new HackerNewsStory(
        JsonFields.requiredLong(item, "id", SOURCE),
        JsonFields.text(item, "title", "N/A"),
        JsonFields.optionalText(item, "url"),
        JsonFields.text(item, "by", "N/A"),
        JsonFields.longValue(item, "score", 0),
        JsonFields.longValue(item, "time", 0),
        JsonFields.text(item, "type", "N/A"),
        JsonFields.longValue(item, "descendants", 0));
  }

  private static String notFoundItemMessage(long itemId) {
    return "Item with ID " + itemId + " not found.";
  }
}
