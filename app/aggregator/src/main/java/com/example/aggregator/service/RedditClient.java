package com.example.aggregator.service;

import com.example.aggregator.api.response.RedditPost;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class RedditClient {

  static final String SOURCE = "Reddit";

  private static final String SITE = "https://www.reddit.com";
  private static final int SEARCH_LIMIT = 25;
  private static final int TOP_LIMIT = 10;

  private final RestClient redditRestClient;
  private final UpstreamExchange upstreamExchange;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public RedditClient(RestClient redditRestClient, UpstreamExchange upstreamExchange) {
    this.redditRestClient = redditRestClient;
    this.upstreamExchange = upstreamExchange;
  }

  public List<RedditPost> search(String subreddit, String query) {
    if (query == null || query.isBlank()) {
      throw SourceIntegrationException.badRequest(
          SOURCE, "Query parameter 'query' must not be blank.");
    }
    final JsonNode listing =
        upstreamExchange.exchange(
            SOURCE,
            "Error searching Reddit",
            () ->
                redditRestClient
                    .get()
                    .uri(
                        "/r/{subreddit}/search.json?q={query}&restrict_sr=on&limit={limit}",
                        subreddit,
                        query,
                        SEARCH_LIMIT)
                    .retrieve()
                    .body(JsonNode.class));
    return toPosts(listing, subreddit, SEARCH_LIMIT);
  }

  /** Today's top posts of a subreddit. */
  public List<RedditPost> top(String subreddit) {
    final JsonNode listing =
        upstreamExchange.exchange(
            SOURCE,
            "Error fetching top Reddit posts",
            () ->
                redditRestClient
                    .get()
                    .uri("/r/{subreddit}/top.json?limit={limit}&t=day", subreddit, TOP_LIMIT)
                    .retrieve()
                    .body(JsonNode.class));
    return toPosts(listing, subreddit, TOP_LIMIT);
  }

  private List<RedditPost> toPosts(JsonNode listing, String subreddit, int limit) {
    return JsonFields.arrayAt(listing == null ? null : listing.path("data"), "children").stream()
        .limit(limit)
        .map(child -> child.path("data"))
        .map(
            post ->
                new RedditPost(
                    JsonFields.requiredText(post, "id", SOURCE),
                    JsonFields.text(post, "title", "No Title"),
                    JsonFields.text(post, "subreddit", subreddit),
                    link(JsonFields.optionalText(post, "permalink")),
                    JsonFields.text(post, "author", "No Author"),
                    JsonFields.longValue(post, "score", 0)))
        .toList();
  }

  @Nullable
  private static String link(@Nullable String permalink) {
    return permalink == null || permalink.isBlank() ? null : SITE + permalink;
  }
}
