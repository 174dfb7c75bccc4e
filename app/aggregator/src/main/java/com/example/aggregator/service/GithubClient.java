/*
 * どこで: Aggregator サービス層
 * 何を: GitHub REST API からリポジトリ・Issue・PR・リリースを取得する
 * なぜ: 認証ユーザー視点の GitHub 情報を固定スキーマで返すため
 */
package com.example.aggregator.service;

import com.example.aggregator.api.response.GithubIssue;
import com.example.aggregator.api.response.GithubPullRequest;
import com.example.aggregator.api.response.GithubRelease;
import com.example.aggregator.api.response.GithubRepo;
import com.example.aggregator.config.GithubProperties;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class GithubClient {

  static final String SOURCE = "GitHub";

  private static final int LIST_LIMIT = 10;
  private static final int RELEASE_LIMIT = 30;

  private final RestClient githubRestClient;
  private final GithubProperties properties;
  private final UpstreamExchange upstreamExchange;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public GithubClient(
      RestClient githubRestClient, GithubProperties properties, UpstreamExchange upstreamExchange) {
    this.githubRestClient = githubRestClient;
    this.properties = properties;
    this.upstreamExchange = upstreamExchange;
  }

  public List<GithubRepo> listRepos() {
    final String token = requireToken();
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch GitHub repos",
            () ->
                githubRestClient
                    .get()
                    .uri("/user/repos?sort=updated&per_page={perPage}", LIST_LIMIT)
                    .headers(headers -> headers.setBearerAuth(token))
                    .retrieve()
                    .body(JsonNode.class));
    return JsonFields.elements(JsonFields.requireArray(body, SOURCE)).stream()
        .limit(LIST_LIMIT)
        .map(
            repo ->
                new GithubRepo(
                    JsonFields.requiredLong(repo, "id", SOURCE),
                    JsonFields.requiredText(repo, "name", SOURCE),
                    JsonFields.requiredText(repo, "html_url", SOURCE)))
        .toList();
  }

  public List<GithubIssue> listAssignedIssues() {
    final String token = requireToken();
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch GitHub issues",
            () ->
                githubRestClient
                    .get()
                    .uri("/issues?filter=assigned&sort=updated&per_page={perPage}", LIST_LIMIT)
                    .headers(headers -> headers.setBearerAuth(token))
                    .retrieve()
                    .body(JsonNode.class));
    return toIssues(JsonFields.elements(JsonFields.requireArray(body, SOURCE)));
  }

  /** Open pull requests anywhere on GitHub that involve the token's owner. */
  public List<GithubIssue> listMyPullRequests() {
    final String token = requireToken();
    final JsonNode user =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch GitHub pull requests",
            () ->
                githubRestClient
                    .get()
                    .uri("/user")
                    .headers(headers -> headers.setBearerAuth(token))
                    .retrieve()
                    .body(JsonNode.class));
    final String login = JsonFields.requiredText(user, "login", SOURCE);
    final JsonNode search =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch GitHub pull requests",
            () ->
                githubRestClient
                    .get()
                    .uri(
                        "/search/issues?q={query}&sort=updated&per_page={perPage}",
                        "is:pr is:open involves:" + login,
                        LIST_LIMIT)
                    .headers(headers -> headers.setBearerAuth(token))
                    .retrieve()
                    .body(JsonNode.class));
    return toIssues(JsonFields.arrayAt(search, "items"));
  }

  public List<GithubPullRequest> listRepositoryPullRequests(String owner, String repo) {
    final String token = requireToken();
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch pull requests for " + owner + "/" + repo,
            "Repository " + owner + "/" + repo + " not found.",
            () ->
                githubRestClient
                    .get()
                    .uri("/repos/{owner}/{repo}/pulls", owner, repo)
                    .headers(headers -> headers.setBearerAuth(token))
                    .retrieve()
                    .body(JsonNode.class));
    return JsonFields.elements(JsonFields.requireArray(body, SOURCE)).stream()
        .map(
            pull ->
                new GithubPullRequest(
                    JsonFields.requiredLong(pull, "id", SOURCE),
                    JsonFields.requiredText(pull, "title", SOURCE),
                    JsonFields.requiredText(pull, "html_url", SOURCE),
                    JsonFields.requiredText(pull.path("user"), "login", SOURCE)))
        .toList();
  }

  /** Works without a token; a configured token only raises the rate limit. */
  public List<GithubRelease> listReleases(String owner, String repo) {
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Error fetching releases",
            "Repository '" + owner + "/" + repo + "' not found.",
            () ->
                githubRestClient
                    .get()
                    .uri("/repos/{owner}/{repo}/releases", owner, repo)
                    .headers(
                        headers -> {
                          if (properties.hasToken()) {
                            headers.setBearerAuth(properties.token());
                          }
                        })
                    .retrieve()
                    .body(JsonNode.class));
    return JsonFields.elements(JsonFields.requireArray(body, SOURCE)).stream()
        .limit(RELEASE_LIMIT)
        .map(
            release ->
                new GithubRelease(
                    JsonFields.text(release, "tag_name", "No Tag"),
                    JsonFields.text(release, "name", "No Name"),
                    JsonFields.text(release, "html_url", ""),
                    JsonFields.text(release, "published_at", "")))
        .toList();
  }

  private List<GithubIssue> toIssues(List<JsonNode> items) {
    return items.stream()
        .limit(LIST_LIMIT)
        .map(
            issue ->
                new GithubIssue(
                    JsonFields.requiredLong(issue, "id", SOURCE),
                    JsonFields.requiredText(issue, "title", SOURCE),
                    JsonFields.requiredText(issue, "html_url", SOURCE)))
        .toList();
  }

  private String requireToken() {
    if (!properties.hasToken()) {
      throw SourceIntegrationException.misconfigured(SOURCE, "GITHUB_TOKEN");
    }
    return properties.token();
  }
}
