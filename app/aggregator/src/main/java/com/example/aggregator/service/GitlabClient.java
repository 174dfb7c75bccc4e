package com.example.aggregator.service;

import com.example.aggregator.api.response.GitlabIssue;
import com.example.aggregator.api.response.GitlabPipeline;
import com.example.aggregator.api.response.GitlabProject;
import com.example.aggregator.config.GitlabProperties;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.function.Supplier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class GitlabClient {

  static final String SOURCE = "GitLab";

  private static final String TOKEN_HEADER = "PRIVATE-TOKEN";
  private static final int LIST_LIMIT = 10;
  private static final int PIPELINE_PROJECT_LIMIT = 3;
  private static final int PIPELINES_PER_PROJECT = 3;

  private final RestClient gitlabRestClient;
  private final GitlabProperties properties;
  private final UpstreamExchange upstreamExchange;
  private final FanOutCoordinator fanOutCoordinator;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public GitlabClient(
      RestClient gitlabRestClient,
      GitlabProperties properties,
      UpstreamExchange upstreamExchange,
      FanOutCoordinator fanOutCoordinator) {
    this.gitlabRestClient = gitlabRestClient;
    this.properties = properties;
    this.upstreamExchange = upstreamExchange;
    this.fanOutCoordinator = fanOutCoordinator;
  }

  public List<GitlabProject> listOwnedProjects() {
    final String token = requireToken();
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch GitLab projects",
            () -> fetchOwnedProjects(token, "created_at", LIST_LIMIT));
    return JsonFields.elements(JsonFields.requireArray(body, SOURCE)).stream()
        .limit(LIST_LIMIT)
        .map(
            project ->
                new GitlabProject(
                    JsonFields.requiredLong(project, "id", SOURCE),
                    JsonFields.requiredText(project, "name", SOURCE),
                    JsonFields.requiredText(project, "web_url", SOURCE)))
        .toList();
  }

  public List<GitlabIssue> listAssignedIssues() {
    final String token = requireToken();
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch GitLab issues",
            () ->
                gitlabRestClient
                    .get()
                    .uri(
                        "/issues?scope=assigned_to_me&order_by=created_at&sort=desc"
                            + "&per_page={perPage}",
                        LIST_LIMIT)
                    .header(TOKEN_HEADER, token)
                    .retrieve()
                    .body(JsonNode.class));
    return JsonFields.elements(JsonFields.requireArray(body, SOURCE)).stream()
        .limit(LIST_LIMIT)
        .map(
            issue ->
                new GitlabIssue(
                    JsonFields.requiredLong(issue, "id", SOURCE),
                    JsonFields.requiredText(issue, "title", SOURCE),
                    JsonFields.requiredText(issue, "web_url", SOURCE)))
        .toList();
  }

  /**
   * Recent pipelines of the caller's most recently active projects.
   *
   * <p>The project listing must succeed. A project whose pipelines cannot be fetched is left out
   * of the result.
   */
  public List<GitlabPipeline> listRecentPipelines() {
    final String token = requireToken();
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch initial projects for pipelines",
            () -> fetchOwnedProjects(token, "last_activity_at", PIPELINE_PROJECT_LIMIT));
    final List<Supplier<List<GitlabPipeline>>> tasks =
        JsonFields.elements(JsonFields.requireArray(body, SOURCE)).stream()
            .limit(PIPELINE_PROJECT_LIMIT)
            .<Supplier<List<GitlabPipeline>>>map(
                project ->
                    () ->
                        fetchPipelines(
                            token,
                            JsonFields.requiredLong(project, "id", SOURCE),
                            JsonFields.requiredText(project, "name", SOURCE)))
            .toList();
    return fanOutCoordinator.gather(SOURCE, tasks).stream().flatMap(List::stream).toList();
  }

  private List<GitlabPipeline> fetchPipelines(String token, long projectId, String projectName) {
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch pipelines for project " + projectName,
            () ->
                gitlabRestClient
                    .get()
                    .uri(
                        "/projects/{id}/pipelines?per_page={perPage}",
                        projectId,
                        PIPELINES_PER_PROJECT)
                    .header(TOKEN_HEADER, token)
                    .retrieve()
                    .body(JsonNode.class));
    return JsonFields.elements(JsonFields.requireArray(body, SOURCE)).stream()
        .map(
            pipeline ->
                new GitlabPipeline(
                    projectName,
                    JsonFields.requiredLong(pipeline, "id", SOURCE),
                    JsonFields.requiredText(pipeline, "status", SOURCE),
                    JsonFields.requiredText(pipeline, "web_url", SOURCE)))
        .toList();
  }

  private JsonNode fetchOwnedProjects(String token, String orderBy, int perPage) {
    return gitlabRestClient
        .get()
        .uri(
            "/projects?owned=true&order_by={orderBy}&sort=desc&per_page={perPage}",
            orderBy,
            perPage)
        .header(TOKEN_HEADER, token)
        .retrieve()
        .body(JsonNode.class);
  }

  private String requireToken() {
    if (!properties.hasToken()) {
      throw SourceIntegrationException.misconfigured(SOURCE, "GITLAB_TOKEN");
    }
    return properties.token();
  }
}
