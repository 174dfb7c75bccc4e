/*
 * どこで: Aggregator API 層
 * 何を: /github 配下のルートを提供する
 * なぜ: 認証ユーザー向けと公開リポジトリ向けの GitHub 機能を 1 つのプレフィックスに統合するため
 */
package com.example.aggregator.api;

import com.example.aggregator.api.response.GithubIssue;
import com.example.aggregator.api.response.GithubPullRequest;
import com.example.aggregator.api.response.GithubRelease;
import com.example.aggregator.api.response.GithubRepo;
import com.example.aggregator.routing.SourceDescription;
import com.example.aggregator.service.GithubClient;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/github")
@SourceDescription(
    exampleEndpoint = "/github/repos",
    description = "List your GitHub repositories")
@RequiredArgsConstructor
public class GithubController {

  private final GithubClient githubClient;

  @GetMapping("/repos")
  public ResponseEntity<List<GithubRepo>> repos() {
    return ResponseEntity.ok(githubClient.listRepos());
  }

  @GetMapping("/issues")
  public ResponseEntity<List<GithubIssue>> issues() {
    return ResponseEntity.ok(githubClient.listAssignedIssues());
  }

  @GetMapping("/pulls")
  public ResponseEntity<List<GithubIssue>> myPullRequests() {
    return ResponseEntity.ok(githubClient.listMyPullRequests());
  }

  @GetMapping("/repos/{owner}/{repo}/pulls")
  public ResponseEntity<List<GithubPullRequest>> repositoryPullRequests(
      @PathVariable("owner") String owner, @PathVariable("repo") String repo) {
    return ResponseEntity.ok(githubClient.listRepositoryPullRequests(owner, repo));
  }

  @GetMapping("/{owner}/{repo}/releases")
  public ResponseEntity<List<GithubRelease>> releases(
      @PathVariable("owner") String owner, @PathVariable("repo") String repo) {
    return ResponseEntity.ok(githubClient.listReleases(owner, repo));
  }
}
