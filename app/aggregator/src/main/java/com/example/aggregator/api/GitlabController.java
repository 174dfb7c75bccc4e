package com.example.aggregator.api;

import com.example.aggregator.api.response.GitlabIssue;
import com.example.aggregator.api.response.GitlabPipeline;
import com.example.aggregator.api.response.GitlabProject;
import com.example.aggregator.routing.SourceDescription;
import com.example.aggregator.service.GitlabClient;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/gitlab")
@SourceDescription(
    exampleEndpoint = "/gitlab/projects",
    description = "List your GitLab projects")
@RequiredArgsConstructor
public class GitlabController {

  private final GitlabClient gitlabClient;

  @GetMapping("/projects")
  public ResponseEntity<List<GitlabProject>> projects() {
    return ResponseEntity.ok(gitlabClient.listOwnedProjects());
  }

  @GetMapping("/issues")
  public ResponseEntity<List<GitlabIssue>> issues() {
    return ResponseEntity.ok(gitlabClient.listAssignedIssues());
  }

  @GetMapping("/pipelines")
  public ResponseEntity<List<GitlabPipeline>> pipelines() {
    return ResponseEntity.ok(gitlabClient.listRecentPipelines());
  }
}
