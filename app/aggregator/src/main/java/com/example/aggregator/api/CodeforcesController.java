package com.example.aggregator.api;

import com.example.aggregator.api.response.CodeforcesContest;
import com.example.aggregator.api.response.CodeforcesUser;
import com.example.aggregator.routing.SourceDescription;
import com.example.aggregator.service.CodeforcesClient;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/codeforces")
@SourceDescription(
    exampleEndpoint = "/codeforces/contests",
    description = "Get upcoming Codeforces contests")
@RequiredArgsConstructor
public class CodeforcesController {

  private final CodeforcesClient codeforcesClient;

  @GetMapping("/contests")
  public ResponseEntity<List<CodeforcesContest>> contests() {
    return ResponseEntity.ok(codeforcesClient.listUpcomingContests());
  }

  // Literal segment wins over the {handle} template, so "me" is never looked up as a handle.
  @GetMapping("/userinfo/me")
  public ResponseEntity<CodeforcesUser> defaultUser() {
    return ResponseEntity.ok(codeforcesClient.getDefaultUser());
  }

  @GetMapping("/userinfo/{handle}")
  public ResponseEntity<CodeforcesUser> user(@PathVariable("handle") String handle) {
    return ResponseEntity.ok(codeforcesClient.getUser(handle));
  }
}
