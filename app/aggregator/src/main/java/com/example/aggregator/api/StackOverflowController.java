package com.example.aggregator.api;

import com.example.aggregator.api.response.StackOverflowAnswer;
import com.example.aggregator.api.response.StackOverflowFeaturedQuestion;
import com.example.aggregator.api.response.StackOverflowQuestion;
import com.example.aggregator.api.response.StackOverflowSearchQuestion;
import com.example.aggregator.routing.SourceDescription;
import com.example.aggregator.service.StackOverflowClient;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/stackoverflow")
@SourceDescription(
    exampleEndpoint = "/stackoverflow/featured",
    description = "Get featured Stack Overflow questions")
@RequiredArgsConstructor
public class StackOverflowController {

  private final StackOverflowClient stackOverflowClient;

  @GetMapping("/featured")
  public ResponseEntity<List<StackOverflowFeaturedQuestion>> featured() {
    return ResponseEntity.ok(stackOverflowClient.listFeaturedQuestions());
  }

  /** Without parameters the configured default account is used. */
  @GetMapping("/questions")
  public ResponseEntity<List<StackOverflowQuestion>> questions(
      @RequestParam(name = "user_id", required = false) Long userId,
      @RequestParam(name = "username", required = false) String username) {
    return ResponseEntity.ok(stackOverflowClient.listUserQuestions(userId, username));
  }

  @GetMapping("/answers")
  public ResponseEntity<List<StackOverflowAnswer>> answers(
      @RequestParam(name = "user_id", required = false) Long userId,
      @RequestParam(name = "username", required = false) String username) {
    return ResponseEntity.ok(stackOverflowClient.listUserAnswers(userId, username));
  }

  @GetMapping("/search")
  public ResponseEntity<List<StackOverflowSearchQuestion>> search(
      @RequestParam("q") String query, @RequestParam("tagged") String tagged) {
    return ResponseEntity.ok(stackOverflowClient.search(query, tagged));
  }
}
