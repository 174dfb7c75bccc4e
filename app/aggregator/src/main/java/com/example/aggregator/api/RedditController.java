package com.example.aggregator.api;

import com.example.aggregator.api.response.RedditPost;
import com.example.aggregator.routing.SourceDescription;
import com.example.aggregator.service.RedditClient;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/reddit")
@SourceDescription(
    exampleEndpoint = "/reddit/r/programming/top",
    description = "Get top posts from a specified subreddit")
@RequiredArgsConstructor
public class RedditController {

  private final RedditClient redditClient;

  @GetMapping("/r/{subreddit}/search")
  public ResponseEntity<List<RedditPost>> search(
      @PathVariable("subreddit") String subreddit, @RequestParam("query") String query) {
    return ResponseEntity.ok(redditClient.search(subreddit, query));
  }

  @GetMapping("/r/{subreddit}/top")
  public ResponseEntity<List<RedditPost>> top(@PathVariable("subreddit") String subreddit) {
    return ResponseEntity.ok(redditClient.top(subreddit));
  }
}
