package com.example.aggregator.api;

import com.example.aggregator.api.response.HackerNewsSearchHit;
import com.example.aggregator.api.response.HackerNewsStory;
import com.example.aggregator.api.response.HackerNewsUser;
import com.example.aggregator.routing.SourceDescription;
import com.example.aggregator.service.HackerNewsClient;
import com.example.aggregator.service.HackerNewsClient.StoryFeed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/hackernews")
@SourceDescription(
    exampleEndpoint = "/hackernews/topstories",
    description = "List top stories from Hacker News")
@RequiredArgsConstructor
public class HackerNewsController {

  private final HackerNewsClient hackerNewsClient;

  @GetMapping("/topstories")
  public ResponseEntity<List<HackerNewsStory>> topStories() {
    return ResponseEntity.ok(hackerNewsClient.listStories(StoryFeed.TOP));
  }

  @GetMapping("/newstories")
  public ResponseEntity<List<HackerNewsStory>> newStories() {
    return ResponseEntity.ok(hackerNewsClient.listStories(StoryFeed.NEW));
  }

  @GetMapping("/beststories")
  public ResponseEntity<List<HackerNewsStory>> bestStories() {
    return ResponseEntity.ok(hackerNewsClient.listStories(StoryFeed.BEST));
  }

  @GetMapping("/item/{item_id}")
  public ResponseEntity<HackerNewsStory> item(@PathVariable("item_id") long itemId) {
    return ResponseEntity.ok(hackerNewsClient.getItem(itemId));
  }

  @GetMapping("/user/{user_id}")
  public ResponseEntity<HackerNewsUser> user(@PathVariable("user_id") String userId) {
    return ResponseEntity.ok(hackerNewsClient.getUser(userId));
  }

  @GetMapping("/search")
  public ResponseEntity<List<HackerNewsSearchHit>> search(@RequestParam("query") String query) {
    return ResponseEntity.ok(hackerNewsClient.search(query));
  }
}
