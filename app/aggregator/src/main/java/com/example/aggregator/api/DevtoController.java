package com.example.aggregator.api;

import com.example.aggregator.api.response.DevtoArticle;
import com.example.aggregator.routing.SourceDescription;
import com.example.aggregator.service.DevtoClient;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/devto")
@SourceDescription(
    exampleEndpoint = "/devto/articles",
    description = "Fetch latest DEV.to articles")
@RequiredArgsConstructor
public class DevtoController {

  private final DevtoClient devtoClient;

  @GetMapping("/articles")
  public ResponseEntity<List<DevtoArticle>> articles() {
    return ResponseEntity.ok(devtoClient.listLatestArticles());
  }

  @GetMapping("/article/{article_id}")
  public ResponseEntity<DevtoArticle> article(@PathVariable("article_id") long articleId) {
    return ResponseEntity.ok(devtoClient.getArticle(articleId));
  }
}
