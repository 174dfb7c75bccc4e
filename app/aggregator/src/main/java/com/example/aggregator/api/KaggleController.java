package com.example.aggregator.api;

import com.example.aggregator.api.response.KaggleCompetition;
import com.example.aggregator.api.response.KaggleDataset;
import com.example.aggregator.routing.SourceDescription;
import com.example.aggregator.service.KaggleClient;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/kaggle")
@SourceDescription(
    exampleEndpoint = "/kaggle/datasets",
    description = "List trending Kaggle datasets")
@RequiredArgsConstructor
public class KaggleController {

  private final KaggleClient kaggleClient;

  @GetMapping("/datasets")
  public ResponseEntity<List<KaggleDataset>> datasets() {
    return ResponseEntity.ok(kaggleClient.listRecentDatasets());
  }

  @GetMapping("/competitions")
  public ResponseEntity<List<KaggleCompetition>> competitions() {
    return ResponseEntity.ok(kaggleClient.listCompetitions());
  }
}
