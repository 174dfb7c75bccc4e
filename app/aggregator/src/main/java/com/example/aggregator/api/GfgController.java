package com.example.aggregator.api;

import com.example.aggregator.api.response.GfgProblemOfTheDay;
import com.example.aggregator.api.response.GfgStats;
import com.example.aggregator.routing.SourceDescription;
import com.example.aggregator.service.GfgClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/gfg")
@SourceDescription(
    exampleEndpoint = "/gfg/potd",
    description = "Get the GeeksforGeeks problem of the day")
@RequiredArgsConstructor
public class GfgController {

  private final GfgClient gfgClient;

  @GetMapping("/stats/{username}")
  public ResponseEntity<GfgStats> stats(@PathVariable("username") String username) {
    return ResponseEntity.ok(gfgClient.getStats(username));
  }

  @GetMapping("/potd")
  public ResponseEntity<GfgProblemOfTheDay> problemOfTheDay() {
    return ResponseEntity.ok(gfgClient.getProblemOfTheDay());
  }
}
