package com.example.aggregator.api;

import com.example.aggregator.api.response.FeatureResponse;
import com.example.aggregator.routing.SourceDescriptor;
import com.example.aggregator.routing.SourceRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class FeaturesController {

  private final SourceRegistry sourceRegistry;

  /** One entry per routed source, keyed by its prefix. */
  @GetMapping("/features")
  public ResponseEntity<Map<String, FeatureResponse>> features() {
    final Map<String, FeatureResponse> features = new LinkedHashMap<>();
    for (SourceDescriptor source : sourceRegistry.sources()) {
      features.put(
          source.prefix(), new FeatureResponse(source.exampleEndpoint(), source.description()));
    }
    return ResponseEntity.ok(features);
  }
}
