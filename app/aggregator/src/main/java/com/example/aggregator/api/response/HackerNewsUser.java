package com.example.aggregator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import org.springframework.lang.Nullable;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HackerNewsUser(
    String id, long created, long karma, @Nullable String about, List<Long> submitted) {

  public HackerNewsUser {
    submitted = submitted == null ? List.of() : List.copyOf(submitted);
  }
}
