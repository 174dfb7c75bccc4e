package com.example.aggregator.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import org.springframework.lang.Nullable;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StackOverflowSearchQuestion(
    long questionId,
    String title,
    String link,
    Owner owner,
    List<String> tags,
    long score,
    @JsonProperty("is_answered") boolean answered) {

  public StackOverflowSearchQuestion {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Owner(@Nullable String displayName) {}
}
