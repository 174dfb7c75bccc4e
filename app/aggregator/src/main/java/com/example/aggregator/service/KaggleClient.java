package com.example.aggregator.service;

import com.example.aggregator.api.response.KaggleCompetition;
import com.example.aggregator.api.response.KaggleDataset;
import com.example.aggregator.config.KaggleProperties;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class KaggleClient {

  static final String SOURCE = "Kaggle";

  private static final int LIST_LIMIT = 10;

  private final RestClient kaggleRestClient;
  private final KaggleProperties properties;
  private final UpstreamExchange upstreamExchange;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public KaggleClient(
      RestClient kaggleRestClient, KaggleProperties properties, UpstreamExchange upstreamExchange) {
    this.kaggleRestClient = kaggleRestClient;
    this.properties = properties;
    this.upstreamExchange = upstreamExchange;
  }

  public List<KaggleDataset> listRecentDatasets() {
    final JsonNode body = fetchList("/datasets/list", "updated", "Failed to fetch Kaggle datasets");
    return JsonFields.elements(JsonFields.requireArray(body, SOURCE)).stream()
        .limit(LIST_LIMIT)
        .map(
            dataset -> {
              final String ref = JsonFields.requiredText(dataset, "ref", SOURCE);
              return new KaggleDataset(
                  JsonFields.requiredText(dataset, "title", SOURCE),
                  ref,
                  "https://www.kaggle.com/datasets/" + ref);
            })
        .toList();
  }

  public List<KaggleCompetition> listCompetitions() {
    final JsonNode body =
        fetchList("/competitions/list", "latestDeadline", "Failed to fetch Kaggle competitions");
    return JsonFields.elements(JsonFields.requireArray(body, SOURCE)).stream()
        .limit(LIST_LIMIT)
        .map(
            competition ->
                new KaggleCompetition(
                    JsonFields.requiredText(competition, "ref", SOURCE),
                    JsonFields.requiredText(competition, "title", SOURCE),
                    JsonFields.requiredText(competition, "deadline", SOURCE)))
        .toList();
  }

  private JsonNode fetchList(String path, String sortBy, String failureMessage) {
    if (!properties.hasCredentials()) {
      throw SourceIntegrationException.misconfigured(SOURCE, "KAGGLE_USERNAME or KAGGLE_KEY");
    }
    return upstreamExchange.exchange(
        SOURCE,
        failureMessage,
        () ->
            kaggleRestClient
                .get()
                .uri(path + "?sort_by={sortBy}&page_size={pageSize}", sortBy, LIST_LIMIT)
                .headers(headers -> headers.setBasicAuth(properties.username(), properties.key()))
                .retrieve()
                .body(JsonNode.class));
  }
}
