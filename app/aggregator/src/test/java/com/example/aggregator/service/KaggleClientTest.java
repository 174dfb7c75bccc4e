package com.example.aggregator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.aggregator.api.response.KaggleCompetition;
import com.example.aggregator.api.response.KaggleDataset;
import com.example.aggregator.config.KaggleProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class KaggleClientTest {

  @Test
  void listRecentDatasetsUsesBasicAuthAndBuildsLinks() {
    final ClientFixture fixture = newFixture("user", "key");
    fixture
        .server
        .expect(requestTo("http://kaggle.test/datasets/list?sort_by=updated&page_size=10"))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Basic dXNlcjprZXk="))
        .andRespond(
            withSuccess(
                "[{\"ref\":\"owner/titanic\",\"title\":\"Titanic\"}]",
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.listRecentDatasets())
        .containsExactly(
            new KaggleDataset(
                "Titanic", "owner/titanic", "https://www.kaggle.com/datasets/owner/titanic"));
  }

  @Test
  void listCompetitionsMapsDeadline() {
    final ClientFixture fixture = newFixture("user", "key");
    fixture
        .server
        .expect(
            requestTo("http://kaggle.test/competitions/list?sort_by=latestDeadline&page_size=10"))
        .andRespond(
            withSuccess(
                "[{\"ref\":\"titanic\",\"title\":\"Titanic\","
                    + "\"deadline\":\"2030-01-01T00:00:00Z\"}]",
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.listCompetitions())
        .containsExactly(new KaggleCompetition("titanic", "Titanic", "2030-01-01T00:00:00Z"));
  }

  @Test
  void missingCredentialsFailBeforeAnyRequest() {
    final ClientFixture fixture = newFixture("user", null);

    assertThatThrownBy(fixture.client::listCompetitions)
        .isInstanceOf(SourceIntegrationException.class)
        .hasMessage("KAGGLE_USERNAME or KAGGLE_KEY is not configured in the environment.");
    fixture.server.verify();
  }

  private ClientFixture newFixture(String username, String key) {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final KaggleClient client =
        new KaggleClient(
            builder.baseUrl("http://kaggle.test").build(),
            new KaggleProperties("http://kaggle.test", username, key),
            new UpstreamExchange(new GatewayMetrics(new SimpleMeterRegistry())));
    return new ClientFixture(client, server);
  }

  private record ClientFixture(KaggleClient client, MockRestServiceServer server) {}
}
