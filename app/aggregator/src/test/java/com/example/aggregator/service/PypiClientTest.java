package com.example.aggregator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.aggregator.api.response.PackageVersion;
import com.example.aggregator.api.response.PypiPackage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class PypiClientTest {

  @Test
  void getPackageMapsInfo() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://pypi.test/requests/json"))
        .andRespond(
            withSuccess(
                """
                {"info":{"name":"requests","version":"2.32.3","summary":"HTTP for Humans.",
                "author":"Kenneth Reitz","home_page":"https://requests.readthedocs.io"}}
                """,
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.getPackage("requests"))
        .isEqualTo(
            new PypiPackage(
                "requests",
                "2.32.3",
                "HTTP for Humans.",
                "Kenneth Reitz",
                "https://requests.readthedocs.io"));
  }

  @Test
  void getPackageDefaultsMissingInfoFields() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://pypi.test/bare/json"))
        .andRespond(withSuccess("{\"info\":{\"author\":null}}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.getPackage("bare"))
        .isEqualTo(new PypiPackage("No Name", "0.0.0", "", null, null));
  }

  @Test
  void getLatestVersionReportsUnknownPackage() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://pypi.test/nope/json"))
        .andRespond(withResourceNotFound());

    assertThatThrownBy(() -> fixture.client.getLatestVersion("nope"))
        .isInstanceOf(SourceIntegrationException.class)
        .hasMessage("Package 'nope' not found on PyPI.")
        .extracting(ex -> ((SourceIntegrationException) ex).reason())
        .isEqualTo(SourceIntegrationException.Reason.NOT_FOUND);
  }

  @Test
  void getLatestVersionReadsVersion() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://pypi.test/flask/json"))
        .andRespond(
            withSuccess(
                "{\"info\":{\"name\":\"Flask\",\"version\":\"3.0.3\"}}",
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.getLatestVersion("flask"))
        .isEqualTo(new PackageVersion("Flask", "3.0.3"));
  }

  @Test
  void responseWithoutInfoIsInvalid() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://pypi.test/odd/json"))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.getPackage("odd"))
        .isInstanceOf(SourceIntegrationException.class)
        .extracting(ex -> ((SourceIntegrationException) ex).reason())
        .isEqualTo(SourceIntegrationException.Reason.INVALID_RESPONSE);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final PypiClient client =
        new PypiClient(
            builder.baseUrl("http://pypi.test").build(),
            new UpstreamExchange(new GatewayMetrics(new SimpleMeterRegistry())));
    return new ClientFixture(client, server);
  }

  private record ClientFixture(PypiClient client, MockRestServiceServer server) {}
}
