package com.example.aggregator.service;

import com.example.aggregator.api.response.PackageVersion;
import com.example.aggregator.api.response.PypiPackage;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class PypiClient {

  static final String SOURCE = "PyPI";

  private final RestClient pypiRestClient;
  private final UpstreamExchange upstreamExchange;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public PypiClient(RestClient pypiRestClient, UpstreamExchange upstreamExchange) {
    this.pypiRestClient = pypiRestClient;
    this.upstreamExchange = upstreamExchange;
  }

  public PypiPackage getPackage(String packageName) {
    final JsonNode info = fetchInfo(packageName, "Error fetching package details");
    return new PypiPackage(
        JsonFields.text(info, "name", "No Name"),
        JsonFields.text(info, "version", "0.0.0"),
        JsonFields.text(info, "summary", ""),
        JsonFields.optionalText(info, "author"),
        JsonFields.optionalText(info, "home_page"));
  }

  public PackageVersion getLatestVersion(String packageName) {
    final JsonNode info = fetchInfo(packageName, "Error fetching package version");
    return new PackageVersion(
        JsonFields.text(info, "name", packageName), JsonFields.text(info, "version", "0.0.0"));
  }

  private JsonNode fetchInfo(String packageName, String failureMessage) {
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            failureMessage,
            "Package '" + packageName + "' not found on PyPI.",
            () ->
                pypiRestClient
                    .get()
                    .uri("/{name}/json", packageName)
                    .retrieve()
                    .body(JsonNode.class));
    final JsonNode info = body == null ? null : body.get("info");
    if (info == null || !info.isObject()) {
      throw SourceIntegrationException.invalidResponse(
          SOURCE, "PyPI response for '" + packageName + "' has no package info.");
    }
    return info;
  }
}
