package com.example.aggregator.service;

import com.example.aggregator.api.response.NpmPackage;
import com.example.aggregator.api.response.PackageVersion;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class NpmClient {

  static final String SOURCE = "npm";

  private final RestClient npmRestClient;
  private final UpstreamExchange upstreamExchange;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public NpmClient(RestClient npmRestClient, UpstreamExchange upstreamExchange) {
    this.npmRestClient = npmRestClient;
    this.upstreamExchange = upstreamExchange;
  }

  public NpmPackage getPackage(String packageName) {
    final JsonNode document = fetchDocument(packageName, "Error fetching npm package");
    return new NpmPackage(
        JsonFields.text(document, "name", packageName),
        JsonFields.text(document, "description", ""),
        latestVersion(document),
        JsonFields.optionalText(document, "homepage"));
  }

  public PackageVersion getLatestVersion(String packageName) {
    final JsonNode document = fetchDocument(packageName, "Error fetching npm version");
    return new PackageVersion(
        JsonFields.text(document, "name", packageName), latestVersion(document));
  }

  private JsonNode fetchDocument(String packageName, String failureMessage) {
    final JsonNode document =
        upstreamExchange.exchange(
            SOURCE,
            failureMessage,
            "Package '" + packageName + "' not found on npm.",
            () -> npmRestClient.get().uri("/{name}", packageName).retrieve().body(JsonNode.class));
    if (document == null || !document.isObject()) {
      throw SourceIntegrationException.invalidResponse(
          SOURCE, "npm response for '" + packageName + "' is not a package document.");
    }
    return document;
  }

  private static String latestVersion(JsonNode document) {
    return JsonFields.text(document.path("dist-tags"), "latest", "0.0.0");
  }
}
