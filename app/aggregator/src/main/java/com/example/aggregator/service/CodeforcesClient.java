/*
 * どこで: Aggregator サービス層
 * 何を: Codeforces API から開催予定コンテストとユーザー情報を取得する
 * なぜ: 競技プログラミングの予定とレーティングを固定スキーマで返すため
 */
package com.example.aggregator.service;

import com.example.aggregator.api.response.CodeforcesContest;
import com.example.aggregator.api.response.CodeforcesUser;
import com.example.aggregator.config.CodeforcesProperties;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class CodeforcesClient {

  static final String SOURCE = "Codeforces";

  private static final int CONTEST_LIMIT = 10;
  private static final DateTimeFormatter LAST_ONLINE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final RestClient codeforcesRestClient;
  private final CodeforcesProperties properties;
  private final UpstreamExchange upstreamExchange;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public CodeforcesClient(
      RestClient codeforcesRestClient,
      CodeforcesProperties properties,
      UpstreamExchange upstreamExchange,
      Clock clock) {
    this.codeforcesRestClient = codeforcesRestClient;
    this.properties = properties;
    this.upstreamExchange = upstreamExchange;
    this.clock = clock;
  }

  /** Contests that have not started yet; the filter runs before the cap. */
  public List<CodeforcesContest> listUpcomingContests() {
    final JsonNode body =
        upstreamExchange.exchange(
            SOURCE,
            "Failed to fetch or parse contests",
            () -> codeforcesRestClient.get().uri("/contest.list").retrieve().body(JsonNode.class));
    return JsonFields.elements(requireResult(body)).stream()
        .filter(contest -> "BEFORE".equals(JsonFields.optionalText(contest, "phase")))
        .limit(CONTEST_LIMIT)
        .map(
            contest -> {
              final long id = JsonFields.requiredLong(contest, "id", SOURCE);
              return new CodeforcesContest(
                  id,
                  JsonFields.requiredText(contest, "name", SOURCE),
                  "BEFORE",
                  "https://codeforces.com/contest/" + id);
            })
        .toList();
  }

  public CodeforcesUser getDefaultUser() {
    final String handle = properties.defaultHandle();
    if (handle == null || handle.isBlank()) {
      throw SourceIntegrationException.misconfigured(SOURCE, "CODEFORCES_HANDLE");
    }
    return getUser(handle.trim());
  }

  public CodeforcesUser getUser(String handle) {
    final String notFoundMessage = "Codeforces user '" + handle + "' not found.";
    final JsonNode body;
    try {
      body =
          upstreamExchange.exchange(
              SOURCE,
              "Failed to fetch Codeforces user",
              notFoundMessage,
              () ->
                  codeforcesRestClient
                      .get()
                      .uri("/user.info?handles={handle}", handle)
                      .retrieve()
                      .body(JsonNode.class));
    } catch (SourceIntegrationException ex) {
      if (isFailedLookup(ex)) {
        throw new SourceIntegrationException(
            SourceIntegrationException.Reason.NOT_FOUND, SOURCE, notFoundMessage, 400, ex);
      }
      throw ex;
    }
    final List<JsonNode> users = JsonFields.elements(requireResult(body));
    if (users.isEmpty()) {
      throw SourceIntegrationException.notFound(SOURCE, notFoundMessage);
    }
    final JsonNode user = users.get(0);
    final String confirmedHandle = JsonFields.requiredText(user, "handle", SOURCE);
    return new CodeforcesUser(
        confirmedHandle,
        JsonFields.optionalText(user, "firstName"),
        JsonFields.optionalText(user, "lastName"),
        JsonFields.optionalText(user, "country"),
        JsonFields.optionalText(user, "organization"),
        JsonFields.optionalInt(user, "rating"),
        JsonFields.optionalInt(user, "maxRating"),
        JsonFields.optionalText(user, "rank"),
        JsonFields.optionalText(user, "maxRank"),
        formatLastOnline(JsonFields.longValue(user, "lastOnlineTimeSeconds", 0)),
        "https://codeforces.com/profile/" + confirmedHandle);
  }

  @Nullable
  private String formatLastOnline(long epochSeconds) {
    if (epochSeconds <= 0) {
      return null;
    }
    return LAST_ONLINE_FORMAT.format(Instant.ofEpochSecond(epochSeconds).atZone(clock.getZone()));
  }

  private JsonNode requireResult(@Nullable JsonNode body) {
    final JsonNode result = body == null ? null : body.get("result");
    if (result == null || !result.isArray()) {
      throw SourceIntegrationException.invalidResponse(
          SOURCE, "Codeforces response has no result list.");
    }
    return result;
  }

  // Unknown handles are reported as 400 with {"status":"FAILED"}.
  private static boolean isFailedLookup(SourceIntegrationException ex) {
    return ex.reason() == SourceIntegrationException.Reason.UPSTREAM_ERROR
        && ex.upstreamStatus() == 400
        && ex.getCause() instanceof RestClientResponseException response
        && response.getResponseBodyAsString().contains("\"FAILED\"");
  }
}
