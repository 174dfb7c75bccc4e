/*
 * どこで: Aggregator サービス層
 * 何を: 全ソース共通の上流呼び出し例外マッピング
 * なぜ: 404 / その他ステータス / 接続失敗 / 不正応答の扱いを各クライアントで重複させないため
 */
package com.example.aggregator.service;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Executes one upstream call and translates its failures into {@link SourceIntegrationException}.
 *
 * <p>Exactly one attempt is made. Shaping of the returned payload happens outside of the call,
 * so failures there are not reinterpreted as upstream failures.
 */
@Component
@RequiredArgsConstructor
public class UpstreamExchange {

  private static final Logger logger = LoggerFactory.getLogger(UpstreamExchange.class);

  private final GatewayMetrics gatewayMetrics;

  public <T> T exchange(String source, String failureMessage, Supplier<T> call) {
    return exchange(source, failureMessage, null, call);
  }

  /**
   * @param failureMessage prefix of the message for non-404 upstream statuses; the raw upstream
   *     body is appended verbatim
   * @param notFoundMessage message for an upstream 404, or {@code null} when a 404 should be
   *     reported like any other upstream status
   */
  public <T> T exchange(
      String source, String failureMessage, @Nullable String notFoundMessage, Supplier<T> call) {
    final long started = System.nanoTime();
    String outcome = "success";
    try {
      return call.get();
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      logger.warn(
          "{} upstream call failed with http status={} statusText={}",
          source,
          status,
          ex.getStatusText());
      if (status == 404 && notFoundMessage != null) {
        outcome = "not_found";
        throw new SourceIntegrationException(
            SourceIntegrationException.Reason.NOT_FOUND, source, notFoundMessage, status, ex);
      }
      outcome = "upstream_error";
      throw new SourceIntegrationException(
          SourceIntegrationException.Reason.UPSTREAM_ERROR,
          source,
          failureMessage + ": " + ex.getResponseBodyAsString(),
          status,
          ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("{} upstream call timed out", source);
        outcome = "timeout";
      } else {
        logger.warn("{} upstream call connection failed: {}", source, ex.getMessage());
        outcome = "unavailable";
      }
      throw new SourceIntegrationException(
          SourceIntegrationException.Reason.UNAVAILABLE,
          source,
          "Could not connect to the " + source + " API.",
          0,
          ex);
    } catch (SourceIntegrationException ex) {
      outcome = ex.reason().name().toLowerCase(Locale.ROOT);
      throw ex;
    } catch (RestClientException ex) {
      logger.warn("{} upstream response could not be read", source, ex);
      outcome = "invalid_response";
      throw new SourceIntegrationException(
          SourceIntegrationException.Reason.INVALID_RESPONSE,
          source,
          "Failed to read the " + source + " response.",
          0,
          ex);
    } finally {
      gatewayMetrics.recordUpstreamCall(
          source, outcome, Duration.ofNanos(System.nanoTime() - started));
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      // Covers socket read timeouts and HttpClient's ConnectTimeoutException.
      if (current instanceof InterruptedIOException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
