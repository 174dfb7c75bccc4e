/*
 * どこで: Aggregator サービス層
 * 何を: 上流呼び出しの結果・所要時間、fan-out の欠落件数、エラー種別をメトリクスとして記録する
 * なぜ: どのソースが不安定かを Prometheus から直接観測できるようにするため
 */
package com.example.aggregator.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class GatewayMetrics {

  private static final String METRIC_UPSTREAM_REQUEST_TOTAL = "gateway.upstream.request.total";
  private static final String METRIC_UPSTREAM_REQUEST_DURATION =
      "gateway.upstream.request.duration";
  private static final String METRIC_FANOUT_DROPPED_TOTAL = "gateway.fanout.dropped.total";
  private static final String METRIC_ERROR_TOTAL = "gateway.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> upstreamRequestCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> upstreamRequestTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> fanOutDroppedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

  public GatewayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordUpstreamCall(String source, String outcome, Duration duration) {
    final String key = source + "|" + outcome;
    upstreamRequestCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_UPSTREAM_REQUEST_TOTAL)
                    .description("Upstream calls by source and outcome")
                    .tags(Tags.of("source", source, "outcome", outcome))
                    .register(meterRegistry))
        .increment();
    upstreamRequestTimers
        .computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_UPSTREAM_REQUEST_DURATION)
                    .description("Upstream call duration by source and outcome")
                    .tags(Tags.of("source", source, "outcome", outcome))
                    .register(meterRegistry))
        .record(duration);
  }

  public void recordFanOutDropped(String source) {
    fanOutDroppedCounters
        .computeIfAbsent(
            source,
            ignored ->
                Counter.builder(METRIC_FANOUT_DROPPED_TOTAL)
                    .description("Fan-out tasks dropped because their upstream call failed")
                    .tags(Tags.of("source", source))
                    .register(meterRegistry))
        .increment();
  }

  public void recordGatewayError(String reason) {
    errorCounters
        .computeIfAbsent(
            reason,
            ignored ->
                Counter.builder(METRIC_ERROR_TOTAL)
                    .description("Gateway error responses by reason")
                    .tags(Tags.of("reason", reason))
                    .register(meterRegistry))
        .increment();
  }
}
