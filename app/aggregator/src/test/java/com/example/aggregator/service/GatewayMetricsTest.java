/*
 * どこで: Aggregator サービス層テスト
 * 何を: ゲートウェイのカスタムメトリクスが期待どおりの名前とタグで記録されることを検証する
 * なぜ: メトリクス名やタグの退行を防ぎ、監視クエリの互換性を保つため
 */
package com.example.aggregator.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class GatewayMetricsTest {

  @Test
  void recordsUpstreamFanOutAndErrorMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final GatewayMetrics metrics = new GatewayMetrics(registry);

    metrics.recordUpstreamCall("GitHub", "success", Duration.ofMillis(120));
    metrics.recordUpstreamCall("GitHub", "success", Duration.ofMillis(80));
    metrics.recordUpstreamCall("GitHub", "timeout", Duration.ofSeconds(10));
    metrics.recordFanOutDropped("Hacker News");
    metrics.recordGatewayError("NOT_FOUND");
    metrics.recordGatewayError("NOT_FOUND");

    final Counter success =
        registry
            .get("gateway.upstream.request.total")
            .tags("source", "GitHub", "outcome", "success")
            .counter();
    final Timer successDuration =
        registry
            .get("gateway.upstream.request.duration")
            .tags("source", "GitHub", "outcome", "success")
            .timer();
    final Counter timeout =
        registry
            .get("gateway.upstream.request.total")
            .tags("source", "GitHub", "outcome", "timeout")
            .counter();

    assertThat(success.count()).isEqualTo(2.0);
    assertThat(successDuration.count()).isEqualTo(2L);
    assertThat(timeout.count()).isEqualTo(1.0);
    assertThat(
            registry
                .get("gateway.fanout.dropped.total")
                .tags("source", "Hacker News")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(
            registry.get("gateway.error.total").tags("reason", "NOT_FOUND").counter().count())
        .isEqualTo(2.0);
  }
}
