/*
 * どこで: Aggregator 設定
 * 何を: CORS 許可オリジン、上流タイムアウト、fan-out スレッド数を保持する
 * なぜ: ソース横断の動作パラメータを環境ごとに外部化するため
 */
package com.example.aggregator.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway")
public record GatewayProperties(Cors cors, Upstream upstream, FanOut fanOut) {

  public GatewayProperties {
    cors = cors == null ? new Cors(null) : cors;
    upstream = upstream == null ? new Upstream(null, null) : upstream;
    fanOut = fanOut == null ? new FanOut(null, null) : fanOut;
  }

  public record Cors(List<String> allowedOrigins) {

    public Cors {
      allowedOrigins =
          allowedOrigins == null || allowedOrigins.isEmpty()
              ? List.of("http://localhost:8001", "http://127.0.0.1:8001", "http://0.0.0.0:8001")
              : List.copyOf(allowedOrigins);
    }
  }

  public record Upstream(Duration connectTimeout, Duration readTimeout) {

    public Upstream {
      connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
      readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    }
  }

  public record FanOut(Integer corePoolSize, Integer maxPoolSize) {

    public FanOut {
      corePoolSize = corePoolSize == null || corePoolSize < 1 ? 8 : corePoolSize;
      maxPoolSize =
          maxPoolSize == null || maxPoolSize < corePoolSize
              ? Math.max(64, corePoolSize)
              : maxPoolSize;
    }
  }
}
