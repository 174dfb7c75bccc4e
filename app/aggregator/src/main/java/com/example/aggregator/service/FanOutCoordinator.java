/*
 * どこで: Aggregator サービス層
 * 何を: 1 リクエスト内の追加上流呼び出しを並列に実行し、成功分だけを入力順で返す
 * なぜ: ストーリー一覧やパイプライン一覧の個別取得を直列にするとレイテンシが件数倍になるため
 */
package com.example.aggregator.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class FanOutCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(FanOutCoordinator.class);

  private final Executor fanOutExecutor;
  private final GatewayMetrics gatewayMetrics;

  public FanOutCoordinator(
      @Qualifier("fanOutExecutor") Executor fanOutExecutor, GatewayMetrics gatewayMetrics) {
    this.fanOutExecutor = fanOutExecutor;
    this.gatewayMetrics = gatewayMetrics;
  }

  /**
   * Runs every task concurrently and waits for all of them.
   *
   * <p>A task that throws or yields {@code null} contributes nothing to the result. The result
   * follows the order of {@code tasks}, not the order of completion.
   */
  public <T> List<T> gather(String source, List<? extends Supplier<? extends T>> tasks) {
    final List<CompletableFuture<Optional<T>>> futures = new ArrayList<>(tasks.size());
    for (int index = 0; index < tasks.size(); index++) {
      final Supplier<? extends T> task = tasks.get(index);
      final int position = index;
      futures.add(
          CompletableFuture.<Optional<T>>supplyAsync(
                  () -> {
                    final T result = task.get();
                    if (result == null) {
                      logger.warn("{} fan-out task {} returned no result", source, position);
                      gatewayMetrics.recordFanOutDropped(source);
                    }
                    return Optional.ofNullable(result);
                  },
                  fanOutExecutor)
              .exceptionally(
                  ex -> {
                    final Throwable cause = unwrap(ex);
                    logger.warn(
                        "{} fan-out task {} dropped: {}", source, position, cause.getMessage());
                    gatewayMetrics.recordFanOutDropped(source);
                    return Optional.empty();
                  }));
    }
    CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

    final List<T> results = new ArrayList<>(futures.size());
    for (CompletableFuture<Optional<T>> future : futures) {
      future.join().ifPresent(results::add);
    }
    return results;
  }

  private Throwable unwrap(Throwable ex) {
    if (ex instanceof CompletionException && ex.getCause() != null) {
      return ex.getCause();
    }
    return ex;
  }
}
