/*
 * どこで: Common 共通設定
 * 何を: 表示用タイムゾーン付きの Clock を DI 可能にする
 * なぜ: 上流の epoch 秒を整形する際に同一のゾーンを使うため
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${app.time-zone:UTC}") String timeZone) {
    if (timeZone == null || timeZone.isBlank()) {
      return Clock.systemUTC();
    }
    return Clock.system(ZoneId.of(timeZone.trim()));
  }
}
