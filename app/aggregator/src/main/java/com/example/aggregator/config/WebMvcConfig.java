/*
 * どこで: Aggregator Web 設定
 * 何を: RequestMdcInterceptor を全リクエストへ適用する
 * なぜ: 上流呼び出しの WARN ログをリクエスト単位で追跡できるようにするため
 */
package com.example.aggregator.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
  }
}
