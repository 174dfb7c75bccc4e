/*
 * どこで: Aggregator 設定
 * 何を: 上流ソースごとの RestClient と共通の HTTP トランスポートを提供する
 * なぜ: baseUrl・認証ヘッダ・タイムアウトの設定責務をクライアント実装から分離するため
 */
package com.example.aggregator.config;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({
  GatewayProperties.class,
  GithubProperties.class,
  GitlabProperties.class,
  HackerNewsProperties.class,
  StackOverflowProperties.class,
  PypiProperties.class,
  NpmProperties.class,
  RedditProperties.class,
  CodeforcesProperties.class,
  DevtoProperties.class,
  KaggleProperties.class,
  GfgProperties.class
})
public class UpstreamClientConfig {

  /** Shared transport; Apache HttpClient decodes gzip/deflate bodies and follows redirects. */
  @Bean
  HttpComponentsClientHttpRequestFactory upstreamRequestFactory(GatewayProperties properties) {
    final GatewayProperties.Upstream upstream = properties.upstream();
    final ConnectionConfig connectionConfig =
        ConnectionConfig.custom()
            .setConnectTimeout(Timeout.ofMilliseconds(upstream.connectTimeout().toMillis()))
            .setSocketTimeout(Timeout.ofMilliseconds(upstream.readTimeout().toMillis()))
            .build();
    final PoolingHttpClientConnectionManager connectionManager =
        PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(connectionConfig)
            .build();
    final RequestConfig requestConfig =
        RequestConfig.custom()
            .setRedirectsEnabled(true)
            .setResponseTimeout(Timeout.ofMilliseconds(upstream.readTimeout().toMillis()))
            .build();
    final CloseableHttpClient httpClient =
        HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            .build();
    return new HttpComponentsClientHttpRequestFactory(httpClient);
  }

  @Bean
  RestClient githubRestClient(
      RestClient.Builder builder,
      HttpComponentsClientHttpRequestFactory upstreamRequestFactory,
      GithubProperties properties) {
    return upstream(builder, upstreamRequestFactory)
        .baseUrl(properties.baseUrl())
        .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github.v3+json")
        .build();
  }

  @Bean
  RestClient gitlabRestClient(
      RestClient.Builder builder,
      HttpComponentsClientHttpRequestFactory upstreamRequestFactory,
      GitlabProperties properties) {
    return upstream(builder, upstreamRequestFactory).baseUrl(properties.apiBaseUrl()).build();
  }

  @Bean
  RestClient hackerNewsItemRestClient(
      RestClient.Builder builder,
      HttpComponentsClientHttpRequestFactory upstreamRequestFactory,
      HackerNewsProperties properties) {
    return upstream(builder, upstreamRequestFactory).baseUrl(properties.itemBaseUrl()).build();
  }

  @Bean
  RestClient hackerNewsSearchRestClient(
      RestClient.Builder builder,
      HttpComponentsClientHttpRequestFactory upstreamRequestFactory,
      HackerNewsProperties properties) {
    return upstream(builder, upstreamRequestFactory).baseUrl(properties.searchBaseUrl()).build();
  }

  @Bean
  RestClient stackOverflowRestClient(
      RestClient.Builder builder,
      HttpComponentsClientHttpRequestFactory upstreamRequestFactory,
      StackOverflowProperties properties) {
    return upstream(builder, upstreamRequestFactory).baseUrl(properties.baseUrl()).build();
  }

  @Bean
  RestClient pypiRestClient(
      RestClient.Builder builder,
      HttpComponentsClientHttpRequestFactory upstreamRequestFactory,
      PypiProperties properties) {
    return upstream(builder, upstreamRequestFactory).baseUrl(properties.baseUrl()).build();
  }

  @Bean
  RestClient npmRestClient(
      RestClient.Builder builder,
      HttpComponentsClientHttpRequestFactory upstreamRequestFactory,
      NpmProperties properties) {
    return upstream(builder, upstreamRequestFactory).baseUrl(properties.baseUrl()).build();
  }

  @Bean
  RestClient redditRestClient(
      RestClient.Builder builder,
      HttpComponentsClientHttpRequestFactory upstreamRequestFactory,
      RedditProperties properties) {
    return upstream(builder, upstreamRequestFactory)
        .baseUrl(properties.baseUrl())
        .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
        .build();
  }

  @Bean
  RestClient codeforcesRestClient(
      RestClient.Builder builder,
      HttpComponentsClientHttpRequestFactory upstreamRequestFactory,
      CodeforcesProperties properties) {
    return upstream(builder, upstreamRequestFactory).baseUrl(properties.baseUrl()).build();
  }

  @Bean
  RestClient devtoRestClient(
      RestClient.Builder builder,
      HttpComponentsClientHttpRequestFactory upstreamRequestFactory,
      DevtoProperties properties) {
    return upstream(builder, upstreamRequestFactory)
        .baseUrl(properties.baseUrl())
        .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.forem.api-v1+json")
        .build();
  }

  @Bean
  RestClient kaggleRestClient(
      RestClient.Builder builder,
      HttpComponentsClientHttpRequestFactory upstreamRequestFactory,
      KaggleProperties properties) {
    return upstream(builder, upstreamRequestFactory).baseUrl(properties.baseUrl()).build();
  }

  // The POTD page is fetched by absolute URL, so only the stats API is the base.
  @Bean
  RestClient gfgRestClient(
      RestClient.Builder builder,
      HttpComponentsClientHttpRequestFactory upstreamRequestFactory,
      GfgProperties properties) {
    return upstream(builder, upstreamRequestFactory).baseUrl(properties.statsBaseUrl()).build();
  }

  private static RestClient.Builder upstream(
      RestClient.Builder builder, HttpComponentsClientHttpRequestFactory upstreamRequestFactory) {
    return builder.requestFactory(upstreamRequestFactory);
  }
}
