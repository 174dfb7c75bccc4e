/*
 * どこで: Aggregator API DTO
 * 何を: /features の 1 ソース分のエントリを定義する
 * なぜ: 公開契約 (example_endpoint / description) をルーティング内部型から分離するため
 */
package com.example.aggregator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeatureResponse(String exampleEndpoint, String description) {}
