/*
 * どこで: Team Balancer 外部接続設定
 * 何を: レーティング API 用 RestClient と照会用スレッドプールを提供する
 * なぜ: 接続/読み取りタイムアウトを必ず効かせ、参加者ごとの照会を並列化するため
 */
package com.example.teambalancer.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(RatingClientProperties.class)
public class RatingClientConfig {

  @Bean
  RestClient ratingRestClient(RestClient.Builder builder, RatingClientProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey())
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }

  @Bean(destroyMethod = "shutdown")
  ExecutorService ratingLookupExecutor(BalancerProperties properties) {
    return Executors.newFixedThreadPool(
        properties.ratingLookupConcurrency(), new CustomizableThreadFactory("rating-lookup-"));
  }
}
