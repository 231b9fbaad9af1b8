/*
 * どこで: Digest Dispatch 設定
 * 何を: 送信 API 呼び出し専用 RestClient を提供する
 * なぜ: baseUrl とタイムアウトを送信先ごとに分離するため
 */
package com.example.dispatch.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "digest.transport.mode", havingValue = "http")
public class TransportClientConfig {

  @Bean
  RestClient transportRestClient(RestClient.Builder builder, TransportProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
