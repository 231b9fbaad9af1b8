/*
 * どこで: Digest Dispatch インフラ設定
 * 何を: 送信済みマーカーとレート制限ウィンドウが使う StringRedisTemplate を提供する
 * なぜ: キャッシュ系リポジトリが同じ文字列シリアライザで Redis を扱うため
 */
package com.example.dispatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RedisConfig {

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }
}
