/*
 * どこで: Common 共通設定
 * 何を: Clock と Sleeper を DI 可能にする
 * なぜ: 各アプリで同一の時刻注入・待機注入を使うため
 */
package com.example.common.config;

import com.example.common.Sleeper;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper sleeper() {
    return Sleeper.SYSTEM;
  }
}
