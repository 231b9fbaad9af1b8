/*
 * どこで: Digest Dispatch 並列実行設定
 * 何を: 受信者ごとの配信タスクを実行する固定サイズのスレッドプールを提供する
 * なぜ: 同時送信数を設定値で上限付けし、スレッド名でログを追えるようにするため
 */
package com.example.dispatch.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatchExecutorConfig {

  @Bean(name = "dispatchExecutor", destroyMethod = "shutdown")
  ExecutorService dispatchExecutor(DispatchProperties properties) {
    return Executors.newFixedThreadPool(
        properties.concurrency(),
        new ThreadFactoryBuilder().setNameFormat("digest-dispatch-%d").setDaemon(true).build());
  }
}
