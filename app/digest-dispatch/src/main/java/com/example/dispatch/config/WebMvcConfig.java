/*
 * どこで: Digest Dispatch Web 設定
 * 何を: MDC 付与とレート制限のインターセプタを登録する
 * なぜ: API ログへの運用キー付与をレート判定より先に行うため
 */
package com.example.dispatch.config;

import com.example.dispatch.ratelimit.RateLimitInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;
  private final RateLimitInterceptor rateLimitInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).order(0);
    registry.addInterceptor(rateLimitInterceptor).order(1);
  }
}
