/*
 * どこで: Digest Dispatch セキュリティ設定
 * 何を: 制御エンドポイントに OPERATOR 権限を要求し、それ以外を公開する。CORS もここで設定する
 * なぜ: ヘルスチェックは無認証、配信操作は運用者のみに限定するため
 */
package com.example.dispatch.config;

import com.example.dispatch.security.ControlApiAuthenticationFilter;
import com.example.dispatch.security.ControlAuthenticationEntryPoint;
import com.example.dispatch.security.ControlAuthenticator;
import com.example.dispatch.security.ControlCorsConfigurationSource;
import com.example.dispatch.security.ControlEndpoint;
import com.example.dispatch.service.DispatchMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
public class ControlSecurityConfig {

  @Bean
  ControlApiAuthenticationFilter controlApiAuthenticationFilter(
      ControlAuthenticator authenticator,
      ControlAuthProperties properties,
      ControlRequestProperties requestProperties,
      DispatchMetrics metrics,
      ObjectMapper objectMapper,
      Clock clock) {
    return new ControlApiAuthenticationFilter(
        authenticator, properties, requestProperties, metrics, objectMapper, clock);
  }

  // セキュリティチェーン内だけで動かし、サーブレットフィルタとしての二重登録を避ける
  @Bean
  FilterRegistrationBean<ControlApiAuthenticationFilter> controlApiAuthenticationFilterRegistration(
      ControlApiAuthenticationFilter filter) {
    final FilterRegistrationBean<ControlApiAuthenticationFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      ControlApiAuthenticationFilter controlApiAuthenticationFilter,
      ControlCorsProperties corsProperties,
      ObjectMapper objectMapper)
      throws Exception {
    // プリフライトは CorsFilter が認証より前に応答する
    http.cors(cors -> cors.configurationSource(new ControlCorsConfigurationSource(corsProperties)))
        .csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .exceptionHandling(
            exceptions ->
                exceptions.authenticationEntryPoint(
                    new ControlAuthenticationEntryPoint(objectMapper)))
        .addFilterBefore(controlApiAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        HttpMethod.POST, ControlEndpoint.TRIGGER_EMAILS.path())
                    .hasRole("OPERATOR")
                    .requestMatchers(HttpMethod.GET, ControlEndpoint.TEST_EMAIL.path())
                    .hasRole("OPERATOR")
                    .requestMatchers(HttpMethod.GET, ControlEndpoint.STATS.path())
                    .hasRole("OPERATOR")
                    // 他メソッドでの制御パス呼び出しは MVC 側で 405 を返す
                    .anyRequest()
                    .permitAll());
    return http.build();
  }
}
