package com.example.dispatch.security;

import com.example.dispatch.config.ControlCorsProperties;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;

/**
 * 登録済みオリジンにはそのオリジンと資格情報の許可を返し、それ以外には {@code *} を返す。
 */
public class ControlCorsConfigurationSource implements CorsConfigurationSource {

  private final ControlCorsProperties properties;

  public ControlCorsConfigurationSource(ControlCorsProperties properties) {
    this.properties = properties;
  }

  @Override
  public CorsConfiguration getCorsConfiguration(HttpServletRequest request) {
    final CorsConfiguration configuration = new CorsConfiguration();
    configuration.setAllowedMethods(properties.allowedMethods());
    configuration.setAllowedHeaders(properties.allowedHeaders());
    configuration.setMaxAge(properties.maxAge());
    final String origin = request.getHeader(HttpHeaders.ORIGIN);
    if (origin != null && properties.allowedOrigins().contains(origin)) {
      configuration.setAllowedOrigins(List.of(origin));
      configuration.setAllowCredentials(true);
    } else {
      // ワイルドカードと資格情報の許可は併用できない
      configuration.setAllowedOrigins(List.of(CorsConfiguration.ALL));
      configuration.setAllowCredentials(false);
    }
    return configuration;
  }
}
