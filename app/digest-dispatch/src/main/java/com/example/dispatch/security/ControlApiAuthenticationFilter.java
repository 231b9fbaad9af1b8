/*
 * どこで: Digest Dispatch 認証
 * 何を: 制御エンドポイントへのリクエストを検証し OPERATOR 権限を付与する
 * なぜ: 認可判定を Spring Security の設定に集約するため
 */
package com.example.dispatch.security;

import com.example.dispatch.api.ApiErrorResponse;
import com.example.dispatch.config.ControlAuthProperties;
import com.example.dispatch.config.ControlRequestProperties;
import com.example.dispatch.service.DispatchMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class ControlApiAuthenticationFilter extends OncePerRequestFilter {

  public static final String AUTH_ERROR_ATTRIBUTE =
      ControlApiAuthenticationFilter.class.getName() + ".AUTH_ERROR";

  private static final Logger logger =
      LoggerFactory.getLogger(ControlApiAuthenticationFilter.class);
  private static final String OPERATOR_ROLE = "ROLE_OPERATOR";

  private final ControlAuthenticator authenticator;
  private final ControlAuthProperties properties;
  private final ControlRequestProperties requestProperties;
  private final DispatchMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ControlApiAuthenticationFilter(
      ControlAuthenticator authenticator,
      ControlAuthProperties properties,
      ControlRequestProperties requestProperties,
      DispatchMetrics metrics,
      ObjectMapper objectMapper,
      Clock clock) {
    this.authenticator = authenticator;
    this.properties = properties;
    this.requestProperties = requestProperties;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return ControlEndpoint.match(request).isEmpty();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final long maxBodyBytes = requestProperties.maxBodySize().toBytes();
    if (request.getContentLengthLong() > maxBodyBytes) {
      rejectTooLarge(request, response);
      return;
    }
    final CachedBodyHttpServletRequest cachedRequest;
    try {
      cachedRequest = new CachedBodyHttpServletRequest(request, maxBodyBytes);
    } catch (RequestBodyTooLargeException ex) {
      rejectTooLarge(request, response);
      return;
    }
    final AuthenticationVerdict verdict =
        authenticator.authenticate(toControlRequest(cachedRequest), Instant.now(clock));
    if (verdict.authenticated()) {
      logger.debug(
          "control authentication established path={} method={}",
          request.getRequestURI(),
          verdict.method());
      SecurityContextHolder.getContext()
          .setAuthentication(
              new UsernamePasswordAuthenticationToken(
                  "operator-" + verdict.method().name().toLowerCase(Locale.ROOT),
                  "N/A",
                  List.of(new SimpleGrantedAuthority(OPERATOR_ROLE))));
    } else {
      logger.warn(
          "control authentication rejected path={} reason={}",
          request.getRequestURI(),
          verdict.error());
      metrics.recordAuthFailure();
      cachedRequest.setAttribute(AUTH_ERROR_ATTRIBUTE, verdict.error());
    }
    filterChain.doFilter(cachedRequest, response);
  }

  private void rejectTooLarge(HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    logger.warn(
        "control request rejected path={} reason=body_too_large contentLength={}",
        request.getRequestURI(),
        request.getContentLengthLong());
    response.setStatus(HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(
        response.getOutputStream(),
        ApiErrorResponse.payloadTooLarge(requestProperties.maxBodySize().toKilobytes()));
  }

  private ControlRequest toControlRequest(CachedBodyHttpServletRequest request) {
    final String query = request.getQueryString();
    final String pathWithQuery =
        query == null || query.isEmpty()
            ? request.getRequestURI()
            : request.getRequestURI() + "?" + query;
    return new ControlRequest(
        request.getMethod(),
        pathWithQuery,
        request.getHeader(HttpHeaders.AUTHORIZATION),
        request.getHeader(properties.timestampHeaderName()),
        request.getHeader(properties.signatureHeaderName()),
        request.bodyAsString());
  }
}
