/*
 * どこで: Digest Dispatch 送信層
 * 何を: HTTP メール送信 API を RestClient で呼び出す
 * なぜ: 下流失敗を TransportException に変換し、リトライ判定へ渡すため
 */
package com.example.dispatch.transport;

import com.example.dispatch.config.TransportProperties;
import com.example.dispatch.content.DigestContent;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
@ConditionalOnProperty(name = "digest.transport.mode", havingValue = "http")
public class HttpNotificationTransport implements NotificationTransport {

  private static final Logger logger = LoggerFactory.getLogger(HttpNotificationTransport.class);

  private final RestClient transportRestClient;
  private final TransportProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public HttpNotificationTransport(
      @Qualifier("transportRestClient") RestClient transportRestClient,
      TransportProperties properties) {
    this.transportRestClient = transportRestClient;
    this.properties = properties;
  }

  @Override
  public DeliveryReceipt send(DigestContent content, String address) {
    if (!configured()) {
      throw new TransportException(
          TransportFailureKind.NOT_CONFIGURED, "transport api key or sender is not configured");
    }
    final EmailSendRequest request = buildRequest(content, address);
    try {
      final EmailSendResponse response =
          transportRestClient
              .post()
              .uri(properties.sendPath())
              .header(properties.apiKeyHeaderName(), properties.apiKey())
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(EmailSendResponse.class);
      return requireReceipt(response);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (TransportException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("transport response parse failed", ex);
      throw new TransportException(
          TransportFailureKind.INVALID_RESPONSE, "transport response parse failed", ex);
    }
  }

  @Override
  public boolean configured() {
    return properties.configured();
  }

  private EmailSendRequest buildRequest(DigestContent content, String address) {
    final List<EmailSendRequest.CustomHeader> headers =
        properties.replyTo().isBlank()
            ? List.of()
            : List.of(new EmailSendRequest.CustomHeader("Reply-To", properties.replyTo()));
    return new EmailSendRequest(
        properties.fromAddress(),
        List.of(address),
        content.subject(),
        content.htmlBody(),
        content.textBody(),
        headers);
  }

  private DeliveryReceipt requireReceipt(EmailSendResponse response) {
    if (response == null || isBlank(response.requestId())) {
      throw new TransportException(
          TransportFailureKind.INVALID_RESPONSE, "transport response has no request_id");
    }
    final EmailSendResponse.Data data = response.data();
    if (data != null && data.failed() != null && data.failed() > 0) {
      throw new TransportException(
          TransportFailureKind.REJECTED,
          "transport rejected message: " + (data.error() == null ? "unknown" : data.error()));
    }
    if (data != null && !isBlank(data.emailId())) {
      return new DeliveryReceipt(data.emailId());
    }
    return new DeliveryReceipt(response.requestId());
  }

  private TransportException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "transport send failed with http status={} statusText={}", status, ex.getStatusText());
    if (status == 429) {
      return new TransportException(
          TransportFailureKind.RATE_LIMITED, status, "transport rate limit exceeded", ex);
    }
    return new TransportException(
        TransportFailureKind.HTTP_STATUS, status, "transport request failed status=" + status, ex);
  }

  private TransportException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("transport send timed out");
      return new TransportException(TransportFailureKind.TIMEOUT, "transport request timeout", ex);
    }
    logger.warn("transport send connection failed", ex);
    return new TransportException(
        TransportFailureKind.NETWORK, "transport network connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
