package com.example.dispatch.retry;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.dispatch.transport.TransportException;
import com.example.dispatch.transport.TransportFailureKind;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

class TransientFailureClassifierTest {

  private final TransientFailureClassifier classifier = new TransientFailureClassifier();

  @Test
  void transportKindsFollowTheirDefaults() {
    assertThat(classifier.test(new TransportException(TransportFailureKind.NETWORK, "x"))).isTrue();
    assertThat(classifier.test(new TransportException(TransportFailureKind.TIMEOUT, "x"))).isTrue();
    assertThat(classifier.test(new TransportException(TransportFailureKind.RATE_LIMITED, "x")))
        .isTrue();
    assertThat(classifier.test(new TransportException(TransportFailureKind.REJECTED, "x")))
        .isFalse();
    assertThat(classifier.test(new TransportException(TransportFailureKind.NOT_CONFIGURED, "x")))
        .isFalse();
  }

  @Test
  void httpStatusFailuresDependOnStatus() {
    assertThat(
            classifier.test(
                new TransportException(TransportFailureKind.HTTP_STATUS, 503, "unavailable", null)))
        .isTrue();
    assertThat(
            classifier.test(
                new TransportException(TransportFailureKind.HTTP_STATUS, 400, "bad request", null)))
        .isFalse();
  }

  @Test
  void restClientExceptionsAreClassifiedByStatus() {
    assertThat(classifier.test(serverError(HttpStatus.BAD_GATEWAY))).isTrue();
    assertThat(classifier.test(clientError(HttpStatus.TOO_MANY_REQUESTS))).isTrue();
    assertThat(classifier.test(clientError(HttpStatus.REQUEST_TIMEOUT))).isTrue();
    assertThat(classifier.test(clientError(HttpStatus.UNAUTHORIZED))).isFalse();
  }

  @Test
  void ioFailuresAreTransientEvenWhenWrapped() {
    assertThat(classifier.test(new ResourceAccessException("I/O error"))).isTrue();
    assertThat(classifier.test(new IllegalStateException("wrapped", new SocketTimeoutException())))
        .isTrue();
    assertThat(classifier.test(new RuntimeException(new IOException("reset")))).isTrue();
  }

  @Test
  void transportVerdictWinsOverWrappedIoCause() {
    final TransportException unreadableBody =
        new TransportException(
            TransportFailureKind.INVALID_RESPONSE,
            "transport response parse failed",
            new IllegalStateException("parse", new IOException("Unexpected character")));
    final TransportException rejected =
        new TransportException(
            TransportFailureKind.REJECTED, "rejected", new SocketTimeoutException("late"));

    assertThat(classifier.test(unreadableBody)).isFalse();
    assertThat(classifier.test(rejected)).isFalse();
    assertThat(classifier.test(new RuntimeException("wrapper", unreadableBody))).isFalse();
  }

  @Test
  void httpStatusWinsOverWrappedIoCause() {
    final HttpClientErrorException badRequest = clientError(HttpStatus.BAD_REQUEST);
    badRequest.initCause(new IOException("body read failed"));

    assertThat(classifier.test(badRequest)).isFalse();
  }

  @Test
  void messagesAreUsedWhenTypeIsUnknown() {
    assertThat(classifier.test(new RuntimeException("Upstream Timeout"))).isTrue();
    assertThat(classifier.test(new RuntimeException("rate limit hit"))).isTrue();
    assertThat(classifier.test(new RuntimeException("network unreachable"))).isTrue();
    assertThat(classifier.test(new IllegalArgumentException("invalid address"))).isFalse();
    assertThat(classifier.test(new IllegalArgumentException())).isFalse();
  }

  private static HttpServerErrorException serverError(HttpStatus status) {
    return HttpServerErrorException.create(
        status, status.getReasonPhrase(), new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);
  }

  private static HttpClientErrorException clientError(HttpStatus status) {
    return HttpClientErrorException.create(
        status, status.getReasonPhrase(), new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);
  }
}
