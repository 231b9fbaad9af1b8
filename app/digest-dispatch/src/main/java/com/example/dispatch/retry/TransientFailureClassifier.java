/*
 * どこで: Digest Dispatch リトライ
 * 何を: 例外が一時的障害(再送で回復し得る)かどうかを判定する
 * なぜ: 恒久的な失敗に対して無駄な再送と待機を行わないため
 */
package com.example.dispatch.retry;

import com.example.dispatch.transport.TransportException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class TransientFailureClassifier implements Predicate<Throwable> {

  private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 429, 500, 502, 503, 504);
  private static final int MAX_CAUSE_DEPTH = 10;

  @Override
  public boolean test(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth < MAX_CAUSE_DEPTH) {
      // 送信境界と HTTP 応答の判定は確定値として扱い、内側の原因は見ない
      if (current instanceof TransportException transportException) {
        return transportException.isTransient();
      }
      if (current instanceof RestClientResponseException responseException) {
        return TRANSIENT_STATUSES.contains(responseException.getStatusCode().value());
      }
      if (isTransient(current)) {
        return true;
      }
      current = current.getCause();
      depth++;
    }
    return false;
  }

  private boolean isTransient(Throwable error) {
    if (error instanceof ResourceAccessException
        || error instanceof SocketTimeoutException
        || error instanceof TimeoutException
        || error instanceof IOException) {
      return true;
    }
    return mentionsTransientCondition(error.getMessage());
  }

  // 型情報のない下流例外はメッセージで判定する
  private boolean mentionsTransientCondition(String message) {
    if (message == null) {
      return false;
    }
    final String normalized = message.toLowerCase(Locale.ROOT);
    return normalized.contains("timeout")
        || normalized.contains("timed out")
        || normalized.contains("rate limit")
        || normalized.contains("network");
  }

  public static boolean isTransientStatus(int status) {
    return TRANSIENT_STATUSES.contains(status);
  }
}
