/*
 * どこで: Digest Dispatch 送信層
 * 何を: 送信 API 呼び出しの失敗種別と HTTP ステータスを表現する
 * なぜ: リトライ判定を送信境界で一貫して行うため
 */
package com.example.dispatch.transport;

import com.example.dispatch.retry.TransientFailureClassifier;

public class TransportException extends RuntimeException {

  private final TransportFailureKind kind;
  private final Integer httpStatus;

  public TransportException(TransportFailureKind kind, String message) {
    this(kind, null, message, null);
  }

  public TransportException(TransportFailureKind kind, String message, Throwable cause) {
    this(kind, null, message, cause);
  }

  public TransportException(
      TransportFailureKind kind, Integer httpStatus, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.httpStatus = httpStatus;
  }

  public TransportFailureKind kind() {
    return kind;
  }

  public Integer httpStatus() {
    return httpStatus;
  }

  public boolean isTransient() {
    if (kind == TransportFailureKind.HTTP_STATUS && httpStatus != null) {
      return TransientFailureClassifier.isTransientStatus(httpStatus);
    }
    return kind.transientByDefault();
  }
}
