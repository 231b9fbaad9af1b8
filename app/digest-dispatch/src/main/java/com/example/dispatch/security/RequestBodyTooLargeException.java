package com.example.dispatch.security;

import java.io.IOException;

/** ボディが上限を超えたため先読みを打ち切ったことを示す。 */
public class RequestBodyTooLargeException extends IOException {

  private final long limitBytes;

  public RequestBodyTooLargeException(long limitBytes) {
    super("request body exceeds " + limitBytes + " bytes");
    this.limitBytes = limitBytes;
  }

  public long limitBytes() {
    return limitBytes;
  }
}
