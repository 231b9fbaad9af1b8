package com.example.dispatch.transport;

public enum TransportFailureKind {
  NETWORK(true),
  TIMEOUT(true),
  RATE_LIMITED(true),
  HTTP_STATUS(false),
  REJECTED(false),
  INVALID_RESPONSE(false),
  NOT_CONFIGURED(false);

  private final boolean transientByDefault;

  TransportFailureKind(boolean transientByDefault) {
    this.transientByDefault = transientByDefault;
  }

  public boolean transientByDefault() {
    return transientByDefault;
  }
}
