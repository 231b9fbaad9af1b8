package com.example.dispatch.content;

public class ContentProductionException extends RuntimeException {

  public ContentProductionException(String message) {
    super(message);
  }

  public ContentProductionException(String message, Throwable cause) {
    super(message, cause);
  }
}
