package com.example.dispatch.security;

public record AuthenticationVerdict(
    boolean authenticated, AuthenticationMethod method, String error) {

  public static AuthenticationVerdict success(AuthenticationMethod method) {
    return new AuthenticationVerdict(true, method, null);
  }

  public static AuthenticationVerdict failure(String error) {
    return new AuthenticationVerdict(false, null, error);
  }
}
