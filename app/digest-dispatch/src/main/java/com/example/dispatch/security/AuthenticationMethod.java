package com.example.dispatch.security;

public enum AuthenticationMethod {
  TOKEN,
  HMAC
}
