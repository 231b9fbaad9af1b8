/*
 * どこで: Digest Dispatch 認証
 * 何を: 制御リクエストの正規化文字列を HMAC-SHA256 で署名し 16 進で返す
 * なぜ: 署名方式をサーバとテストで同一実装にそろえるため
 */
package com.example.dispatch.security;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

public final class HmacSigner {

  private static final String ALGORITHM = "HmacSHA256";

  private HmacSigner() {}

  public static String canonicalString(
      String method, String pathWithQuery, String timestamp, String body) {
    final String signedBody = "GET".equalsIgnoreCase(method) || body == null ? "" : body;
    return method + "\n" + pathWithQuery + "\n" + timestamp + "\n" + signedBody;
  }

  public static String sign(String secret, String canonical) {
    try {
      final Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      final byte[] digest = mac.doFinal(canonical.getBytes(StandardCharsets.UTF_8));
      final StringBuilder hex = new StringBuilder(digest.length * 2);
      for (byte value : digest) {
        hex.append(String.format("%02x", value));
      }
      return hex.toString();
    } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
      throw new IllegalStateException("HmacSHA256 is not available", ex);
    }
  }
}
