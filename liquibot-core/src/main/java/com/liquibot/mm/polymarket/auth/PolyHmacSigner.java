package com.liquibot.mm.polymarket.auth;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Objects;

/**
 * HMAC-SHA256 request signature for L2 (API key) authenticated CLOB calls.
 */
public final class PolyHmacSigner {

  private static final String HMAC_SHA256 = "HmacSHA256";

  private PolyHmacSigner() {
  }

  public static String sign(String base64Secret, long timestampSeconds, String method, String requestPath, String body) {
    Objects.requireNonNull(base64Secret, "base64Secret");
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(requestPath, "requestPath");

    String message = timestampSeconds + method + requestPath + (body == null ? "" : body);
    try {
      Mac mac = Mac.getInstance(HMAC_SHA256);
      mac.init(new SecretKeySpec(decodeSecret(base64Secret), HMAC_SHA256));
      byte[] digest = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
      return Base64.getUrlEncoder().encodeToString(digest);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HMAC signing failed", e);
    }
  }

  // secrets are issued url-safe, but tolerate the standard alphabet
  private static byte[] decodeSecret(String secret) {
    String normalized = secret.trim().replace('+', '-').replace('/', '_');
    return Base64.getUrlDecoder().decode(normalized);
  }
}
