package com.scholary.recipe.media.provider.cloudflare;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies the {@code Webhook-Signature} header Cloudflare Stream attaches to notifications.
 *
 * <p>The header looks like {@code time=1230811200,sig1=60493ec9...}. The signature is the hex
 * HMAC-SHA256 of {@code "<time>.<raw body>"} keyed with the webhook secret. Signatures older than
 * {@code maxAge} are refused.
 */
public class StreamWebhookVerifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamWebhookVerifier.class);
  private static final String HMAC_SHA256 = "HmacSHA256";

  private final String secret;
  private final Duration maxAge;
  private final Clock clock;

  public StreamWebhookVerifier(String secret, Duration maxAge, Clock clock) {
    this.secret = secret;
    this.maxAge = maxAge;
    this.clock = clock;
  }

  /** Whether a secret is configured; without one webhooks are accepted unsigned. */
  public boolean isEnabled() {
    return secret != null && !secret.isBlank();
  }

  /**
   * Check a signature header against the raw request body.
   *
   * @param signatureHeader value of {@code Webhook-Signature}, may be null
   * @param rawBody request body exactly as received
   * @return true if the signature is present, fresh and matches
   */
  public boolean verify(String signatureHeader, String rawBody) {
    if (signatureHeader == null || signatureHeader.isBlank()) {
      return false;
    }

    String time = null;
    String signature = null;
    for (String part : signatureHeader.split(",")) {
      String[] pair = part.trim().split("=", 2);
      if (pair.length != 2) {
        continue;
      }
      if ("time".equals(pair[0])) {
        time = pair[1];
      } else if ("sig1".equals(pair[0])) {
        signature = pair[1];
      }
    }
    if (time == null || signature == null) {
      LOGGER.warn("Malformed Stream webhook signature header");
      return false;
    }

    long signedAt;
    try {
      signedAt = Long.parseLong(time);
    } catch (NumberFormatException e) {
      LOGGER.warn("Stream webhook signature has a non-numeric time: {}", time);
      return false;
    }
    long ageSeconds = clock.instant().getEpochSecond() - signedAt;
    if (Math.abs(ageSeconds) > maxAge.getSeconds()) {
      LOGGER.warn("Stream webhook signature expired: age={}s", ageSeconds);
      return false;
    }

    String expected = sign(time + "." + rawBody);
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.US_ASCII),
        signature.getBytes(StandardCharsets.US_ASCII));
  }

  String sign(String payload) {
    try {
      Mac mac = Mac.getInstance(HMAC_SHA256);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
      byte[] digest = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder(digest.length * 2);
      for (byte b : digest) {
        hex.append(String.format("%02x", b));
      }
      return hex.toString();
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }
}
