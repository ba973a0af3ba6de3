package dev.feedbridge.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Timeouts and identity for every outbound HTTP call, bound from {@code feedbridge.http.*}.
 *
 * <p>No external call may block indefinitely, so both timeouts always resolve to a positive
 * duration.
 */
@ConfigurationProperties(prefix = "feedbridge.http")
public record HttpProperties(Duration connectTimeout, Duration readTimeout, String userAgent) {

  static final String DEFAULT_USER_AGENT =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
          + "Chrome/127.0.0.0 Safari/537.36";

  public HttpProperties {
    connectTimeout = positiveOr(connectTimeout, Duration.ofSeconds(10));
    readTimeout = positiveOr(readTimeout, Duration.ofSeconds(30));
    userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
  }

  private static Duration positiveOr(Duration value, Duration fallback) {
    return value == null || value.isZero() || value.isNegative() ? fallback : value;
  }
}
