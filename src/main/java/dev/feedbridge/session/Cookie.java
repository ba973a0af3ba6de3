package dev.feedbridge.session;

import java.time.Instant;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * A captured session cookie. {@code expiry} is {@code null} for cookies that last for the browser
 * session, which never count as expired.
 */
public record Cookie(
    String name,
    String value,
    @Nullable String domain,
    @Nullable String path,
    @Nullable Instant expiry,
    boolean secure,
    boolean httpOnly) {

  public static Cookie of(String name, String value) {
    return new Cookie(name, value, null, null, null, false, false);
  }

  /** Whether the cookie has an expiry at or before {@code now}. */
  public boolean isExpiredAt(Instant now) {
    return expiry != null && !expiry.isAfter(now);
  }

  /** Whether the cookie should be sent to {@code host}, following domain-match rules. */
  public boolean matchesHost(@Nullable String host) {
    if (domain == null || domain.isBlank() || host == null) {
      return true;
    }
    String bare = domain.startsWith(".") ? domain.substring(1) : domain;
    String lowerHost = host.toLowerCase(Locale.ROOT);
    String lowerDomain = bare.toLowerCase(Locale.ROOT);
    return lowerHost.equals(lowerDomain) || lowerHost.endsWith("." + lowerDomain);
  }

  @Override
  public String toString() {
    return "Cookie[name=" + name + ", domain=" + domain + ", expiry=" + expiry + "]";
  }
}
