package dev.feedbridge.session.login;

import dev.feedbridge.session.Cookie;
import java.net.HttpCookie;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Converts {@link HttpCookie}s from a login exchange into cached {@link Cookie}s. */
final class HttpCookies {

  private HttpCookies() {}

  static Cookie toCookie(HttpCookie cookie, Instant now) {
    long maxAge = cookie.getMaxAge();
    Instant expiry = maxAge < 0 ? null : now.plusSeconds(maxAge);
    return new Cookie(
        cookie.getName(),
        cookie.getValue(),
        cookie.getDomain(),
        cookie.getPath(),
        expiry,
        cookie.getSecure(),
        cookie.isHttpOnly());
  }

  /** Keeps the last cookie per name, restricted to {@code allowed} when it is not empty. */
  static List<Cookie> select(Collection<Cookie> cookies, Collection<String> allowed) {
    Map<String, Cookie> byName = new LinkedHashMap<>();
    for (Cookie cookie : cookies) {
      if (allowed.isEmpty() || allowed.contains(cookie.name())) {
        byName.put(cookie.name(), cookie);
      }
    }
    return new ArrayList<>(byName.values());
  }
}
