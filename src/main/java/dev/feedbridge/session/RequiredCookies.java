package dev.feedbridge.session;

import dev.feedbridge.source.SiteDescriptor;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evaluates the required cookies of a site against a cookie list. A site that declares no
 * required cookies treats every captured cookie as required.
 */
public final class RequiredCookies {

  private RequiredCookies() {}

  /** Declared required names that are absent from {@code cookies}. */
  public static List<String> missing(SiteDescriptor site, Collection<Cookie> cookies) {
    Set<String> present = cookies.stream().map(Cookie::name).collect(Collectors.toSet());
    return site.requiredCookies().stream().filter(name -> !present.contains(name)).toList();
  }

  /** The cookies the session depends on. */
  public static List<Cookie> of(SiteDescriptor site, Collection<Cookie> cookies) {
    if (site.requiredCookies().isEmpty()) {
      return List.copyOf(cookies);
    }
    return cookies.stream().filter(c -> site.requiredCookies().contains(c.name())).toList();
  }

  /** Required cookies expired at {@code now}. */
  public static List<Cookie> expired(SiteDescriptor site, Collection<Cookie> cookies, Instant now) {
    return of(site, cookies).stream().filter(c -> c.isExpiredAt(now)).toList();
  }

  /** Earliest expiry among required cookies; empty when none expires. */
  public static Optional<Instant> earliestExpiry(SiteDescriptor site, Collection<Cookie> cookies) {
    return of(site, cookies).stream()
        .map(Cookie::expiry)
        .filter(expiry -> expiry != null)
        .min(Instant::compareTo);
  }

  /**
   * Fails a fresh login whose cookies lack a declared required cookie.
   *
   * @throws AuthenticationException naming the missing cookies
   */
  public static void requirePresent(SiteDescriptor site, Collection<Cookie> cookies) {
    if (cookies.isEmpty()) {
      throw new AuthenticationException("Login to " + site.id() + " captured no cookies");
    }
    List<String> missing = missing(site, cookies);
    if (!missing.isEmpty()) {
      throw new AuthenticationException(
          "Login to " + site.id() + " did not set required cookies " + missing);
    }
  }
}
