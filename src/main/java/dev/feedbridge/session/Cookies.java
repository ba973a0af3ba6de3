package dev.feedbridge.session;

import java.net.URI;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/** Helpers for rendering cookie lists into request headers. */
public final class Cookies {

  private Cookies() {}

  /** Renders {@code a=b; c=d}, the {@code Cookie} header format. */
  public static String header(Collection<Cookie> cookies) {
    return cookies.stream().map(c -> c.name() + "=" + c.value()).collect(Collectors.joining("; "));
  }

  /** The cookies whose domain matches the host of {@code url}. */
  public static List<Cookie> forUrl(Collection<Cookie> cookies, String url) {
    String host = URI.create(url).getHost();
    return cookies.stream().filter(c -> c.matchesHost(host)).toList();
  }

  /** Cookie names only, for log output. */
  public static List<String> names(Collection<Cookie> cookies) {
    return cookies.stream().map(Cookie::name).toList();
  }
}
