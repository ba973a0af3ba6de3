package dev.feedbridge.ingest.http;

import dev.feedbridge.ingest.ContentFetcher;
import dev.feedbridge.ingest.FetchException;
import dev.feedbridge.ingest.PaywalledContentException;
import dev.feedbridge.session.Cookie;
import dev.feedbridge.session.Cookies;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches article HTML with the session cookies, following redirects by hand so that a bounce to a
 * login page is seen before the page is read.
 *
 * <p>Cookies are re-scoped to the host of every hop. A redirect to a login URL, a 401/403, or a
 * body carrying a known paywall marker raises {@link PaywalledContentException}.
 */
@Component
public class HttpContentFetcher implements ContentFetcher {

  private static final Logger log = LoggerFactory.getLogger(HttpContentFetcher.class);

  static final int MAX_REDIRECTS = 5;

  private final RestClient restClient;

  public HttpContentFetcher(@Qualifier("sessionRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public String fetch(String url, List<Cookie> cookies, Map<String, String> headers) {
    URI current = parse(url, null);
    log.debug("Fetching article {} with headers {}", url, SensitiveHeaders.redact(headers));
    for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
      Hop result = request(current, cookies, headers);
      if (result.location() == null) {
        return accept(url, result);
      }
      URI next = parse(result.location(), current);
      if (PaywallDetector.isLoginUrl(next)) {
        throw new PaywalledContentException(url + " redirected to login page " + next);
      }
      log.debug("Article {} redirected to {}", url, next);
      current = next;
    }
    throw new FetchException("Too many redirects fetching " + url);
  }

  private static URI parse(String location, URI base) {
    if (location == null || location.isBlank()) {
      throw new FetchException("Missing article URL");
    }
    try {
      URI uri = base == null ? URI.create(location) : base.resolve(location);
      if (uri.getHost() == null) {
        throw new FetchException("Article URL has no host: " + location);
      }
      return uri;
    } catch (IllegalArgumentException e) {
      throw new FetchException("Malformed article URL " + location, e);
    }
  }

  private Hop request(URI uri, List<Cookie> cookies, Map<String, String> headers) {
    List<Cookie> scoped = Cookies.forUrl(cookies, uri.toString());
    try {
      return restClient
          .get()
          .uri(uri)
          .headers(
              h -> {
                headers.forEach(h::set);
                if (!scoped.isEmpty()) {
                  h.set(HttpHeaders.COOKIE, Cookies.header(scoped));
                }
              })
          .exchange(
              (req, response) -> {
                int status = response.getStatusCode().value();
                String location =
                    response.getStatusCode().is3xxRedirection()
                        ? response.getHeaders().getFirst(HttpHeaders.LOCATION)
                        : null;
                String body =
                    location == null
                        ? StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8)
                        : "";
                return new Hop(status, location, body);
              });
    } catch (RestClientException e) {
      throw new FetchException("Failed to fetch " + uri + ": " + e.getMessage(), e);
    }
  }

  private static String accept(String url, Hop result) {
    if (result.status() == 401 || result.status() == 403) {
      throw new PaywalledContentException(url + " answered HTTP " + result.status());
    }
    if (result.status() >= 300) {
      throw new FetchException("Fetching " + url + " failed with HTTP " + result.status());
    }
    Optional<String> marker = PaywallDetector.paywallMarker(result.body());
    if (marker.isPresent()) {
      throw new PaywalledContentException(url + " looks paywalled (" + marker.get() + ")");
    }
    return result.body();
  }

  private record Hop(int status, String location, String body) {}
}
