package dev.feedbridge.miniflux;

import dev.feedbridge.refresh.RefreshException;
import dev.feedbridge.refresh.RefreshTarget;
import dev.feedbridge.session.Cookie;
import dev.feedbridge.session.Cookies;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Pushes session cookies into Miniflux feed settings with {@code PUT /v1/feeds/{id}}, so Miniflux
 * can fetch authenticated feeds itself.
 */
public class MinifluxClient implements RefreshTarget {

  private static final Logger log = LoggerFactory.getLogger(MinifluxClient.class);

  private final RestClient restClient;
  private final List<Long> feedIds;

  /** @param restClient client with the instance base URL and {@code X-Auth-Token} preset */
  public MinifluxClient(RestClient restClient, List<Long> feedIds) {
    this.restClient = restClient;
    this.feedIds = List.copyOf(feedIds);
  }

  /** Updates every feed, then fails if any update failed. */
  @Override
  public void refresh(List<Cookie> cookies) {
    Map<String, String> body = Map.of("cookie", Cookies.header(cookies));
    List<Long> failed = new ArrayList<>();
    for (Long feedId : feedIds) {
      try {
        restClient
            .put()
            .uri("/v1/feeds/{id}", feedId)
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .toBodilessEntity();
        log.debug("Updated cookies {} of Miniflux feed {}", Cookies.names(cookies), feedId);
      } catch (RestClientException e) {
        log.warn("Failed to update Miniflux feed {}: {}", feedId, e.getMessage());
        failed.add(feedId);
      }
    }
    if (!failed.isEmpty()) {
      throw new RefreshException("Miniflux feeds not updated: " + failed);
    }
  }
}
