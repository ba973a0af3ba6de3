package dev.feedbridge.ingest.http;

import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import dev.feedbridge.ingest.FeedDocument;
import dev.feedbridge.ingest.FeedItem;
import dev.feedbridge.ingest.FeedSource;
import dev.feedbridge.ingest.FetchException;
import dev.feedbridge.session.Cookie;
import dev.feedbridge.session.Cookies;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** {@link FeedSource} that downloads with {@link RestClient} and parses RSS or Atom with Rome. */
@Component
public class RomeFeedSource implements FeedSource {

  private static final Logger log = LoggerFactory.getLogger(RomeFeedSource.class);

  private final RestClient restClient;

  public RomeFeedSource(@Qualifier("feedRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public FeedDocument fetch(String url, List<Cookie> cookies) {
    byte[] body;
    try {
      body =
          restClient
              .get()
              .uri(url)
              .headers(
                  h -> {
                    if (!cookies.isEmpty()) {
                      h.set(HttpHeaders.COOKIE, Cookies.header(cookies));
                    }
                  })
              .retrieve()
              .body(byte[].class);
    } catch (RestClientException e) {
      throw new FetchException("Failed to fetch feed " + url + ": " + e.getMessage(), e);
    }
    if (body == null || body.length == 0) {
      throw new FetchException("Feed " + url + " returned an empty body");
    }
    try {
      SyndFeed feed = new SyndFeedInput().build(new XmlReader(new ByteArrayInputStream(body)));
      log.debug("Parsed feed {} ({} entries, cookies={})", url, feed.getEntries().size(),
          Cookies.names(cookies));
      return new FeedDocument(
          feed.getTitle(),
          categoryNames(feed.getCategories()),
          feed.getEntries().stream().map(this::toItem).toList());
    } catch (FeedException | IOException | IllegalArgumentException e) {
      throw new FetchException("Failed to parse feed " + url + ": " + e.getMessage(), e);
    }
  }

  private FeedItem toItem(SyndEntry entry) {
    return new FeedItem(
        entry.getLink(),
        entry.getTitle() == null ? entry.getLink() : entry.getTitle(),
        toInstant(entry.getPublishedDate()),
        toInstant(entry.getUpdatedDate()),
        categoryNames(entry.getCategories()));
  }

  private static List<String> categoryNames(List<SyndCategory> categories) {
    if (categories == null) {
      return List.of();
    }
    return categories.stream().map(SyndCategory::getName).filter(n -> n != null).toList();
  }

  private static Instant toInstant(Date date) {
    return date == null ? null : date.toInstant();
  }
}
