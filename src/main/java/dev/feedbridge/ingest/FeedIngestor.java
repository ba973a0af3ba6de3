package dev.feedbridge.ingest;

import dev.feedbridge.session.Cookie;
import dev.feedbridge.session.Session;
import dev.feedbridge.source.FeedSettings;
import dev.feedbridge.source.LoginBinding;
import dev.feedbridge.source.SourceConfig;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Polls a source's feed and turns entries newer than the high-water mark into {@link
 * PendingEntry}s.
 *
 * <p>Filtering is strict: an entry published exactly at the mark was already processed. Replaying
 * the same feed against an unchanged mark therefore yields the same entries, and against an
 * advanced mark yields none of the published ones.
 */
@Service
public class FeedIngestor {

  private static final Logger log = LoggerFactory.getLogger(FeedIngestor.class);

  private final FeedSource feedSource;
  private final ContentFetcher contentFetcher;
  private final Clock clock;

  public FeedIngestor(FeedSource feedSource, ContentFetcher contentFetcher, Clock clock) {
    this.feedSource = feedSource;
    this.contentFetcher = contentFetcher;
    this.clock = clock;
  }

  /**
   * Fetches the feed and prepares every entry strictly newer than {@code highWaterMark}.
   *
   * @throws FetchException if the feed cannot be fetched, or authentication is needed but the
   *     session has no cookies
   */
  public IngestResult fetchNewEntries(SourceConfig source, Instant highWaterMark, Session session) {
    FeedSettings feed = source.feed();
    if (feed == null || source.destination() == null) {
      return new IngestResult(List.of(), 0, false);
    }
    if ((feed.requiresAuth() || feed.paywalled()) && !session.hasCookies()) {
      throw new FetchException(
          "Source " + source.id() + " requires authentication but has no session cookies");
    }

    List<Cookie> feedCookies = feed.requiresAuth() ? session.cookies() : List.of();
    FeedDocument document = feedSource.fetch(feed.url(), feedCookies);
    Instant cutoff = cutoff(feed, highWaterMark);

    List<PendingEntry> entries = new ArrayList<>();
    int dropped = 0;
    boolean invalidated = false;
    Map<String, String> headers = headers(source);
    List<String> siteCriteria =
        source.login() == null ? List.of() : source.login().site().sanitizingCriteria();

    for (FeedItem item : document.items()) {
      Instant time = item.effectiveTime();
      if (time == null) {
        log.debug("Skipping entry without timestamp in {}: {}", source.id(), item.url());
        continue;
      }
      if (!time.isAfter(cutoff)) {
        continue;
      }
      if (item.url() == null || item.url().isBlank()) {
        log.debug("Skipping entry without link in {}: {}", source.id(), item.title());
        dropped++;
        continue;
      }
      String content = null;
      if (feed.paywalled()) {
        try {
          content = contentFetcher.fetch(item.url(), session.cookies(), headers);
        } catch (PaywalledContentException e) {
          log.warn("Session for source {} no longer grants access: {}", source.id(), e.getMessage());
          invalidated = true;
          dropped++;
          continue;
        } catch (FetchException e) {
          log.warn("Dropping entry {} of source {}: {}", item.url(), source.id(), e.getMessage());
          dropped++;
          continue;
        }
      }
      entries.add(
          new PendingEntry(
              source.id(),
              item.url(),
              item.title(),
              time,
              categories(document, item),
              content,
              source.destination(),
              siteCriteria));
    }
    log.info(
        "Polled {}: {} entries, {} new after {}, {} dropped",
        source.id(),
        document.items().size(),
        entries.size(),
        cutoff,
        dropped);
    return new IngestResult(entries, dropped, invalidated);
  }

  private Instant cutoff(FeedSettings feed, Instant highWaterMark) {
    if (Instant.EPOCH.equals(highWaterMark) && feed.initialLookback() != null) {
      return clock.instant().minus(feed.initialLookback());
    }
    return highWaterMark;
  }

  private static List<String> categories(FeedDocument document, FeedItem item) {
    Set<String> merged = new LinkedHashSet<>();
    for (String category : document.categories()) {
      addCategory(merged, category);
    }
    for (String category : item.categories()) {
      addCategory(merged, category);
    }
    return List.copyOf(merged);
  }

  private static void addCategory(Set<String> merged, String category) {
    if (category != null && !category.isBlank()) {
      merged.add(category.trim());
    }
  }

  /** Site headers overridden by feed headers. */
  private static Map<String, String> headers(SourceConfig source) {
    Map<String, String> headers = new LinkedHashMap<>();
    LoginBinding login = source.login();
    if (login != null) {
      headers.putAll(login.site().headers());
    }
    headers.putAll(source.feed().headers());
    return headers;
  }
}
