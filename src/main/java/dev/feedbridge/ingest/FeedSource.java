package dev.feedbridge.ingest;

import dev.feedbridge.session.Cookie;
import java.util.List;

/** Fetches and parses feed documents. */
public interface FeedSource {

  /**
   * @param cookies sent with the request; empty for anonymous fetches
   * @throws FetchException if the document cannot be fetched or parsed
   */
  FeedDocument fetch(String url, List<Cookie> cookies);
}
