package dev.feedbridge.ingest;

import dev.feedbridge.session.Cookie;
import java.util.List;
import java.util.Map;

/** Fetches the HTML body of an article. */
public interface ContentFetcher {

  /**
   * @param cookies session cookies; only those matching the URL's host are sent
   * @param headers extra request headers
   * @throws PaywalledContentException if the response is a login redirect or a paywall
   * @throws FetchException for any other failure
   */
  String fetch(String url, List<Cookie> cookies, Map<String, String> headers);
}
