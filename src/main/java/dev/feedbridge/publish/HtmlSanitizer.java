package dev.feedbridge.publish;

import dev.feedbridge.ingest.PendingEntry;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Strips unwanted elements from article HTML with Jsoup before it is published. */
final class HtmlSanitizer {

  private static final Logger log = LoggerFactory.getLogger(HtmlSanitizer.class);

  static final List<String> DEFAULT_CRITERIA = List.of("img");

  private HtmlSanitizer() {}

  /** Destination selectors win over the site's; with neither, images are stripped. */
  static List<String> criteriaFor(PendingEntry entry) {
    if (!entry.destination().sanitizingCriteria().isEmpty()) {
      return entry.destination().sanitizingCriteria();
    }
    if (!entry.siteSanitizingCriteria().isEmpty()) {
      return entry.siteSanitizingCriteria();
    }
    return DEFAULT_CRITERIA;
  }

  static String sanitize(String html, List<String> selectors) {
    Document document = Jsoup.parse(html);
    for (String selector : selectors) {
      try {
        document.select(selector).remove();
      } catch (Selector.SelectorParseException e) {
        log.warn("Ignoring invalid sanitizing selector '{}': {}", selector, e.getMessage());
      }
    }
    return document.outerHtml();
  }
}
