package dev.feedbridge.ingest;

/**
 * Article content came back as a login page or paywall teaser, meaning the session cookies no
 * longer grant access.
 */
public class PaywalledContentException extends FetchException {

  public PaywalledContentException(String message) {
    super(message);
  }
}
