package dev.feedbridge.ingest;

/** A feed document or article body could not be fetched or parsed. */
public class FetchException extends RuntimeException {

  public FetchException(String message) {
    super(message);
  }

  public FetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
