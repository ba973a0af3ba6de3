package dev.feedbridge.refresh;

/** Pushing cookies to a downstream feed reader failed. */
public class RefreshException extends RuntimeException {

  public RefreshException(String message) {
    super(message);
  }

  public RefreshException(String message, Throwable cause) {
    super(message, cause);
  }
}
