package dev.feedbridge.publish;

/** The read-later service rejected or failed a publish or folder call. */
public class PublishException extends RuntimeException {

  public PublishException(String message) {
    super(message);
  }

  public PublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
