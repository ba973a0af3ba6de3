package dev.feedbridge.sweep;

/** A status or delete call to the read-later service failed. */
public class SyncException extends RuntimeException {

  public SyncException(String message) {
    super(message);
  }

  public SyncException(String message, Throwable cause) {
    super(message, cause);
  }
}
