package dev.feedbridge.state;

/** The state store failed. Progress can no longer be recorded safely, so the loop stops. */
public class StatePersistenceException extends RuntimeException {

  public StatePersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
