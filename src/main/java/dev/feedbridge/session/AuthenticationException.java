package dev.feedbridge.session;

/** A login failed, or no usable session exists for a source that needs one. */
public class AuthenticationException extends RuntimeException {

  public AuthenticationException(String message) {
    super(message);
  }

  public AuthenticationException(String message, Throwable cause) {
    super(message, cause);
  }
}
