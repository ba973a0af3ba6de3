package dev.feedbridge.source;

/** Thrown when a configured source cannot be turned into a runnable {@link SourceConfig}. */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }
}
