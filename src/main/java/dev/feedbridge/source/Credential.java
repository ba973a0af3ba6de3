package dev.feedbridge.source;

import java.util.HashMap;
import java.util.Map;

/**
 * Login secrets for one account. {@code values} carries extra template values (API keys, tenant ids)
 * referenced as {@code {{name}}} by API logins.
 */
public record Credential(String id, String username, String password, Map<String, String> values) {

  public Credential {
    values = values == null ? Map.of() : Map.copyOf(values);
  }

  /** Template values including {@code username} and {@code password}. */
  public Map<String, String> templateValues() {
    var merged = new HashMap<>(values);
    if (username != null) {
      merged.put("username", username);
    }
    if (password != null) {
      merged.put("password", password);
    }
    return merged;
  }

  @Override
  public String toString() {
    return "Credential[id=" + id + ", username=" + username + "]";
  }
}
