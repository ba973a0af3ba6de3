package dev.feedbridge.session;

import dev.feedbridge.source.ConfigurationException;
import dev.feedbridge.source.LoginType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Dispatches logins to the {@link Authenticator} registered for a site's {@link LoginType}. */
@Component
public class AuthenticatorRegistry {

  private final Map<LoginType, Authenticator> byType = new EnumMap<>(LoginType.class);

  public AuthenticatorRegistry(List<Authenticator> authenticators) {
    for (Authenticator authenticator : authenticators) {
      Authenticator previous = byType.put(authenticator.loginType(), authenticator);
      if (previous != null) {
        throw new IllegalStateException(
            "Two authenticators registered for " + authenticator.loginType());
      }
    }
  }

  public Authenticator forType(LoginType loginType) {
    Authenticator authenticator = byType.get(loginType);
    if (authenticator == null) {
      throw new ConfigurationException("No authenticator for login type " + loginType);
    }
    return authenticator;
  }
}
