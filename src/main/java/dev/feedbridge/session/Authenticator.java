package dev.feedbridge.session;

import dev.feedbridge.source.Credential;
import dev.feedbridge.source.LoginType;
import dev.feedbridge.source.SiteDescriptor;
import java.util.List;

/** Logs in to a site and returns the cookies that make up the new session. */
public interface Authenticator {

  /** The login type this authenticator handles. */
  LoginType loginType();

  /**
   * Performs a fresh login.
   *
   * @return the captured cookies, never empty
   * @throws AuthenticationException if the login fails or required cookies are missing
   */
  List<Cookie> login(SiteDescriptor site, Credential credential);
}
