package dev.feedbridge.source;

import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * How to log in to a site and which cookies make up its session.
 *
 * <p>{@code requiredCookies} names the cookies that must be present and unexpired for a cached
 * session to be reused. When empty, every captured cookie counts as required.
 *
 * @param id catalog key of the site
 * @param loginType selects the authenticator
 * @param siteUrl login page ({@link LoginType#FORM}) or base URL ({@link LoginType#API})
 * @param requiredCookies cookie names that must survive for the session to be valid
 * @param form form login settings, required for {@link LoginType#FORM}
 * @param api API login settings, required for {@link LoginType#API}
 * @param headers extra HTTP headers sent with content fetches for this site
 * @param sanitizingCriteria CSS selectors stripped from article content before publishing
 */
public record SiteDescriptor(
    String id,
    LoginType loginType,
    String siteUrl,
    List<String> requiredCookies,
    @Nullable FormLogin form,
    @Nullable ApiLogin api,
    Map<String, String> headers,
    List<String> sanitizingCriteria) {

  public SiteDescriptor {
    requiredCookies = requiredCookies == null ? List.of() : List.copyOf(requiredCookies);
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    sanitizingCriteria = sanitizingCriteria == null ? List.of() : List.copyOf(sanitizingCriteria);
  }

  /**
   * Selectors and success checks for a login form.
   *
   * @param usernameSelector CSS selector of the username input
   * @param passwordSelector CSS selector of the password input
   * @param submitSelector CSS selector of the submit control, sent as the submitter when named
   * @param postLoginSelector element whose presence proves the login succeeded
   * @param successTextClass class of the element holding {@code expectedSuccessText}
   * @param expectedSuccessText text proving the login succeeded
   * @param cookiesToStore cookie names to keep; empty keeps all
   */
  public record FormLogin(
      String usernameSelector,
      String passwordSelector,
      @Nullable String submitSelector,
      @Nullable String postLoginSelector,
      @Nullable String successTextClass,
      @Nullable String expectedSuccessText,
      List<String> cookiesToStore) {

    public FormLogin {
      cookiesToStore = cookiesToStore == null ? List.of() : List.copyOf(cookiesToStore);
    }
  }

  /**
   * An API login: optional pre-login requests followed by the login request itself.
   *
   * @param preLogin requests issued in order before {@code login}, sharing one cookie jar
   * @param login the login request
   * @param cookiesToStore cookie names to keep from {@code Set-Cookie}; empty keeps all
   * @param cookieMapping cookie name to either a JSON pointer into the login response ({@code
   *     $.data.token}) or a template rendered from the credential
   */
  public record ApiLogin(
      List<ApiRequest> preLogin,
      ApiRequest login,
      List<String> cookiesToStore,
      Map<String, String> cookieMapping) {

    public ApiLogin {
      preLogin = preLogin == null ? List.of() : List.copyOf(preLogin);
      cookiesToStore = cookiesToStore == null ? List.of() : List.copyOf(cookiesToStore);
      cookieMapping = cookieMapping == null ? Map.of() : Map.copyOf(cookieMapping);
    }
  }

  /**
   * One templated HTTP request. The body is sent as a form when the {@code Content-Type} header
   * is {@code application/x-www-form-urlencoded}, as JSON otherwise.
   */
  public record ApiRequest(
      String endpoint,
      String method,
      Map<String, String> headers,
      Map<String, String> body) {

    public ApiRequest {
      method = method == null || method.isBlank() ? "POST" : method;
      headers = headers == null ? Map.of() : Map.copyOf(headers);
      body = body == null ? Map.of() : Map.copyOf(body);
    }
  }
}
