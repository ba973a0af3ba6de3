package dev.feedbridge.session.login;

import dev.feedbridge.config.HttpProperties;
import dev.feedbridge.session.AuthenticationException;
import dev.feedbridge.session.Authenticator;
import dev.feedbridge.session.Cookie;
import dev.feedbridge.session.RequiredCookies;
import dev.feedbridge.source.Credential;
import dev.feedbridge.source.LoginType;
import dev.feedbridge.source.SiteDescriptor;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.FormElement;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs in by filling and submitting a site's HTML login form with Jsoup.
 *
 * <p>The login page is fetched, the username and password inputs are located by CSS selector and
 * their enclosing form is submitted in the same Jsoup session, so cookies set by the login page and
 * by every redirect are kept. Success is proven by, in order of preference: the configured
 * success text inside an element with {@code successTextClass}, the presence of {@code
 * postLoginSelector}, or the final URL differing from the login page.
 */
@Component
public class FormAuthenticator implements Authenticator {

  private static final Logger log = LoggerFactory.getLogger(FormAuthenticator.class);

  private final HttpProperties http;
  private final Clock clock;

  public FormAuthenticator(HttpProperties http, Clock clock) {
    this.http = http;
    this.clock = clock;
  }

  @Override
  public LoginType loginType() {
    return LoginType.FORM;
  }

  @Override
  public List<Cookie> login(SiteDescriptor site, Credential credential) {
    SiteDescriptor.FormLogin form = site.form();
    if (form == null) {
      throw new AuthenticationException("Site " + site.id() + " has no form login settings");
    }
    Connection session =
        Jsoup.newSession()
            .userAgent(http.userAgent())
            .timeout((int) http.readTimeout().toMillis())
            .headers(site.headers());
    try {
      Connection.Response page = session.newRequest().url(site.siteUrl()).execute();
      Document loginPage = page.parse();
      FormElement loginForm = fill(site, form, loginPage, credential);

      Connection submit =
          session
              .newRequest()
              .url(actionUrl(loginForm, page))
              .method(formMethod(loginForm))
              .data(loginForm.formData());
      addSubmitter(form, loginPage, submit);
      Connection.Response result = submit.execute();

      verify(site, form, page, result);

      Instant now = clock.instant();
      List<Cookie> captured =
          session.cookieStore().getCookies().stream()
              .map(c -> HttpCookies.toCookie(c, now))
              .toList();
      List<Cookie> cookies = HttpCookies.select(captured, form.cookiesToStore());
      RequiredCookies.requirePresent(site, cookies);
      log.debug("Form login to {} landed on {}", site.id(), result.url());
      return cookies;
    } catch (IOException e) {
      throw new AuthenticationException("Form login to " + site.id() + " failed: " + e.getMessage(), e);
    } catch (Selector.SelectorParseException e) {
      throw new AuthenticationException(
          "Form login settings of " + site.id() + " hold an invalid selector: " + e.getMessage(), e);
    }
  }

  private static FormElement fill(
      SiteDescriptor site, SiteDescriptor.FormLogin form, Document page, Credential credential) {
    Element username = page.selectFirst(form.usernameSelector());
    Element password = page.selectFirst(form.passwordSelector());
    if (username == null || password == null) {
      throw new AuthenticationException(
          "Login page of " + site.id() + " has no element matching the username or password selector");
    }
    Element enclosing = password.closest("form");
    if (!(enclosing instanceof FormElement loginForm)) {
      throw new AuthenticationException("Password field of " + site.id() + " is not inside a form");
    }
    username.val(credential.username() == null ? "" : credential.username());
    password.val(credential.password() == null ? "" : credential.password());
    return loginForm;
  }

  private static String actionUrl(FormElement form, Connection.Response page) {
    String action = form.absUrl("action");
    return action.isEmpty() ? page.url().toString() : action;
  }

  private static Connection.Method formMethod(FormElement form) {
    return "get".equalsIgnoreCase(form.attr("method")) ? Connection.Method.GET : Connection.Method.POST;
  }

  private static void addSubmitter(SiteDescriptor.FormLogin form, Document page, Connection submit) {
    if (form.submitSelector() == null) {
      return;
    }
    Element button = page.selectFirst(form.submitSelector());
    if (button != null && button.hasAttr("name")) {
      submit.data(button.attr("name"), button.attr("value"));
    }
  }

  private static void verify(
      SiteDescriptor site,
      SiteDescriptor.FormLogin form,
      Connection.Response page,
      Connection.Response result)
      throws IOException {
    Document landed = result.parse();
    if (form.successTextClass() != null && form.expectedSuccessText() != null) {
      boolean found =
          landed.getElementsByClass(form.successTextClass()).stream()
              .anyMatch(e -> e.text().contains(form.expectedSuccessText()));
      if (!found) {
        throw new AuthenticationException(
            "Login to " + site.id() + " did not show the expected success text");
      }
      return;
    }
    if (form.postLoginSelector() != null) {
      if (landed.selectFirst(form.postLoginSelector()) == null) {
        throw new AuthenticationException(
            "Login to " + site.id() + " did not reach an element matching " + form.postLoginSelector());
      }
      return;
    }
    if (result.url().toString().equals(page.url().toString())) {
      throw new AuthenticationException("Login to " + site.id() + " stayed on the login page");
    }
  }
}
