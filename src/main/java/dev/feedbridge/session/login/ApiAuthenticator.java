package dev.feedbridge.session.login;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.feedbridge.session.AuthenticationException;
import dev.feedbridge.session.Authenticator;
import dev.feedbridge.session.Cookie;
import dev.feedbridge.session.Cookies;
import dev.feedbridge.session.RequiredCookies;
import dev.feedbridge.source.Credential;
import dev.feedbridge.source.LoginType;
import dev.feedbridge.source.SiteDescriptor;
import java.io.IOException;
import java.net.HttpCookie;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Logs in by calling a site's API directly.
 *
 * <p>Pre-login requests run first, in order, sharing one cookie jar with the login request. Every
 * endpoint, header and body value is a template rendered from the credential ({@code
 * {{username}}}, {@code {{password}}} and any configured value). Bodies go out as a form when the
 * request's {@code Content-Type} is {@code application/x-www-form-urlencoded}, as JSON otherwise.
 *
 * <p>Cookies come from {@code Set-Cookie} headers and from {@code cookieMapping}: a value starting
 * with {@code $.} is a dotted path into the login response body, anything else is a template.
 */
@Component
public class ApiAuthenticator implements Authenticator {

  private static final Logger log = LoggerFactory.getLogger(ApiAuthenticator.class);

  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ApiAuthenticator(
      @Qualifier("sessionRestClient") RestClient restClient, ObjectMapper objectMapper, Clock clock) {
    this.restClient = restClient;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public LoginType loginType() {
    return LoginType.API;
  }

  @Override
  public List<Cookie> login(SiteDescriptor site, Credential credential) {
    SiteDescriptor.ApiLogin api = site.api();
    if (api == null || api.login() == null) {
      throw new AuthenticationException("Site " + site.id() + " has no API login settings");
    }
    Map<String, String> values = credential.templateValues();
    Instant now = clock.instant();
    List<Cookie> jar = new ArrayList<>();

    for (SiteDescriptor.ApiRequest step : api.preLogin()) {
      exchange(site, step, values, jar, now);
    }
    String body = exchange(site, api.login(), values, jar, now);

    List<Cookie> cookies = new ArrayList<>(HttpCookies.select(jar, api.cookiesToStore()));
    cookies.addAll(mappedCookies(site, api.cookieMapping(), body, values, site.siteUrl()));
    List<Cookie> selected = HttpCookies.select(cookies, List.of());
    RequiredCookies.requirePresent(site, selected);
    return selected;
  }

  private String exchange(
      SiteDescriptor site,
      SiteDescriptor.ApiRequest request,
      Map<String, String> values,
      List<Cookie> jar,
      Instant now) {
    String url = resolve(site.siteUrl(), TemplateRenderer.render(request.endpoint(), values));
    HttpHeaders headers = new HttpHeaders();
    request.headers().forEach((name, value) -> headers.set(name, TemplateRenderer.render(value, values)));
    List<Cookie> scoped = Cookies.forUrl(jar, url);
    if (!scoped.isEmpty()) {
      headers.set(HttpHeaders.COOKIE, Cookies.header(scoped));
    }
    HttpMethod method = HttpMethod.valueOf(request.method().toUpperCase(Locale.ROOT));

    RestClient.RequestBodySpec spec =
        restClient.method(method).uri(URI.create(url)).headers(h -> h.addAll(headers));
    if (!request.body().isEmpty() && method != HttpMethod.GET) {
      applyBody(spec, headers, request.body(), values);
    }
    try {
      return spec.exchange(
          (req, response) -> {
            int status = response.getStatusCode().value();
            List<String> setCookies = response.getHeaders().getOrEmpty(HttpHeaders.SET_COOKIE);
            for (String header : setCookies) {
              try {
                HttpCookie.parse(header).forEach(c -> jar.add(HttpCookies.toCookie(c, now)));
              } catch (IllegalArgumentException e) {
                log.warn("Ignoring malformed Set-Cookie from {}: {}", url, e.getMessage());
              }
            }
            String text = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
            if (status >= 400) {
              throw new AuthenticationException(
                  "API login to " + site.id() + " failed with HTTP " + status + " at " + url);
            }
            log.debug("API login step {} {} returned {}", method, url, status);
            return text;
          });
    } catch (RestClientException e) {
      throw new AuthenticationException(
          "API login to " + site.id() + " failed at " + url + ": " + e.getMessage(), e);
    }
  }

  private static void applyBody(
      RestClient.RequestBodySpec spec,
      HttpHeaders headers,
      Map<String, String> body,
      Map<String, String> values) {
    MediaType contentType = headers.getContentType();
    if (MediaType.APPLICATION_FORM_URLENCODED.isCompatibleWith(contentType)) {
      MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
      body.forEach((name, value) -> form.add(name, TemplateRenderer.render(value, values)));
      spec.contentType(MediaType.APPLICATION_FORM_URLENCODED).body(form);
    } else {
      Map<String, String> json = new LinkedHashMap<>();
      body.forEach((name, value) -> json.put(name, TemplateRenderer.render(value, values)));
      spec.contentType(contentType == null ? MediaType.APPLICATION_JSON : contentType).body(json);
    }
  }

  private List<Cookie> mappedCookies(
      SiteDescriptor site,
      Map<String, String> mapping,
      String body,
      Map<String, String> values,
      String siteUrl) {
    if (mapping.isEmpty()) {
      return List.of();
    }
    String domain = URI.create(siteUrl).getHost();
    JsonNode json = null;
    List<Cookie> cookies = new ArrayList<>();
    for (Map.Entry<String, String> entry : mapping.entrySet()) {
      String source = entry.getValue();
      String value;
      if (source.startsWith("$.")) {
        if (json == null) {
          json = parse(site, body);
        }
        JsonNode node = json.at("/" + source.substring(2).replace('.', '/'));
        if (node.isMissingNode() || node.isNull()) {
          throw new AuthenticationException(
              "API login to " + site.id() + " response has no value at " + source);
        }
        value = node.isValueNode() ? node.asText() : node.toString();
      } else {
        value = TemplateRenderer.render(source, values);
      }
      cookies.add(new Cookie(entry.getKey(), value, domain, "/", null, false, false));
    }
    return cookies;
  }

  private JsonNode parse(SiteDescriptor site, String body) {
    try {
      return objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
    } catch (IOException e) {
      throw new AuthenticationException("API login to " + site.id() + " returned invalid JSON", e);
    }
  }

  private static String resolve(String base, String endpoint) {
    if (endpoint.startsWith("http://") || endpoint.startsWith("https://")) {
      return endpoint;
    }
    return URI.create(base).resolve(endpoint).toString();
  }
}
