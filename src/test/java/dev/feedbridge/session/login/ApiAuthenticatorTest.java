package dev.feedbridge.session.login;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.feedbridge.session.AuthenticationException;
import dev.feedbridge.session.Cookie;
import dev.feedbridge.source.Credential;
import dev.feedbridge.source.LoginType;
import dev.feedbridge.source.SiteDescriptor;
import dev.feedbridge.source.SiteDescriptor.ApiLogin;
import dev.feedbridge.source.SiteDescriptor.ApiRequest;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class ApiAuthenticatorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final Credential ALICE =
      new Credential("alice", "alice", "s3cret", Map.of("tenant", "acme"));

  private MockRestServiceServer server;
  private ApiAuthenticator authenticator;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    authenticator =
        new ApiAuthenticator(builder.build(), new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static SiteDescriptor site(List<String> requiredCookies, ApiLogin api) {
    return new SiteDescriptor(
        "example-api", LoginType.API, "https://api.example.com", requiredCookies, null, api, Map.of(), List.of());
  }

  @Test
  void runsPreLoginThenFormLoginCollectingCookies() {
    ApiLogin api =
        new ApiLogin(
            List.of(new ApiRequest("/csrf", "GET", Map.of(), Map.of())),
            new ApiRequest(
                "/auth/{{tenant}}/login",
                "POST",
                Map.of("Content-Type", "application/x-www-form-urlencoded"),
                Map.of("user", "{{username}}", "pass", "{{password}}")),
            List.of(),
            Map.of("token", "$.data.token"));
    server
        .expect(requestTo("https://api.example.com/csrf"))
        .andExpect(method(HttpMethod.GET))
        .andRespond(withSuccess().header("Set-Cookie", "csrf=abc; Path=/"));
    server
        .expect(requestTo("https://api.example.com/auth/acme/login"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("Cookie", "csrf=abc"))
        .andExpect(content().formDataContains(Map.of("user", "alice", "pass", "s3cret")))
        .andRespond(
            withSuccess("{\"data\":{\"token\":\"t0k\"}}", MediaType.APPLICATION_JSON)
                .header("Set-Cookie", "sid=xyz; Max-Age=3600; Path=/; HttpOnly"));

    List<Cookie> cookies = authenticator.login(site(List.of("sid", "token"), api), ALICE);

    server.verify();
    assertThat(cookies).extracting(Cookie::name).containsExactly("csrf", "sid", "token");
    Cookie sid = cookies.get(1);
    assertThat(sid.value()).isEqualTo("xyz");
    assertThat(sid.expiry()).isEqualTo(NOW.plusSeconds(3600));
    assertThat(sid.httpOnly()).isTrue();
    assertThat(cookies.get(2).value()).isEqualTo("t0k");
    assertThat(cookies.get(2).domain()).isEqualTo("api.example.com");
  }

  @Test
  void sendsJsonBodyByDefaultAndKeepsOnlyConfiguredCookies() {
    ApiLogin api =
        new ApiLogin(
            List.of(),
            new ApiRequest("https://auth.example.com/session", null, Map.of(), Map.of("email", "{{username}}")),
            List.of("sid"),
            Map.of());
    server
        .expect(requestTo("https://auth.example.com/session"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().json("{\"email\":\"alice\"}"))
        .andRespond(
            withSuccess()
                .header("Set-Cookie", "sid=xyz; Path=/", "tracking=1; Path=/"));

    List<Cookie> cookies = authenticator.login(site(List.of("sid"), api), ALICE);

    assertThat(cookies).extracting(Cookie::name).containsExactly("sid");
    assertThat(cookies.get(0).expiry()).isNull();
  }

  @Test
  void rejectedLoginFails() {
    ApiLogin api =
        new ApiLogin(List.of(), new ApiRequest("/login", "POST", Map.of(), Map.of()), List.of(), Map.of());
    server
        .expect(requestTo("https://api.example.com/login"))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> authenticator.login(site(List.of(), api), ALICE))
        .isInstanceOf(AuthenticationException.class)
        .hasMessageContaining("HTTP 401");
  }

  @Test
  void missingRequiredCookieFailsLogin() {
    ApiLogin api =
        new ApiLogin(List.of(), new ApiRequest("/login", "POST", Map.of(), Map.of()), List.of(), Map.of());
    server
        .expect(requestTo("https://api.example.com/login"))
        .andRespond(withSuccess().header("Set-Cookie", "other=1"));

    assertThatThrownBy(() -> authenticator.login(site(List.of("sid"), api), ALICE))
        .isInstanceOf(AuthenticationException.class)
        .hasMessageContaining("[sid]");
  }

  @Test
  void missingMappedValueFailsLogin() {
    ApiLogin api =
        new ApiLogin(
            List.of(),
            new ApiRequest("/login", "POST", Map.of(), Map.of()),
            List.of(),
            Map.of("token", "$.data.token"));
    server
        .expect(requestTo("https://api.example.com/login"))
        .andRespond(withSuccess("{\"data\":{}}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> authenticator.login(site(List.of(), api), ALICE))
        .isInstanceOf(AuthenticationException.class)
        .hasMessageContaining("$.data.token");
  }
}
