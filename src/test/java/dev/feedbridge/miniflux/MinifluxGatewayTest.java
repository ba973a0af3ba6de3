package dev.feedbridge.miniflux;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;

import dev.feedbridge.refresh.RefreshException;
import dev.feedbridge.session.Cookie;
import dev.feedbridge.source.ConfigurationException;
import dev.feedbridge.source.RefreshSettings;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class MinifluxGatewayTest {

  private static final List<Cookie> COOKIES = List.of(Cookie.of("sid", "abc"), Cookie.of("csrf", "def"));

  private MockRestServiceServer server;
  private MinifluxGateway gateway;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    gateway =
        new MinifluxGateway(
            new MinifluxProperties(
                Map.of("reader", new MinifluxProperties.Instance("https://rss.example.com/", "api-key"))),
            builder);
  }

  private static RefreshSettings settings(String target, Long... feedIds) {
    return new RefreshSettings(target, List.of(feedIds), Duration.ofHours(1));
  }

  @Test
  void putsCookieHeaderIntoEveryFeed() {
    for (long feedId : List.of(7L, 9L)) {
      server
          .expect(requestTo("https://rss.example.com/v1/feeds/" + feedId))
          .andExpect(method(HttpMethod.PUT))
          .andExpect(header(MinifluxGateway.AUTH_HEADER, "api-key"))
          .andExpect(content().json("{\"cookie\":\"sid=abc; csrf=def\"}"))
          .andRespond(withStatus(HttpStatus.CREATED));
    }

    gateway.forSettings(settings("reader", 7L, 9L)).refresh(COOKIES);

    server.verify();
  }

  @Test
  void triesEveryFeedBeforeReportingFailures() {
    server.expect(requestTo("https://rss.example.com/v1/feeds/7")).andRespond(withServerError());
    server
        .expect(requestTo("https://rss.example.com/v1/feeds/9"))
        .andRespond(withStatus(HttpStatus.CREATED));

    assertThatThrownBy(() -> gateway.forSettings(settings("reader", 7L, 9L)).refresh(COOKIES))
        .isInstanceOf(RefreshException.class)
        .hasMessageContaining("[7]");
    server.verify();
  }

  @Test
  void unknownInstanceIsConfigurationError() {
    assertThatThrownBy(() -> gateway.forSettings(settings("elsewhere", 1L)))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("elsewhere");
  }
}
