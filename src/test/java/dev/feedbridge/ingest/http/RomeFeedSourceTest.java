package dev.feedbridge.ingest.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import dev.feedbridge.ingest.FeedDocument;
import dev.feedbridge.ingest.FeedItem;
import dev.feedbridge.ingest.FetchException;
import dev.feedbridge.session.Cookie;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class RomeFeedSourceTest {

  private static final String FEED_URL = "https://example.com/feed.xml";

  private static final String RSS =
      """
      <?xml version="1.0" encoding="UTF-8"?>
      <rss version="2.0">
        <channel>
          <title>Example News</title>
          <link>https://example.com</link>
          <description>News</description>
          <category>News</category>
          <item>
            <title>First</title>
            <link>https://example.com/first</link>
            <pubDate>Sun, 01 Mar 2026 10:00:00 GMT</pubDate>
            <category>Tech</category>
          </item>
          <item>
            <link>https://example.com/untitled</link>
          </item>
        </channel>
      </rss>
      """;

  private static final String ATOM =
      """
      <?xml version="1.0" encoding="UTF-8"?>
      <feed xmlns="http://www.w3.org/2005/Atom">
        <title>Example Atom</title>
        <id>urn:example</id>
        <updated>2026-03-01T12:00:00Z</updated>
        <entry>
          <title>Atom entry</title>
          <id>urn:example:1</id>
          <link href="https://example.com/atom-entry"/>
          <updated>2026-03-01T11:30:00Z</updated>
        </entry>
      </feed>
      """;

  private MockRestServiceServer server;
  private RomeFeedSource feedSource;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    feedSource = new RomeFeedSource(builder.build());
  }

  @Test
  void parsesRssWithCategoriesAndDates() {
    server
        .expect(requestTo(FEED_URL))
        .andExpect(headerDoesNotExist("Cookie"))
        .andRespond(withSuccess(RSS, MediaType.APPLICATION_XML));

    FeedDocument document = feedSource.fetch(FEED_URL, List.of());

    assertThat(document.title()).isEqualTo("Example News");
    assertThat(document.categories()).containsExactly("News");
    assertThat(document.items()).hasSize(2);
    FeedItem first = document.items().get(0);
    assertThat(first.url()).isEqualTo("https://example.com/first");
    assertThat(first.publishedAt()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
    assertThat(first.categories()).containsExactly("Tech");
    FeedItem untitled = document.items().get(1);
    assertThat(untitled.title()).isEqualTo("https://example.com/untitled");
    assertThat(untitled.effectiveTime()).isNull();
  }

  @Test
  void parsesAtomUpdatedTime() {
    server.expect(requestTo(FEED_URL)).andRespond(withSuccess(ATOM, MediaType.APPLICATION_ATOM_XML));

    FeedDocument document = feedSource.fetch(FEED_URL, List.of());

    assertThat(document.items())
        .singleElement()
        .satisfies(
            item -> {
              assertThat(item.url()).isEqualTo("https://example.com/atom-entry");
              assertThat(item.effectiveTime()).isEqualTo(Instant.parse("2026-03-01T11:30:00Z"));
            });
  }

  @Test
  void sendsSessionCookies() {
    server
        .expect(requestTo(FEED_URL))
        .andExpect(header("Cookie", "sid=abc; csrf=def"))
        .andRespond(withSuccess(RSS, MediaType.APPLICATION_XML));

    feedSource.fetch(FEED_URL, List.of(Cookie.of("sid", "abc"), Cookie.of("csrf", "def")));

    server.verify();
  }

  @Test
  void httpErrorBecomesFetchException() {
    server.expect(requestTo(FEED_URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

    assertThatThrownBy(() -> feedSource.fetch(FEED_URL, List.of()))
        .isInstanceOf(FetchException.class)
        .hasMessageContaining(FEED_URL);
  }

  @Test
  void malformedDocumentBecomesFetchException() {
    server
        .expect(requestTo(FEED_URL))
        .andRespond(withSuccess("<html><body>not a feed</body></html>", MediaType.TEXT_HTML));

    assertThatThrownBy(() -> feedSource.fetch(FEED_URL, List.of()))
        .isInstanceOf(FetchException.class)
        .hasMessageContaining("parse");
  }
}
