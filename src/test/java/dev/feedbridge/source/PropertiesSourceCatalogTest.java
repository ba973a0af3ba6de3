package dev.feedbridge.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class PropertiesSourceCatalogTest {

  private final Map<String, String> props = new HashMap<>();

  @BeforeEach
  void setUp() {
    props.put("feedbridge.credentials.alice.username", "alice@example.com");
    props.put("feedbridge.credentials.alice.password", "s3cret");
    props.put("feedbridge.sites.example.login-type", "FORM");
    props.put("feedbridge.sites.example.site-url", "https://example.com/login");
    props.put("feedbridge.sites.example.required-cookies[0]", "sid");
    props.put("feedbridge.sites.example.form.username-selector", "#email");
    props.put("feedbridge.sites.example.form.password-selector", "#password");
    props.put("feedbridge.sites.example.sanitizing-criteria[0]", "div.ad");
  }

  private CatalogProperties bind() {
    CatalogProperties properties =
        new Binder(new MapConfigurationPropertySource(props))
            .bind("feedbridge", Bindable.of(CatalogProperties.class))
            .get();
    properties.validate();
    return properties;
  }

  private PropertiesSourceCatalog catalog() {
    return new PropertiesSourceCatalog(bind());
  }

  private void source(int index, String id) {
    props.put("feedbridge.sources[" + index + "].id", id);
  }

  @Test
  void resolvesFullyConfiguredSource() {
    source(0, "news");
    props.put("feedbridge.sources[0].credential", "alice");
    props.put("feedbridge.sources[0].site", "example");
    props.put("feedbridge.sources[0].feed.url", "https://example.com/feed");
    props.put("feedbridge.sources[0].feed.paywalled", "true");
    props.put("feedbridge.sources[0].feed.poll-cadence", "30m");
    props.put("feedbridge.sources[0].feed.initial-lookback", "7d");
    props.put("feedbridge.sources[0].destination.account", "main");
    props.put("feedbridge.sources[0].destination.folder", "News");
    props.put("feedbridge.sources[0].destination.retention", "30d");
    props.put("feedbridge.sources[0].refresh.target", "reader");
    props.put("feedbridge.sources[0].refresh.feed-ids[0]", "7");
    props.put("feedbridge.sources[0].refresh.cadence", "1h");

    SourceConfig source = catalog().resolve("news");

    assertThat(source.feed().pollCadence()).isEqualTo(Duration.ofMinutes(30));
    assertThat(source.feed().initialLookback()).isEqualTo(Duration.ofDays(7));
    assertThat(source.feed().paywalled()).isTrue();
    assertThat(source.login().cacheKey()).isEqualTo("alice-example");
    assertThat(source.login().credential().username()).isEqualTo("alice@example.com");
    assertThat(source.login().site().requiredCookies()).containsExactly("sid");
    assertThat(source.login().site().sanitizingCriteria()).containsExactly("div.ad");
    assertThat(source.destination().folder()).isEqualTo("News");
    assertThat(source.destination().addDefaultTag()).isTrue();
    assertThat(source.destination().sanitizeContent()).isTrue();
    assertThat(source.destination().retention()).isEqualTo(Duration.ofDays(30));
    assertThat(source.hasRefresh()).isTrue();
    assertThat(source.refresh().feedIds()).containsExactly(7L);
  }

  @Test
  void appliesDefaultsForMinimalPublicFeed() {
    source(0, "public");
    props.put("feedbridge.sources[0].feed.url", "https://example.com/feed");
    props.put("feedbridge.sources[0].destination.account", "main");

    SourceConfig source = catalog().resolve("public");

    assertThat(source.hasLogin()).isFalse();
    assertThat(source.feed().pollCadence()).isEqualTo(Duration.ofHours(1));
    assertThat(source.feed().initialLookback()).isNull();
    assertThat(source.destination().resolveFinalUrl()).isTrue();
    assertThat(source.destination().retention()).isNull();
  }

  @Test
  void refreshWithoutCadenceIsDisabled() {
    source(0, "keepalive");
    props.put("feedbridge.sources[0].credential", "alice");
    props.put("feedbridge.sources[0].site", "example");
    props.put("feedbridge.sources[0].refresh.target", "reader");
    props.put("feedbridge.sources[0].refresh.feed-ids[0]", "7");

    SourceConfig source = catalog().resolve("keepalive");

    assertThat(source.hasFeed()).isFalse();
    assertThat(source.refresh().cadence()).isEqualTo(Duration.ZERO);
  }

  @Test
  void listsSourcesInConfigurationOrder() {
    source(0, "b");
    source(1, "a");

    assertThat(catalog().sourceIds()).containsExactly("b", "a");
  }

  @Test
  void duplicateIdsFailAtStartup() {
    source(0, "same");
    source(1, "same");

    assertThatThrownBy(this::bind)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("duplicate id: same");
  }

  @Test
  void unknownSourceFails() {
    assertThatThrownBy(() -> catalog().resolve("missing"))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void unknownCredentialFails() {
    source(0, "news");
    props.put("feedbridge.sources[0].credential", "bob");
    props.put("feedbridge.sources[0].site", "example");

    assertThatThrownBy(() -> catalog().resolve("news"))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("unknown credential: bob");
  }

  @Test
  void credentialWithoutSiteFails() {
    source(0, "news");
    props.put("feedbridge.sources[0].credential", "alice");

    assertThatThrownBy(() -> catalog().resolve("news"))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("both a credential and a site");
  }

  @Test
  void feedWithoutDestinationFails() {
    source(0, "news");
    props.put("feedbridge.sources[0].feed.url", "https://example.com/feed");

    assertThatThrownBy(() -> catalog().resolve("news"))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("no destination");
  }

  @Test
  void formSiteWithoutFormSettingsFails() {
    props.remove("feedbridge.sites.example.form.username-selector");
    props.remove("feedbridge.sites.example.form.password-selector");
    source(0, "news");
    props.put("feedbridge.sources[0].credential", "alice");
    props.put("feedbridge.sources[0].site", "example");

    assertThatThrownBy(() -> catalog().resolve("news"))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("without form settings");
  }
}
