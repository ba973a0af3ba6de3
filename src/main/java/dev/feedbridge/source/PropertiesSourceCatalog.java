package dev.feedbridge.source;

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link SourceCatalog} over {@link CatalogProperties}. Sources are re-resolved on every call so
 * each cycle sees a consistent snapshot of the bound configuration.
 */
@Component
public class PropertiesSourceCatalog implements SourceCatalog {

  private static final Logger log = LoggerFactory.getLogger(PropertiesSourceCatalog.class);

  private final CatalogProperties properties;

  public PropertiesSourceCatalog(CatalogProperties properties) {
    this.properties = properties;
  }

  @Override
  public List<String> sourceIds() {
    return properties.getSources().stream().map(CatalogProperties.Source::getId).toList();
  }

  @Override
  public SourceConfig resolve(String sourceId) {
    CatalogProperties.Source source =
        properties.getSources().stream()
            .filter(s -> sourceId.equals(s.getId()))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown source: " + sourceId));

    LoginBinding login = resolveLogin(source);
    FeedSettings feed = source.getFeed();
    Destination destination = source.getDestination();

    if (feed != null) {
      if (feed.url() == null || feed.url().isBlank()) {
        throw new ConfigurationException("Source " + sourceId + " has a feed without a url");
      }
      if (destination == null) {
        throw new ConfigurationException("Source " + sourceId + " has a feed but no destination");
      }
      if ((feed.requiresAuth() || feed.paywalled()) && login == null) {
        log.warn(
            "Source {} needs authentication (requiresAuth={}, paywalled={}) but has no login",
            sourceId,
            feed.requiresAuth(),
            feed.paywalled());
      }
    }
    if (destination != null && (destination.account() == null || destination.account().isBlank())) {
      throw new ConfigurationException("Source " + sourceId + " has a destination without account");
    }
    RefreshSettings refresh = source.getRefresh();
    if (refresh != null && (refresh.target() == null || refresh.target().isBlank())) {
      throw new ConfigurationException("Source " + sourceId + " has a refresh without target");
    }
    return new SourceConfig(sourceId, feed, login, destination, refresh);
  }

  private @Nullable LoginBinding resolveLogin(CatalogProperties.Source source) {
    String credentialId = source.getCredential();
    String siteId = source.getSite();
    if (credentialId == null && siteId == null) {
      return null;
    }
    if (credentialId == null || siteId == null) {
      throw new ConfigurationException(
          "Source " + source.getId() + " must reference both a credential and a site");
    }
    Credential bound = properties.getCredentials().get(credentialId);
    if (bound == null) {
      throw new ConfigurationException(
          "Source " + source.getId() + " references unknown credential: " + credentialId);
    }
    CatalogProperties.Site site = properties.getSites().get(siteId);
    if (site == null) {
      throw new ConfigurationException(
          "Source " + source.getId() + " references unknown site: " + siteId);
    }
    if (site.loginType() == null) {
      throw new ConfigurationException("Site " + siteId + " has no login-type");
    }
    if (site.loginType() == LoginType.FORM && site.form() == null) {
      throw new ConfigurationException("Site " + siteId + " uses FORM login without form settings");
    }
    if (site.loginType() == LoginType.API && site.api() == null) {
      throw new ConfigurationException("Site " + siteId + " uses API login without api settings");
    }
    Credential credential =
        new Credential(credentialId, bound.username(), bound.password(), bound.values());
    return new LoginBinding(credential, site.toDescriptor(siteId));
  }
}
