package dev.feedbridge.source;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Credentials, sites and sources bound from {@code feedbridge.*}.
 *
 * <pre>
 * feedbridge:
 *   credentials:
 *     alice: { username: alice, password: secret }
 *   sites:
 *     example: { login-type: FORM, site-url: https://example.com/login, form: {...} }
 *   sources:
 *     - id: example-news
 *       credential: alice
 *       site: example
 *       feed: { url: https://example.com/feed, paywalled: true }
 *       destination: { account: main, folder: News }
 * </pre>
 *
 * <p>Source ids are validated at startup via {@link #validate()}; everything else is checked per
 * source by {@link PropertiesSourceCatalog} so one bad source cannot stop the others.
 */
@Configuration
@ConfigurationProperties(prefix = "feedbridge")
public class CatalogProperties {

  private Map<String, Credential> credentials = new LinkedHashMap<>();
  private Map<String, Site> sites = new LinkedHashMap<>();
  private List<Source> sources = new ArrayList<>();

  /** Validates configuration at startup. Throws if a source id is missing or duplicated. */
  @PostConstruct
  void validate() {
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < sources.size(); i++) {
      String id = sources.get(i).getId();
      if (id == null || id.isBlank()) {
        throw new IllegalStateException("feedbridge.sources[" + i + "].id must not be blank");
      }
      if (!seen.add(id)) {
        throw new IllegalStateException("feedbridge.sources contains duplicate id: " + id);
      }
    }
  }

  public Map<String, Credential> getCredentials() {
    return credentials;
  }

  public void setCredentials(Map<String, Credential> credentials) {
    this.credentials = credentials;
  }

  public Map<String, Site> getSites() {
    return sites;
  }

  public void setSites(Map<String, Site> sites) {
    this.sites = sites;
  }

  public List<Source> getSources() {
    return sources;
  }

  public void setSources(List<Source> sources) {
    this.sources = sources;
  }

  /** A site as configured; its id is the map key. */
  public record Site(
      LoginType loginType,
      String siteUrl,
      List<String> requiredCookies,
      SiteDescriptor.@Nullable FormLogin form,
      SiteDescriptor.@Nullable ApiLogin api,
      Map<String, String> headers,
      List<String> sanitizingCriteria) {

    SiteDescriptor toDescriptor(String id) {
      return new SiteDescriptor(
          id, loginType, siteUrl, requiredCookies, form, api, headers, sanitizingCriteria);
    }
  }

  /** A source as configured, with its credential and site given by key. */
  public static class Source {

    private String id;
    private @Nullable FeedSettings feed;
    private @Nullable String credential;
    private @Nullable String site;
    private @Nullable Destination destination;
    private @Nullable RefreshSettings refresh;

    public String getId() {
      return id;
    }

    public void setId(String id) {
      this.id = id;
    }

    public @Nullable FeedSettings getFeed() {
      return feed;
    }

    public void setFeed(@Nullable FeedSettings feed) {
      this.feed = feed;
    }

    public @Nullable String getCredential() {
      return credential;
    }

    public void setCredential(@Nullable String credential) {
      this.credential = credential;
    }

    public @Nullable String getSite() {
      return site;
    }

    public void setSite(@Nullable String site) {
      this.site = site;
    }

    public @Nullable Destination getDestination() {
      return destination;
    }

    public void setDestination(@Nullable Destination destination) {
      this.destination = destination;
    }

    public @Nullable RefreshSettings getRefresh() {
      return refresh;
    }

    public void setRefresh(@Nullable RefreshSettings refresh) {
      this.refresh = refresh;
    }
  }
}
