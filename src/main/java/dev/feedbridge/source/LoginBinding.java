package dev.feedbridge.source;

/** The credential and site a source logs in with. Sources sharing both share one cookie cache. */
public record LoginBinding(Credential credential, SiteDescriptor site) {

  /** Cookie cache key, {@code credentialId-siteId}. */
  public String cacheKey() {
    return credential.id() + "-" + site.id();
  }
}
