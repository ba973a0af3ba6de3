package dev.feedbridge.instapaper;

import com.github.scribejava.core.builder.api.DefaultApi10a;

/**
 * ScribeJava descriptor of Instapaper's OAuth 1.0a endpoints. Only request signing is used; access
 * tokens are configured, so the token endpoints are never called.
 */
class InstapaperApi extends DefaultApi10a {

  private final String baseUrl;

  InstapaperApi(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  @Override
  public String getRequestTokenEndpoint() {
    return baseUrl + "/api/1/oauth/access_token";
  }

  @Override
  public String getAccessTokenEndpoint() {
    return baseUrl + "/api/1/oauth/access_token";
  }

  @Override
  protected String getAuthorizationBaseUrl() {
    return baseUrl + "/api/1/oauth/authorize";
  }
}
