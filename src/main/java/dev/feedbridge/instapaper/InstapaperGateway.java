package dev.feedbridge.instapaper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.scribejava.core.builder.ServiceBuilder;
import com.github.scribejava.core.httpclient.jdk.JDKHttpClientConfig;
import com.github.scribejava.core.model.OAuth1AccessToken;
import com.github.scribejava.core.oauth.OAuth10aService;
import dev.feedbridge.config.HttpProperties;
import dev.feedbridge.publish.PublishTargets;
import dev.feedbridge.source.ConfigurationException;
import dev.feedbridge.sweep.SyncTargets;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Hands out one {@link InstapaperClient} per configured account. All clients share a single OAuth
 * service, built on first use, whose HTTP timeouts come from {@link HttpProperties}.
 */
@Component
public class InstapaperGateway implements PublishTargets, SyncTargets {

  private final InstapaperProperties properties;
  private final HttpProperties http;
  private final ObjectMapper objectMapper;
  private final ConcurrentHashMap<String, InstapaperClient> clients = new ConcurrentHashMap<>();
  private volatile OAuth10aService service;

  public InstapaperGateway(
      InstapaperProperties properties, HttpProperties http, ObjectMapper objectMapper) {
    this.properties = properties;
    this.http = http;
    this.objectMapper = objectMapper;
  }

  /**
   * @throws ConfigurationException if the account or the application credentials are missing
   */
  @Override
  public InstapaperClient forAccount(String account) {
    InstapaperProperties.Account credentials = properties.accounts().get(account);
    if (credentials == null) {
      throw new ConfigurationException("Unknown Instapaper account: " + account);
    }
    OAuth10aService oauth = service();
    return clients.computeIfAbsent(
        account,
        key ->
            new InstapaperClient(
                oauth,
                new OAuth1AccessToken(credentials.oauthToken(), credentials.oauthTokenSecret()),
                properties.baseUrl(),
                objectMapper));
  }

  private OAuth10aService service() {
    OAuth10aService current = service;
    if (current != null) {
      return current;
    }
    synchronized (this) {
      if (service == null) {
        if (isBlank(properties.consumerKey()) || isBlank(properties.consumerSecret())) {
          throw new ConfigurationException(
              "feedbridge.instapaper.consumer-key and consumer-secret must be set");
        }
        JDKHttpClientConfig httpConfig = JDKHttpClientConfig.defaultConfig();
        httpConfig.setConnectTimeout((int) http.connectTimeout().toMillis());
        httpConfig.setReadTimeout((int) http.readTimeout().toMillis());
        service =
            new ServiceBuilder(properties.consumerKey())
                .apiSecret(properties.consumerSecret())
                .httpClientConfig(httpConfig)
                .build(new InstapaperApi(properties.baseUrl()));
      }
      return service;
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
