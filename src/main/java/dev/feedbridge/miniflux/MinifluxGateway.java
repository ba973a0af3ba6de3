package dev.feedbridge.miniflux;

import dev.feedbridge.refresh.RefreshTarget;
import dev.feedbridge.refresh.RefreshTargets;
import dev.feedbridge.source.ConfigurationException;
import dev.feedbridge.source.RefreshSettings;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** Builds {@link MinifluxClient}s for configured instances, one {@link RestClient} per instance. */
@Component
public class MinifluxGateway implements RefreshTargets {

  static final String AUTH_HEADER = "X-Auth-Token";

  private final MinifluxProperties properties;
  private final RestClient.Builder restClientBuilder;
  private final ConcurrentHashMap<String, RestClient> clients = new ConcurrentHashMap<>();

  public MinifluxGateway(MinifluxProperties properties, RestClient.Builder restClientBuilder) {
    this.properties = properties;
    this.restClientBuilder = restClientBuilder;
  }

  @Override
  public RefreshTarget forSettings(RefreshSettings settings) {
    MinifluxProperties.Instance instance = properties.miniflux().get(settings.target());
    if (instance == null || instance.baseUrl() == null || instance.apiKey() == null) {
      throw new ConfigurationException("Miniflux instance not configured: " + settings.target());
    }
    RestClient restClient =
        clients.computeIfAbsent(
            settings.target(),
            key ->
                restClientBuilder
                    .clone()
                    .baseUrl(stripTrailingSlash(instance.baseUrl()))
                    .defaultHeader(AUTH_HEADER, instance.apiKey())
                    .build());
    return new MinifluxClient(restClient, settings.feedIds());
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
