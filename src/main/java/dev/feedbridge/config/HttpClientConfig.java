package dev.feedbridge.config;

import java.net.http.HttpClient;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} instances used for feed, content and login traffic.
 *
 * <p>Every builder handed out by Spring gets the timeouts from {@link HttpProperties}, so adapter
 * clients built elsewhere (Miniflux) are bounded as well. Two named clients are exposed:
 *
 * <ul>
 *   <li>{@code feedRestClient} follows redirects; used for feed documents.
 *   <li>{@code sessionRestClient} never follows redirects, so login redirects and {@code
 *       Set-Cookie} headers on 3xx responses stay observable; used for article content and API
 *       logins.
 * </ul>
 */
@Configuration
public class HttpClientConfig {

  @Bean
  public RestClientCustomizer boundedTimeoutCustomizer(HttpProperties props) {
    return builder ->
        builder
            .requestFactory(requestFactory(props, HttpClient.Redirect.NORMAL))
            .defaultHeader(HttpHeaders.USER_AGENT, props.userAgent());
  }

  @Bean
  public RestClient feedRestClient(RestClient.Builder builder) {
    return builder.build();
  }

  @Bean
  public RestClient sessionRestClient(RestClient.Builder builder, HttpProperties props) {
    return builder.requestFactory(requestFactory(props, HttpClient.Redirect.NEVER)).build();
  }

  static JdkClientHttpRequestFactory requestFactory(
      HttpProperties props, HttpClient.Redirect redirect) {
    HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(props.connectTimeout())
            .followRedirects(redirect)
            .build();
    var requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(props.readTimeout());
    return requestFactory;
  }
}
