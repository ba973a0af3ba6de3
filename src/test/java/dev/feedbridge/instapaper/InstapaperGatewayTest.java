package dev.feedbridge.instapaper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.feedbridge.config.HttpProperties;
import dev.feedbridge.source.ConfigurationException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InstapaperGatewayTest {

  private static final HttpProperties HTTP = new HttpProperties(null, null, null);
  private static final Map<String, InstapaperProperties.Account> ACCOUNTS =
      Map.of("main", new InstapaperProperties.Account("token", "token-secret"));

  private static InstapaperGateway gateway(String consumerKey, String consumerSecret) {
    return new InstapaperGateway(
        new InstapaperProperties("https://www.instapaper.com", consumerKey, consumerSecret, ACCOUNTS),
        HTTP,
        new ObjectMapper());
  }

  @Test
  void reusesClientPerAccount() {
    InstapaperGateway gateway = gateway("key", "secret");

    assertThat(gateway.forAccount("main")).isSameAs(gateway.forAccount("main"));
  }

  @Test
  void unknownAccountIsConfigurationError() {
    assertThatThrownBy(() -> gateway("key", "secret").forAccount("other"))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("other");
  }

  @Test
  void missingApplicationCredentialsIsConfigurationError() {
    assertThatThrownBy(() -> gateway("", null).forAccount("main"))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("consumer-key");
  }
}
