package dev.feedbridge.instapaper;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Instapaper application credentials and per-account access tokens, bound from {@code
 * feedbridge.instapaper.*}. Accounts are referenced by key from a source's destination.
 */
@Validated
@ConfigurationProperties(prefix = "feedbridge.instapaper")
public record InstapaperProperties(
    @DefaultValue("https://www.instapaper.com") @NotBlank String baseUrl,
    String consumerKey,
    String consumerSecret,
    Map<String, @Valid Account> accounts) {

  public InstapaperProperties {
    accounts = accounts == null ? Map.of() : Map.copyOf(accounts);
  }

  /** OAuth access token of one Instapaper user, obtained out of band. */
  public record Account(@NotBlank String oauthToken, @NotBlank String oauthTokenSecret) {

    @Override
    public String toString() {
      return "Account[oauthToken=<redacted>]";
    }
  }
}
