package dev.feedbridge.miniflux;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Miniflux instances keyed by id, bound from {@code feedbridge.miniflux.<id>.*}. */
@Validated
@ConfigurationProperties(prefix = "feedbridge")
public record MinifluxProperties(Map<String, @Valid Instance> miniflux) {

  public MinifluxProperties {
    miniflux = miniflux == null ? Map.of() : Map.copyOf(miniflux);
  }

  /** Base URL and API key of one instance. */
  public record Instance(@NotBlank String baseUrl, @NotBlank String apiKey) {

    @Override
    public String toString() {
      return "Instance[baseUrl=" + baseUrl + "]";
    }
  }
}
