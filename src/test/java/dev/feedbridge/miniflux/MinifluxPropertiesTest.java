package dev.feedbridge.miniflux;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class MinifluxPropertiesTest {

  private static ValidatorFactory factory;
  private static Validator validator;

  @BeforeAll
  static void createValidator() {
    factory = Validation.buildDefaultValidatorFactory();
    validator = factory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    factory.close();
  }

  @Test
  void completeInstanceIsValid() {
    var properties =
        new MinifluxProperties(
            Map.of("reader", new MinifluxProperties.Instance("https://rss.example.com", "key")));

    assertThat(validator.validate(properties)).isEmpty();
  }

  @Test
  void instanceWithoutApiKeyIsRejected() {
    var properties =
        new MinifluxProperties(
            Map.of("reader", new MinifluxProperties.Instance("https://rss.example.com", " ")));

    assertThat(validator.validate(properties))
        .singleElement()
        .satisfies(v -> assertThat(v.getPropertyPath().toString()).contains("apiKey"));
  }

  @Test
  void noInstancesIsValid() {
    assertThat(validator.validate(new MinifluxProperties(null))).isEmpty();
  }
}
