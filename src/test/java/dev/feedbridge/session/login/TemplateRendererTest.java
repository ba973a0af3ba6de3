package dev.feedbridge.session.login;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateRendererTest {

  @Test
  void replacesKnownPlaceholders() {
    String rendered =
        TemplateRenderer.render(
            "/login?user={{username}}&tenant={{ tenant.id }}",
            Map.of("username", "alice", "tenant.id", "acme"));

    assertThat(rendered).isEqualTo("/login?user=alice&tenant=acme");
  }

  @Test
  void unknownPlaceholdersRenderEmpty() {
    assertThat(TemplateRenderer.render("Bearer {{token}}", Map.of())).isEqualTo("Bearer ");
  }

  @Test
  void valuesAreInsertedLiterally() {
    assertThat(TemplateRenderer.render("{{password}}", Map.of("password", "p$1\\x")))
        .isEqualTo("p$1\\x");
  }

  @Test
  void textWithoutPlaceholdersIsUnchanged() {
    assertThat(TemplateRenderer.render("plain {value}", Map.of("value", "x"))).isEqualTo("plain {value}");
  }
}
