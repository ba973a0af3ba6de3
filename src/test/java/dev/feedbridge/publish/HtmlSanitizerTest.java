package dev.feedbridge.publish;

import static org.assertj.core.api.Assertions.assertThat;

import dev.feedbridge.fixture.PendingEntryBuilder;
import dev.feedbridge.source.Destination;
import java.util.List;
import org.junit.jupiter.api.Test;

class HtmlSanitizerTest {

  private static final String ARTICLE =
      "<article><h1>Title</h1><img src=\"hero.png\"><p>Body</p>"
          + "<aside class=\"newsletter\">Sign up</aside></article>";

  @Test
  void stripsImagesByDefault() {
    List<String> criteria = HtmlSanitizer.criteriaFor(new PendingEntryBuilder().build());

    String html = HtmlSanitizer.sanitize(ARTICLE, criteria);

    assertThat(criteria).containsExactly("img");
    assertThat(html).doesNotContain("hero.png").contains("<p>Body</p>").contains("Sign up");
  }

  @Test
  void siteCriteriaReplaceDefault() {
    List<String> criteria =
        HtmlSanitizer.criteriaFor(new PendingEntryBuilder().siteSanitizingCriteria("aside.newsletter").build());

    assertThat(criteria).containsExactly("aside.newsletter");
  }

  @Test
  void destinationCriteriaWinOverSite() {
    Destination destination =
        new Destination("main", null, List.of(), true, false, true, List.of("h1"), true, null);

    List<String> criteria =
        HtmlSanitizer.criteriaFor(
            new PendingEntryBuilder().destination(destination).siteSanitizingCriteria("aside").build());

    assertThat(criteria).containsExactly("h1");
  }

  @Test
  void invalidSelectorIsSkipped() {
    String html = HtmlSanitizer.sanitize(ARTICLE, List.of("%%", "aside.newsletter"));

    assertThat(html).doesNotContain("Sign up").contains("hero.png");
  }
}
