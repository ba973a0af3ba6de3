package dev.feedbridge.publish;

import static org.assertj.core.api.Assertions.assertThat;

import dev.feedbridge.source.Destination;
import java.util.List;
import org.junit.jupiter.api.Test;

class TagComposerTest {

  private static Destination destination(List<String> tags, boolean defaultTag, boolean categories) {
    return new Destination("main", null, tags, defaultTag, categories, true, List.of(), true, null);
  }

  @Test
  void configuredTagsComeFirstThenDefaultThenCategories() {
    List<String> tags =
        TagComposer.compose(destination(List.of("work"), true, true), List.of("Tech", "News"));

    assertThat(tags).containsExactly("work", "RSS", "Tech", "News");
  }

  @Test
  void categoriesAreOptIn() {
    assertThat(TagComposer.compose(destination(List.of(), true, false), List.of("Tech")))
        .containsExactly("RSS");
  }

  @Test
  void defaultTagCanBeDisabled() {
    assertThat(TagComposer.compose(destination(List.of("work"), false, false), List.of()))
        .containsExactly("work");
  }

  @Test
  void dropsBlanksAndDuplicates() {
    List<String> tags =
        TagComposer.compose(destination(List.of(" work ", ""), true, true), List.of("work", "RSS", " "));

    assertThat(tags).containsExactly("work", "RSS");
  }
}
