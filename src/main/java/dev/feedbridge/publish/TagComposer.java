package dev.feedbridge.publish;

import dev.feedbridge.source.Destination;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Builds the tag list of a published entry. */
final class TagComposer {

  static final String DEFAULT_TAG = "RSS";

  private TagComposer() {}

  /** Configured tags, then {@code RSS}, then feed categories; blanks dropped, duplicates removed. */
  static List<String> compose(Destination destination, List<String> categories) {
    Set<String> tags = new LinkedHashSet<>();
    destination.tags().forEach(tag -> add(tags, tag));
    if (destination.addDefaultTag()) {
      add(tags, DEFAULT_TAG);
    }
    if (destination.addCategoriesAsTags()) {
      categories.forEach(category -> add(tags, category));
    }
    return List.copyOf(tags);
  }

  private static void add(Set<String> tags, String tag) {
    if (tag != null && !tag.isBlank()) {
      tags.add(tag.trim());
    }
  }
}
