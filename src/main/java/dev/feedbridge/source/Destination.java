package dev.feedbridge.source;

import java.time.Duration;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Read-later account, folder and tagging rules for a source's entries.
 *
 * @param account key of the configured read-later account
 * @param folder folder title, created on demand; {@code null} publishes to the default list
 * @param tags tags added to every entry
 * @param addDefaultTag also add the {@code RSS} tag
 * @param addCategoriesAsTags also add the entry's feed categories as tags
 * @param sanitizeContent strip {@code sanitizingCriteria} from content before publishing
 * @param sanitizingCriteria CSS selectors to strip; empty falls back to the site's, then {@code img}
 * @param resolveFinalUrl let the service follow redirects on the entry URL
 * @param retention age after which published items are deleted; {@code null} keeps them forever
 */
public record Destination(
    String account,
    @Nullable String folder,
    List<String> tags,
    @DefaultValue("true") boolean addDefaultTag,
    boolean addCategoriesAsTags,
    @DefaultValue("true") boolean sanitizeContent,
    List<String> sanitizingCriteria,
    @DefaultValue("true") boolean resolveFinalUrl,
    @Nullable Duration retention) {

  public Destination {
    tags = tags == null ? List.of() : List.copyOf(tags);
    sanitizingCriteria = sanitizingCriteria == null ? List.of() : List.copyOf(sanitizingCriteria);
  }
}
