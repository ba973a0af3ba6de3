package dev.feedbridge.refresh;

import dev.feedbridge.session.Cookie;
import java.util.List;

/** A downstream reader whose stored feed cookies are kept in step with our sessions. */
public interface RefreshTarget {

  /**
   * Replaces the cookies of every feed this target was resolved for.
   *
   * @throws RefreshException if any update fails
   */
  void refresh(List<Cookie> cookies);
}
