package dev.archivist.ingestion.wiki;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One wiki page as returned by the wiki platform.
 *
 * @param id page id
 * @param title page title
 * @param spaceKey key of the space the page belongs to
 * @param bodyHtml page body in storage (HTML) format
 * @param author display name of the last editor; null if unknown
 * @param lastUpdated time of the last edit; null if unknown
 * @param version page version number
 * @param ancestors titles of the ancestor pages, root first
 * @param url absolute link to the page; null if unknown
 */
public record WikiPage(
    String id,
    String title,
    String spaceKey,
    String bodyHtml,
    @Nullable String author,
    @Nullable Instant lastUpdated,
    int version,
    List<String> ancestors,
    @Nullable String url) {

  public WikiPage {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(title, "title must not be null");
    Objects.requireNonNull(spaceKey, "spaceKey must not be null");
    bodyHtml = bodyHtml == null ? "" : bodyHtml;
    ancestors = ancestors == null ? List.of() : List.copyOf(ancestors);
  }

  /** Ancestor titles and the page title joined with {@code " / "}. */
  public String hierarchyPath() {
    if (ancestors.isEmpty()) {
      return title;
    }
    return String.join(" / ", ancestors) + " / " + title;
  }
}
