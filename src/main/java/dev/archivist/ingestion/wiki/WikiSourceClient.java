package dev.archivist.ingestion.wiki;

import java.util.List;

/** Read access to a wiki platform. */
public interface WikiSourceClient {

  /** Pages of a space, at most {@code limit}. */
  List<WikiPage> spacePages(String spaceKey, int limit);

  WikiPage page(String pageId);
}
