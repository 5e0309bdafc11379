package dev.archivist.ingestion.upload;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Text and document information extracted from a PDF.
 *
 * @param pages text of each page, first page first
 * @param title document title from the PDF information dictionary; null if absent
 * @param author document author; null if absent
 * @param subject document subject; null if absent
 * @param creator producing application; null if absent
 */
public record PdfContent(
    List<String> pages,
    @Nullable String title,
    @Nullable String author,
    @Nullable String subject,
    @Nullable String creator) {

  public PdfContent {
    pages = pages == null ? List.of() : List.copyOf(pages);
  }
}
