package dev.archivist.ingestion.upload;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/** Extracts per-page text and document information from PDF bytes with PDFBox. */
@Component
public class PdfTextExtractor {

  public PdfContent extract(byte[] pdf) throws IOException {
    try (PDDocument document = PDDocument.load(pdf)) {
      PDFTextStripper stripper = new PDFTextStripper();
      List<String> pages = new ArrayList<>(document.getNumberOfPages());
      for (int page = 1; page <= document.getNumberOfPages(); page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        pages.add(stripper.getText(document).strip());
      }
      PDDocumentInformation info = document.getDocumentInformation();
      return new PdfContent(pages, blankToNull(info.getTitle()), blankToNull(info.getAuthor()),
          blankToNull(info.getSubject()), blankToNull(info.getCreator()));
    }
  }

  private static @Nullable String blankToNull(@Nullable String value) {
    return value == null || value.isBlank() ? null : value.strip();
  }
}
