package com.flamingo.ai.literatureingest.fulltext;

import com.flamingo.ai.literatureingest.exception.FullTextUnavailableException;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** Extracts plain text from a PDF page by page with Apache PDFBox. */
@Component
@Slf4j
public class PdfTextExtractor {

  /**
   * Returns all extractable text, pages separated by a blank line. Nothing is truncated.
   *
   * @throws FullTextUnavailableException if the PDF cannot be parsed, forbids extraction or
   *     contains no text
   */
  public String extractText(byte[] pdf, String fullTextId) {
    try (PDDocument document = Loader.loadPDF(pdf)) {
      if (!document.getCurrentAccessPermission().canExtractContent()) {
        throw new FullTextUnavailableException(fullTextId, "PDF forbids text extraction");
      }
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);

      StringBuilder text = new StringBuilder();
      int pages = document.getNumberOfPages();
      for (int page = 1; page <= pages; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String pageText = stripper.getText(document).strip();
        if (!pageText.isEmpty()) {
          if (text.length() > 0) {
            text.append("\n\n");
          }
          text.append(pageText);
        }
      }
      if (text.length() == 0) {
        throw new FullTextUnavailableException(fullTextId, "PDF has no extractable text");
      }
      log.debug("Extracted {} chars from {} pages of PMC{}", text.length(), pages, fullTextId);
      return text.toString();
    } catch (IOException e) {
      throw new FullTextUnavailableException(
          fullTextId, "unreadable PDF: " + e.getMessage(), e);
    }
  }
}
