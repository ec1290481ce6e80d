package com.flamingo.ai.literatureingest.document;

import com.flamingo.ai.literatureingest.domain.model.AssembledDocument;
import com.flamingo.ai.literatureingest.domain.model.RecordMetadata;
import org.springframework.stereotype.Component;

/**
 * Merges a record's metadata, abstract and optional full text into one document.
 *
 * <p>Content order is title, a short bibliographic header, the abstract, then the full text under
 * a banner. Pure: no I/O and no state.
 */
@Component
public class DocumentAssembler {

  static final String FULL_TEXT_BANNER =
      "=".repeat(60) + "\nFULL TEXT (EXTRACTED FROM PDF)\n" + "=".repeat(60);

  /**
   * Builds the document for one record.
   *
   * @param metadata the record's metadata
   * @param fullText extracted full text, or null when none was retrieved
   * @param query the query that surfaced the record
   * @return the assembled document; {@code hasFullText} is true only for non-blank full text
   */
  public AssembledDocument assemble(RecordMetadata metadata, String fullText, String query) {
    StringBuilder content = new StringBuilder();
    if (!metadata.title().isBlank()) {
      content.append(metadata.title().strip()).append("\n\n");
    }

    appendField(content, "Authors", String.join(", ", metadata.authors()));
    appendField(content, "Journal", metadata.journal());
    appendField(content, "Published", metadata.publicationDate());
    appendField(content, "PMID", metadata.recordId());
    appendField(content, "DOI", metadata.doi());
    if (metadata.hasFullTextSource()) {
      appendField(content, "PMC ID", "PMC" + metadata.fullTextId());
    }

    if (!metadata.abstractText().isBlank()) {
      content.append("\nAbstract:\n").append(metadata.abstractText().strip()).append("\n");
    }

    boolean hasFullText = fullText != null && !fullText.isBlank();
    if (hasFullText) {
      content.append("\n").append(FULL_TEXT_BANNER).append("\n\n").append(fullText.strip());
    }

    return new AssembledDocument(
        metadata.recordId(), content.toString().strip(), metadata, query, hasFullText);
  }

  private static void appendField(StringBuilder content, String label, String value) {
    if (value != null && !value.isBlank()) {
      content.append(label).append(": ").append(value.strip()).append("\n");
    }
  }
}
