package com.flamingo.ai.literatureingest.domain.model;

import java.util.List;
import lombok.Builder;

/**
 * Bibliographic metadata for one record as returned by the metadata API.
 *
 * @param recordId the PubMed ID
 * @param title article title with inline markup flattened
 * @param authors display names in author order
 * @param journal journal title
 * @param publicationDate {@code YYYY}, {@code YYYY-MM}, {@code YYYY-MM-DD} or a free-form date
 * @param doi the DOI, or null
 * @param fullTextId the PMC ID without its {@code PMC} prefix, present for open-access records
 * @param abstractText the abstract, or an empty string
 */
@Builder(toBuilder = true)
public record RecordMetadata(
    String recordId,
    String title,
    List<String> authors,
    String journal,
    String publicationDate,
    String doi,
    String fullTextId,
    String abstractText) {

  public RecordMetadata {
    authors = authors == null ? List.of() : List.copyOf(authors);
    title = title == null ? "" : title;
    abstractText = abstractText == null ? "" : abstractText;
  }

  public boolean hasFullTextSource() {
    return fullTextId != null && !fullTextId.isBlank();
  }
}
