package com.flamingo.ai.literatureingest.fulltext;

import com.flamingo.ai.literatureingest.domain.model.RecordMetadata;
import java.util.Optional;

/** Fetches open-access full text for a record when the source offers it. */
public interface FullTextRetriever {

  /**
   * Downloads and extracts the record's full text.
   *
   * <p>Never fails the record: any problem obtaining or reading the document yields an empty
   * result and the record is indexed from its abstract.
   *
   * @param metadata the record; nothing is attempted without a full-text ID
   * @return all extractable text, or empty
   */
  Optional<String> maybeFetchFullText(RecordMetadata metadata);
}
