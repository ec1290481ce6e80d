package com.flamingo.ai.literatureingest.pubmed;

import com.flamingo.ai.literatureingest.domain.model.RecordMetadata;
import java.util.List;
import java.util.Map;

/**
 * Articles read from one efetch response.
 *
 * @param records articles that carried enough data to index
 * @param failures PMID to reason, for articles that were present but malformed
 * @param complete false when the XML broke off before the end of the document
 */
public record ParsedArticles(
    List<RecordMetadata> records, Map<String, String> failures, boolean complete) {}
