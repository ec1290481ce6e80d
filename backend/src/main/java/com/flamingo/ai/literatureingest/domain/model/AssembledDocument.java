package com.flamingo.ai.literatureingest.domain.model;

/**
 * One record merged into a single text, ready for chunking. Never persisted.
 *
 * @param recordId the record the document was built from
 * @param content title, header, abstract and optional full text
 * @param metadata the record's metadata
 * @param query the search query that surfaced the record
 * @param hasFullText whether full text was appended
 */
public record AssembledDocument(
    String recordId,
    String content,
    RecordMetadata metadata,
    String query,
    boolean hasFullText) {}
