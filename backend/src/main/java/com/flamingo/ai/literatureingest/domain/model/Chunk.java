package com.flamingo.ai.literatureingest.domain.model;

/**
 * A bounded window of an assembled document; the unit written to the vector store.
 *
 * @param recordId owning record
 * @param chunkIndex zero-based position within the record
 * @param text the window text
 * @param metadata owning record's metadata
 * @param query the query that surfaced the record
 * @param hasFullText whether the owning document included full text
 */
public record Chunk(
    String recordId,
    int chunkIndex,
    String text,
    RecordMetadata metadata,
    String query,
    boolean hasFullText) {

  /** Stable identifier, so re-indexing a record overwrites its chunks instead of adding more. */
  public String id() {
    return recordId + "_" + chunkIndex;
  }
}
