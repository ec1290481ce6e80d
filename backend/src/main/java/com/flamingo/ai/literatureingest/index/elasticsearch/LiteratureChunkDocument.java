package com.flamingo.ai.literatureingest.index.elasticsearch;

import com.flamingo.ai.literatureingest.domain.model.Chunk;
import com.flamingo.ai.literatureingest.domain.model.RecordMetadata;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A literature chunk as stored in Elasticsearch, with its text, metadata and embedding. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiteratureChunkDocument {

  public static final String SOURCE_PUBMED = "pubmed";

  private String id;
  private String recordId;
  private int chunkIndex;
  private String content;
  private List<Float> embedding;

  @Builder.Default private String source = SOURCE_PUBMED;
  private String query;
  private String title;
  @Builder.Default private List<String> authors = List.of();
  private String journal;
  private String publicationDate;
  private String doi;
  /** PMC ID with its {@code PMC} prefix, or null when the record has none. */
  private String pmcId;

  private boolean hasFullText;
  private long indexedAt;

  static LiteratureChunkDocument from(Chunk chunk, List<Float> embedding, long indexedAt) {
    RecordMetadata metadata = chunk.metadata();
    return LiteratureChunkDocument.builder()
        .id(chunk.id())
        .recordId(chunk.recordId())
        .chunkIndex(chunk.chunkIndex())
        .content(chunk.text())
        .embedding(embedding)
        .query(chunk.query())
        .title(metadata.title())
        .authors(metadata.authors())
        .journal(metadata.journal())
        .publicationDate(metadata.publicationDate())
        .doi(metadata.doi())
        .pmcId(metadata.hasFullTextSource() ? "PMC" + metadata.fullTextId() : null)
        .hasFullText(chunk.hasFullText())
        .indexedAt(indexedAt)
        .build();
  }
}
