package com.flamingo.ai.literatureingest.index.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.domain.model.Chunk;
import com.flamingo.ai.literatureingest.exception.IndexingException;
import com.flamingo.ai.literatureingest.exception.VectorStoreUnavailableException;
import com.flamingo.ai.literatureingest.index.ChunkVectorStore;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Elasticsearch-backed store for embedded literature chunks. */
@Service
@Slf4j
public class LiteratureChunkIndexService implements ChunkVectorStore {

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final int vectorDimensions;
  private final Clock clock;

  @Autowired
  public LiteratureChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      IngestionConfig ingestionConfig) {
    this(
        elasticsearchClient,
        meterRegistry,
        ingestionConfig.getVectorStore().getIndexName(),
        ingestionConfig.getVectorStore().getVectorDimensions(),
        Clock.systemUTC());
  }

  @VisibleForTesting
  LiteratureChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions,
      Clock clock) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
    this.clock = clock;
  }

  public String getIndexName() {
    return indexName;
  }

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn("Elasticsearch client not available, skipping initialization of {}", indexName);
        return;
      }
      if (indices.exists(e -> e.index(indexName)).value()) {
        addMissingFields();
      } else {
        CreateIndexRequest request =
            CreateIndexRequest.of(
                c ->
                    c.index(indexName)
                        .mappings(
                            m -> m.dynamic(DynamicMapping.False).properties(indexProperties())));
        indices.create(request);
        log.info("Created Elasticsearch index: {}", indexName);
      }
    } catch (IOException | RuntimeException e) {
      // runs probe the store again before starting
      log.error("Failed to initialize Elasticsearch index '{}': {}", indexName, e.getMessage());
    }
  }

  /** Adds fields missing from an existing index; a field with a different type fails fast. */
  private void addMissingFields() throws IOException {
    var mapping = elasticsearchClient.indices().getMapping(g -> g.index(indexName)).get(indexName);
    if (mapping == null) {
      return;
    }
    Map<String, Property> actual = mapping.mappings().properties();
    Map<String, Property> missing = new HashMap<>();
    List<String> mismatches = new ArrayList<>();
    indexProperties()
        .forEach(
            (field, expected) -> {
              Property existing = actual.get(field);
              if (existing == null) {
                missing.put(field, expected);
              } else if (existing._kind() != expected._kind()) {
                mismatches.add(
                    field + " is " + existing._kind() + ", expected " + expected._kind());
              }
            });
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + indexName
              + "' has incompatible field types, recreate it: "
              + String.join("; ", mismatches));
    }
    if (missing.isEmpty()) {
      log.debug("Index '{}' mapping verified", indexName);
      return;
    }
    elasticsearchClient
        .indices()
        .putMapping(PutMappingRequest.of(p -> p.index(indexName).properties(missing)));
    log.info("Added {} field(s) to index '{}': {}", missing.size(), indexName, missing.keySet());
  }

  @VisibleForTesting
  Map<String, Property> indexProperties() {
    Map<String, Property> properties = new LinkedHashMap<>();
    properties.put("content", Property.of(p -> p.text(t -> t)));
    properties.put("record_id", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunk_index", Property.of(p -> p.integer(i -> i)));
    properties.put("source", Property.of(p -> p.keyword(k -> k)));
    properties.put("query", Property.of(p -> p.keyword(k -> k)));
    properties.put("title", Property.of(p -> p.text(t -> t)));
    properties.put("authors", Property.of(p -> p.text(t -> t)));
    properties.put("journal", Property.of(p -> p.text(t -> t)));
    // free-form for MedlineDate values like "2019 Spring"
    properties.put("publication_date", Property.of(p -> p.keyword(k -> k)));
    properties.put("doi", Property.of(p -> p.keyword(k -> k)));
    properties.put("pmc_id", Property.of(p -> p.keyword(k -> k)));
    properties.put("has_full_text", Property.of(p -> p.boolean_(b -> b)));
    properties.put("indexed_at", Property.of(p -> p.date(d -> d)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  public void verifyAvailable() {
    boolean reachable;
    try {
      reachable = elasticsearchClient.ping().value();
    } catch (IOException | RuntimeException e) {
      throw new VectorStoreUnavailableException(
          "Elasticsearch is not reachable: " + e.getMessage(), e);
    }
    if (!reachable) {
      throw new VectorStoreUnavailableException("Elasticsearch did not answer ping");
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index literature chunks")
  public void write(List<Chunk> chunks, List<List<Float>> embeddings) {
    if (chunks.isEmpty()) {
      return;
    }
    if (chunks.size() != embeddings.size()) {
      throw new IllegalArgumentException(
          chunks.size() + " chunks but " + embeddings.size() + " embeddings");
    }
    long indexedAt = clock.millis();
    Map<String, String> recordByChunkId = new HashMap<>();
    BulkRequest.Builder bulk = new BulkRequest.Builder();
    for (int i = 0; i < chunks.size(); i++) {
      Chunk chunk = chunks.get(i);
      LiteratureChunkDocument document =
          LiteratureChunkDocument.from(chunk, embeddings.get(i), indexedAt);
      Map<String, Object> source = convertToDocument(document);
      recordByChunkId.put(document.getId(), document.getRecordId());
      bulk.operations(
          op -> op.index(idx -> idx.index(indexName).id(document.getId()).document(source)));
    }

    BulkResponse response;
    try {
      response = elasticsearchClient.bulk(bulk.build());
    } catch (IOException e) {
      meterRegistry.counter("literature_chunk.index.errors").increment();
      throw new IndexingException(
          new LinkedHashSet<>(recordByChunkId.values()),
          "Bulk write to " + indexName + " failed: " + e.getMessage(),
          e);
    }
    if (response.errors()) {
      Set<String> failedRecords = new LinkedHashSet<>();
      String firstReason = null;
      for (BulkResponseItem item : response.items()) {
        if (item.error() != null) {
          failedRecords.add(recordByChunkId.getOrDefault(item.id(), item.id()));
          if (firstReason == null) {
            firstReason = item.error().reason();
          }
        }
      }
      meterRegistry.counter("literature_chunk.index.errors").increment();
      throw new IndexingException(
          failedRecords,
          "Elasticsearch rejected chunks of records " + failedRecords + ": " + firstReason);
    }
    log.debug("Indexed {} chunks to {}", chunks.size(), indexName);
    meterRegistry.counter("literature_chunk.indexed").increment(chunks.size());
  }

  @Override
  public long countChunks() {
    try {
      return elasticsearchClient.count(c -> c.index(indexName)).count();
    } catch (IOException e) {
      throw new VectorStoreUnavailableException("Failed to count chunks: " + e.getMessage(), e);
    }
  }

  @VisibleForTesting
  static Map<String, Object> convertToDocument(LiteratureChunkDocument document) {
    Map<String, Object> doc = new HashMap<>();
    doc.put("content", document.getContent());
    doc.put("record_id", document.getRecordId());
    doc.put("chunk_index", document.getChunkIndex());
    doc.put("source", document.getSource());
    doc.put("query", document.getQuery());
    doc.put("title", document.getTitle());
    doc.put("authors", document.getAuthors());
    doc.put("journal", document.getJournal());
    doc.put("publication_date", document.getPublicationDate());
    doc.put("doi", document.getDoi());
    doc.put("pmc_id", document.getPmcId());
    doc.put("has_full_text", document.isHasFullText());
    doc.put("indexed_at", document.getIndexedAt());
    doc.put("embedding", document.getEmbedding());
    return doc;
  }
}
