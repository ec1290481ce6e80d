package com.flamingo.ai.literatureingest.pipeline;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.credential.CredentialBinding;
import com.flamingo.ai.literatureingest.document.DocumentAssembler;
import com.flamingo.ai.literatureingest.document.chunking.RecursiveCharacterChunker;
import com.flamingo.ai.literatureingest.domain.model.Chunk;
import com.flamingo.ai.literatureingest.domain.model.FetchResult;
import com.flamingo.ai.literatureingest.domain.model.RecordMetadata;
import com.flamingo.ai.literatureingest.exception.IndexingException;
import com.flamingo.ai.literatureingest.fulltext.FullTextRetriever;
import com.flamingo.ai.literatureingest.index.ChunkIndexer;
import com.flamingo.ai.literatureingest.index.ChunkVectorStore;
import com.flamingo.ai.literatureingest.index.EmbeddingService;
import com.flamingo.ai.literatureingest.ledger.ProgressLedger;
import com.flamingo.ai.literatureingest.pubmed.LiteratureSearchClient;
import com.flamingo.ai.literatureingest.pubmed.RecordMetadataFetcher;
import com.flamingo.ai.literatureingest.support.TestFixtures;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/** In-memory stand-ins for the external services, wired around the real pipeline steps. */
class PipelineFakes {

  final IngestionConfig config;
  final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  final IngestionStats stats = new IngestionStats(meterRegistry);
  final FakeSearch search = new FakeSearch();
  final FakeFetcher fetcher = new FakeFetcher();
  final FakeFullText fullText = new FakeFullText();
  final FakeStore store = new FakeStore();
  final ChunkIndexer indexer;
  final PipelineStages stages;

  PipelineFakes(Path ledgerPath) {
    this(ledgerPath, config -> {});
  }

  PipelineFakes(Path ledgerPath, Consumer<IngestionConfig> customizer) {
    config = TestFixtures.fastConfig();
    config.getLedger().setPath(ledgerPath.toString());
    config.getLedger().setFlushEvery(5);
    customizer.accept(config);
    EmbeddingModel embeddingModel = mock(EmbeddingModel.class);
    when(embeddingModel.embedAll(anyList()))
        .thenAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              List<Embedding> vectors = new ArrayList<>();
              segments.forEach(segment -> vectors.add(Embedding.from(new float[] {0.1f, 0.2f})));
              return Response.from(vectors);
            });
    indexer =
        new ChunkIndexer(
            new EmbeddingService(embeddingModel, meterRegistry),
            store,
            TestFixtures.retryPolicies(config, meterRegistry),
            CircuitBreakerRegistry.ofDefaults(),
            config);
    stages =
        new PipelineStages(
            search,
            fetcher,
            fullText,
            new DocumentAssembler(),
            new RecursiveCharacterChunker(config),
            indexer);
  }

  ProgressLedger newLedger() {
    return new ProgressLedger(config, new ObjectMapper());
  }

  /** Registers {@code perQuery} distinct record IDs for each query, numbered from 1001. */
  List<String> queriesWithRecords(int queryCount, int perQuery) {
    List<String> queries = new ArrayList<>();
    int next = 1001;
    for (int q = 0; q < queryCount; q++) {
      String query = "vision query " + q;
      List<String> ids = new ArrayList<>();
      for (int r = 0; r < perQuery; r++) {
        ids.add(String.valueOf(next++));
      }
      search.results.put(query, ids);
      queries.add(query);
    }
    return queries;
  }

  static class FakeSearch implements LiteratureSearchClient {
    final Map<String, List<String>> results = new LinkedHashMap<>();
    final Map<String, String> credentialByQuery = new ConcurrentHashMap<>();
    final Set<String> failingQueries = ConcurrentHashMap.newKeySet();

    @Override
    public List<String> search(String query, CredentialBinding credential) {
      credentialByQuery.put(query, credential.getId());
      if (failingQueries.contains(query)) {
        throw new IllegalStateException("search exhausted retries for " + query);
      }
      return results.getOrDefault(query, List.of());
    }
  }

  static class FakeFetcher implements RecordMetadataFetcher {
    final Map<String, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    final Set<String> malformed = ConcurrentHashMap.newKeySet();
    volatile Runnable onFetch = () -> {};

    @Override
    public FetchResult fetchMetadata(List<String> recordIds, CredentialBinding credential) {
      onFetch.run();
      List<RecordMetadata> records = new ArrayList<>();
      Map<String, String> failures = new HashMap<>();
      for (String id : recordIds) {
        fetchCounts.computeIfAbsent(id, key -> new AtomicInteger()).incrementAndGet();
        if (malformed.contains(id)) {
          failures.put(id, "article has neither title nor abstract");
          continue;
        }
        RecordMetadata metadata = TestFixtures.metadata(id);
        if (hasEvenLastDigit(id)) {
          metadata = metadata.toBuilder().fullTextId("9" + id).build();
        }
        records.add(metadata);
      }
      return new FetchResult(records, failures);
    }

    int totalFetches() {
      return fetchCounts.values().stream().mapToInt(AtomicInteger::get).sum();
    }
  }

  static boolean hasEvenLastDigit(String id) {
    return (id.charAt(id.length() - 1) - '0') % 2 == 0;
  }

  static class FakeFullText implements FullTextRetriever {
    volatile Function<RecordMetadata, Optional<String>> behavior =
        metadata -> Optional.of("Full text of record " + metadata.recordId() + ".");

    @Override
    public Optional<String> maybeFetchFullText(RecordMetadata metadata) {
      return behavior.apply(metadata);
    }
  }

  /**
   * Vector store that can poison the record of its Nth write. Every later write of that record
   * fails too, so the record still fails once the index retry policy has run out.
   */
  static class FakeStore implements ChunkVectorStore {
    final List<Chunk> written = Collections.synchronizedList(new ArrayList<>());
    final AtomicInteger writeCalls = new AtomicInteger();
    final Set<String> poisoned = ConcurrentHashMap.newKeySet();
    volatile int poisonWriteNumber = -1;
    volatile boolean alwaysFail;
    volatile RuntimeException unavailable;

    @Override
    public void verifyAvailable() {
      if (unavailable != null) {
        throw unavailable;
      }
    }

    @Override
    public void write(List<Chunk> chunks, List<List<Float>> embeddings) {
      int call = writeCalls.incrementAndGet();
      if (call == poisonWriteNumber) {
        poisoned.add(chunks.get(0).recordId());
      }
      boolean rejected =
          alwaysFail || chunks.stream().anyMatch(chunk -> poisoned.contains(chunk.recordId()));
      if (rejected) {
        throw new IndexingException(Set.of(chunks.get(0).recordId()), "mapping rejected");
      }
      written.addAll(chunks);
    }

    @Override
    public long countChunks() {
      return written.size();
    }
  }
}
