package com.flamingo.ai.literatureingest.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.domain.model.Chunk;
import com.flamingo.ai.literatureingest.exception.IndexingException;
import com.flamingo.ai.literatureingest.exception.VectorStoreUnavailableException;
import com.flamingo.ai.literatureingest.support.TestFixtures;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.invocation.InvocationOnMock;

@DisplayName("ChunkIndexer Tests")
class ChunkIndexerTest {

  private IngestionConfig config;
  private EmbeddingService embeddingService;
  private RecordingStore store;
  private ChunkIndexer indexer;

  /** Store that fails writes of chunks matching a predicate. */
  static class RecordingStore implements ChunkVectorStore {
    final List<Chunk> written = Collections.synchronizedList(new ArrayList<>());
    final AtomicInteger writeCalls = new AtomicInteger();
    volatile Predicate<Chunk> failing = chunk -> false;

    @Override
    public void verifyAvailable() {}

    @Override
    public void write(List<Chunk> chunks, List<List<Float>> embeddings) {
      writeCalls.incrementAndGet();
      if (chunks.stream().anyMatch(failing)) {
        throw new IndexingException(Set.of(chunks.get(0).recordId()), "rejected");
      }
      written.addAll(chunks);
    }

    @Override
    public long countChunks() {
      return written.size();
    }
  }

  static List<Chunk> chunks(String recordId, int count) {
    return IntStream.range(0, count)
        .mapToObj(
            i ->
                new Chunk(
                    recordId, i, "text " + i, TestFixtures.metadata(recordId), "query", false))
        .toList();
  }

  private static List<List<Float>> vectorsFor(InvocationOnMock invocation) {
    List<?> texts = invocation.getArgument(0);
    return texts.stream().map(text -> List.of(0.5f)).toList();
  }

  @BeforeEach
  void setUp() {
    config = TestFixtures.fastConfig();
    config.getIndexing().setBatchSize(2);
    config.getIndexing().setUnreachableThreshold(2);
    embeddingService = mock(EmbeddingService.class);
    when(embeddingService.embedPassages(anyList())).thenAnswer(ChunkIndexerTest::vectorsFor);
    store = new RecordingStore();
    indexer = newIndexer();
  }

  private ChunkIndexer newIndexer() {
    return new ChunkIndexer(
        embeddingService,
        store,
        TestFixtures.retryPolicies(config, new SimpleMeterRegistry()),
        CircuitBreakerRegistry.ofDefaults(),
        config);
  }

  @Nested
  @DisplayName("Batching")
  class Batching {

    @Test
    @DisplayName("Should write all chunks in batches of the configured size")
    void shouldWriteInBatches() {
      IndexResult result = indexer.index(chunks("1", 5));

      assertThat(result.chunksIndexed()).isEqualTo(5);
      assertThat(result.failedRecordIds()).isEmpty();
      assertThat(store.writeCalls).hasValue(3);
      assertThat(store.written).extracting(Chunk::chunkIndex).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    @DisplayName("Should retry a batch that fails once")
    void shouldRetryTransientFailure() {
      AtomicInteger attempts = new AtomicInteger();
      store.failing = chunk -> chunk.chunkIndex() == 0 && attempts.getAndIncrement() == 0;

      IndexResult result = indexer.index(chunks("1", 2));

      assertThat(result.chunksIndexed()).isEqualTo(2);
      assertThat(result.hasFailed("1")).isFalse();
      assertThat(store.writeCalls).hasValue(2);
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Should fail the record whose batch keeps failing and skip its other batches")
    void shouldAttributeFailure() {
      store.failing = chunk -> chunk.chunkIndex() == 0;

      IndexResult result = indexer.index(chunks("1", 4));

      assertThat(result.hasFailed("1")).isTrue();
      assertThat(result.chunksIndexed()).isZero();
      assertThat(store.writeCalls).hasValue(3);
    }

    @Test
    @DisplayName("Should treat an open circuit as an unreachable store")
    void shouldAbortWhenCircuitOpens() {
      store.failing = chunk -> true;

      indexer.index(chunks("1", 1));
      indexer.index(chunks("2", 1));

      assertThatThrownBy(() -> indexer.index(chunks("3", 1)))
          .isInstanceOf(VectorStoreUnavailableException.class);
    }

    @Test
    @DisplayName("Should close the circuit again on reset")
    void shouldResetCircuit() {
      store.failing = chunk -> true;
      indexer.index(chunks("1", 1));
      indexer.index(chunks("2", 1));
      store.failing = chunk -> false;

      indexer.resetCircuit();

      assertThat(indexer.index(chunks("3", 1)).chunksIndexed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not count a success in between as consecutive failures")
    void shouldNeedConsecutiveFailures() {
      store.failing = chunk -> chunk.recordId().startsWith("bad");

      indexer.index(chunks("bad-1", 1));
      indexer.index(chunks("good", 1));
      indexer.index(chunks("bad-2", 1));

      assertThat(indexer.index(chunks("good-2", 1)).chunksIndexed()).isEqualTo(1);
    }
  }
}
