package com.flamingo.ai.literatureingest.index;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.domain.model.Chunk;
import com.flamingo.ai.literatureingest.exception.FatalIngestionException;
import com.flamingo.ai.literatureingest.exception.IngestionInterruptedException;
import com.flamingo.ai.literatureingest.exception.VectorStoreUnavailableException;
import com.flamingo.ai.literatureingest.retry.RetryPolicies;
import com.google.common.collect.Lists;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds and writes chunks in batches of {@code ingestion.indexing.batch-size}.
 *
 * <p>Each batch is retried under the index retry policy. A batch that still fails marks its
 * records failed and indexing moves on. Batches run behind a circuit breaker that opens after
 * {@code unreachable-threshold} consecutive failed batches; an open breaker means the store is
 * unreachable and aborts the run.
 */
@Service
@Slf4j
public class ChunkIndexer {

  public static final String CIRCUIT_BREAKER = "vector-store";

  private final EmbeddingService embeddingService;
  private final ChunkVectorStore vectorStore;
  private final RetryPolicies retryPolicies;
  private final CircuitBreaker circuitBreaker;
  private final int batchSize;

  public ChunkIndexer(
      EmbeddingService embeddingService,
      ChunkVectorStore vectorStore,
      RetryPolicies retryPolicies,
      CircuitBreakerRegistry circuitBreakerRegistry,
      IngestionConfig ingestionConfig) {
    this.embeddingService = embeddingService;
    this.vectorStore = vectorStore;
    this.retryPolicies = retryPolicies;
    IngestionConfig.Indexing settings = ingestionConfig.getIndexing();
    this.batchSize = settings.getBatchSize();
    int threshold = settings.getUnreachableThreshold();
    CircuitBreakerConfig config =
        CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(threshold)
            .minimumNumberOfCalls(threshold)
            .failureRateThreshold(100.0f)
            .waitDurationInOpenState(settings.getUnreachableWait())
            .ignoreExceptions(IngestionInterruptedException.class)
            .build();
    circuitBreakerRegistry.remove(CIRCUIT_BREAKER);
    this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER, config);
  }

  /**
   * Indexes the chunks, attributing failures to the records of the failed batches.
   *
   * @throws VectorStoreUnavailableException if the store has stopped accepting writes entirely
   */
  public IndexResult index(List<Chunk> chunks) {
    int indexed = 0;
    Set<String> failed = new LinkedHashSet<>();
    for (List<Chunk> batch : Lists.partition(chunks, batchSize)) {
      Set<String> batchRecords =
          batch.stream().map(Chunk::recordId).collect(Collectors.toCollection(LinkedHashSet::new));
      if (failed.containsAll(batchRecords)) {
        continue;
      }
      try {
        circuitBreaker.executeRunnable(
            () -> retryPolicies.index().executeRunnable(() -> writeBatch(batch)));
        indexed += batch.size();
      } catch (CallNotPermittedException e) {
        throw new VectorStoreUnavailableException(
            "Vector store unreachable, circuit breaker '" + CIRCUIT_BREAKER + "' is open", e);
      } catch (FatalIngestionException | IngestionInterruptedException e) {
        throw e;
      } catch (RuntimeException e) {
        log.warn(
            "Indexing {} chunks of records {} failed after retries: {}",
            batch.size(),
            batchRecords,
            e.getMessage());
        failed.addAll(batchRecords);
      }
    }
    return new IndexResult(indexed, failed);
  }

  /** Closes the circuit breaker, called when a new run starts. */
  public void resetCircuit() {
    circuitBreaker.reset();
  }

  private void writeBatch(List<Chunk> batch) {
    List<List<Float>> embeddings =
        embeddingService.embedPassages(batch.stream().map(Chunk::text).toList());
    vectorStore.write(batch, embeddings);
  }
}
