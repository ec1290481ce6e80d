package com.flamingo.ai.literatureingest.pipeline;

import com.flamingo.ai.literatureingest.domain.enums.FailureCategory;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;
import org.springframework.stereotype.Component;

/**
 * Live counters for the current run, mirrored to Micrometer.
 *
 * <p>Reset by the coordinator at the start of each run. Only one run is active at a time.
 */
@Component
public class IngestionStats {

  private final MeterRegistry meterRegistry;

  private final LongAdder queriesCompleted = new LongAdder();
  private final LongAdder queriesSkipped = new LongAdder();
  private final LongAdder queriesFailed = new LongAdder();
  private final LongAdder recordsDownloaded = new LongAdder();
  private final LongAdder recordsIndexed = new LongAdder();
  private final LongAdder recordsFailed = new LongAdder();
  private final LongAdder recordsSkipped = new LongAdder();
  private final LongAdder fullTextsRetrieved = new LongAdder();
  private final LongAdder chunksIndexed = new LongAdder();
  private final Map<FailureCategory, LongAdder> failures = new EnumMap<>(FailureCategory.class);

  public IngestionStats(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    for (FailureCategory category : FailureCategory.values()) {
      failures.put(category, new LongAdder());
    }
  }

  public void reset() {
    queriesCompleted.reset();
    queriesSkipped.reset();
    queriesFailed.reset();
    recordsDownloaded.reset();
    recordsIndexed.reset();
    recordsFailed.reset();
    recordsSkipped.reset();
    fullTextsRetrieved.reset();
    chunksIndexed.reset();
    failures.values().forEach(LongAdder::reset);
  }

  public void queryCompleted() {
    queriesCompleted.increment();
    meterRegistry.counter("ingestion.queries", "outcome", "completed").increment();
  }

  public void querySkipped() {
    queriesSkipped.increment();
    meterRegistry.counter("ingestion.queries", "outcome", "skipped").increment();
  }

  public void queryFailed() {
    queriesFailed.increment();
    failures.get(FailureCategory.PERMANENT_QUERY).increment();
    meterRegistry.counter("ingestion.queries", "outcome", "failed").increment();
  }

  public void recordDownloaded() {
    recordsDownloaded.increment();
    meterRegistry.counter("ingestion.records", "outcome", "downloaded").increment();
  }

  public void recordIndexed() {
    recordsIndexed.increment();
    meterRegistry.counter("ingestion.records", "outcome", "indexed").increment();
  }

  public void recordFailed() {
    recordsFailed.increment();
    failures.get(FailureCategory.PERMANENT_RECORD).increment();
    meterRegistry.counter("ingestion.records", "outcome", "failed").increment();
  }

  public void recordsSkipped(int count) {
    if (count <= 0) {
      return;
    }
    recordsSkipped.add(count);
    meterRegistry.counter("ingestion.records", "outcome", "skipped").increment(count);
  }

  public void fullTextRetrieved() {
    fullTextsRetrieved.increment();
    meterRegistry.counter("ingestion.fulltext.retrieved").increment();
  }

  public void chunksIndexed(int count) {
    chunksIndexed.add(count);
    meterRegistry.counter("ingestion.chunks.indexed").increment(count);
  }

  /** Counts a retry of a transient or rate-limited call. */
  public void retryScheduled(FailureCategory category) {
    failures.get(category).increment();
    meterRegistry.counter("ingestion.retries", "category", category.name()).increment();
  }

  public void fatal() {
    failures.get(FailureCategory.FATAL).increment();
  }

  public long getQueriesCompleted() {
    return queriesCompleted.sum();
  }

  public long getQueriesSkipped() {
    return queriesSkipped.sum();
  }

  public long getQueriesFailed() {
    return queriesFailed.sum();
  }

  public long getRecordsDownloaded() {
    return recordsDownloaded.sum();
  }

  public long getRecordsIndexed() {
    return recordsIndexed.sum();
  }

  public long getRecordsFailed() {
    return recordsFailed.sum();
  }

  public long getRecordsSkipped() {
    return recordsSkipped.sum();
  }

  public long getFullTextsRetrieved() {
    return fullTextsRetrieved.sum();
  }

  public long getChunksIndexed() {
    return chunksIndexed.sum();
  }

  public Map<FailureCategory, Long> getFailuresByCategory() {
    Map<FailureCategory, Long> snapshot = new EnumMap<>(FailureCategory.class);
    failures.forEach((category, adder) -> snapshot.put(category, adder.sum()));
    return snapshot;
  }

  /** Flat view of every counter, for logging and the status endpoint. */
  public Map<String, Long> snapshot() {
    Map<String, Long> counters = new LinkedHashMap<>();
    counters.put("queriesCompleted", getQueriesCompleted());
    counters.put("queriesSkipped", getQueriesSkipped());
    counters.put("queriesFailed", getQueriesFailed());
    counters.put("recordsDownloaded", getRecordsDownloaded());
    counters.put("recordsIndexed", getRecordsIndexed());
    counters.put("recordsFailed", getRecordsFailed());
    counters.put("recordsSkipped", getRecordsSkipped());
    counters.put("fullTextsRetrieved", getFullTextsRetrieved());
    counters.put("chunksIndexed", getChunksIndexed());
    return counters;
  }
}
