package com.flamingo.ai.literatureingest.support;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.credential.CredentialBinding;
import com.flamingo.ai.literatureingest.credential.MinIntervalRateLimiter;
import com.flamingo.ai.literatureingest.domain.model.Credential;
import com.flamingo.ai.literatureingest.domain.model.RecordMetadata;
import com.flamingo.ai.literatureingest.pipeline.IngestionStats;
import com.flamingo.ai.literatureingest.retry.RetryEventLogger;
import com.flamingo.ai.literatureingest.retry.RetryPolicies;
import com.google.common.base.Ticker;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;

/** Shared builders for unit tests. */
public final class TestFixtures {

  private TestFixtures() {}

  /** Default configuration with millisecond retry backoff and no jitter. */
  public static IngestionConfig fastConfig() {
    IngestionConfig config = new IngestionConfig();
    IngestionConfig.Retry retry = config.getRetry();
    retry.setSearch(fastPolicy(3));
    retry.setFetch(fastPolicy(3));
    retry.setFullText(fastPolicy(2));
    retry.setIndex(fastPolicy(3));
    config.getIndexing().setUnreachableWait(Duration.ofMillis(50));
    return config;
  }

  public static IngestionConfig.Policy fastPolicy(int maxAttempts) {
    IngestionConfig.Policy policy =
        new IngestionConfig.Policy(maxAttempts, Duration.ofMillis(1), Duration.ofMillis(5));
    policy.setJitter(0.0);
    return policy;
  }

  public static RetryPolicies retryPolicies(IngestionConfig config, MeterRegistry registry) {
    return new RetryPolicies(
        RetryRegistry.ofDefaults(), config, new RetryEventLogger(), new IngestionStats(registry));
  }

  public static CredentialBinding credential(String id) {
    return new CredentialBinding(
        new Credential(id, "key-" + id, id + "@example.org"),
        new MinIntervalRateLimiter(10_000),
        new SimpleMeterRegistry(),
        Ticker.systemTicker());
  }

  public static RecordMetadata metadata(String recordId) {
    return RecordMetadata.builder()
        .recordId(recordId)
        .title("Title of " + recordId)
        .authors(List.of("Ada Lovelace", "Alan Turing"))
        .journal("Investigative Ophthalmology")
        .publicationDate("2021-03")
        .doi("10.1000/" + recordId)
        .abstractText("Abstract of record " + recordId + ". It describes retinal findings.")
        .build();
  }
}
