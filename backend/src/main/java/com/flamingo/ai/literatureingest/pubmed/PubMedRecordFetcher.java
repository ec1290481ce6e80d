package com.flamingo.ai.literatureingest.pubmed;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.credential.CredentialBinding;
import com.flamingo.ai.literatureingest.domain.model.FetchResult;
import com.flamingo.ai.literatureingest.domain.model.RecordMetadata;
import com.flamingo.ai.literatureingest.exception.FatalIngestionException;
import com.flamingo.ai.literatureingest.exception.IngestionInterruptedException;
import com.flamingo.ai.literatureingest.retry.RetryPolicies;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * PubMed metadata via {@code efetch}, in batches of at most {@code ingestion.fetch.batch-size}.
 *
 * <p>A batch whose retries are exhausted fails all of its IDs; the other batches are unaffected.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PubMedRecordFetcher implements RecordMetadataFetcher {

  private final EutilsClient eutilsClient;
  private final PubMedXmlParser pubMedXmlParser;
  private final RetryPolicies retryPolicies;
  private final IngestionConfig ingestionConfig;

  @Override
  public FetchResult fetchMetadata(List<String> recordIds, CredentialBinding credential) {
    if (recordIds.isEmpty()) {
      return FetchResult.empty();
    }
    List<String> distinct = new ArrayList<>(new LinkedHashSet<>(recordIds));
    List<RecordMetadata> records = new ArrayList<>();
    Map<String, String> failures = new LinkedHashMap<>();

    int batchSize = ingestionConfig.getFetch().getBatchSize();
    for (List<String> batch : Lists.partition(distinct, batchSize)) {
      ParsedArticles parsed;
      try {
        String xml =
            retryPolicies.fetch().executeSupplier(() -> eutilsClient.efetch(batch, credential));
        parsed = pubMedXmlParser.parse(xml);
      } catch (FatalIngestionException | IngestionInterruptedException e) {
        throw e;
      } catch (RuntimeException e) {
        log.warn(
            "efetch batch of {} ids failed via {}: {}",
            batch.size(),
            credential.getId(),
            e.getMessage());
        batch.forEach(id -> failures.put(id, "metadata fetch failed: " + e.getMessage()));
        continue;
      }

      Map<String, RecordMetadata> byId = new HashMap<>();
      parsed.records().forEach(record -> byId.putIfAbsent(record.recordId(), record));
      String missingReason =
          parsed.complete() ? "not present in efetch response" : "efetch response was truncated";
      for (String id : batch) {
        RecordMetadata record = byId.get(id);
        if (record != null) {
          records.add(record);
        } else {
          failures.put(id, parsed.failures().getOrDefault(id, missingReason));
        }
      }
    }

    if (!failures.isEmpty()) {
      log.info(
          "Fetched metadata for {}/{} records, {} failed",
          records.size(),
          distinct.size(),
          failures.size());
    }
    return new FetchResult(records, failures);
  }
}
