package com.flamingo.ai.literatureingest.ledger;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** On-disk layout of the progress ledger. Older files keyed by {@code *_pmids} still load. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
  "completed_queries",
  "downloaded_record_ids",
  "indexed_record_ids",
  "failed_record_ids",
  "updated_at"
})
class LedgerFile {

  @Builder.Default
  @JsonProperty("completed_queries")
  private List<String> completedQueries = new ArrayList<>();

  @Builder.Default
  @JsonProperty("downloaded_record_ids")
  @JsonAlias("downloaded_pmids")
  private List<String> downloadedRecordIds = new ArrayList<>();

  @Builder.Default
  @JsonProperty("indexed_record_ids")
  @JsonAlias("indexed_pmids")
  private List<String> indexedRecordIds = new ArrayList<>();

  @Builder.Default
  @JsonProperty("failed_record_ids")
  @JsonAlias("failed_pmids")
  private List<String> failedRecordIds = new ArrayList<>();

  /** ISO-8601 instant of the last write. */
  @JsonProperty("updated_at")
  private String updatedAt;
}
