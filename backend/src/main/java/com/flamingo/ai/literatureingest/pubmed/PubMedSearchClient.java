package com.flamingo.ai.literatureingest.pubmed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.credential.CredentialBinding;
import com.flamingo.ai.literatureingest.exception.LiteratureApiException;
import com.flamingo.ai.literatureingest.retry.RetryPolicies;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * PubMed search over {@code esearch}, paged until the max-results cap or the hit count is reached.
 *
 * <p>Each page is retried on its own under the search retry policy. If a page still fails, the
 * exception propagates and the caller fails the query.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PubMedSearchClient implements LiteratureSearchClient {

  /** esearch refuses {@code retstart} beyond this many results. */
  static final int SOURCE_RESULT_LIMIT = 10_000;

  private static final String DEFAULT_DATE_FROM = "1800";
  private static final String DEFAULT_DATE_TO = "3000";

  private final EutilsClient eutilsClient;
  private final RetryPolicies retryPolicies;
  private final IngestionConfig ingestionConfig;
  private final ObjectMapper objectMapper;

  @Override
  public List<String> search(String query, CredentialBinding credential) {
    IngestionConfig.Search settings = ingestionConfig.getSearch();
    String term = buildTerm(query);
    int cap = Math.min(settings.getMaxResults(), SOURCE_RESULT_LIMIT);

    Set<String> ids = new LinkedHashSet<>();
    int retstart = 0;
    long totalCount = Long.MAX_VALUE;
    while (retstart < cap && retstart < totalCount) {
      int start = retstart;
      int retmax = Math.min(settings.getPageSize(), cap - retstart);
      SearchPage page =
          retryPolicies
              .search()
              .executeSupplier(
                  () -> parsePage(eutilsClient.esearch(term, start, retmax, credential)));
      ids.addAll(page.ids());
      totalCount = page.totalCount();
      retstart += retmax;
      if (page.ids().size() < retmax) {
        break;
      }
    }

    List<String> result = new ArrayList<>(ids);
    if (result.size() > cap) {
      result = result.subList(0, cap);
    }
    log.info(
        "Search '{}' returned {} ids ({} total hits) via {}",
        query,
        result.size(),
        totalCount == Long.MAX_VALUE ? 0 : totalCount,
        credential.getId());
    return List.copyOf(result);
  }

  /** Adds the configured publication date range to the query, if any. */
  @VisibleForTesting
  String buildTerm(String query) {
    IngestionConfig.Search settings = ingestionConfig.getSearch();
    boolean hasFrom = settings.getDateFrom() != null && !settings.getDateFrom().isBlank();
    boolean hasTo = settings.getDateTo() != null && !settings.getDateTo().isBlank();
    if (!hasFrom && !hasTo) {
      return query;
    }
    String from = hasFrom ? settings.getDateFrom().trim() : DEFAULT_DATE_FROM;
    String to = hasTo ? settings.getDateTo().trim() : DEFAULT_DATE_TO;
    return "(" + query + ") AND " + from + ":" + to + "[pdat]";
  }

  @VisibleForTesting
  SearchPage parsePage(String json) {
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new LiteratureApiException("esearch", 200, "unparseable response: " + e.getMessage());
    }

    String error = root.path("error").asText("");
    if (!error.isEmpty()) {
      int status = error.toLowerCase(Locale.ROOT).contains("rate limit") ? 429 : 200;
      throw new LiteratureApiException("esearch", status, error);
    }

    JsonNode result = root.path("esearchresult");
    if (result.isMissingNode()) {
      throw new LiteratureApiException("esearch", 200, "response has no esearchresult");
    }
    String resultError = result.path("ERROR").asText("");
    if (!resultError.isEmpty()) {
      throw new LiteratureApiException("esearch", 200, resultError);
    }

    List<String> ids = new ArrayList<>();
    for (JsonNode id : result.path("idlist")) {
      String value = id.asText("").trim();
      if (!value.isEmpty()) {
        ids.add(value);
      }
    }
    long count = result.path("count").asLong(ids.size());
    return new SearchPage(ids, count);
  }

  record SearchPage(List<String> ids, long totalCount) {}
}
