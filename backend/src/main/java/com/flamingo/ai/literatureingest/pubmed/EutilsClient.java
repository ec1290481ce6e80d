package com.flamingo.ai.literatureingest.pubmed;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.credential.CredentialBinding;
import com.flamingo.ai.literatureingest.domain.model.Credential;
import com.flamingo.ai.literatureingest.exception.LiteratureApiException;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * HTTP client for the NCBI E-utilities {@code esearch} and {@code efetch} endpoints.
 *
 * <p>Both calls are POSTs so the API key travels in the body and never shows up in a logged URL.
 * Each call first takes a slot from the credential's rate limiter. Error responses become {@link
 * LiteratureApiException}; connection problems surface as the client's own exceptions.
 */
@Component
@Slf4j
public class EutilsClient {

  private static final int MAX_RESPONSE_BYTES = 32 * 1024 * 1024;
  private static final int MAX_ERROR_BODY_CHARS = 300;

  private final WebClient webClient;
  private final IngestionConfig.Search search;
  private final Duration fetchTimeout;

  @Autowired
  public EutilsClient(IngestionConfig ingestionConfig) {
    this(
        WebClient.builder()
            .baseUrl(ingestionConfig.getSearch().getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
            .build(),
        ingestionConfig);
    log.info(
        "E-utilities client initialized: baseUrl={}, db={}",
        ingestionConfig.getSearch().getBaseUrl(),
        ingestionConfig.getSearch().getDatabase());
  }

  /** Constructor for testing - allows injecting a stubbed WebClient. */
  @VisibleForTesting
  EutilsClient(WebClient webClient, IngestionConfig ingestionConfig) {
    this.webClient = webClient;
    this.search = ingestionConfig.getSearch();
    this.fetchTimeout = ingestionConfig.getFetch().getTimeout();
  }

  /**
   * Calls {@code esearch.fcgi} for one page of results.
   *
   * @return the raw JSON response
   */
  @Timed(value = "ingestion.eutils.esearch", description = "Time for one esearch page")
  public String esearch(String term, int retstart, int retmax, CredentialBinding credential) {
    MultiValueMap<String, String> form = baseForm(credential.getCredential());
    form.add("term", term);
    form.add("retstart", String.valueOf(retstart));
    form.add("retmax", String.valueOf(retmax));
    form.add("sort", search.getSort());
    form.add("retmode", "json");

    credential.acquire("esearch");
    log.debug("esearch term='{}' retstart={} retmax={}", term, retstart, retmax);
    return post("esearch", "/esearch.fcgi", form, search.getTimeout());
  }

  /**
   * Calls {@code efetch.fcgi} for a batch of PubMed IDs.
   *
   * @return the raw PubmedArticleSet XML
   */
  @Timed(value = "ingestion.eutils.efetch", description = "Time for one efetch batch")
  public String efetch(List<String> recordIds, CredentialBinding credential) {
    MultiValueMap<String, String> form = baseForm(credential.getCredential());
    form.add("id", String.join(",", recordIds));
    form.add("rettype", "abstract");
    form.add("retmode", "xml");

    credential.acquire("efetch");
    log.debug("efetch {} ids", recordIds.size());
    return post("efetch", "/efetch.fcgi", form, fetchTimeout);
  }

  private MultiValueMap<String, String> baseForm(Credential credential) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("db", search.getDatabase());
    form.add("tool", search.getTool());
    form.add("email", credential.contactIdentity());
    form.add("api_key", credential.secretKey());
    return form;
  }

  private String post(
      String operation, String path, MultiValueMap<String, String> form, Duration timeout) {
    return webClient
        .post()
        .uri(path)
        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
        .body(BodyInserters.fromFormData(form))
        .retrieve()
        .onStatus(HttpStatusCode::isError, response -> toApiException(operation, response))
        .bodyToMono(String.class)
        .switchIfEmpty(
            Mono.error(() -> new LiteratureApiException(operation, 502, "empty response body")))
        .timeout(timeout)
        .block();
  }

  private Mono<LiteratureApiException> toApiException(String operation, ClientResponse response) {
    int status = response.statusCode().value();
    Duration retryAfter = parseRetryAfter(response.headers().header(HttpHeaders.RETRY_AFTER));
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(body -> new LiteratureApiException(operation, status, abbreviate(body), retryAfter));
  }

  @VisibleForTesting
  static Duration parseRetryAfter(List<String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    try {
      return Duration.ofSeconds(Long.parseLong(values.get(0).trim()));
    } catch (NumberFormatException e) {
      // HTTP-date form; the backoff policy decides the wait instead
      return null;
    }
  }

  private static String abbreviate(String body) {
    String flat = body.replaceAll("\\s+", " ").trim();
    return flat.length() <= MAX_ERROR_BODY_CHARS
        ? flat
        : flat.substring(0, MAX_ERROR_BODY_CHARS) + "...";
  }
}
