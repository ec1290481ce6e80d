package com.flamingo.ai.literatureingest.fulltext;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.domain.model.RecordMetadata;
import com.flamingo.ai.literatureingest.exception.FatalIngestionException;
import com.flamingo.ai.literatureingest.exception.FullTextUnavailableException;
import com.flamingo.ai.literatureingest.exception.IngestionInterruptedException;
import com.flamingo.ai.literatureingest.exception.LiteratureApiException;
import com.flamingo.ai.literatureingest.retry.RetryPolicies;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * Full text from the open-access PDF that PubMed Central serves for a PMC ID.
 *
 * <p>403 and 404 mean the article has no downloadable PDF. 429 and 5xx are retried under the
 * full-text retry policy. A body that is not a PDF, for example an HTML challenge page, counts as
 * unavailable.
 */
@Service
@Slf4j
public class PmcFullTextRetriever implements FullTextRetriever {

  private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);
  private static final String OPERATION = "pmc-pdf";

  private final WebClient webClient;
  private final PdfTextExtractor pdfTextExtractor;
  private final RetryPolicies retryPolicies;
  private final IngestionConfig.FullText settings;
  private final MeterRegistry meterRegistry;

  @Autowired
  public PmcFullTextRetriever(
      IngestionConfig ingestionConfig,
      PdfTextExtractor pdfTextExtractor,
      RetryPolicies retryPolicies,
      MeterRegistry meterRegistry) {
    this(
        buildWebClient(ingestionConfig),
        pdfTextExtractor,
        retryPolicies,
        ingestionConfig,
        meterRegistry);
  }

  /** Constructor for testing - allows injecting a stubbed WebClient. */
  @VisibleForTesting
  PmcFullTextRetriever(
      WebClient webClient,
      PdfTextExtractor pdfTextExtractor,
      RetryPolicies retryPolicies,
      IngestionConfig ingestionConfig,
      MeterRegistry meterRegistry) {
    this.webClient = webClient;
    this.pdfTextExtractor = pdfTextExtractor;
    this.retryPolicies = retryPolicies;
    this.settings = ingestionConfig.getFullText();
    this.meterRegistry = meterRegistry;
  }

  private static WebClient buildWebClient(IngestionConfig ingestionConfig) {
    IngestionConfig.FullText fullText = ingestionConfig.getFullText();
    HttpClient httpClient =
        HttpClient.create().followRedirect(true).responseTimeout(fullText.getTimeout());
    return WebClient.builder()
        .baseUrl(fullText.getBaseUrl())
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .defaultHeader(HttpHeaders.USER_AGENT, ingestionConfig.getSearch().getTool())
        .codecs(
            configurer ->
                configurer.defaultCodecs().maxInMemorySize(fullText.getMaxDownloadBytes()))
        .build();
  }

  @Override
  @Timed(value = "ingestion.fulltext.fetch", description = "Time to download and extract a PDF")
  public Optional<String> maybeFetchFullText(RecordMetadata metadata) {
    if (!settings.isEnabled() || !metadata.hasFullTextSource()) {
      return Optional.empty();
    }
    String pmcId = metadata.fullTextId();
    try {
      byte[] pdf = retryPolicies.fullText().executeSupplier(() -> download(pmcId));
      if (!isPdf(pdf)) {
        throw new FullTextUnavailableException(pmcId, "response is not a PDF");
      }
      String text = pdfTextExtractor.extractText(pdf, pmcId);
      savePdf(metadata.recordId(), pmcId, pdf);
      meterRegistry.counter("ingestion.fulltext.requests", "outcome", "extracted").increment();
      return Optional.of(text);
    } catch (FatalIngestionException | IngestionInterruptedException e) {
      throw e;
    } catch (RuntimeException e) {
      log.info(
          "No full text for record {} (PMC{}), using abstract only: {}",
          metadata.recordId(),
          pmcId,
          e.getMessage());
      meterRegistry.counter("ingestion.fulltext.requests", "outcome", "unavailable").increment();
      return Optional.empty();
    }
  }

  private byte[] download(String pmcId) {
    return webClient
        .get()
        .uri("/PMC{id}/pdf/", pmcId)
        .accept(MediaType.APPLICATION_PDF, MediaType.ALL)
        .retrieve()
        .onStatus(HttpStatusCode::isError, response -> toException(pmcId, response))
        .bodyToMono(byte[].class)
        .switchIfEmpty(
            Mono.error(() -> new FullTextUnavailableException(pmcId, "empty response body")))
        .timeout(settings.getTimeout())
        .block();
  }

  private Mono<RuntimeException> toException(String pmcId, ClientResponse response) {
    int status = response.statusCode().value();
    RuntimeException error =
        status == 429 || status >= 500
            ? new LiteratureApiException(OPERATION, status, "PMC" + pmcId)
            : new FullTextUnavailableException(pmcId, "HTTP " + status);
    return response.releaseBody().thenReturn(error);
  }

  private static boolean isPdf(byte[] body) {
    return body != null
        && body.length >= PDF_MAGIC.length
        && Arrays.equals(Arrays.copyOf(body, PDF_MAGIC.length), PDF_MAGIC);
  }

  private void savePdf(String recordId, String pmcId, byte[] pdf) {
    Path pdfDir = settings.getPdfDir();
    if (pdfDir == null) {
      return;
    }
    Path target = pdfDir.resolve(recordId + "_PMC" + pmcId + ".pdf");
    try {
      Files.createDirectories(pdfDir);
      Files.write(target, pdf);
      log.debug("Saved {} ({} bytes)", target, pdf.length);
    } catch (IOException e) {
      log.warn("Could not save PDF to {}: {}", target, e.getMessage());
    }
  }
}
