package com.flamingo.ai.literatureingest.fulltext;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.domain.model.RecordMetadata;
import com.flamingo.ai.literatureingest.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@DisplayName("PmcFullTextRetriever Tests")
class PmcFullTextRetrieverTest {

  private static byte[] samplePdf;

  private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
  private final Deque<Supplier<ClientResponse>> responses = new ArrayDeque<>();
  private IngestionConfig config;
  private SimpleMeterRegistry meterRegistry;
  private PmcFullTextRetriever retriever;

  @BeforeAll
  static void createPdf() throws IOException {
    try (PDDocument document = new PDDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      for (String line : List.of("Retinal imaging methods", "Results of the cohort study")) {
        PDPage page = new PDPage();
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          content.beginText();
          content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
          content.newLineAtOffset(72, 700);
          content.showText(line);
          content.endText();
        }
      }
      document.save(out);
      samplePdf = out.toByteArray();
    }
  }

  @BeforeEach
  void setUp() {
    requests.clear();
    responses.clear();
    config = TestFixtures.fastConfig();
    meterRegistry = new SimpleMeterRegistry();
    WebClient webClient =
        WebClient.builder()
            .baseUrl("https://pmc.test/articles")
            .exchangeFunction(
                request -> {
                  requests.add(request);
                  Supplier<ClientResponse> next =
                      responses.size() > 1 ? responses.poll() : responses.peek();
                  return Mono.just(next.get());
                })
            .build();
    retriever =
        new PmcFullTextRetriever(
            webClient,
            new PdfTextExtractor(),
            TestFixtures.retryPolicies(config, meterRegistry),
            config,
            meterRegistry);
  }

  private static ClientResponse pdfResponse(byte[] body) {
    return ClientResponse.create(HttpStatus.OK)
        .header(HttpHeaders.CONTENT_TYPE, "application/pdf")
        .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body)))
        .build();
  }

  private static RecordMetadata openAccess() {
    return TestFixtures.metadata("31415926").toBuilder().fullTextId("7000001").build();
  }

  @Nested
  @DisplayName("Available PDF")
  class AvailablePdf {

    @Test
    @DisplayName("Should extract the text of every page")
    void shouldExtractAllPages() {
      responses.add(() -> pdfResponse(samplePdf));

      Optional<String> text = retriever.maybeFetchFullText(openAccess());

      assertThat(text).isPresent();
      assertThat(text.get())
          .contains("Retinal imaging methods")
          .contains("Results of the cohort study");
      assertThat(requests).hasSize(1);
      assertThat(requests.get(0).url().getPath()).isEqualTo("/articles/PMC7000001/pdf/");
    }

    @Test
    @DisplayName("Should keep the PDF when a PDF directory is configured")
    void shouldSavePdf(@TempDir Path pdfDir) {
      config.getFullText().setPdfDir(pdfDir);
      responses.add(() -> pdfResponse(samplePdf));

      retriever.maybeFetchFullText(openAccess());

      assertThat(Files.exists(pdfDir.resolve("31415926_PMC7000001.pdf"))).isTrue();
    }

    @Test
    @DisplayName("Should retry a server error before giving up on the download")
    void shouldRetryServerError() {
      responses.add(() -> ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build());
      responses.add(() -> pdfResponse(samplePdf));

      assertThat(retriever.maybeFetchFullText(openAccess())).isPresent();
      assertThat(requests).hasSize(2);
    }
  }

  @Nested
  @DisplayName("Unavailable full text")
  class UnavailableFullText {

    @Test
    @DisplayName("Should return empty for 404 without retrying")
    void shouldHandleNotFound() {
      responses.add(() -> ClientResponse.create(HttpStatus.NOT_FOUND).build());

      assertThat(retriever.maybeFetchFullText(openAccess())).isEmpty();
      assertThat(requests).hasSize(1);
      double unavailable =
          meterRegistry.counter("ingestion.fulltext.requests", "outcome", "unavailable").count();
      assertThat(unavailable).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return empty when retries are exhausted")
    void shouldHandleExhaustedRetries() {
      responses.add(() -> ClientResponse.create(HttpStatus.BAD_GATEWAY).build());

      assertThat(retriever.maybeFetchFullText(openAccess())).isEmpty();
      assertThat(requests).hasSize(2);
    }

    @Test
    @DisplayName("Should reject a body that is not a PDF")
    void shouldRejectHtml() {
      responses.add(
          () ->
              ClientResponse.create(HttpStatus.OK)
                  .header(HttpHeaders.CONTENT_TYPE, "text/html")
                  .body("<html>Please enable JavaScript</html>")
                  .build());

      assertThat(retriever.maybeFetchFullText(openAccess())).isEmpty();
    }

    @Test
    @DisplayName("Should reject a damaged PDF")
    void shouldRejectDamagedPdf() {
      responses.add(() -> pdfResponse("%PDF-1.7 truncated".getBytes()));

      assertThat(retriever.maybeFetchFullText(openAccess())).isEmpty();
    }

    @Test
    @DisplayName("Should not download anything for a record without a PMC ID")
    void shouldSkipRecordWithoutSource() {
      assertThat(retriever.maybeFetchFullText(TestFixtures.metadata("1"))).isEmpty();
      assertThat(requests).isEmpty();
    }

    @Test
    @DisplayName("Should not download anything when full text is disabled")
    void shouldSkipWhenDisabled() {
      config.getFullText().setEnabled(false);

      assertThat(retriever.maybeFetchFullText(openAccess())).isEmpty();
      assertThat(requests).isEmpty();
    }
  }
}
