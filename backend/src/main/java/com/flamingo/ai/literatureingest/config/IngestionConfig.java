package com.flamingo.ai.literatureingest.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the ingestion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Validated
@Getter
@Setter
public class IngestionConfig {

  /** Search terms, in assignment order. */
  private List<String> queries = new ArrayList<>();

  /** Optional file with one query per line; blank lines and lines starting with # are skipped. */
  private Path queriesFile;

  @Valid private List<CredentialProperties> credentials = new ArrayList<>();
  @Valid private RateLimit rateLimit = new RateLimit();
  @Valid private Search search = new Search();
  @Valid private Fetch fetch = new Fetch();
  @Valid private FullText fullText = new FullText();
  @Valid private Chunking chunking = new Chunking();
  @Valid private Indexing indexing = new Indexing();
  @Valid private VectorStore vectorStore = new VectorStore();
  @Valid private Ledger ledger = new Ledger();
  @Valid private Retry retry = new Retry();
  @Valid private Monitor monitor = new Monitor();
  @Valid private Startup startup = new Startup();

  @Getter
  @Setter
  public static class CredentialProperties {
    private String id;
    private String apiKey;
    private String email;
  }

  @Getter
  @Setter
  public static class RateLimit {
    /** Per-credential ceiling. PubMed allows 10 with an API key. */
    @DecimalMin("0.1")
    private double requestsPerSecond = 10.0;
  }

  @Getter
  @Setter
  public static class Search {
    @NotBlank private String baseUrl = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
    @NotBlank private String database = "pubmed";
    @NotBlank private String tool = "literature-ingest";
    @NotBlank private String sort = "relevance";

    /** Max IDs kept per query. The source refuses to page past 10,000. */
    @Positive
    @Max(10_000)
    private int maxResults = 500;

    @Positive private int pageSize = 500;

    /** Lower publication date bound, e.g. {@code 2015} or {@code 2015/01/01}. */
    private String dateFrom;

    /** Upper publication date bound; defaults to {@code 3000} when only the lower one is set. */
    private String dateTo;

    private Duration timeout = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Fetch {
    @Positive
    @Max(200)
    private int batchSize = 200;

    private Duration timeout = Duration.ofSeconds(60);
  }

  @Getter
  @Setter
  public static class FullText {
    private boolean enabled = true;
    @NotBlank private String baseUrl = "https://pmc.ncbi.nlm.nih.gov/articles";

    /** Where downloaded PDFs are kept; PDFs are discarded when unset. */
    private Path pdfDir;

    private Duration timeout = Duration.ofSeconds(60);
    @Positive private int maxDownloadBytes = 50 * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Chunking {
    @Positive private int size = 1000;
    @Min(0)
    private int overlap = 200;
  }

  @Getter
  @Setter
  public static class Indexing {
    @Positive private int batchSize = 100;

    /** Consecutive failed index batches after which the vector store is considered unreachable. */
    @Positive private int unreachableThreshold = 5;

    private Duration unreachableWait = Duration.ofMinutes(1);
  }

  @Getter
  @Setter
  public static class VectorStore {
    @NotBlank private String indexName = "pubmed-vision-research";
    @Positive private int vectorDimensions = 1536;
  }

  @Getter
  @Setter
  public static class Ledger {
    @NotBlank private String path = "data/ingestion-progress.json";

    /** Record operations between flushes; query completion always flushes. */
    @Positive private int flushEvery = 50;
  }

  @Getter
  @Setter
  public static class Retry {
    @Valid private Policy search = new Policy();
    @Valid private Policy fetch = new Policy();
    @Valid private Policy fullText = new Policy(3, Duration.ofSeconds(1), Duration.ofSeconds(10));
    @Valid
    private Policy index = new Policy(3, Duration.ofMillis(500), Duration.ofSeconds(10));
  }

  @Getter
  @Setter
  public static class Policy {
    @Positive private int maxAttempts = 5;
    private Duration baseDelay = Duration.ofSeconds(1);
    private Duration maxDelay = Duration.ofSeconds(30);

    /** Randomization factor applied to each backoff interval, in [0, 1). */
    @DecimalMin("0.0")
    @DecimalMax(value = "1.0", inclusive = false)
    private double jitter = 0.5;

    public Policy() {}

    public Policy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
      this.maxAttempts = maxAttempts;
      this.baseDelay = baseDelay;
      this.maxDelay = maxDelay;
    }
  }

  @Getter
  @Setter
  public static class Monitor {
    private Duration interval = Duration.ofSeconds(10);
  }

  @Getter
  @Setter
  public static class Startup {
    /** What to do once the application is up: {@code none}, {@code run} or {@code status}. */
    private StartupCommand command = StartupCommand.NONE;

    private boolean exitOnCompletion = false;
  }

  /** Command executed by the startup runner. */
  public enum StartupCommand {
    NONE,
    RUN,
    STATUS
  }
}
