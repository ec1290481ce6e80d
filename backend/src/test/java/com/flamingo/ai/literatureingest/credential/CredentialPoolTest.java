package com.flamingo.ai.literatureingest.credential;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.domain.model.Credential;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CredentialPoolTest {

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

  @Nested
  @DisplayName("CredentialPool")
  class Pool {

    @Test
    @DisplayName("should bind one limiter per credential in order")
    void shouldBindOneLimiterPerCredential() {
      CredentialPool pool =
          CredentialPool.create(
              List.of(
                  new Credential("a", "key-a", "a@example.org"),
                  new Credential("b", "key-b", "b@example.org")),
              10,
              meterRegistry);

      assertThat(pool.size()).isEqualTo(2);
      assertThat(pool.get(0).getId()).isEqualTo("a");
      assertThat(pool.get(1).getId()).isEqualTo("b");
    }

    @Test
    @DisplayName("should count requests per credential and operation")
    void shouldCountRequests() {
      CredentialPool pool =
          CredentialPool.create(
              List.of(new Credential("a", "key-a", "a@example.org")), 1000, meterRegistry);

      pool.get(0).acquire("esearch");
      pool.get(0).acquire("efetch");
      pool.get(0).acquire("efetch");

      assertThat(pool.get(0).getRequestCount()).isEqualTo(3);
      assertThat(
              meterRegistry
                  .counter("ingestion.api.requests", "credential", "a", "operation", "efetch")
                  .count())
          .isEqualTo(2.0);
    }

    @Test
    @DisplayName("should reject an empty pool and duplicate ids")
    void shouldRejectInvalidPools() {
      assertThatThrownBy(() -> CredentialPool.create(List.of(), 10, meterRegistry))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(
              () ->
                  CredentialPool.create(
                      List.of(
                          new Credential("a", "k1", "x@example.org"),
                          new Credential("a", "k2", "y@example.org")),
                      10,
                      meterRegistry))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Credential")
  class CredentialValue {

    @Test
    @DisplayName("should not print the secret key")
    void shouldMaskSecret() {
      Credential credential = new Credential("a", "super-secret-key", "a@example.org");

      assertThat(credential.toString())
          .doesNotContain("super-secret-key")
          .contains("a@example.org");
    }
  }

  @Nested
  @DisplayName("ConfiguredCredentials")
  class Configured {

    @Test
    @DisplayName("should skip entries missing a key or e-mail and name anonymous entries")
    void shouldSkipIncompleteEntries() {
      IngestionConfig config = new IngestionConfig();
      config.setCredentials(
          List.of(
              entry(null, "key-1", "one@example.org"),
              entry("second", "", "two@example.org"),
              entry("third", "key-3", null),
              entry("fourth", " key-4 ", "four@example.org")));

      List<Credential> credentials = new ConfiguredCredentials(config).load();

      assertThat(credentials).extracting(Credential::id).containsExactly("credential-1", "fourth");
      assertThat(credentials.get(1).secretKey()).isEqualTo("key-4");
    }

    private IngestionConfig.CredentialProperties entry(String id, String key, String email) {
      IngestionConfig.CredentialProperties entry = new IngestionConfig.CredentialProperties();
      entry.setId(id);
      entry.setApiKey(key);
      entry.setEmail(email);
      return entry;
    }
  }
}
