package com.flamingo.ai.literatureingest.pubmed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.literatureingest.credential.CredentialBinding;
import com.flamingo.ai.literatureingest.exception.LiteratureApiException;
import com.flamingo.ai.literatureingest.support.TestFixtures;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@DisplayName("EutilsClient Tests")
class EutilsClientTest {

  private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
  private CredentialBinding credential;

  @BeforeEach
  void setUp() {
    requests.clear();
    credential = TestFixtures.credential("pubmed-1");
  }

  private EutilsClient clientReturning(ClientResponse response) {
    WebClient webClient =
        WebClient.builder()
            .baseUrl("https://eutils.test/entrez/eutils")
            .exchangeFunction(
                request -> {
                  requests.add(request);
                  return Mono.just(response);
                })
            .build();
    return new EutilsClient(webClient, TestFixtures.fastConfig());
  }

  @Nested
  @DisplayName("Successful calls")
  class SuccessfulCalls {

    @Test
    @DisplayName("Should POST esearch and return the raw body")
    void shouldPostEsearch() {
      EutilsClient client =
          clientReturning(
              ClientResponse.create(HttpStatus.OK)
                  .header(HttpHeaders.CONTENT_TYPE, "application/json")
                  .body("{\"esearchresult\":{\"count\":\"0\",\"idlist\":[]}}")
                  .build());

      String body = client.esearch("glaucoma", 0, 20, credential);

      assertThat(body).contains("esearchresult");
      assertThat(requests).hasSize(1);
      ClientRequest request = requests.get(0);
      assertThat(request.method()).isEqualTo(HttpMethod.POST);
      assertThat(request.url().getPath()).isEqualTo("/entrez/eutils/esearch.fcgi");
      assertThat(request.url().toString()).doesNotContain("key-pubmed-1");
    }

    @Test
    @DisplayName("Should take a rate limiter slot for every call")
    void shouldCountRequests() {
      EutilsClient client =
          clientReturning(
              ClientResponse.create(HttpStatus.OK)
                  .header(HttpHeaders.CONTENT_TYPE, "text/xml")
                  .body("<PubmedArticleSet/>")
                  .build());

      client.efetch(List.of("1", "2"), credential);

      assertThat(credential.getRequestCount()).isEqualTo(1);
      assertThat(requests.get(0).url().getPath()).endsWith("/efetch.fcgi");
    }
  }

  @Nested
  @DisplayName("Error responses")
  class ErrorResponses {

    @Test
    @DisplayName("Should map 429 to a rate-limited exception with the server's wait")
    void shouldMapRateLimit() {
      EutilsClient client =
          clientReturning(
              ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS)
                  .header(HttpHeaders.RETRY_AFTER, "7")
                  .body("{\"error\":\"API rate limit exceeded\"}")
                  .build());

      assertThatThrownBy(() -> client.esearch("glaucoma", 0, 20, credential))
          .isInstanceOfSatisfying(
              LiteratureApiException.class,
              e -> {
                assertThat(e.isRateLimited()).isTrue();
                assertThat(e.getOperation()).isEqualTo("esearch");
                assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(7));
                assertThat(e.getMessage()).contains("API rate limit exceeded");
              });
    }

    @Test
    @DisplayName("Should map 400 to a non-retryable exception")
    void shouldMapClientError() {
      EutilsClient client =
          clientReturning(ClientResponse.create(HttpStatus.BAD_REQUEST).body("bad id").build());

      assertThatThrownBy(() -> client.efetch(List.of("x"), credential))
          .isInstanceOfSatisfying(
              LiteratureApiException.class,
              e -> {
                assertThat(e.getStatusCode()).isEqualTo(400);
                assertThat(e.isRetryable()).isFalse();
              });
    }

    @Test
    @DisplayName("Should treat an empty body as a server error")
    void shouldRejectEmptyBody() {
      EutilsClient client = clientReturning(ClientResponse.create(HttpStatus.OK).build());

      assertThatThrownBy(() -> client.efetch(List.of("1"), credential))
          .isInstanceOfSatisfying(
              LiteratureApiException.class, e -> assertThat(e.isServerError()).isTrue());
    }
  }

  @Test
  @DisplayName("Should parse Retry-After seconds and ignore the date form")
  void shouldParseRetryAfter() {
    assertThat(EutilsClient.parseRetryAfter(List.of(" 3 "))).isEqualTo(Duration.ofSeconds(3));
    assertThat(EutilsClient.parseRetryAfter(List.of("Wed, 21 Oct 2026 07:28:00 GMT"))).isNull();
    assertThat(EutilsClient.parseRetryAfter(List.of())).isNull();
    assertThat(EutilsClient.parseRetryAfter(null)).isNull();
  }
}
