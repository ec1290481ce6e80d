package com.flamingo.ai.literatureingest.domain.model;

import java.util.Objects;

/**
 * One API key and contact identity pair. Each credential gets its own rate limiter and worker.
 *
 * @param id stable name used in logs, metrics and the run summary
 * @param secretKey the API key sent with every request
 * @param contactIdentity the contact e-mail the source requires alongside the key
 */
public record Credential(String id, String secretKey, String contactIdentity) {

  public Credential {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(secretKey, "secretKey");
    Objects.requireNonNull(contactIdentity, "contactIdentity");
  }

  @Override
  public String toString() {
    return "Credential[id=" + id + ", contactIdentity=" + contactIdentity + ", secretKey=***]";
  }
}
