package com.flamingo.ai.literatureingest.credential;

import com.flamingo.ai.literatureingest.domain.model.Credential;
import com.google.common.base.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Fixed set of credentials for one run, each bound to its own rate limiter. */
public class CredentialPool {

  private final List<CredentialBinding> bindings;

  public CredentialPool(List<CredentialBinding> bindings) {
    if (bindings.isEmpty()) {
      throw new IllegalArgumentException("At least one credential is required");
    }
    Set<String> ids = new HashSet<>();
    for (CredentialBinding binding : bindings) {
      if (!ids.add(binding.getId())) {
        throw new IllegalArgumentException("Duplicate credential id: " + binding.getId());
      }
    }
    this.bindings = List.copyOf(bindings);
  }

  /**
   * Creates a pool with one {@link MinIntervalRateLimiter} per credential.
   *
   * @param credentials credentials in assignment order
   * @param requestsPerSecond ceiling applied to each credential independently
   * @param meterRegistry registry for per-credential request counters
   * @return the pool
   */
  public static CredentialPool create(
      List<Credential> credentials, double requestsPerSecond, MeterRegistry meterRegistry) {
    List<CredentialBinding> bindings = new ArrayList<>(credentials.size());
    for (Credential credential : credentials) {
      bindings.add(
          new CredentialBinding(
              credential,
              new MinIntervalRateLimiter(requestsPerSecond),
              meterRegistry,
              Ticker.systemTicker()));
    }
    return new CredentialPool(bindings);
  }

  public int size() {
    return bindings.size();
  }

  public CredentialBinding get(int index) {
    return bindings.get(index);
  }

  public List<CredentialBinding> getBindings() {
    return bindings;
  }
}
