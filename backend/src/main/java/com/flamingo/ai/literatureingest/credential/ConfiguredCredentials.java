package com.flamingo.ai.literatureingest.credential;

import com.flamingo.ai.literatureingest.config.IngestionConfig;
import com.flamingo.ai.literatureingest.domain.model.Credential;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Turns the {@code ingestion.credentials} entries into usable credentials. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfiguredCredentials {

  private final IngestionConfig ingestionConfig;

  /**
   * Returns every configured credential that has both an API key and a contact e-mail.
   *
   * <p>Incomplete entries are skipped with a warning. Entries without an id are named {@code
   * credential-N} after their position.
   */
  public List<Credential> load() {
    List<Credential> credentials = new ArrayList<>();
    List<IngestionConfig.CredentialProperties> configured = ingestionConfig.getCredentials();
    for (int i = 0; i < configured.size(); i++) {
      IngestionConfig.CredentialProperties entry = configured.get(i);
      String id = isBlank(entry.getId()) ? "credential-" + (i + 1) : entry.getId().trim();
      if (isBlank(entry.getApiKey()) || isBlank(entry.getEmail())) {
        log.warn("Skipping credential {}: both api-key and email are required", id);
        continue;
      }
      credentials.add(new Credential(id, entry.getApiKey().trim(), entry.getEmail().trim()));
    }
    log.info("Loaded {} of {} configured credentials", credentials.size(), configured.size());
    return credentials;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
