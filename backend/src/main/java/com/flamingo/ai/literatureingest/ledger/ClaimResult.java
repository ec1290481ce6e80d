package com.flamingo.ai.literatureingest.ledger;

import java.util.List;

/**
 * Outcome of claiming record IDs for download.
 *
 * @param claimed IDs now owned by the caller, to be fetched
 * @param alreadyProcessed IDs already downloaded, indexed or failed by this or an earlier run
 * @param inFlightElsewhere IDs currently owned by another worker
 */
public record ClaimResult(
    List<String> claimed, List<String> alreadyProcessed, List<String> inFlightElsewhere) {

  public ClaimResult {
    claimed = List.copyOf(claimed);
    alreadyProcessed = List.copyOf(alreadyProcessed);
    inFlightElsewhere = List.copyOf(inFlightElsewhere);
  }
}
