package com.flamingo.ai.literatureingest.pipeline;

import com.flamingo.ai.literatureingest.domain.enums.WorkerState;

/**
 * Point-in-time view of one worker, for monitoring.
 *
 * @param name worker name, also used as its claim owner in the ledger
 * @param credentialId bound credential
 * @param state current state
 * @param currentQuery query being processed, or null
 * @param queriesAssigned queries assigned for the run
 * @param queriesProcessed queries finished, skipped or failed so far
 * @param requests API requests issued with the credential
 * @param requestsPerSecond average request rate since the worker started
 */
public record WorkerSnapshot(
    String name,
    String credentialId,
    WorkerState state,
    String currentQuery,
    int queriesAssigned,
    int queriesProcessed,
    long requests,
    double requestsPerSecond) {}
