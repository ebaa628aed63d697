package com.taskpilot.orchestrator.runtime;

/**
 * How the output view for an AUTO task should be fed.
 */
public enum AutoOutputMode {
    LIVE,        // attach to the running agent's stream
    BACKFILL,    // replay persisted log chunks
    WAITING,     // a run is recorded as RUNNING but nothing has been logged yet
    UNAVAILABLE  // nothing to show
}
