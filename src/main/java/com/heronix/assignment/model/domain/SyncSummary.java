package com.heronix.assignment.model.domain;

/**
 * Counters reported by an inventory sync.
 */
public record SyncSummary(int fetched, int inserted, int updated) {

    public static SyncSummary empty() {
        return new SyncSummary(0, 0, 0);
    }
}
