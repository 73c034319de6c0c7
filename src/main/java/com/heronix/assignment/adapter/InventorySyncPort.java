package com.heronix.assignment.adapter;

import com.heronix.assignment.model.domain.SyncSummary;

/**
 * Pulls platform state into the local inventory.
 */
public interface InventorySyncPort {

    SyncSummary syncDevices();

    SyncSummary syncSubscriptions();
}
