package com.warmlead.crm.sync.service;

import java.util.List;

/**
 * A batch that ended with at least one failure.
 *
 * @param batchNumber 1-based batch number
 * @param startIndex index of the batch's first contact in the run
 * @param endIndex index one past the batch's last contact
 * @param succeededContacts Pipedrive person ids already synced in this batch
 * @param error the failure that represents the batch
 */
public record FailedBatch(
    int batchNumber,
    int startIndex,
    int endIndex,
    List<String> succeededContacts,
    Throwable error
) {
}
