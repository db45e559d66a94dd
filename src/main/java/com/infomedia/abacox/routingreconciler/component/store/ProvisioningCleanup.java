package com.infomedia.abacox.routingreconciler.component.store;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of a provisioning delete: the rows read before the delete and the
 * row count the store reported for the delete itself.
 */
@Getter
@AllArgsConstructor
public class ProvisioningCleanup {
    private final List<ProvisioningRow> snapshot;
    private final int deletedCount;
}
