package com.infomedia.abacox.routingreconciler.component.store;

import java.util.List;

/**
 * The {@code cli_provisioning} table, keyed by target number.
 */
public interface ProvisioningStore {

    List<ProvisioningRow> findByTargets(List<String> targets);

    /**
     * Reads the rows for {@code targets} and deletes them in one local transaction.
     * The transaction is rolled back if the delete fails.
     */
    ProvisioningCleanup deleteByTargets(List<String> targets);
}
