package com.infomedia.abacox.routingreconciler.component.store;

import java.util.List;

/**
 * The key-value routing cache.
 */
public interface RoutingCacheStore {

    /**
     * @return the logical database the keys are deleted from
     */
    int getDatabase();

    /**
     * Deletes all {@code keys} in a single batched round-trip.
     *
     * @return one count per key, in key order: 1 when the key existed, 0 otherwise
     */
    List<Long> deleteKeys(List<String> keys);
}
