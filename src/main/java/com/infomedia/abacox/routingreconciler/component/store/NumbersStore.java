package com.infomedia.abacox.routingreconciler.component.store;

import com.infomedia.abacox.routingreconciler.model.EnpProfile;

import java.util.List;

/**
 * The relational {@code numbers} table, keyed by directory number.
 */
public interface NumbersStore {

    /**
     * Reassigns every existing row whose {@code dn} is in {@code dns} to the given profile
     * in one statement. Rows that do not exist are skipped.
     *
     * @return the directory numbers the store reports as updated
     */
    List<String> reassign(List<String> dns, EnpProfile profile);
}
