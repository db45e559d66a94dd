package com.infomedia.abacox.routingreconciler.component.store;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of one {@code cli_provisioning} row, keyed by column label in select order.
 * Values keep the type the driver returned, timestamps become {@link java.time.LocalDateTime}.
 */
@EqualsAndHashCode
@ToString
public class ProvisioningRow {

    private final Map<String, Object> columns;

    public ProvisioningRow(Map<String, Object> columns) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    @JsonAnyGetter
    public Map<String, Object> getColumns() {
        return columns;
    }

    public Object get(String column) {
        return columns.get(column);
    }
}
