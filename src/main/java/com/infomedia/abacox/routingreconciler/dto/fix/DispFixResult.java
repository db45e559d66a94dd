package com.infomedia.abacox.routingreconciler.dto.fix;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.infomedia.abacox.routingreconciler.component.store.ProvisioningRow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Dry runs fill the {@code would_delete_*} fields, live runs the {@code deleted_*} fields.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"dry_run"})
public class DispFixResult {
    @JsonProperty("dry_run")
    private boolean dryRun;
    @JsonUnwrapped
    private PreviewDto preview;
    @JsonProperty("would_delete_count")
    private Integer wouldDeleteCount;
    @JsonProperty("would_delete_rows")
    private List<ProvisioningRow> wouldDeleteRows;
    @JsonProperty("deleted_count")
    private Integer deletedCount;
    @JsonProperty("deleted_rows")
    private List<ProvisioningRow> deletedRows;
}
