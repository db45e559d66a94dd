package com.infomedia.abacox.routingreconciler.dto.fix;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.infomedia.abacox.routingreconciler.model.EnpProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"dry_run", "enp_target"})
public class EnpFixResult {
    @JsonProperty("dry_run")
    private boolean dryRun;
    @JsonProperty("enp_target")
    private EnpProfile enpTarget;
    @JsonUnwrapped
    private PreviewDto preview;
    @JsonProperty("system_id")
    private int systemId;
    private int nprn;
    /**
     * Only set for live runs.
     */
    @JsonProperty("updated_dns")
    private List<String> updatedDns;
}
