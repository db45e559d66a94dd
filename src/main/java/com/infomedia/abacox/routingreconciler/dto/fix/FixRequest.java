package com.infomedia.abacox.routingreconciler.dto.fix;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.infomedia.abacox.routingreconciler.model.EnpProfile;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class FixRequest {

    @NotNull
    @Schema(description = "number or range of numbers", example = "0412345678-681")
    private String input;

    @JsonProperty("dry_run")
    @Schema(description = "only report what would change", example = "true")
    private boolean dryRun = false;

    @NotNull
    @JsonProperty("enp_target")
    @Schema(description = "routing platform for the numbers table", example = "NXP1")
    private EnpProfile enpTarget = EnpProfile.NXP1;
}
