package com.infomedia.abacox.routingreconciler.dto.fix;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.infomedia.abacox.routingreconciler.component.numbering.NumberPreview;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Expanded numbers echoed back by every fix operation.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PreviewDto {
    private int count;
    @JsonProperty("expanded_targets")
    private List<String> expandedTargets;
    @JsonProperty("expanded_dns")
    private List<String> expandedDns;
    @JsonProperty("expanded_redis_keys")
    private List<String> expandedRedisKeys;

    public static PreviewDto of(NumberPreview preview) {
        return new PreviewDto(preview.getCount(), preview.getTargets(), preview.getDns(), preview.getCacheKeys());
    }
}
