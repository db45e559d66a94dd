package com.infomedia.abacox.routingreconciler.dto.fix;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
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
@JsonPropertyOrder({"dry_run"})
public class NprnFixResult {
    @JsonProperty("dry_run")
    private boolean dryRun;
    @JsonUnwrapped
    private PreviewDto preview;
    @JsonProperty("redis_db")
    private int redisDb;
    @JsonProperty("deleted_counts")
    private List<Long> deletedCounts;
}
