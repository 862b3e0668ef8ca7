package com.planning.tdg.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Estimated resource cost of running one task.
 *
 * Durations are in seconds, memory in MB, bandwidth in Mbps.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class CostModel {
    /** Seconds of duration that weigh as much as one unit of money. */
    public static final double DURATION_COST_FACTOR = 0.01;

    @Builder.Default
    private double estimatedDuration = 1.0;
    @Builder.Default
    private double estimatedCost = 0.0;
    @Builder.Default
    private double cpuUnits = 1.0;
    @Builder.Default
    private double memoryMb = 128.0;
    @Builder.Default
    private long ioOperations = 0;
    @Builder.Default
    private double networkBandwidth = 0.0;

    /** Convenience for the common case where only the duration matters. */
    public static CostModel ofDuration(double estimatedDuration) {
        return CostModel.builder().estimatedDuration(estimatedDuration).build();
    }

    /**
     * Single comparable scalar blending money and time:
     * {@code estimatedCost + estimatedDuration * 0.01}.
     */
    public double totalCost() {
        return estimatedCost + estimatedDuration * DURATION_COST_FACTOR;
    }

    public CostModel copy() {
        return toBuilder().build();
    }
}
