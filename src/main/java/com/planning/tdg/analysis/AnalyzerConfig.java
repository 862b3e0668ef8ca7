package com.planning.tdg.analysis;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tunables for {@link GraphAnalyzer}.
 *
 * Readable from JSON with snake_case keys, e.g.
 * {@code {"bottleneck_threshold": 4, "pagerank_iterations": 30}}; absent keys
 * keep their defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalyzerConfig {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Fan-in or fan-out at which {@link GraphAnalyzer#findBottlenecks()} reports a node. */
    @Builder.Default
    private int bottleneckThreshold = 3;
    /** Stricter threshold used when scoring health. */
    @Builder.Default
    private int healthBottleneckThreshold = 5;
    @Builder.Default
    private int pagerankIterations = 20;
    @Builder.Default
    private double dampingFactor = 0.85;
    @Builder.Default
    private int topN = 5;
    /** Cyclic graphs larger than this skip exhaustive path counting. */
    @Builder.Default
    private int redundancyNodeLimit = 64;
    /** Maximum DFS steps spent counting paths on a cyclic graph. */
    @Builder.Default
    private long redundancyExplorationBudget = 100_000L;

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig();
    }

    public static AnalyzerConfig fromJson(String json) {
        try {
            return MAPPER.readValue(json, AnalyzerConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid analyzer config", e);
        }
    }

    public static AnalyzerConfig fromJson(InputStream in) {
        try {
            return MAPPER.readValue(in, AnalyzerConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid analyzer config", e);
        }
    }

    /** Loads a config from the classpath, or the defaults if the resource is absent. */
    public static AnalyzerConfig fromResource(String resource) {
        try (InputStream in = AnalyzerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            return in != null ? fromJson(in) : defaults();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
    }
}
