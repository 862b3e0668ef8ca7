package com.planning.tdg.util;

import java.util.ArrayList;
import java.util.List;

/** Text formats {@link GraphExporter} can render. */
public enum ExportFormat {
    JSON("json"),
    DOT("dot"),
    MARKDOWN("markdown", "md"),
    MERMAID("mermaid", "mmd"),
    YAML("yaml", "yml");

    private final String[] names;

    ExportFormat(String... names) {
        this.names = names;
    }

    /** File extension without the dot. */
    public String extension() {
        return switch (this) {
            case MARKDOWN -> "md";
            case MERMAID -> "mmd";
            default -> names[0];
        };
    }

    /** Whether the format can carry an analysis section. */
    public boolean supportsAnalysis() {
        return this == JSON || this == MARKDOWN || this == YAML;
    }

    public static ExportFormat fromString(String text) {
        for (ExportFormat f : values()) {
            for (String n : f.names) {
                if (n.equalsIgnoreCase(text))
                    return f;
            }
        }
        throw new IllegalArgumentException("Unsupported format: " + text + ". Supported: " + supportedNames());
    }

    public static List<String> supportedNames() {
        List<String> all = new ArrayList<>();
        for (ExportFormat f : values()) {
            all.addAll(List.of(f.names));
        }
        return all;
    }
}
