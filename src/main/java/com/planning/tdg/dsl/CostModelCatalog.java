package com.planning.tdg.dsl;

import com.planning.tdg.engine.CostModel;
import com.planning.tdg.io.GraphCodec;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Registry of cost models keyed by task type, and of dependency patterns keyed
 * by task name.
 *
 * The built-ins are read from the classpath resource {@value #RESOURCE}.
 * Unknown task types resolve to the {@value #GENERIC} model.
 */
@Log4j2
public final class CostModelCatalog {
    public static final String RESOURCE = "task-catalog.json";
    public static final String GENERIC = "generic";

    /** JSON layout of the catalog resource. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static final class CatalogDocument {
        private Map<String, CostModel> costModels = new LinkedHashMap<>();
        private Map<String, List<String>> dependencyPatterns = new LinkedHashMap<>();
    }

    private final Map<String, CostModel> costModels = new LinkedHashMap<>();
    private final Map<String, List<String>> dependencyPatterns = new LinkedHashMap<>();

    public CostModelCatalog() {
        this(true);
    }

    /** A catalog holding only the given document's entries plus a default generic model. */
    public static CostModelCatalog of(CatalogDocument doc) {
        CostModelCatalog catalog = new CostModelCatalog(false);
        catalog.load(doc);
        return catalog;
    }

    private CostModelCatalog(boolean builtIns) {
        if (builtIns)
            registerBuiltIns();
        costModels.putIfAbsent(GENERIC, new CostModel());
    }

    private void registerBuiltIns() {
        try (InputStream in = CostModelCatalog.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null)
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            load(GraphCodec.mapper().readValue(in, CatalogDocument.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        log.debug("Loaded {} cost models and {} dependency patterns", costModels.size(), dependencyPatterns.size());
    }

    private void load(CatalogDocument doc) {
        if (doc.getCostModels() != null)
            doc.getCostModels().forEach(this::register);
        if (doc.getDependencyPatterns() != null)
            doc.getDependencyPatterns().forEach(this::registerPattern);
    }

    public void register(String taskType, CostModel model) {
        costModels.put(taskType, model.copy());
    }

    public void registerPattern(String taskName, List<String> dependencies) {
        dependencyPatterns.put(taskName, List.copyOf(dependencies));
    }

    /** A fresh copy of the model for {@code taskType}, falling back to generic. */
    public CostModel lookup(String taskType) {
        CostModel model = costModels.get(taskType);
        return (model != null ? model : costModels.get(GENERIC)).copy();
    }

    public boolean hasCostModel(String taskType) {
        return costModels.containsKey(taskType);
    }

    /** Task names that {@code taskName} depends on; empty if none registered. */
    public List<String> dependenciesOf(String taskName) {
        return dependencyPatterns.getOrDefault(taskName, List.of());
    }

    public List<String> taskTypes() {
        return Collections.unmodifiableList(new ArrayList<>(costModels.keySet()));
    }
}
