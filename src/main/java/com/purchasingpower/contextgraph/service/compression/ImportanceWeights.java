package com.purchasingpower.contextgraph.service.compression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Field-name to weight table used to rank payload entries.
 *
 * <p>Lookup is by exact name, then by the first table key contained in the
 * field name (case-insensitive), then {@link #DEFAULT_WEIGHT}.
 */
public final class ImportanceWeights {

    public static final double DEFAULT_WEIGHT = 0.5;

    private final Map<String, Double> weights;

    public ImportanceWeights(Map<String, Double> weights) {
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public static ImportanceWeights defaults() {
        Map<String, Double> table = new LinkedHashMap<>();
        table.put("error", 1.0);
        table.put("output", 0.9);
        table.put("status", 1.0);
        table.put("state", 0.95);
        table.put("id", 1.0);
        table.put("agentId", 1.0);
        table.put("agentType", 1.0);
        table.put("capabilities", 0.8);
        table.put("config", 0.7);
        table.put("history", 0.3);
        table.put("logs", 0.2);
        table.put("tempData", 0.1);
        table.put("massiveData", 0.1);
        return new ImportanceWeights(table);
    }

    /**
     * Base table of graph-aware compression, before enhancement.
     */
    public static Map<String, Double> graphBase() {
        Map<String, Double> table = new LinkedHashMap<>();
        table.put("error", 1.0);
        table.put("output", 0.9);
        table.put("status", 1.0);
        table.put("id", 1.0);
        table.put("capabilities", 0.8);
        table.put("config", 0.7);
        table.put("history", 0.3);
        table.put("logs", 0.2);
        table.put("tempData", 0.1);
        return table;
    }

    public double weightOf(String field) {
        Double exact = weights.get(field);
        if (exact != null) {
            return exact;
        }
        String lower = field.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (lower.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                return entry.getValue();
            }
        }
        return DEFAULT_WEIGHT;
    }

    public Map<String, Double> asMap() {
        return weights;
    }
}
