package com.purchasingpower.contextgraph.service.compression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Importance-ranked recursive selection shared by smart and graph-aware
 * compression.
 *
 * <p>At every object level entries are ranked by weight (descending, stable)
 * and the top {@code max(1, ceil(n * objectRatio))} are kept, plus every
 * must-keep key. Nested objects and arrays are compressed with the same base
 * ratio; strings over the long-string threshold are shortened to
 * {@code ceil(length * objectRatio)}. Arrays keep their last
 * {@code max(1, ceil(n * arrayRatio))} items. Dropped keys are listed under
 * {@code _compressionSummary}.
 */
public class WeightedPayloadCompressor {

    public static final String SUMMARY_KEY = "_compressionSummary";

    private final ToDoubleFunction<String> weigher;
    private final Set<String> preserveKeys;
    private final int longStringThreshold;
    private final double objectBonus;
    private final double arrayBonus;
    private final Map<String, Object> summaryExtras;

    /**
     * @param objectBonus   object ratio becomes {@code min(ratio * (1 + objectBonus), 1)}
     * @param arrayBonus    array ratio becomes {@code min(ratio * (1 + arrayBonus), 1)}
     * @param summaryExtras entries appended to every {@code _compressionSummary}
     */
    public WeightedPayloadCompressor(ToDoubleFunction<String> weigher, Collection<String> preserveKeys,
                                     int longStringThreshold, double objectBonus, double arrayBonus,
                                     Map<String, Object> summaryExtras) {
        this.weigher = weigher;
        this.preserveKeys = Set.copyOf(preserveKeys);
        this.longStringThreshold = longStringThreshold;
        this.objectBonus = objectBonus;
        this.arrayBonus = arrayBonus;
        this.summaryExtras = summaryExtras;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> compressObject(Map<String, Object> object, double ratio) {
        double objectRatio = Math.min(ratio * (1 + objectBonus), 1.0);

        List<Map.Entry<String, Object>> ranked = new ArrayList<>(object.entrySet());
        ranked.sort(Comparator.comparingDouble((Map.Entry<String, Object> e) -> weigher.applyAsDouble(e.getKey()))
                .reversed());

        int keepCount = Math.max(1, (int) Math.ceil(ranked.size() * objectRatio));
        Set<String> kept = new HashSet<>();
        for (Map.Entry<String, Object> entry : ranked) {
            if (preserveKeys.contains(entry.getKey())) {
                kept.add(entry.getKey());
            }
        }
        for (Map.Entry<String, Object> entry : ranked) {
            if (kept.size() >= keepCount) {
                break;
            }
            kept.add(entry.getKey());
        }

        Map<String, Object> result = new LinkedHashMap<>();
        List<String> dropped = new ArrayList<>();
        for (Map.Entry<String, Object> entry : ranked) {
            if (!kept.contains(entry.getKey())) {
                dropped.add(entry.getKey());
                continue;
            }
            Object value = entry.getValue();
            if (value instanceof Map) {
                result.put(entry.getKey(), compressObject((Map<String, Object>) value, ratio));
            } else if (value instanceof List<?> list) {
                result.put(entry.getKey(), compressArray(list, ratio));
            } else if (value instanceof String text && text.length() > longStringThreshold) {
                result.put(entry.getKey(), TextTruncator.shorten(text, (int) Math.ceil(text.length() * objectRatio)));
            } else {
                result.put(entry.getKey(), value);
            }
        }

        if (!dropped.isEmpty()) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("originalKeys", ranked.size());
            summary.put("preservedKeys", kept.size());
            summary.put("droppedKeys", dropped.size());
            summary.put("droppedKeyNames", dropped);
            summary.putAll(summaryExtras);
            result.put(SUMMARY_KEY, summary);
        }
        return result;
    }

    public List<Object> compressArray(List<?> array, double ratio) {
        if (array.isEmpty()) {
            return new ArrayList<>();
        }
        double arrayRatio = Math.min(ratio * (1 + arrayBonus), 1.0);
        int keepCount = Math.max(1, (int) Math.ceil(array.size() * arrayRatio));
        return new ArrayList<>(array.subList(array.size() - Math.min(keepCount, array.size()), array.size()));
    }
}
