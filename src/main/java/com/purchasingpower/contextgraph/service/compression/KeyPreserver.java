package com.purchasingpower.contextgraph.service.compression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ratio-driven key selection of ratio-based summarization.
 *
 * <p>Configured must-keep keys are always kept. Of the remaining keys the
 * smallest (by serialized size) {@code ceil(remaining * ratio)} are kept.
 * A {@code _summary} entry records how many keys were dropped.
 */
public class KeyPreserver {

    public static final String SUMMARY_KEY = "_summary";

    private final Collection<String> preserveKeys;
    private final PayloadInspector inspector;

    public KeyPreserver(Collection<String> preserveKeys, PayloadInspector inspector) {
        this.preserveKeys = List.copyOf(preserveKeys);
        this.inspector = inspector;
    }

    public Map<String, Object> preserve(Map<String, Object> object, double preserveRatio) {
        if (object == null) {
            return null;
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : preserveKeys) {
            if (object.containsKey(key)) {
                result.put(key, object.get(key));
            }
        }

        List<String> remaining = new ArrayList<>();
        for (String key : object.keySet()) {
            if (!preserveKeys.contains(key)) {
                remaining.add(key);
            }
        }
        int keepCount = (int) Math.ceil(remaining.size() * preserveRatio);
        remaining.sort(Comparator.comparingLong(key -> inspector.sizeOf(object.get(key))));
        for (int i = 0; i < keepCount && i < remaining.size(); i++) {
            result.put(remaining.get(i), object.get(remaining.get(i)));
        }

        if (object.size() > result.size()) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("originalKeys", object.size());
            summary.put("preservedKeys", result.size());
            summary.put("droppedKeys", object.size() - result.size());
            result.put(SUMMARY_KEY, summary);
        }
        return result;
    }

    public Collection<String> getPreserveKeys() {
        return preserveKeys;
    }
}
