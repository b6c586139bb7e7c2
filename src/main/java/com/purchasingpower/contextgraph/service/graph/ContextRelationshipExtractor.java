package com.purchasingpower.contextgraph.service.graph;

import com.purchasingpower.contextgraph.exception.NodeNotFoundException;
import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import com.purchasingpower.contextgraph.model.graph.ContextEdge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives edges from references embedded in a context payload.
 *
 * <p>Three sources are recognized:
 * <ul>
 *   <li>16-hex-character ids inside string values whose key mentions
 *       {@code context}, {@code ref}, {@code parent} or {@code related}</li>
 *   <li>a {@code dependencies} array of ids or {@code {contextId, required, version}} objects</li>
 *   <li>a {@code previousTaskId}, linked from the previous task to this one</li>
 * </ul>
 * References to contexts not yet in the graph are skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextRelationshipExtractor {

    static final Pattern CONTEXT_ID = Pattern.compile("[0-9a-f]{16}");

    private final ContextGraph graph;

    /**
     * @return edges actually added
     */
    public List<ContextEdge> extractAndLink(String contextId, Map<String, Object> payload) {
        List<ContextEdge> added = new ArrayList<>();
        if (payload == null) {
            return added;
        }

        for (Reference ref : findReferences(payload)) {
            if (ref.contextId().equals(contextId)) {
                continue;
            }
            link(contextId, ref.contextId(), ref.type(), ref.strength(), Map.of("foundIn", ref.path()), added);
        }

        if (payload.get("dependencies") instanceof List<?> dependencies) {
            for (Object dependency : dependencies) {
                linkDependency(contextId, dependency, added);
            }
        }

        if (payload.get("previousTaskId") instanceof String previous && !previous.isBlank()) {
            link(previous, contextId, "temporal-sequence", 0.7, Map.of("relation", "before"), added);
        }

        log.debug("Extracted {} relationships for {}", added.size(), contextId);
        return added;
    }

    private void linkDependency(String contextId, Object dependency, List<ContextEdge> added) {
        String target;
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (dependency instanceof String id) {
            target = id;
            metadata.put("required", true);
        } else if (dependency instanceof Map<?, ?> declared && declared.get("contextId") instanceof String id) {
            target = id;
            metadata.put("required", !Boolean.FALSE.equals(declared.get("required")));
            if (declared.get("version") != null) {
                metadata.put("version", declared.get("version"));
            }
        } else {
            log.debug("Ignoring malformed dependency of {}: {}", contextId, dependency);
            return;
        }
        link(contextId, target, "depends-on", 0.9, metadata, added);
    }

    private void link(String from, String to, String type, double weight, Map<String, Object> metadata,
                      List<ContextEdge> added) {
        try {
            added.add(graph.addEdge(from, to, type, weight, metadata));
        } catch (NodeNotFoundException e) {
            log.debug("Could not add {} edge {} -> {}: {}", type, from, to, e.getMessage());
        }
    }

    // ================================================================
    // REFERENCE SCAN
    // ================================================================

    List<Reference> findReferences(Map<String, Object> payload) {
        List<Reference> references = new ArrayList<>();
        scan(payload, "", references);
        return references;
    }

    private void scan(Map<?, ?> object, String path, List<Reference> references) {
        for (Map.Entry<?, ?> entry : object.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String currentPath = path.isEmpty() ? key : path + "." + key;
            Object value = entry.getValue();

            if (value instanceof String text) {
                if (!isReferenceKey(key)) {
                    continue;
                }
                Matcher matcher = CONTEXT_ID.matcher(text);
                while (matcher.find()) {
                    references.add(new Reference(matcher.group(), inferType(key), strength(key), currentPath));
                }
            } else if (value instanceof List<?> list) {
                for (int i = 0; i < list.size(); i++) {
                    if (list.get(i) instanceof Map<?, ?> item) {
                        scan(item, currentPath + "[" + i + "]", references);
                    }
                }
            } else if (value instanceof Map<?, ?> nested) {
                scan(nested, currentPath, references);
            }
        }
    }

    private static boolean isReferenceKey(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return lower.contains("context") || lower.contains("ref")
                || lower.contains("parent") || lower.contains("related");
    }

    static String inferType(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        if (lower.contains("parent")) return "parent";
        if (lower.contains("child")) return "child";
        if (lower.contains("depend")) return "depends-on";
        if (lower.contains("block")) return "blocks";
        if (lower.contains("related")) return "relates-to";
        if (lower.contains("mention")) return "mentions";
        return "references";
    }

    static double strength(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        if (lower.contains("parent") || lower.contains("depend")) return 0.9;
        if (lower.contains("child") || lower.contains("block")) return 0.8;
        if (lower.contains("related") || lower.contains("ref")) return 0.5;
        return 0.3;
    }

    record Reference(String contextId, String type, double strength, String path) {
    }
}
