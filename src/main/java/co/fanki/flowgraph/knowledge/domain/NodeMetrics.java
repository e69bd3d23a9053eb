package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.shared.ValueObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Numeric facts about a knowledge node.
 *
 * @param complexity the cyclomatic complexity, null when not applicable
 * @param nodeCount the number of children, null when not applicable
 * @param edgeCount the number of edges, null when not applicable
 * @param custom further named metrics, in insertion order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record NodeMetrics(
        Integer complexity,
        Integer nodeCount,
        Integer edgeCount,
        Map<String, Integer> custom) implements ValueObject {

    /**
     * Copies the custom metrics into an unmodifiable map.
     */
    public NodeMetrics {
        custom = custom == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(custom));
    }

    /**
     * Creates metrics that carry nothing.
     *
     * @return empty metrics
     */
    public static NodeMetrics empty() {
        return new NodeMetrics(null, null, null, Map.of());
    }

    /**
     * Checks if no metric is set.
     *
     * @return true for {@link #empty()}
     */
    public boolean isEmpty() {
        return complexity == null && nodeCount == null && edgeCount == null
                && custom.isEmpty();
    }
}
