package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the generic knowledge graph.
 *
 * <p>Nodes are emitted once by the projector and never change afterwards.
 * Children are referenced by id through {@link #contains()}; related nodes
 * are referenced by id through {@link #relationships()}.</p>
 *
 * @param id the stable node id, the join key of graph documents
 * @param type the node type
 * @param label the text shown for the node
 * @param contains the references to child nodes, in order
 * @param relationships both ends of every relationship touching the node
 * @param properties descriptive attributes, in insertion order
 * @param metrics numeric facts
 * @param visualization presentation hints
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record KnowledgeNode(
        String id,
        NodeType type,
        String label,
        List<NodeReference> contains,
        List<RelationshipPair> relationships,
        Map<String, Object> properties,
        NodeMetrics metrics,
        VisualizationHints visualization) {

    /**
     * Validates the node and freezes its collections.
     */
    public KnowledgeNode {
        Preconditions.requireNonBlank(id, "Node id is required");
        Preconditions.requireNonNull(type, "Node type is required");
        label = label == null ? "" : label;
        contains = contains == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(contains));
        relationships = relationships == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(relationships));
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        metrics = metrics == null ? NodeMetrics.empty() : metrics;
    }

    /**
     * Returns a property value.
     *
     * @param name the property name
     * @return the value, or null when absent
     */
    public Object property(final String name) {
        return properties.get(name);
    }

    /**
     * Returns the relationships in which this node is the source.
     *
     * @return the outgoing relationship ends
     */
    public List<RelationshipPair> outgoing() {
        return relationships.stream()
                .filter(r -> r.direction() == RelationshipDirection.OUTGOING)
                .toList();
    }

    /**
     * Returns the relationships in which this node is the target.
     *
     * @return the incoming relationship ends
     */
    public List<RelationshipPair> incoming() {
        return relationships.stream()
                .filter(r -> r.direction() == RelationshipDirection.INCOMING)
                .toList();
    }
}
