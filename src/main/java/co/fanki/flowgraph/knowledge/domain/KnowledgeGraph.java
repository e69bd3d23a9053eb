package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.flow.domain.FlowGraphException;
import co.fanki.flowgraph.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The knowledge graph document produced for one method.
 *
 * <p>Holds the nodes in emission order, the method node first, and an
 * index by id through which every {@link NodeReference} and
 * {@link RelationshipPair} of the document resolves.</p>
 *
 * <p>The aggregate view is a filter over this document: the method node
 * alone, whose references still resolve here.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class KnowledgeGraph {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<KnowledgeNode> nodes;
    private final Map<String, KnowledgeNode> index;

    /**
     * Creates a new knowledge graph.
     *
     * @param theNodes the nodes, the method node first
     */
    public KnowledgeGraph(final List<KnowledgeNode> theNodes) {
        Preconditions.requireNonEmpty(theNodes, "Nodes are required");
        this.nodes = Collections.unmodifiableList(new ArrayList<>(theNodes));

        final Map<String, KnowledgeNode> byId = new LinkedHashMap<>();
        for (final KnowledgeNode node : nodes) {
            Preconditions.requireDomain(byId.putIfAbsent(node.id(), node) == null,
                    "Duplicate node id: " + node.id());
        }
        this.index = Collections.unmodifiableMap(byId);
    }

    public List<KnowledgeNode> nodes() {
        return nodes;
    }

    /**
     * Returns the node with the given id.
     *
     * @param id the node id
     * @return the node, or empty if the document has no such node
     */
    public Optional<KnowledgeNode> node(final String id) {
        return Optional.ofNullable(index.get(id));
    }

    /**
     * Returns the method node.
     *
     * @return the first node of the document
     */
    public KnowledgeNode methodNode() {
        return nodes.get(0);
    }

    /**
     * Returns the nodes of the aggregate view.
     *
     * @return a list holding the method node only
     */
    public List<KnowledgeNode> aggregateView() {
        return List.of(methodNode());
    }

    /**
     * Resolves the children of a node through this document.
     *
     * @param node a node of this document
     * @return the child nodes in reference order; references this document
     *         cannot resolve are left out
     */
    public List<KnowledgeNode> children(final KnowledgeNode node) {
        Preconditions.requireNonNull(node, "Node is required");
        final List<KnowledgeNode> children = new ArrayList<>();
        for (final NodeReference reference : node.contains()) {
            node(reference.nodeId()).ifPresent(children::add);
        }
        return children;
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Counts the relationship ends stored on all nodes.
     *
     * @return twice the number of projected edges
     */
    public int relationshipCount() {
        return nodes.stream().mapToInt(n -> n.relationships().size()).sum();
    }

    /**
     * Serializes the document to JSON.
     *
     * <p>Format: {@code {"nodes": [{"id": ..., "type": {...}, "label": ...,
     * "contains": [...], "relationships": [...], "properties": {...},
     * "metrics": {...}, "visualization": {...}}]}}.</p>
     *
     * @return the JSON string
     */
    public String toJson() {
        final ObjectNode root = MAPPER.createObjectNode();
        final ArrayNode nodesArray = MAPPER.createArrayNode();
        for (final KnowledgeNode node : nodes) {
            nodesArray.add(toJson(node));
        }
        root.set("nodes", nodesArray);

        try {
            return MAPPER.writeValueAsString(root);
        } catch (final JsonProcessingException e) {
            throw new FlowGraphException(
                    "Failed to serialize knowledge graph",
                    FlowGraphException.CONVERSION_FAILURE, e);
        }
    }

    private ObjectNode toJson(final KnowledgeNode node) {
        final ObjectNode nodeObj = MAPPER.createObjectNode();
        nodeObj.put("id", node.id());

        final ObjectNode typeObj = MAPPER.createObjectNode();
        typeObj.put("primary", node.type().primary());
        typeObj.put("secondary", node.type().secondary());
        typeObj.put("custom", node.type().custom());
        nodeObj.set("type", typeObj);

        nodeObj.put("label", node.label());

        final ArrayNode containsArray = MAPPER.createArrayNode();
        for (final NodeReference reference : node.contains()) {
            final ObjectNode refObj = MAPPER.createObjectNode();
            refObj.put("nodeId", reference.nodeId());
            refObj.put("role", reference.role());
            refObj.put("order", reference.order());
            containsArray.add(refObj);
        }
        nodeObj.set("contains", containsArray);

        final ArrayNode relationshipsArray = MAPPER.createArrayNode();
        for (final RelationshipPair pair : node.relationships()) {
            final ObjectNode pairObj = MAPPER.createObjectNode();
            final ObjectNode relTypeObj = MAPPER.createObjectNode();
            relTypeObj.put("forward", pair.type().forward());
            relTypeObj.put("reverse", pair.type().reverse());
            relTypeObj.put("category", pair.type().category());
            pairObj.set("type", relTypeObj);
            pairObj.put("direction", pair.direction().label());
            pairObj.put("targetId", pair.targetId());
            relationshipsArray.add(pairObj);
        }
        nodeObj.set("relationships", relationshipsArray);

        nodeObj.set("properties", MAPPER.valueToTree(node.properties()));

        final ObjectNode metricsObj = MAPPER.createObjectNode();
        final NodeMetrics metrics = node.metrics();
        if (metrics.complexity() != null) {
            metricsObj.put("complexity", metrics.complexity());
        }
        if (metrics.nodeCount() != null) {
            metricsObj.put("nodeCount", metrics.nodeCount());
        }
        if (metrics.edgeCount() != null) {
            metricsObj.put("edgeCount", metrics.edgeCount());
        }
        if (!metrics.custom().isEmpty()) {
            metricsObj.set("custom", MAPPER.valueToTree(metrics.custom()));
        }
        nodeObj.set("metrics", metricsObj);

        final VisualizationHints hints = node.visualization();
        if (hints != null) {
            final ObjectNode hintsObj = MAPPER.createObjectNode();
            hintsObj.put("color", hints.color());
            hintsObj.put("icon", hints.icon());
            hintsObj.put("preferredLayout", hints.preferredLayout());
            hintsObj.put("collapsed", hints.collapsed());
            nodeObj.set("visualization", hintsObj);
        }
        return nodeObj;
    }

}
