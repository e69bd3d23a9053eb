package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.flow.domain.BasicBlock;
import co.fanki.flowgraph.flow.domain.BranchInfo;
import co.fanki.flowgraph.flow.domain.ComplexityMetrics;
import co.fanki.flowgraph.flow.domain.Edge;
import co.fanki.flowgraph.flow.domain.MethodBlockGraph;
import co.fanki.flowgraph.flow.domain.Operation;
import co.fanki.flowgraph.flow.domain.SourceLocation;
import co.fanki.flowgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Projects a complete method graph into a knowledge graph document.
 *
 * <p>The document holds the method node first, then one node per block
 * in id order, then, when operations are included, one node per
 * operation. Ids are hierarchical and stable:</p>
 * <pre>
 * method-{typeName}-{methodName}
 * block-{methodId}-{ordinal}
 * op-{blockId}-{index}
 * </pre>
 *
 * <p>Every edge is projected into two relationship ends in the same pass:
 * an outgoing end on the source block and an incoming end, with the
 * names swapped, on the target block.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class KnowledgeGraphProjector {

    /**
     * Projects a method graph in flat mode.
     *
     * @param graph the complete method graph
     * @param includeOperations whether to emit one node per operation
     * @return the knowledge graph document
     */
    public KnowledgeGraph project(final MethodBlockGraph graph,
            final boolean includeOperations) {
        Preconditions.requireNonNull(graph, "Method graph is required");
        Preconditions.requireDomain(graph.isComplete(),
                "Method graph " + graph.methodName() + " has no metrics yet");

        final String methodId = methodId(graph);
        final Map<Integer, List<RelationshipPair>> relationships =
                relationships(graph, methodId);

        final List<KnowledgeNode> blockNodes = new ArrayList<>();
        final List<KnowledgeNode> operationNodes = new ArrayList<>();
        for (final BasicBlock block : graph.basicBlocks()) {
            final String blockId = blockId(methodId, block.ordinal());
            final List<NodeReference> contains = new ArrayList<>();

            if (includeOperations) {
                final List<Operation> operations = block.operations();
                for (int index = 0; index < operations.size(); index++) {
                    final KnowledgeNode operationNode = operationNode(
                            operations.get(index), blockId, index);
                    operationNodes.add(operationNode);
                    contains.add(new NodeReference(operationNode.id(),
                            "operation", index));
                }
            }

            blockNodes.add(blockNode(block, blockId, contains,
                    relationships.getOrDefault(block.id(), List.of()),
                    includeOperations));
        }

        final List<KnowledgeNode> nodes = new ArrayList<>();
        nodes.add(methodNode(graph, methodId));
        nodes.addAll(blockNodes);
        nodes.addAll(operationNodes);
        return new KnowledgeGraph(nodes);
    }

    /**
     * Projects a method graph in aggregate mode.
     *
     * @param graph the complete method graph
     * @return the method node alone; its references point to block ids
     */
    public List<KnowledgeNode> projectAggregate(final MethodBlockGraph graph) {
        return project(graph, false).aggregateView();
    }

    // -- ids ---------------------------------------------------------------

    static String methodId(final MethodBlockGraph graph) {
        return "method-" + graph.typeName() + "-" + graph.methodName();
    }

    static String blockId(final String methodId, final int ordinal) {
        return "block-" + methodId + "-" + ordinal;
    }

    static String operationId(final String blockId, final int index) {
        return "op-" + blockId + "-" + index;
    }

    // -- relationships -----------------------------------------------------

    private Map<Integer, List<RelationshipPair>> relationships(
            final MethodBlockGraph graph, final String methodId) {
        final Map<Integer, List<RelationshipPair>> byBlock = new LinkedHashMap<>();
        for (final Edge edge : graph.edges()) {
            final RelationshipType type = RelationshipType.forEdge(edge.kind());
            final String sourceId = blockId(methodId, edge.source());
            final String targetId = blockId(methodId, edge.target());

            byBlock.computeIfAbsent(edge.source(), k -> new ArrayList<>())
                    .add(new RelationshipPair(type,
                            RelationshipDirection.OUTGOING, targetId));
            byBlock.computeIfAbsent(edge.target(), k -> new ArrayList<>())
                    .add(new RelationshipPair(type.reversed(),
                            RelationshipDirection.INCOMING, sourceId));
        }
        return byBlock;
    }

    // -- nodes -------------------------------------------------------------

    private KnowledgeNode methodNode(final MethodBlockGraph graph,
            final String methodId) {
        final ComplexityMetrics metrics = graph.metrics();

        final List<NodeReference> contains = new ArrayList<>();
        for (final BasicBlock block : graph.basicBlocks()) {
            contains.add(new NodeReference(blockId(methodId, block.ordinal()),
                    VisualizationRules.blockRole(block.kind()),
                    block.ordinal()));
        }

        final Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("typeName", graph.typeName());
        properties.put("methodName", graph.methodName());
        properties.put("entryBlockId", graph.entryBlock() == null
                ? null : graph.entryBlock().id());
        properties.put("exitBlockId", graph.exitBlock() == null
                ? null : graph.exitBlock().id());
        properties.put("totalBlocks", graph.basicBlocks().size());
        properties.put("totalEdges", graph.edges().size());
        properties.put("sourceLocation", location(graph.location(), true));

        final Map<String, Integer> custom = new LinkedHashMap<>();
        custom.put("decisionPoints", metrics.decisionPoints());
        custom.put("loopCount", metrics.loopCount());
        custom.put("unreachableBlocks", graph.unreachableBlocks().size());

        return new KnowledgeNode(
                methodId,
                new NodeType("method",
                        VisualizationRules.classifyMethod(metrics),
                        "cfg-method"),
                graph.methodName(),
                contains,
                List.of(),
                properties,
                new NodeMetrics(metrics.cyclomaticComplexity(),
                        metrics.blockCount(), metrics.edgeCount(), custom),
                new VisualizationHints(
                        VisualizationRules.methodColor(
                                metrics.cyclomaticComplexity()),
                        null, VisualizationRules.PREFERRED_LAYOUT, false));
    }

    private KnowledgeNode blockNode(final BasicBlock block, final String blockId,
            final List<NodeReference> contains,
            final List<RelationshipPair> relationships,
            final boolean includeOperations) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("ordinal", block.ordinal());
        properties.put("kind", block.kind().name());
        properties.put("isReachable", block.isReachable());
        properties.put("operationCount", block.operations().size());
        properties.put("predecessors", new ArrayList<>(block.predecessors()));
        properties.put("successors", new ArrayList<>(block.successors()));
        properties.put("branchInfo", branch(block.branchInfo()));

        final Map<String, Integer> custom = new LinkedHashMap<>();
        custom.put("predecessorCount", block.predecessors().size());
        custom.put("successorCount", block.successors().size());

        return new KnowledgeNode(
                blockId,
                new NodeType("basic-block",
                        VisualizationRules.blockSecondaryType(block.kind()),
                        block.kind().name().toLowerCase(Locale.ROOT)),
                "Block " + block.ordinal(),
                contains,
                relationships,
                properties,
                new NodeMetrics(null, block.operations().size(), null, custom),
                new VisualizationHints(
                        VisualizationRules.blockColor(block.kind()),
                        VisualizationRules.blockIcon(block.kind()),
                        VisualizationRules.PREFERRED_LAYOUT,
                        !includeOperations));
    }

    private KnowledgeNode operationNode(final Operation operation,
            final String blockId, final int index) {
        final String kindName = operation.kind().displayName();

        final Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("operationKind", kindName);
        properties.put("sourceText", operation.sourceText());
        properties.put("summary", operation.summary());
        properties.put("mayThrow", operation.mayThrow());
        properties.put("index", index);
        properties.put("sourceLocation", location(operation.location(), false));

        return new KnowledgeNode(
                operationId(blockId, index),
                new NodeType("operation", kindName.toLowerCase(Locale.ROOT),
                        kindName),
                operation.summary(),
                List.of(),
                List.of(),
                properties,
                NodeMetrics.empty(),
                new VisualizationHints(
                        VisualizationRules.operationColor(operation.kind()),
                        VisualizationRules.operationIcon(operation.kind()),
                        VisualizationRules.PREFERRED_LAYOUT, true));
    }

    // -- property values ---------------------------------------------------

    private Map<String, Object> location(final SourceLocation location,
            final boolean withFile) {
        if (location == null) {
            return null;
        }
        final Map<String, Object> value = new LinkedHashMap<>();
        value.put("startLine", location.startLine());
        value.put("endLine", location.endLine());
        value.put("startColumn", location.startColumn());
        value.put("endColumn", location.endColumn());
        if (withFile) {
            value.put("filePath", location.filePath());
        }
        return value;
    }

    private Map<String, Object> branch(final BranchInfo branchInfo) {
        if (branchInfo == null) {
            return null;
        }
        final Map<String, Object> value = new LinkedHashMap<>();
        value.put("branchType", branchInfo.branchType().name());
        value.put("condition", branchInfo.condition());
        return value;
    }

}
