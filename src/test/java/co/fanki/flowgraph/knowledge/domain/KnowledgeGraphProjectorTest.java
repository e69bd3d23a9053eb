package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.flow.domain.ComplexityCalculator;
import co.fanki.flowgraph.flow.domain.Edge;
import co.fanki.flowgraph.flow.domain.FlowGraphIngestor;
import co.fanki.flowgraph.flow.domain.FlowGraphNormalizer;
import co.fanki.flowgraph.flow.domain.MethodBlockGraph;
import co.fanki.flowgraph.flow.domain.MethodFlowPipeline;
import co.fanki.flowgraph.flow.domain.OperationSummarizer;
import co.fanki.flowgraph.flow.domain.RawFlowGraph;
import co.fanki.flowgraph.flow.domain.RawGraphs;
import co.fanki.flowgraph.flow.domain.ReachabilityAnalyzer;
import co.fanki.flowgraph.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for KnowledgeGraphProjector.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class KnowledgeGraphProjectorTest {

    private static final String SIGN_ID = "method-Demo.Calculator-Sign";

    private final MethodFlowPipeline pipeline = new MethodFlowPipeline(
            new FlowGraphIngestor(),
            new FlowGraphNormalizer(new OperationSummarizer()),
            new ReachabilityAnalyzer(),
            new ComplexityCalculator());

    private final KnowledgeGraphProjector projector =
            new KnowledgeGraphProjector();

    // -- flat mode ---------------------------------------------------------

    @Test
    void whenProjecting_givenOperations_shouldEmitMethodThenBlocksThenOps() {
        final KnowledgeGraph knowledge = projector.project(
                pipeline.run(RawGraphs.ifElse()), true);

        assertEquals(9, knowledge.nodeCount());
        assertEquals(SIGN_ID, knowledge.nodes().get(0).id());
        assertEquals("block-" + SIGN_ID + "-0", knowledge.nodes().get(1).id());
        assertEquals("block-" + SIGN_ID + "-3", knowledge.nodes().get(4).id());
        assertEquals("op-block-" + SIGN_ID + "-0-0",
                knowledge.nodes().get(5).id());
    }

    @Test
    void whenProjecting_givenIfElse_shouldDescribeMethodNode() {
        final KnowledgeNode method = projector.project(
                pipeline.run(RawGraphs.ifElse()), true).methodNode();

        assertEquals("method", method.type().primary());
        assertEquals("conditional-method", method.type().secondary());
        assertEquals("cfg-method", method.type().custom());
        assertEquals("Sign", method.label());
        assertEquals(2, method.metrics().complexity());
        assertEquals(4, method.metrics().nodeCount());
        assertEquals(4, method.metrics().edgeCount());
        assertEquals(1, method.metrics().custom().get("decisionPoints"));
        assertEquals(0, method.metrics().custom().get("unreachableBlocks"));
        assertEquals("#4CAF50", method.visualization().color());
        assertEquals("cfg-timeline", method.visualization().preferredLayout());
        assertEquals(0, method.property("entryBlockId"));
        assertEquals(3, method.property("exitBlockId"));
    }

    @Test
    void whenProjecting_givenIfElse_shouldListBlocksWithRolesInMethodNode() {
        final KnowledgeNode method = projector.project(
                pipeline.run(RawGraphs.ifElse()), false).methodNode();

        assertEquals(List.of("entry", "regular", "regular", "exit"),
                method.contains().stream().map(NodeReference::role).toList());
        assertEquals(List.of(0, 1, 2, 3),
                method.contains().stream().map(NodeReference::order).toList());
    }

    @Test
    void whenProjecting_givenOperations_shouldReferenceOpsFromBlocks() {
        final KnowledgeGraph knowledge = projector.project(
                pipeline.run(RawGraphs.ifElse()), true);

        final KnowledgeNode elseBlock = knowledge.node(
                "block-" + SIGN_ID + "-1").orElseThrow();
        final List<KnowledgeNode> operations = knowledge.children(elseBlock);

        assertEquals(1, operations.size());
        assertEquals("r = -1", operations.get(0).label());
        assertEquals("Assignment", operations.get(0).type().custom());
        assertEquals("assignment", operations.get(0).visualization().icon());
        assertFalse(elseBlock.visualization().collapsed());
    }

    @Test
    void whenProjecting_givenForLoop_shouldClassifyAsLoopMethod() {
        final KnowledgeGraph knowledge = projector.project(
                pipeline.run(RawGraphs.forLoop()), false);

        assertEquals("loop-method", knowledge.methodNode().type().secondary());

        final KnowledgeNode body = knowledge.node("block-method-"
                + RawGraphs.TYPE + "-Sum-2").orElseThrow();
        assertTrue(body.outgoing().stream()
                .anyMatch(r -> r.type().equals(RelationshipType.LOOPS_TO)));
    }

    // -- relationships -----------------------------------------------------

    @Test
    void whenProjecting_givenAnyGraph_shouldEmitTwoSwappedEndsPerEdge() {
        for (final RawFlowGraph raw : List.of(RawGraphs.singleBlock(),
                RawGraphs.ifElse(), RawGraphs.forLoop(),
                RawGraphs.twoBlockConditional())) {
            final MethodBlockGraph graph = pipeline.run(raw);
            final KnowledgeGraph knowledge = projector.project(graph, true);
            final String methodId = knowledge.methodNode().id();

            assertEquals(2 * graph.edges().size(),
                    knowledge.relationshipCount());

            for (final Edge edge : graph.edges()) {
                final String sourceId = "block-" + methodId + "-" + edge.source();
                final String targetId = "block-" + methodId + "-" + edge.target();
                final RelationshipType type = RelationshipType.forEdge(
                        edge.kind());

                assertTrue(knowledge.node(sourceId).orElseThrow().outgoing()
                        .contains(new RelationshipPair(type,
                                RelationshipDirection.OUTGOING, targetId)));
                assertTrue(knowledge.node(targetId).orElseThrow().incoming()
                        .contains(new RelationshipPair(type.reversed(),
                                RelationshipDirection.INCOMING, sourceId)));
            }
        }
    }

    @Test
    void whenProjecting_givenTwoBlockConditionalWithoutOps_shouldEmitThreeNodes() {
        final KnowledgeGraph knowledge = projector.project(
                pipeline.run(RawGraphs.twoBlockConditional()), false);

        assertEquals(3, knowledge.nodeCount());
        assertEquals(2, knowledge.relationshipCount());

        final KnowledgeNode entry = knowledge.nodes().get(1);
        assertEquals("branches-to", entry.outgoing().get(0).type().forward());
        assertTrue(entry.contains().isEmpty());
        assertTrue(entry.visualization().collapsed());
    }

    @Test
    void whenProjecting_givenEmptyBody_shouldEmitNoRelationships() {
        final KnowledgeGraph knowledge = projector.project(
                pipeline.run(RawGraphs.emptyBody()), true);

        assertEquals(2, knowledge.nodeCount());
        assertEquals(0, knowledge.relationshipCount());
        assertEquals(1, knowledge.methodNode().metrics().complexity());
        assertEquals(0, knowledge.nodes().get(1).property("operationCount"));
    }

    @Test
    void whenProjecting_givenNoBlocks_shouldEmitLoneMethodNode() {
        final KnowledgeGraph knowledge = projector.project(
                pipeline.run(RawFlowGraph.method("Nothing", RawGraphs.TYPE,
                        List.of())), true);

        assertEquals(1, knowledge.nodeCount());
        assertTrue(knowledge.methodNode().contains().isEmpty());
        assertEquals(0, knowledge.relationshipCount());
    }

    @Test
    void whenProjecting_givenSameGraphTwice_shouldProduceSameDocument() {
        final String first = projector.project(
                pipeline.run(RawGraphs.forLoop()), true).toJson();
        final String second = projector.project(
                pipeline.run(RawGraphs.forLoop()), true).toJson();

        assertEquals(first, second);
    }

    @Test
    void whenProjecting_givenGraphWithoutMetrics_shouldThrowDomainException() {
        final MethodBlockGraph incomplete = new FlowGraphNormalizer(
                new OperationSummarizer()).normalize(RawGraphs.ifElse());

        assertThrows(DomainException.class,
                () -> projector.project(incomplete, true));
    }

    // -- aggregate mode ----------------------------------------------------

    @Test
    void whenProjectingAggregate_givenIfElse_shouldReturnMethodNodeOnly() {
        final MethodBlockGraph graph = pipeline.run(RawGraphs.ifElse());

        final List<KnowledgeNode> aggregate = projector.projectAggregate(graph);

        assertEquals(1, aggregate.size());
        assertEquals(SIGN_ID, aggregate.get(0).id());
        assertEquals(4, aggregate.get(0).contains().size());
        assertEquals(projector.project(graph, true).methodNode(),
                aggregate.get(0));
    }

}
