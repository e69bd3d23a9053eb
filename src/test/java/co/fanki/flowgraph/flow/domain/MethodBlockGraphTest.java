package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for the MethodBlockGraph domain object.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MethodBlockGraphTest {

    private final FlowGraphNormalizer normalizer = new FlowGraphNormalizer(
            new OperationSummarizer());

    // -- block -------------------------------------------------------------

    @Test
    void whenLookingUpBlock_givenKnownId_shouldReturnBlock() {
        final MethodBlockGraph graph = normalizer.normalize(RawGraphs.ifElse());

        assertEquals(2, graph.block(2).orElseThrow().id());
    }

    @Test
    void whenLookingUpBlock_givenUnknownId_shouldReturnEmpty() {
        final MethodBlockGraph graph = normalizer.normalize(RawGraphs.ifElse());

        assertTrue(graph.block(9).isEmpty());
        assertTrue(graph.block(-1).isEmpty());
    }

    // -- loopBlocks --------------------------------------------------------

    @Test
    void whenListingLoopBlocks_givenForLoop_shouldReturnBothEndsOfBackEdge() {
        final MethodBlockGraph graph = normalizer.normalize(RawGraphs.forLoop());

        assertEquals(List.of(1, 2), graph.loopBlocks().stream()
                .map(BasicBlock::id).toList());
    }

    @Test
    void whenListingLoopBlocks_givenIfElse_shouldReturnNothing() {
        final MethodBlockGraph graph = normalizer.normalize(RawGraphs.ifElse());

        assertTrue(graph.loopBlocks().isEmpty());
    }

    // -- validate ----------------------------------------------------------

    @Test
    void whenValidating_givenWellFormedGraph_shouldReportNoProblems() {
        final MethodBlockGraph graph = normalizer.normalize(RawGraphs.ifElse());

        assertTrue(graph.validate().isEmpty());
    }

    @Test
    void whenValidating_givenEmptyGraph_shouldReportMissingEntryAndExit() {
        final MethodBlockGraph graph = normalizer.normalize(
                RawFlowGraph.method("Nothing", RawGraphs.TYPE, List.of()));

        assertEquals(List.of("Graph has no entry block",
                "Graph has no exit block"), graph.validate());
    }

    @Test
    void whenValidating_givenOrphanBlock_shouldReportMissingIncomingEdges() {
        final MethodBlockGraph graph = normalizer.normalize(
                RawFlowGraph.method("Dead", RawGraphs.TYPE, List.of(
                        RawGraphs.block(0, 2, null),
                        RawGraphs.block(1, 2, null),
                        RawGraphs.block(2, null, null))));

        assertEquals(List.of("Block 1 has no incoming edges"),
                graph.validate());
    }

    // -- construction and completion ---------------------------------------

    @Test
    void whenCreating_givenEdgeToUnknownBlock_shouldThrowDomainException() {
        final List<BasicBlock> blocks = List.of(
                new BasicBlock(0, BlockKind.ENTRY, null, null, null, null));

        assertThrows(DomainException.class, () -> new MethodBlockGraph("Run",
                RawGraphs.TYPE, null, blocks, List.of(Edge.fallThrough(0, 3)),
                null, List.of()));
    }

    @Test
    void whenCompleting_givenMetrics_shouldAttachThemOnce() {
        final MethodBlockGraph graph = normalizer.normalize(RawGraphs.ifElse());
        final ComplexityMetrics metrics = new ComplexityCalculator()
                .calculate(graph);

        assertFalse(graph.isComplete());
        graph.complete(metrics);

        assertTrue(graph.isComplete());
        assertEquals(metrics, graph.metrics());
        assertThrows(DomainException.class, () -> graph.complete(metrics));
    }

}
