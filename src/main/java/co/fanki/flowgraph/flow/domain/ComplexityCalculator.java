package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;

import java.util.List;

/**
 * Computes the {@link ComplexityMetrics} of a set of blocks and edges.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ComplexityCalculator {

    /**
     * Computes the metrics of a method graph.
     *
     * @param graph the graph
     * @return the metrics
     */
    public ComplexityMetrics calculate(final MethodBlockGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");
        return calculate(graph.basicBlocks(), graph.edges());
    }

    /**
     * Computes the metrics of a list of blocks and the edges between them.
     *
     * @param blocks the blocks
     * @param edges the edges
     * @return the metrics
     */
    public ComplexityMetrics calculate(final List<BasicBlock> blocks,
            final List<Edge> edges) {
        Preconditions.requireNonNull(blocks, "Blocks are required");
        Preconditions.requireNonNull(edges, "Edges are required");

        int decisionPoints = 0;
        int loopCount = 0;
        boolean exceptionEdge = false;

        for (final Edge edge : edges) {
            if (edge.kind().isConditional()) {
                decisionPoints++;
            } else if (edge.kind() == EdgeKind.BACK_EDGE) {
                loopCount++;
            } else if (edge.kind() == EdgeKind.EXCEPTION) {
                exceptionEdge = true;
            }
        }

        final boolean handlerBlock = blocks.stream()
                .anyMatch(b -> b.kind() == BlockKind.EXCEPTION_HANDLER);

        return new ComplexityMetrics(
                blocks.size(),
                edges.size(),
                decisionPoints,
                loopCount,
                ComplexityMetrics.cyclomatic(edges.size(), blocks.size()),
                handlerBlock || exceptionEdge);
    }

}
