package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;
import co.fanki.flowgraph.shared.ValueObject;

/**
 * Size and complexity figures of a method graph.
 *
 * @param blockCount the number of blocks
 * @param edgeCount the number of edges
 * @param decisionPoints the number of conditional edges
 * @param loopCount the number of back edges
 * @param cyclomaticComplexity {@code max(1, edges - blocks + 2)}
 * @param hasExceptionHandling whether a handler block or exception edge
 *        exists
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ComplexityMetrics(
        int blockCount,
        int edgeCount,
        int decisionPoints,
        int loopCount,
        int cyclomaticComplexity,
        boolean hasExceptionHandling) implements ValueObject {

    /**
     * Validates the figures.
     */
    public ComplexityMetrics {
        Preconditions.requireNonNegative(blockCount, "Block count must be >= 0");
        Preconditions.requireNonNegative(edgeCount, "Edge count must be >= 0");
        Preconditions.requireNonNegative(decisionPoints,
                "Decision points must be >= 0");
        Preconditions.requireNonNegative(loopCount, "Loop count must be >= 0");
        Preconditions.require(cyclomaticComplexity >= 1,
                "Cyclomatic complexity must be >= 1");
    }

    /**
     * Computes the cyclomatic complexity of a graph, floored at 1.
     *
     * @param edgeCount the number of edges
     * @param blockCount the number of blocks
     * @return {@code max(1, edgeCount - blockCount + 2)}
     */
    public static int cyclomatic(final int edgeCount, final int blockCount) {
        return Math.max(1, edgeCount - blockCount + 2);
    }
}
