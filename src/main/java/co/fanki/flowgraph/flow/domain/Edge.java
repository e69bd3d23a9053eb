package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;
import co.fanki.flowgraph.shared.ValueObject;

/**
 * A directed control-flow edge between two blocks of the same graph.
 *
 * @param source the id of the block control leaves
 * @param target the id of the block control enters
 * @param kind the edge classification
 * @param label a short label: fallthrough, condition or loop
 * @param condition the branch condition, null unless conditional
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Edge(
        int source,
        int target,
        EdgeKind kind,
        String label,
        EdgeCondition condition) implements ValueObject {

    /** Label of a fall-through edge. */
    public static final String FALLTHROUGH_LABEL = "fallthrough";

    /** Label of a conditional edge. */
    public static final String CONDITION_LABEL = "condition";

    /** Label of a back edge. */
    public static final String LOOP_LABEL = "loop";

    /**
     * Validates the edge.
     */
    public Edge {
        Preconditions.requireNonNegative(source, "Source id must be >= 0");
        Preconditions.requireNonNegative(target, "Target id must be >= 0");
        Preconditions.requireNonNull(kind, "Edge kind is required");
        label = label == null ? "" : label;
    }

    /**
     * Creates a fall-through edge.
     *
     * @param source the source block id
     * @param target the target block id
     * @return the edge
     */
    public static Edge fallThrough(final int source, final int target) {
        return new Edge(source, target, EdgeKind.REGULAR, FALLTHROUGH_LABEL,
                null);
    }

    /**
     * Creates the taken-branch edge of a condition.
     *
     * @param source the source block id
     * @param target the target block id
     * @param condition the summarized condition, may be null
     * @return the edge
     */
    public static Edge conditional(final int source, final int target,
            final String condition) {
        return new Edge(source, target, EdgeKind.CONDITIONAL_TRUE,
                CONDITION_LABEL,
                condition == null ? null : new EdgeCondition(true, condition));
    }

    /**
     * Checks if the edge jumps to the same or an earlier block.
     *
     * @return true if the target does not come after the source
     */
    public boolean pointsBackward() {
        return target <= source;
    }

    /**
     * Returns this edge reclassified as a back edge when it points
     * backward, or this edge otherwise.
     *
     * <p>The branch condition is kept so that a loop edge still tells
     * which condition closes it.</p>
     *
     * @return the classified edge
     */
    public Edge classified() {
        if (!pointsBackward() || kind == EdgeKind.BACK_EDGE) {
            return this;
        }
        return new Edge(source, target, EdgeKind.BACK_EDGE, LOOP_LABEL,
                condition);
    }
}
