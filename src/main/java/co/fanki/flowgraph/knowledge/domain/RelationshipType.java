package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.flow.domain.EdgeKind;
import co.fanki.flowgraph.shared.Preconditions;
import co.fanki.flowgraph.shared.ValueObject;

/**
 * A typed relationship, named from both of its ends.
 *
 * @param forward the name read from the source, e.g. {@code flows-to}
 * @param reverse the name read from the target, e.g. {@code flows-from}
 * @param category the relationship family
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RelationshipType(String forward, String reverse, String category)
        implements ValueObject {

    /** Category of every control-flow relationship. */
    public static final String CONTROL_FLOW = "control-flow";

    /** Sequential or exceptional transfer of control. */
    public static final RelationshipType FLOWS_TO = new RelationshipType(
            "flows-to", "flows-from", CONTROL_FLOW);

    /** Transfer taken on a branch outcome. */
    public static final RelationshipType BRANCHES_TO = new RelationshipType(
            "branches-to", "branches-from", CONTROL_FLOW);

    /** Transfer back to the head of a loop. */
    public static final RelationshipType LOOPS_TO = new RelationshipType(
            "loops-to", "loops-from", CONTROL_FLOW);

    /**
     * Validates the names.
     */
    public RelationshipType {
        Preconditions.requireNonBlank(forward, "Forward name is required");
        Preconditions.requireNonBlank(reverse, "Reverse name is required");
        Preconditions.requireNonBlank(category, "Category is required");
    }

    /**
     * Returns the relationship type a control-flow edge projects to.
     *
     * @param kind the edge kind
     * @return the relationship type, never null
     */
    public static RelationshipType forEdge(final EdgeKind kind) {
        Preconditions.requireNonNull(kind, "Edge kind is required");
        return switch (kind) {
            case REGULAR, EXCEPTION -> FLOWS_TO;
            case CONDITIONAL_TRUE, CONDITIONAL_FALSE -> BRANCHES_TO;
            case BACK_EDGE -> LOOPS_TO;
        };
    }

    /**
     * Returns this type as seen from the other end.
     *
     * @return a type with forward and reverse swapped
     */
    public RelationshipType reversed() {
        return new RelationshipType(reverse, forward, category);
    }
}
