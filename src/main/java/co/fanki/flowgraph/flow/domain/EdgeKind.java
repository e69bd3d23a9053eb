package co.fanki.flowgraph.flow.domain;

/**
 * Classification of a control-flow edge.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeKind {

    /** Sequential fall-through. */
    REGULAR,

    /** The taken branch of a condition. */
    CONDITIONAL_TRUE,

    /** The untaken branch of a condition. */
    CONDITIONAL_FALSE,

    /** Jump back to an earlier or the same block, closing a loop. */
    BACK_EDGE,

    /** Transfer to an exception handler. */
    EXCEPTION;

    /**
     * Checks if this edge kind is one of the two branch outcomes.
     *
     * @return true for CONDITIONAL_TRUE and CONDITIONAL_FALSE
     */
    public boolean isConditional() {
        return this == CONDITIONAL_TRUE || this == CONDITIONAL_FALSE;
    }

}
