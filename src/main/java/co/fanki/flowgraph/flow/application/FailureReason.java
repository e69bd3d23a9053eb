package co.fanki.flowgraph.flow.application;

import co.fanki.flowgraph.flow.domain.FlowGraphException;

/**
 * Why a member of a batch produced no graph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum FailureReason {

    /** The raw graph, or its block list, was not available. */
    MISSING_INPUT,

    /** The raw graph could not be read or converted. */
    CONVERSION_FAILURE,

    /** The batch was cancelled before the member completed. */
    CANCELLED,

    /** The member exceeded its time budget. */
    TIMED_OUT;

    /**
     * Maps a flow graph error code to a failure reason.
     *
     * @param errorCode the error code, may be null
     * @return the reason, CONVERSION_FAILURE for unknown codes
     */
    public static FailureReason fromErrorCode(final String errorCode) {
        if (FlowGraphException.MISSING_INPUT.equals(errorCode)) {
            return MISSING_INPUT;
        }
        if (FlowGraphException.CANCELLED.equals(errorCode)) {
            return CANCELLED;
        }
        if (FlowGraphException.TIMED_OUT.equals(errorCode)) {
            return TIMED_OUT;
        }
        return CONVERSION_FAILURE;
    }

}
