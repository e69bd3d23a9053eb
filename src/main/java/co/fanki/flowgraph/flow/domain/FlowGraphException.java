package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.DomainException;

import java.time.Duration;

/**
 * Raised when a raw flow graph cannot be turned into a method graph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FlowGraphException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** The raw graph, or its block list, is absent. */
    public static final String MISSING_INPUT = "MISSING_INPUT";

    /** The raw graph is present but cannot be read. */
    public static final String INVALID_INPUT = "INVALID_INPUT";

    /** Building the graph or its projection failed unexpectedly. */
    public static final String CONVERSION_FAILURE = "CONVERSION_FAILURE";

    /** The conversion was stopped by a cancellation signal. */
    public static final String CANCELLED = "CANCELLED";

    /** The conversion ran past its time budget. */
    public static final String TIMED_OUT = "TIMED_OUT";

    /**
     * Creates a new flow graph exception.
     *
     * @param message the error message
     * @param errorCode one of the codes declared in this class
     */
    public FlowGraphException(final String message, final String errorCode) {
        super(message, errorCode);
    }

    /**
     * Creates a new flow graph exception with a cause.
     *
     * @param message the error message
     * @param errorCode one of the codes declared in this class
     * @param cause the underlying cause
     */
    public FlowGraphException(final String message, final String errorCode,
            final Throwable cause) {
        super(message, errorCode, cause);
    }

    static FlowGraphException missingInput(final String what) {
        return new FlowGraphException(what + " is not available",
                MISSING_INPUT);
    }

    static FlowGraphException invalidInput(final String message,
            final Throwable cause) {
        return new FlowGraphException(message, INVALID_INPUT, cause);
    }

    /**
     * Creates the exception raised when a cancellation signal is seen.
     *
     * @param member the member whose conversion was stopped
     * @return the exception
     */
    public static FlowGraphException cancelled(final String member) {
        return new FlowGraphException("Conversion of " + member
                + " was cancelled", CANCELLED);
    }

    /**
     * Creates the exception raised when a time budget is spent.
     *
     * @param member the member whose conversion was stopped
     * @param budget the budget it exceeded
     * @return the exception
     */
    public static FlowGraphException timedOut(final String member,
            final Duration budget) {
        return new FlowGraphException("Conversion of " + member
                + " exceeded " + budget.toMillis() + " ms", TIMED_OUT);
    }

    /**
     * Checks if this exception reports a missing input.
     *
     * @return true for {@link #MISSING_INPUT}
     */
    public boolean isMissingInput() {
        return MISSING_INPUT.equals(getErrorCode());
    }

}
