package co.fanki.flowgraph.flow.application;

import co.fanki.flowgraph.shared.Preconditions;

/**
 * A member of a batch that produced no graph.
 *
 * @param methodIdentifier the qualified member name
 * @param reason why the member failed
 * @param message the error message
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MethodFailure(
        String methodIdentifier,
        FailureReason reason,
        String message) {

    /**
     * Validates the failure.
     */
    public MethodFailure {
        Preconditions.requireNonBlank(methodIdentifier,
                "Method identifier is required");
        Preconditions.requireNonNull(reason, "Failure reason is required");
        message = message == null ? "" : message;
    }
}
