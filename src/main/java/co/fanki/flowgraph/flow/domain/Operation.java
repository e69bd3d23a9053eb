package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;
import co.fanki.flowgraph.shared.ValueObject;

/**
 * A single operation inside a basic block.
 *
 * <p>The throw-risk flag is derived from the kind and cannot be set by
 * callers.</p>
 *
 * @param kind the operation kind
 * @param sourceText the source text, empty when unknown
 * @param summary the human-readable summary
 * @param location where the operation sits in the source, may be null
 * @param mayThrow whether the operation may throw
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Operation(
        OperationKind kind,
        String sourceText,
        String summary,
        SourceLocation location,
        boolean mayThrow) implements ValueObject {

    /**
     * Validates the operation and ties the throw flag to the kind.
     */
    public Operation {
        Preconditions.requireNonNull(kind, "Operation kind is required");
        Preconditions.require(mayThrow == kind.mayThrow(),
                "Throw flag must follow the operation kind");
        sourceText = sourceText == null ? "" : sourceText;
        summary = summary == null ? "" : summary;
    }

    /**
     * Creates an operation whose throw flag is derived from its kind.
     *
     * @param kind the operation kind
     * @param sourceText the source text
     * @param summary the summary
     * @param location the source location, may be null
     * @return the operation
     */
    public static Operation of(final OperationKind kind,
            final String sourceText, final String summary,
            final SourceLocation location) {
        Preconditions.requireNonNull(kind, "Operation kind is required");
        return new Operation(kind, sourceText, summary, location,
                kind.mayThrow());
    }
}
