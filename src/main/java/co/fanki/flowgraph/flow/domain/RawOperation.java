package co.fanki.flowgraph.flow.domain;

import java.util.Map;

/**
 * An operation as reported by the compiler front end.
 *
 * <p>The kind is the front end's own name for the operation (for instance
 * {@code SimpleAssignment} or {@code Invocation}). The details map carries
 * the structured parts a summary is made of; the keys understood by
 * {@link OperationSummarizer} are listed as constants here.</p>
 *
 * @param kind the raw operation kind name
 * @param sourceText the source text of the operation
 * @param location where the operation sits in the source, may be null
 * @param details structured parts of the operation, never null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RawOperation(
        String kind,
        String sourceText,
        SourceLocation location,
        Map<String, String> details) {

    /** Assignment target, the left-hand side. */
    public static final String TARGET = "target";

    /** Assigned, returned or declared value. */
    public static final String VALUE = "value";

    /** Declared variable name. */
    public static final String VARIABLE = "variable";

    /** Invoked method name. */
    public static final String METHOD = "method";

    /** Number of invocation arguments. */
    public static final String ARGUMENT_COUNT = "argumentCount";

    /** Condition expression of a conditional. */
    public static final String CONDITION = "condition";

    /** Left operand of a binary operator. */
    public static final String LEFT = "left";

    /** Operator of a binary operator. */
    public static final String OPERATOR = "operator";

    /** Right operand of a binary operator. */
    public static final String RIGHT = "right";

    /** Loop flavour: for, foreach or while. */
    public static final String LOOP_KIND = "loopKind";

    /**
     * Normalizes absent text and details to empty values.
     */
    public RawOperation {
        sourceText = sourceText == null ? "" : sourceText;
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * Creates an operation that only carries its kind and source text.
     *
     * @param kind the raw kind name
     * @param sourceText the source text
     * @return the operation
     */
    public static RawOperation of(final String kind, final String sourceText) {
        return new RawOperation(kind, sourceText, null, Map.of());
    }

    /**
     * Returns a structured detail of this operation.
     *
     * @param key the detail key
     * @return the detail value, or null when absent
     */
    public String detail(final String key) {
        return details.get(key);
    }
}
