package co.fanki.flowgraph.flow.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The control-flow graph of one method or constructor, as produced by the
 * compiler front end.
 *
 * <p>This is the upstream contract of the pipeline. A null block list is
 * kept as null so that the ingestor can tell a missing graph apart from
 * an empty one.</p>
 *
 * @param name the simple member name
 * @param containingTypeName the fully qualified name of the declaring type
 * @param sourceLocation where the member is declared, may be null
 * @param constructor whether the member is a constructor
 * @param parameterTypes the declared parameter types, null when unknown
 * @param blocks the blocks of the graph in front end order, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RawFlowGraph(
        String name,
        String containingTypeName,
        SourceLocation sourceLocation,
        boolean constructor,
        List<String> parameterTypes,
        List<RawBlock> blocks) {

    /** Name given to constructors in display names. */
    public static final String CONSTRUCTOR_NAME = ".ctor";

    /**
     * Copies the lists into unmodifiable ones, keeping null as null.
     */
    public RawFlowGraph {
        parameterTypes = parameterTypes == null
                ? null
                : Collections.unmodifiableList(new ArrayList<>(parameterTypes));
        blocks = blocks == null
                ? null
                : Collections.unmodifiableList(new ArrayList<>(blocks));
    }

    /**
     * Creates the graph of a plain method with unknown parameter types.
     *
     * @param name the method name
     * @param containingTypeName the declaring type
     * @param blocks the blocks
     * @return the raw graph
     */
    public static RawFlowGraph method(final String name,
            final String containingTypeName, final List<RawBlock> blocks) {
        return new RawFlowGraph(name, containingTypeName, null, false, null,
                blocks);
    }

    /**
     * Returns the member name in the compiler's short display format.
     *
     * <p>Constructors are shown as {@code .ctor(T1, T2)}. Methods are shown
     * as {@code name(T1, T2)} when parameter types are known and as the
     * bare name otherwise.</p>
     *
     * @return the display name
     */
    public String displayName() {
        final String base = constructor ? CONSTRUCTOR_NAME : name;
        if (parameterTypes == null && !constructor) {
            return base;
        }
        final List<String> types = parameterTypes == null
                ? List.of() : parameterTypes;
        return base + "(" + String.join(", ", types) + ")";
    }

    /**
     * Returns a human identifier of the member for logs and batch reports.
     *
     * @return {@code Type.displayName}, or the display name alone when the
     *         type is unknown
     */
    public String qualifiedName() {
        if (containingTypeName == null || containingTypeName.isBlank()) {
            return displayName();
        }
        return containingTypeName + "." + displayName();
    }
}
