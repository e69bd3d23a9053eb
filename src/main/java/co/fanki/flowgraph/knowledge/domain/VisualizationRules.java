package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.flow.domain.BlockKind;
import co.fanki.flowgraph.flow.domain.ComplexityMetrics;
import co.fanki.flowgraph.flow.domain.OperationKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Lookup rules that give nodes their classification, colors and icons.
 *
 * <p>Every rule is a pure function of its argument.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class VisualizationRules {

    /** Layout every control-flow node prefers. */
    public static final String PREFERRED_LAYOUT = "cfg-timeline";

    static final String SIMPLE_COLOR = "#4CAF50";
    static final String MODERATE_COLOR = "#FF9800";
    static final String COMPLEX_COLOR = "#F44336";

    private static final Style DEFAULT_BLOCK_STYLE = new Style("#9E9E9E",
            "help");
    private static final Style DEFAULT_OPERATION_STYLE = new Style("#795548",
            "code");

    private static final Map<BlockKind, Style> BLOCK_STYLES =
            new EnumMap<>(BlockKind.class);

    private static final Map<OperationKind, Style> OPERATION_STYLES =
            new EnumMap<>(OperationKind.class);

    static {
        BLOCK_STYLES.put(BlockKind.ENTRY, new Style("#2196F3", "play"));
        BLOCK_STYLES.put(BlockKind.EXIT, new Style("#9C27B0", "stop"));
        BLOCK_STYLES.put(BlockKind.BLOCK, new Style("#607D8B", "square"));

        OPERATION_STYLES.put(OperationKind.ASSIGNMENT,
                new Style("#8BC34A", "assignment"));
        OPERATION_STYLES.put(OperationKind.INVOCATION,
                new Style("#FF5722", "call"));
        OPERATION_STYLES.put(OperationKind.CONDITIONAL,
                new Style("#E91E63", "help-outline"));
        OPERATION_STYLES.put(OperationKind.RETURN,
                new Style("#673AB7", "return"));
    }

    private VisualizationRules() {
    }

    /**
     * Classifies a method by its loops and decisions.
     *
     * @param metrics the method metrics
     * @return complex-method, loop-method, conditional-method or
     *         simple-method
     */
    public static String classifyMethod(final ComplexityMetrics metrics) {
        if (metrics.loopCount() > 0 && metrics.decisionPoints() > 2) {
            return "complex-method";
        }
        if (metrics.loopCount() > 0) {
            return "loop-method";
        }
        if (metrics.decisionPoints() > 0) {
            return "conditional-method";
        }
        return "simple-method";
    }

    /**
     * Picks the method color: green up to 5, orange up to 10, red above.
     *
     * @param cyclomaticComplexity the method complexity
     * @return the hex color
     */
    public static String methodColor(final int cyclomaticComplexity) {
        if (cyclomaticComplexity <= 5) {
            return SIMPLE_COLOR;
        }
        if (cyclomaticComplexity <= 10) {
            return MODERATE_COLOR;
        }
        return COMPLEX_COLOR;
    }

    public static String blockColor(final BlockKind kind) {
        return BLOCK_STYLES.getOrDefault(kind, DEFAULT_BLOCK_STYLE).color();
    }

    public static String blockIcon(final BlockKind kind) {
        return BLOCK_STYLES.getOrDefault(kind, DEFAULT_BLOCK_STYLE).icon();
    }

    public static String operationColor(final OperationKind kind) {
        return OPERATION_STYLES.getOrDefault(kind, DEFAULT_OPERATION_STYLE)
                .color();
    }

    public static String operationIcon(final OperationKind kind) {
        return OPERATION_STYLES.getOrDefault(kind, DEFAULT_OPERATION_STYLE)
                .icon();
    }

    /**
     * Returns the role a block plays inside its method.
     *
     * @param kind the block kind
     * @return entry, exit, regular or handler
     */
    public static String blockRole(final BlockKind kind) {
        return switch (kind) {
            case ENTRY -> "entry";
            case EXIT -> "exit";
            case BLOCK -> "regular";
            case EXCEPTION_HANDLER -> "handler";
        };
    }

    /**
     * Returns the secondary node type of a block.
     *
     * @param kind the block kind
     * @return entry-block, exit-block, regular-block or basic-block
     */
    public static String blockSecondaryType(final BlockKind kind) {
        return switch (kind) {
            case ENTRY -> "entry-block";
            case EXIT -> "exit-block";
            case BLOCK -> "regular-block";
            case EXCEPTION_HANDLER -> "basic-block";
        };
    }

    private record Style(String color, String icon) {
    }

}
