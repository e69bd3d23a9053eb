package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.flow.domain.BlockKind;
import co.fanki.flowgraph.flow.domain.ComplexityMetrics;
import co.fanki.flowgraph.flow.domain.OperationKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for VisualizationRules.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class VisualizationRulesTest {

    // -- classifyMethod ----------------------------------------------------

    @Test
    void whenClassifying_givenLoopsAndManyDecisions_shouldBeComplex() {
        assertEquals("complex-method",
                VisualizationRules.classifyMethod(metrics(3, 1)));
    }

    @Test
    void whenClassifying_givenLoopsAndFewDecisions_shouldBeLoopMethod() {
        assertEquals("loop-method",
                VisualizationRules.classifyMethod(metrics(2, 1)));
    }

    @Test
    void whenClassifying_givenDecisionsOnly_shouldBeConditional() {
        assertEquals("conditional-method",
                VisualizationRules.classifyMethod(metrics(5, 0)));
    }

    @Test
    void whenClassifying_givenNoDecisionsNorLoops_shouldBeSimple() {
        assertEquals("simple-method",
                VisualizationRules.classifyMethod(metrics(0, 0)));
    }

    // -- colors and icons --------------------------------------------------

    @Test
    void whenColoringMethod_givenComplexityBoundaries_shouldPickBand() {
        assertEquals("#4CAF50", VisualizationRules.methodColor(1));
        assertEquals("#4CAF50", VisualizationRules.methodColor(5));
        assertEquals("#FF9800", VisualizationRules.methodColor(6));
        assertEquals("#FF9800", VisualizationRules.methodColor(10));
        assertEquals("#F44336", VisualizationRules.methodColor(11));
    }

    @Test
    void whenStylingBlock_givenEachKind_shouldLookUpColorAndIcon() {
        assertEquals("#2196F3", VisualizationRules.blockColor(BlockKind.ENTRY));
        assertEquals("play", VisualizationRules.blockIcon(BlockKind.ENTRY));
        assertEquals("#9C27B0", VisualizationRules.blockColor(BlockKind.EXIT));
        assertEquals("stop", VisualizationRules.blockIcon(BlockKind.EXIT));
        assertEquals("#607D8B", VisualizationRules.blockColor(BlockKind.BLOCK));
        assertEquals("square", VisualizationRules.blockIcon(BlockKind.BLOCK));
        assertEquals("#9E9E9E",
                VisualizationRules.blockColor(BlockKind.EXCEPTION_HANDLER));
        assertEquals("help",
                VisualizationRules.blockIcon(BlockKind.EXCEPTION_HANDLER));
    }

    @Test
    void whenStylingOperation_givenKnownKinds_shouldLookUpColorAndIcon() {
        assertEquals("#8BC34A",
                VisualizationRules.operationColor(OperationKind.ASSIGNMENT));
        assertEquals("call",
                VisualizationRules.operationIcon(OperationKind.INVOCATION));
        assertEquals("help-outline",
                VisualizationRules.operationIcon(OperationKind.CONDITIONAL));
        assertEquals("#673AB7",
                VisualizationRules.operationColor(OperationKind.RETURN));
    }

    @Test
    void whenStylingOperation_givenUnlistedKind_shouldFallBackToCode() {
        assertEquals("#795548",
                VisualizationRules.operationColor(OperationKind.LOOP));
        assertEquals("code",
                VisualizationRules.operationIcon(OperationKind.THROW));
    }

    @Test
    void whenNamingRole_givenHandlerBlock_shouldReturnHandler() {
        assertEquals("handler",
                VisualizationRules.blockRole(BlockKind.EXCEPTION_HANDLER));
        assertEquals("regular", VisualizationRules.blockRole(BlockKind.BLOCK));
    }

    private static ComplexityMetrics metrics(final int decisions,
            final int loops) {
        return new ComplexityMetrics(4, 4, decisions, loops, 2, false);
    }

}
