package co.fanki.flowgraph.flow.domain;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for OperationSummarizer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class OperationSummarizerTest {

    private final OperationSummarizer summarizer = new OperationSummarizer();

    // -- details -----------------------------------------------------------

    @Test
    void whenSummarizing_givenAssignmentDetails_shouldRenderTargetAndValue() {
        final Operation operation = summarizer.summarize(
                RawGraphs.assignment("total", "total + item"));

        assertEquals(OperationKind.ASSIGNMENT, operation.kind());
        assertEquals("total = total + item", operation.summary());
        assertFalse(operation.mayThrow());
    }

    @Test
    void whenSummarizing_givenInvocationDetails_shouldRenderArgumentCommas() {
        final RawOperation raw = new RawOperation("Invocation",
                "logger.Log(a, b, c)", null, Map.of(
                        RawOperation.METHOD, "Log",
                        RawOperation.ARGUMENT_COUNT, "3"));

        final Operation operation = summarizer.summarize(raw);

        assertEquals("Log(,,)", operation.summary());
        assertTrue(operation.mayThrow());
    }

    @Test
    void whenSummarizing_givenBinaryOperatorDetails_shouldRenderOperands() {
        final RawOperation raw = new RawOperation("BinaryOperator", "a+b",
                null, Map.of(RawOperation.LEFT, "a",
                        RawOperation.OPERATOR, "+",
                        RawOperation.RIGHT, "b"));

        assertEquals("a + b", summarizer.summarize(raw).summary());
    }

    @Test
    void whenSummarizing_givenLoopKindDetail_shouldNameTheLoop() {
        final RawOperation raw = new RawOperation("Loop", "", null,
                Map.of(RawOperation.LOOP_KIND, "ForEach"));

        assertEquals("foreach loop", summarizer.summarize(raw).summary());
    }

    // -- source text fallback ----------------------------------------------

    @Test
    void whenSummarizing_givenAssignmentText_shouldSplitAtAssignment() {
        final Operation operation = summarizer.summarize(
                RawOperation.of("SimpleAssignment", "result = x == y;"));

        assertEquals("result = x == y", operation.summary());
    }

    @Test
    void whenSummarizing_givenDeclarationText_shouldKeepVariableName() {
        final Operation operation = summarizer.summarize(
                RawOperation.of("VariableDeclarator", "int count = 0"));

        assertEquals(OperationKind.VARIABLE_DECLARATION, operation.kind());
        assertEquals("var count", operation.summary());
    }

    @Test
    void whenSummarizing_givenInvocationText_shouldCountTopLevelArguments() {
        final Operation operation = summarizer.summarize(
                RawOperation.of("Invocation", "Process(Map(a, b), c);"));

        assertEquals("Process(,)", operation.summary());
    }

    @Test
    void whenSummarizing_givenInvocationWithoutArguments_shouldRenderEmptyParens() {
        assertEquals("Run()", summarizer.summarize(
                RawOperation.of("Invocation", "Run()")).summary());
    }

    @Test
    void whenSummarizing_givenReturnText_shouldKeepReturnedValue() {
        assertEquals("return a + b", summarizer.summarize(
                RawOperation.of("Return", "return a + b;")).summary());
        assertEquals("return", summarizer.summarize(
                RawOperation.of("Return", "return;")).summary());
    }

    @Test
    void whenSummarizing_givenConditionalText_shouldPrefixQuestionMark() {
        assertEquals("? x > 0", summarizer.summarize(
                RawOperation.of("Conditional", "x > 0")).summary());
    }

    @Test
    void whenSummarizing_givenLoopText_shouldDetectLoopFlavour() {
        assertEquals("for loop", summarizer.summarize(
                RawOperation.of("Loop", "for (i = 0; i < n; i++)")).summary());
        assertEquals("foreach loop", summarizer.summarize(
                RawOperation.of("Loop", "foreach (var x in xs)")).summary());
        assertEquals("while loop", summarizer.summarize(
                RawOperation.of("Loop", "while (running)")).summary());
        assertEquals("loop", summarizer.summarize(
                RawOperation.of("Loop", "")).summary());
    }

    @Test
    void whenSummarizing_givenOtherKind_shouldUseTrimmedText() {
        final Operation operation = summarizer.summarize(
                RawOperation.of("Await", "  await task  "));

        assertEquals(OperationKind.OTHER, operation.kind());
        assertEquals("await task", operation.summary());
    }

    @Test
    void whenSummarizing_givenOtherKindWithoutText_shouldUseKindName() {
        assertEquals("Throw", summarizer.summarize(
                RawOperation.of("Throw", null)).summary());
    }

    @Test
    void whenSummarizing_givenLocation_shouldKeepIt() {
        final SourceLocation location = SourceLocation.ofLine(14, 9, 22);

        final Operation operation = summarizer.summarize(new RawOperation(
                "Invocation", "Save(order)", location, null));

        assertEquals(location, operation.location());
        assertEquals(14, operation.location().endLine());
    }

    // -- branches ----------------------------------------------------------

    @Test
    void whenSummarizingBranch_givenLoopBranch_shouldKeepConditionAndType() {
        final BranchInfo branch = summarizer.summarizeBranch(
                new RawBranchValue(" i < n ", "Loop"));

        assertEquals("i < n", branch.condition());
        assertEquals(BranchType.LOOP, branch.branchType());
    }

    @Test
    void whenSummarizingBranch_givenNoBranch_shouldReturnNull() {
        assertNull(summarizer.summarizeBranch(null));
    }

}
