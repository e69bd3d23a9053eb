package co.fanki.flowgraph;

import co.fanki.flowgraph.config.FlowGraphProperties;
import co.fanki.flowgraph.flow.application.BatchFlowAnalysisService;
import co.fanki.flowgraph.flow.application.BatchFlowAnalysisService.BatchResult;
import co.fanki.flowgraph.flow.application.FailureReason;
import co.fanki.flowgraph.flow.application.MethodFlowResult;
import co.fanki.flowgraph.flow.domain.RawCompilationUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Context test: wires the application and analyzes a compilation unit
 * read from JSON end to end.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest(properties = "flowgraph.batch.parallelism=2")
class FlowGraphApplicationTest {

    @Autowired
    private FlowGraphProperties properties;

    @Autowired
    private BatchFlowAnalysisService batchService;

    @Test
    void whenStarting_givenApplicationYaml_shouldBindSettings() {
        assertEquals(2, properties.batch().parallelism());
        assertEquals(Duration.ofSeconds(10), properties.batch().methodTimeout());
        assertTrue(properties.projection().includeOperations());
    }

    @Test
    void whenAnalyzing_givenFixtureUnit_shouldConvertAvailableMembers()
            throws IOException {
        final BatchResult result = batchService.analyze(read());

        assertEquals("src/Demo/Calculator.cs", result.unitName());
        assertEquals(List.of("Demo.Calculator.Add(int, int)",
                "Demo.Calculator.Sign(int)", "Demo.Calculator..ctor()"),
                result.succeeded().stream()
                        .map(MethodFlowResult::methodIdentifier).toList());
        assertEquals(2, result.failureCount());
        assertTrue(result.failures().stream()
                .allMatch(f -> f.reason() == FailureReason.MISSING_INPUT));

        final MethodFlowResult sign = result.succeeded().get(1);
        assertEquals("method-Demo.Calculator-Sign(int)",
                sign.knowledgeGraph().methodNode().id());
        assertEquals(9, sign.knowledgeGraph().nodeCount());
        assertTrue(sign.knowledgeGraph().toJson()
                .contains("\"summary\":\"x > 0\""));
    }

    private static RawCompilationUnit read() throws IOException {
        try (InputStream input = FlowGraphApplicationTest.class
                .getResourceAsStream("/fixtures/calculator-unit.json")) {
            assertNotNull(input, "fixture not found");
            return RawCompilationUnit.fromJson(input);
        }
    }

}
