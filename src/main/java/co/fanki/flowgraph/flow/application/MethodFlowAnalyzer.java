package co.fanki.flowgraph.flow.application;

import co.fanki.flowgraph.config.FlowGraphProperties;
import co.fanki.flowgraph.flow.domain.CancellationSignal;
import co.fanki.flowgraph.flow.domain.FlowGraphException;
import co.fanki.flowgraph.flow.domain.MethodBlockGraph;
import co.fanki.flowgraph.flow.domain.MethodFlowPipeline;
import co.fanki.flowgraph.flow.domain.RawFlowGraph;
import co.fanki.flowgraph.knowledge.domain.KnowledgeGraph;
import co.fanki.flowgraph.knowledge.domain.KnowledgeGraphProjector;
import co.fanki.flowgraph.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Application service that turns the raw flow graph of one member into
 * its analyzed graph and knowledge graph projection.
 *
 * <p>This is the failure boundary of a member. Unexpected errors raised by
 * any stage are logged with the member and its type and reported as a
 * {@link FlowGraphException#CONVERSION_FAILURE}; no half-built result ever
 * leaves this class.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class MethodFlowAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            MethodFlowAnalyzer.class);

    private final MethodFlowPipeline pipeline;
    private final KnowledgeGraphProjector projector;
    private final boolean includeOperations;

    /**
     * Creates a new analyzer.
     *
     * @param thePipeline the analysis stages
     * @param theProjector the knowledge graph projector
     * @param theProperties the application settings
     */
    public MethodFlowAnalyzer(
            final MethodFlowPipeline thePipeline,
            final KnowledgeGraphProjector theProjector,
            final FlowGraphProperties theProperties) {
        this.pipeline = Preconditions.requireNonNull(thePipeline,
                "Pipeline is required");
        this.projector = Preconditions.requireNonNull(theProjector,
                "Projector is required");
        Preconditions.requireNonNull(theProperties, "Properties are required");
        this.includeOperations = theProperties.projection().includeOperations();
    }

    /**
     * Analyzes one member.
     *
     * @param raw the raw graph, may be null
     * @param signal the cancellation signal of the caller
     * @return the analyzed graph and its projection
     * @throws FlowGraphException when the member yields no graph; the error
     *         code tells why
     */
    public MethodFlowResult analyze(final RawFlowGraph raw,
            final CancellationSignal signal) {
        final String member = identify(raw);
        final String type = raw == null ? "<unknown>" : raw.containingTypeName();

        try {
            final MethodBlockGraph graph = pipeline.run(raw, signal);
            signal.throwIfCancelled(member);
            final KnowledgeGraph knowledgeGraph = projector.project(graph,
                    includeOperations);
            return new MethodFlowResult(member, graph, knowledgeGraph);

        } catch (final FlowGraphException e) {
            if (e.isMissingInput()) {
                LOG.warn("Flow graph unavailable for {}: {}", member,
                        e.getMessage());
            } else if (!FlowGraphException.CANCELLED.equals(e.getErrorCode())
                    && !FlowGraphException.TIMED_OUT.equals(e.getErrorCode())) {
                LOG.warn("Rejected flow graph of {} in type {}: {}", member,
                        type, e.getMessage());
            }
            throw e;

        } catch (final RuntimeException e) {
            LOG.error("Failed to convert flow graph of {} in type {}: {}",
                    member, type, e.getMessage(), e);
            throw new FlowGraphException("Failed to convert flow graph of "
                    + member + ": " + e.getMessage(),
                    FlowGraphException.CONVERSION_FAILURE, e);
        }
    }

    /**
     * Analyzes one member, turning any failure into an empty result.
     *
     * @param raw the raw graph, may be null
     * @return the result, or empty when the member yields no graph
     */
    public Optional<MethodFlowResult> tryAnalyze(final RawFlowGraph raw) {
        try {
            return Optional.of(analyze(raw, CancellationSignal.none()));
        } catch (final FlowGraphException e) {
            LOG.debug("No flow graph for {}: {}", identify(raw),
                    e.getErrorCode());
            return Optional.empty();
        }
    }

    /**
     * Returns the identifier a member is reported under.
     *
     * @param raw the raw graph, may be null
     * @return the qualified member name, or a placeholder when absent
     */
    static String identify(final RawFlowGraph raw) {
        return raw == null ? "<unavailable>" : raw.qualifiedName();
    }

}
