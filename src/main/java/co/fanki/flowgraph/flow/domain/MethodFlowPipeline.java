package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the analysis stages of one member in order: ingest, normalize,
 * mark reachability and compute metrics.
 *
 * <p>The cancellation signal is checked before every stage, so a raised
 * signal, a spent time budget or an interrupt stops the member at the next
 * stage boundary. A stage that already started always runs to its end.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MethodFlowPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(
            MethodFlowPipeline.class);

    private final FlowGraphIngestor ingestor;
    private final FlowGraphNormalizer normalizer;
    private final ReachabilityAnalyzer reachabilityAnalyzer;
    private final ComplexityCalculator complexityCalculator;

    /**
     * Creates a new pipeline.
     *
     * @param theIngestor validates the raw graph
     * @param theNormalizer builds blocks and edges
     * @param theReachabilityAnalyzer marks reachable blocks
     * @param theComplexityCalculator computes the metrics
     */
    public MethodFlowPipeline(
            final FlowGraphIngestor theIngestor,
            final FlowGraphNormalizer theNormalizer,
            final ReachabilityAnalyzer theReachabilityAnalyzer,
            final ComplexityCalculator theComplexityCalculator) {
        this.ingestor = Preconditions.requireNonNull(theIngestor,
                "Ingestor is required");
        this.normalizer = Preconditions.requireNonNull(theNormalizer,
                "Normalizer is required");
        this.reachabilityAnalyzer = Preconditions.requireNonNull(
                theReachabilityAnalyzer, "Reachability analyzer is required");
        this.complexityCalculator = Preconditions.requireNonNull(
                theComplexityCalculator, "Complexity calculator is required");
    }

    /**
     * Analyzes one member without a cancellation signal.
     *
     * @param raw the raw graph, may be null
     * @return the complete method graph
     * @throws FlowGraphException if the input is missing or invalid
     */
    public MethodBlockGraph run(final RawFlowGraph raw) {
        return run(raw, CancellationSignal.none());
    }

    /**
     * Analyzes one member.
     *
     * @param raw the raw graph, may be null
     * @param signal the cancellation signal of the batch
     * @return the complete method graph
     * @throws FlowGraphException if the input is missing or invalid, or
     *         with {@link FlowGraphException#CANCELLED} or
     *         {@link FlowGraphException#TIMED_OUT} when the signal stops
     *         it between stages
     */
    public MethodBlockGraph run(final RawFlowGraph raw,
            final CancellationSignal signal) {
        Preconditions.requireNonNull(signal, "Cancellation signal is required");

        final String member = raw == null ? "<unavailable>" : raw.qualifiedName();

        signal.throwIfCancelled(member);
        final RawFlowGraph ingested = ingestor.ingest(raw);

        signal.throwIfCancelled(member);
        final MethodBlockGraph graph = normalizer.normalize(ingested);

        signal.throwIfCancelled(member);
        final int reachable = reachabilityAnalyzer.analyze(graph);

        signal.throwIfCancelled(member);
        graph.complete(complexityCalculator.calculate(graph));

        LOG.debug("Analyzed {}: {}/{} blocks reachable, complexity {}",
                member, reachable, graph.basicBlocks().size(),
                graph.metrics().cyclomaticComplexity());
        return graph;
    }

}
