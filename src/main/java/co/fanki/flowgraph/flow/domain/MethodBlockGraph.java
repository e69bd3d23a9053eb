package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The block-level control-flow graph of one method or constructor.
 *
 * <p>Blocks are held in a list indexed by their id, so that lookups by id
 * are direct. Edges are held in a single list; the predecessor and
 * successor sets of each block are built from that same list when the
 * graph is normalized.</p>
 *
 * <p>The graph is created by {@link FlowGraphNormalizer}. It is complete
 * once {@link MethodFlowPipeline} attached its metrics; after that nothing
 * in it changes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MethodBlockGraph {

    private final String methodName;
    private final String typeName;
    private final SourceLocation location;
    private final List<BasicBlock> basicBlocks;
    private final List<Edge> edges;
    private final BasicBlock entryBlock;
    private final BasicBlock exitBlock;
    private final List<String> diagnostics;
    private ComplexityMetrics metrics;

    /**
     * Creates a new method graph.
     *
     * @param theMethodName the member display name
     * @param theTypeName the declaring type name, empty when unknown
     * @param theLocation the member location, may be null
     * @param theBasicBlocks the blocks; the block at index i has id i
     * @param theEdges the edges between the blocks
     * @param theExitBlock the recorded exit block, may be null
     * @param theDiagnostics problems found while normalizing
     */
    MethodBlockGraph(
            final String theMethodName,
            final String theTypeName,
            final SourceLocation theLocation,
            final List<BasicBlock> theBasicBlocks,
            final List<Edge> theEdges,
            final BasicBlock theExitBlock,
            final List<String> theDiagnostics) {
        this.methodName = Preconditions.requireNonBlank(theMethodName,
                "Method name is required");
        this.typeName = theTypeName == null ? "" : theTypeName;
        this.location = theLocation;
        this.basicBlocks = Collections.unmodifiableList(
                new ArrayList<>(theBasicBlocks));
        this.edges = Collections.unmodifiableList(new ArrayList<>(theEdges));
        this.diagnostics = Collections.unmodifiableList(
                new ArrayList<>(theDiagnostics));

        for (int i = 0; i < basicBlocks.size(); i++) {
            Preconditions.requireDomain(basicBlocks.get(i).id() == i,
                    "Block at position " + i + " must have id " + i);
        }
        for (final Edge edge : edges) {
            Preconditions.requireDomain(
                    edge.source() < basicBlocks.size()
                            && edge.target() < basicBlocks.size(),
                    "Edge " + edge.source() + " -> " + edge.target()
                            + " references an unknown block");
        }

        this.entryBlock = basicBlocks.isEmpty() ? null : basicBlocks.get(0);
        this.exitBlock = theExitBlock;
    }

    /**
     * Attaches the metrics, completing the graph.
     *
     * @param theMetrics the computed metrics
     */
    void complete(final ComplexityMetrics theMetrics) {
        Preconditions.requireNonNull(theMetrics, "Metrics are required");
        Preconditions.requireDomain(metrics == null,
                "Metrics of " + methodName + " are already attached");
        this.metrics = theMetrics;
    }

    /**
     * Checks if the metrics were attached.
     *
     * @return true once the pipeline completed the graph
     */
    public boolean isComplete() {
        return metrics != null;
    }

    /**
     * Returns the block with the given id.
     *
     * @param id the block id
     * @return the block, or empty if no block has that id
     */
    public Optional<BasicBlock> block(final int id) {
        if (id < 0 || id >= basicBlocks.size()) {
            return Optional.empty();
        }
        return Optional.of(basicBlocks.get(id));
    }

    /**
     * Returns the blocks reachable from the entry block.
     *
     * @return the reachable blocks in id order
     */
    public List<BasicBlock> reachableBlocks() {
        return basicBlocks.stream().filter(BasicBlock::isReachable).toList();
    }

    /**
     * Returns the blocks no path from the entry reaches, that is dead code.
     *
     * @return the unreachable blocks in id order
     */
    public List<BasicBlock> unreachableBlocks() {
        return basicBlocks.stream().filter(b -> !b.isReachable()).toList();
    }

    /**
     * Returns the blocks at either end of a back edge.
     *
     * @return the loop blocks in id order
     */
    public List<BasicBlock> loopBlocks() {
        final Set<Integer> ids = new HashSet<>();
        for (final Edge edge : edges) {
            if (edge.kind() == EdgeKind.BACK_EDGE) {
                ids.add(edge.source());
                ids.add(edge.target());
            }
        }
        return basicBlocks.stream().filter(b -> ids.contains(b.id())).toList();
    }

    /**
     * Checks the structure of the graph.
     *
     * <p>Reports a missing entry or exit block, edges to unknown blocks and
     * blocks other than the entry that no edge enters. An empty list means
     * the graph is well formed.</p>
     *
     * @return the problems found, in a stable order
     */
    public List<String> validate() {
        final List<String> errors = new ArrayList<>();

        if (entryBlock == null) {
            errors.add("Graph has no entry block");
        }
        if (exitBlock == null) {
            errors.add("Graph has no exit block");
        }

        final Set<Integer> entered = new HashSet<>();
        for (final Edge edge : edges) {
            if (block(edge.source()).isEmpty()) {
                errors.add("Edge references unknown source block "
                        + edge.source());
            }
            if (block(edge.target()).isEmpty()) {
                errors.add("Edge references unknown target block "
                        + edge.target());
            }
            entered.add(edge.target());
        }

        for (final BasicBlock block : basicBlocks) {
            if (block.kind() != BlockKind.ENTRY
                    && !entered.contains(block.id())) {
                errors.add("Block " + block.id() + " has no incoming edges");
            }
        }
        return errors;
    }

    public String methodName() {
        return methodName;
    }

    public String typeName() {
        return typeName;
    }

    public SourceLocation location() {
        return location;
    }

    public List<BasicBlock> basicBlocks() {
        return basicBlocks;
    }

    public List<Edge> edges() {
        return edges;
    }

    /**
     * Returns the entry block.
     *
     * @return the first block, or null when the graph has no blocks
     */
    public BasicBlock entryBlock() {
        return entryBlock;
    }

    /**
     * Returns the exit block.
     *
     * <p>When several blocks have no successor, the last one is kept.</p>
     *
     * @return the exit block, or null when no block qualifies
     */
    public BasicBlock exitBlock() {
        return exitBlock;
    }

    /**
     * Returns the metrics of the graph.
     *
     * @return the metrics, or null until the graph is complete
     */
    public ComplexityMetrics metrics() {
        return metrics;
    }

    /**
     * Returns the problems recorded while normalizing, such as edges to
     * ordinals no block carries.
     *
     * @return the diagnostics, empty for a clean input
     */
    public List<String> diagnostics() {
        return diagnostics;
    }

}
