package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A maximal straight-line run of operations in a method graph.
 *
 * <p>The id is the block ordinal: the position of the block in the order
 * the front end listed it. Everything but reachability is fixed at
 * construction; reachability can only go from false to true.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class BasicBlock {

    private final int id;
    private final BlockKind kind;
    private final List<Operation> operations;
    private final BranchInfo branchInfo;
    private final Set<Integer> predecessors;
    private final Set<Integer> successors;
    private boolean reachable;

    /**
     * Creates a new basic block.
     *
     * @param theId the block ordinal
     * @param theKind the block role
     * @param theOperations the operations in execution order
     * @param theBranchInfo what the block branches on, may be null
     * @param thePredecessors ids of the blocks flowing into this one
     * @param theSuccessors ids of the blocks this one flows into
     */
    public BasicBlock(
            final int theId,
            final BlockKind theKind,
            final List<Operation> theOperations,
            final BranchInfo theBranchInfo,
            final Set<Integer> thePredecessors,
            final Set<Integer> theSuccessors) {
        this.id = Preconditions.requireNonNegative(theId,
                "Block id must be >= 0");
        this.kind = Preconditions.requireNonNull(theKind,
                "Block kind is required");
        this.operations = theOperations != null
                ? Collections.unmodifiableList(new ArrayList<>(theOperations))
                : List.of();
        this.branchInfo = theBranchInfo;
        this.predecessors = thePredecessors != null
                ? Collections.unmodifiableSet(
                        new LinkedHashSet<>(thePredecessors))
                : Set.of();
        this.successors = theSuccessors != null
                ? Collections.unmodifiableSet(
                        new LinkedHashSet<>(theSuccessors))
                : Set.of();
    }

    /** Marks this block as reachable from the entry block. */
    void markReachable() {
        reachable = true;
    }

    public int id() {
        return id;
    }

    /**
     * Returns the block ordinal, which is also its id.
     *
     * @return the ordinal
     */
    public int ordinal() {
        return id;
    }

    public BlockKind kind() {
        return kind;
    }

    public List<Operation> operations() {
        return operations;
    }

    public BranchInfo branchInfo() {
        return branchInfo;
    }

    public Set<Integer> predecessors() {
        return predecessors;
    }

    public Set<Integer> successors() {
        return successors;
    }

    public boolean isReachable() {
        return reachable;
    }

    /**
     * Checks if the block ends with a branch.
     *
     * @return true if branch information is present
     */
    public boolean hasBranch() {
        return branchInfo != null;
    }

    @Override
    public String toString() {
        return "Block " + id + " (" + kind + ", " + operations.size()
                + " operations)";
    }

}
