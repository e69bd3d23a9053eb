package co.fanki.flowgraph.flow.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block as reported by the compiler front end.
 *
 * <p>Successors are referenced by ordinal. A reference to an ordinal that
 * no block carries is tolerated here and dropped during normalization.</p>
 *
 * @param ordinal the block ordinal in the front end's numbering
 * @param operations the operations of the block, in execution order
 * @param branchValue the value the block branches on, may be null
 * @param fallThroughSuccessor the ordinal reached when falling through,
 *        may be null
 * @param conditionalSuccessor the ordinal reached when the branch is
 *        taken, may be null
 * @param exceptionHandler whether the block belongs to a catch or finally
 *        region
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RawBlock(
        int ordinal,
        List<RawOperation> operations,
        RawBranchValue branchValue,
        Integer fallThroughSuccessor,
        Integer conditionalSuccessor,
        boolean exceptionHandler) {

    /**
     * Copies the operations into an unmodifiable list.
     */
    public RawBlock {
        operations = operations == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(operations));
    }

    /**
     * Checks if this block has neither a fall-through nor a conditional
     * successor.
     *
     * @return true if control leaves the method after this block
     */
    public boolean hasNoSuccessor() {
        return fallThroughSuccessor == null && conditionalSuccessor == null;
    }
}
