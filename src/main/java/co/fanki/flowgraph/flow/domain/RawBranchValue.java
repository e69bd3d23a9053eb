package co.fanki.flowgraph.flow.domain;

/**
 * The value a raw block branches on.
 *
 * @param conditionText the condition as written in the source
 * @param branchType the construct owning the branch (conditional, loop or
 *        switch); null means conditional
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RawBranchValue(String conditionText, String branchType) {

    /**
     * Creates a branch value for a plain conditional.
     *
     * @param conditionText the condition text
     * @return the branch value
     */
    public static RawBranchValue conditional(final String conditionText) {
        return new RawBranchValue(conditionText, null);
    }
}
