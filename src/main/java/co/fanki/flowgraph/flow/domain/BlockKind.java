package co.fanki.flowgraph.flow.domain;

/**
 * The role of a basic block in its method graph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum BlockKind {

    /** Where execution of the method begins. */
    ENTRY,

    /** Where execution of the method ends. */
    EXIT,

    /** Any other block. */
    BLOCK,

    /** A block of a catch or finally region. */
    EXCEPTION_HANDLER

}
