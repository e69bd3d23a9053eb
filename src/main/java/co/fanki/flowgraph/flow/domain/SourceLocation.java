package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.ValueObject;

/**
 * A span of source text, with 1-based lines and columns.
 *
 * @param filePath the file the span belongs to, may be null
 * @param startLine the first line of the span
 * @param startColumn the first column of the span
 * @param endLine the last line of the span
 * @param endColumn the column right after the span
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceLocation(
        String filePath,
        int startLine,
        int startColumn,
        int endLine,
        int endColumn) implements ValueObject {

    /**
     * Creates a span on a single line of an unnamed file.
     *
     * @param line the line number
     * @param startColumn the first column
     * @param endColumn the column right after the span
     * @return the location
     */
    public static SourceLocation ofLine(final int line, final int startColumn,
            final int endColumn) {
        return new SourceLocation(null, line, startColumn, line, endColumn);
    }
}
