package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The raw flow graphs of every method and constructor of one compilation
 * unit, as handed over by the compiler front end.
 *
 * <p>Front ends that are not written in Java hand the unit over as JSON:</p>
 * <pre>
 * {
 *   "name": "Calculator.cs",
 *   "members": [
 *     { "name": "Add", "containingTypeName": "Demo.Calculator",
 *       "parameterTypes": ["int", "int"],
 *       "blocks": [ { "ordinal": 0, "fallThroughSuccessor": 1,
 *                     "operations": [ { "kind": "Return",
 *                                       "sourceText": "return a + b;" } ] },
 *                   { "ordinal": 1 } ] }
 *   ]
 * }
 * </pre>
 *
 * <p>A member may be {@code null} in the list; it stays null here and is
 * reported as unavailable by the batch.</p>
 *
 * @param name the unit name, usually its file path
 * @param members the member graphs in declaration order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RawCompilationUnit(String name, List<RawFlowGraph> members) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                    false);

    /**
     * Copies the members into an unmodifiable list that may hold nulls.
     */
    public RawCompilationUnit {
        Preconditions.requireNonBlank(name, "Compilation unit name is required");
        members = members == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(members));
    }

    /**
     * Reads a compilation unit from its JSON form.
     *
     * @param json the JSON document
     * @return the compilation unit
     * @throws FlowGraphException with {@link FlowGraphException#INVALID_INPUT}
     *         if the document cannot be read
     */
    public static RawCompilationUnit fromJson(final String json) {
        Preconditions.requireNonBlank(json, "JSON is required");
        try {
            return MAPPER.readValue(json, RawCompilationUnit.class);
        } catch (final JsonProcessingException e) {
            throw FlowGraphException.invalidInput(
                    "Failed to read compilation unit: "
                            + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a compilation unit from a JSON stream.
     *
     * @param input the stream, closed by the caller
     * @return the compilation unit
     * @throws FlowGraphException with {@link FlowGraphException#INVALID_INPUT}
     *         if the stream cannot be read
     */
    public static RawCompilationUnit fromJson(final InputStream input) {
        Preconditions.requireNonNull(input, "Input stream is required");
        try {
            return MAPPER.readValue(input, RawCompilationUnit.class);
        } catch (final IOException e) {
            throw FlowGraphException.invalidInput(
                    "Failed to read compilation unit: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the number of members in this unit, null members included.
     *
     * @return the member count
     */
    public int memberCount() {
        return members.size();
    }
}
