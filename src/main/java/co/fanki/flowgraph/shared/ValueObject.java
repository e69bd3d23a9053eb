package co.fanki.flowgraph.shared;

import java.io.Serializable;

/**
 * Marker for value objects of the flow and knowledge models.
 *
 * <p>Edges, source spans, relationship types and visualization hints are
 * compared by value, never by identity. Implementations are immutable
 * records that validate themselves on construction.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
