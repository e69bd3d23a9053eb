package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.shared.ValueObject;

/**
 * How a renderer should present a node. Renderers are free to ignore it.
 *
 * @param color the fill color as a hex string
 * @param icon the icon name, may be null
 * @param preferredLayout the layout the node reads best in
 * @param collapsed whether the node starts collapsed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record VisualizationHints(
        String color,
        String icon,
        String preferredLayout,
        boolean collapsed) implements ValueObject {
}
