package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.flow.domain.EdgeKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for RelationshipType.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RelationshipTypeTest {

    @Test
    void whenMappingEdge_givenEachKind_shouldPickRelationship() {
        assertEquals(RelationshipType.FLOWS_TO,
                RelationshipType.forEdge(EdgeKind.REGULAR));
        assertEquals(RelationshipType.FLOWS_TO,
                RelationshipType.forEdge(EdgeKind.EXCEPTION));
        assertEquals(RelationshipType.BRANCHES_TO,
                RelationshipType.forEdge(EdgeKind.CONDITIONAL_TRUE));
        assertEquals(RelationshipType.BRANCHES_TO,
                RelationshipType.forEdge(EdgeKind.CONDITIONAL_FALSE));
        assertEquals(RelationshipType.LOOPS_TO,
                RelationshipType.forEdge(EdgeKind.BACK_EDGE));
    }

    @Test
    void whenReversing_givenLoopsTo_shouldSwapNamesAndKeepCategory() {
        final RelationshipType reversed = RelationshipType.LOOPS_TO.reversed();

        assertEquals("loops-from", reversed.forward());
        assertEquals("loops-to", reversed.reverse());
        assertEquals("control-flow", reversed.category());
    }

}
