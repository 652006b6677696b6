package io.lslite.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdjacencyListTest {

    private static final Name B = Name.parse("/site/router-b");
    private static final Name C = Name.parse("/site/router-c");

    private static AdjacencyList twoNeighbors() {
        return new AdjacencyList(List.of(
                new Adjacency(B, new Endpoint("10.0.0.2", 6363), 25),
                new Adjacency(C, null, 40)
        ));
    }

    @Test
    void neighborsStartInactiveWithZeroTimeouts() {
        AdjacencyList list = twoNeighbors();
        assertEquals(AdjacencyStatus.INACTIVE, list.getStatusOfNeighbor(B));
        assertEquals(0, list.getTimedOutProbeCount(C));
        assertEquals(0, list.activeCount());
    }

    @Test
    void countersIncrementAndReset() {
        AdjacencyList list = twoNeighbors();
        assertEquals(1, list.incrementTimedOutProbeCount(B));
        assertEquals(2, list.incrementTimedOutProbeCount(B));
        list.setTimedOutProbeCount(B, 0);
        assertEquals(0, list.getTimedOutProbeCount(B));
        assertThrows(IllegalArgumentException.class, () -> list.setTimedOutProbeCount(B, -1));
    }

    @Test
    void endpointCanBeAttachedLater() {
        AdjacencyList list = twoNeighbors();
        Adjacency c = list.findAdjacent(C).orElseThrow();
        assertFalse(c.hasEndpoint());

        list.setEndpoint(C, new Endpoint("10.0.0.3", 6363));
        assertTrue(c.hasEndpoint());
        assertEquals("10.0.0.3:6363", c.endpoint().target());
    }

    @Test
    void unknownNeighborIsRejected() {
        AdjacencyList list = twoNeighbors();
        Name stranger = Name.parse("/elsewhere/router-z");
        assertFalse(list.isNeighbor(stranger));
        assertTrue(list.findAdjacent(stranger).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> list.getStatusOfNeighbor(stranger));
    }

    @Test
    void duplicateNeighborsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AdjacencyList(List.of(
                new Adjacency(B, null, 10),
                new Adjacency(B, null, 20)
        )));
    }
}
