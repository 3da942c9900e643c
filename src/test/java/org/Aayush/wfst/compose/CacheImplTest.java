package org.Aayush.wfst.compose;

import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.Fst;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CacheImpl Tests")
class CacheImplTest {

    @Test
    @DisplayName("Arcs and final weights are stored once per state")
    void testStoreOnce() {
        CacheImpl<Double> cache = new CacheImpl<>();
        List<Arc<Double>> arcs = new ArrayList<>();
        arcs.add(new Arc<>(1, 1, 0.0d, 3));

        assertFalse(cache.hasArcs(3));
        cache.setArcs(3, arcs);
        assertTrue(cache.hasArcs(3));
        assertFalse(cache.hasArcs(0));
        assertEquals(1, cache.expandedStates());
        assertThrows(UnsupportedOperationException.class, () -> cache.arcs(3).clear());
        assertThrows(IllegalStateException.class, () -> cache.setArcs(3, new ArrayList<>()));

        cache.setFinal(1, null);
        assertTrue(cache.hasFinal(1));
        assertNull(cache.finalWeight(1));
        assertThrows(IllegalStateException.class, () -> cache.setFinal(1, 0.0d));
    }

    @Test
    @DisplayName("Start is cached once, including 'no start'")
    void testStart() {
        CacheImpl<Double> cache = new CacheImpl<>();

        assertFalse(cache.hasStart());
        cache.setStart(Fst.NO_STATE);
        assertTrue(cache.hasStart());
        assertEquals(Fst.NO_STATE, cache.start());
        assertThrows(IllegalStateException.class, () -> cache.setStart(0));
    }
}
