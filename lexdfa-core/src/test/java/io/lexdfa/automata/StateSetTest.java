package io.lexdfa.automata;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StateSetTest {

    @Test
    void testCanonicalForm() {
        StateSet set = StateSet.of(5, 1, 3, 1, 5);
        assertArrayEquals(new int[]{1, 3, 5}, set.toArray());
        assertEquals(3, set.size());
        assertEquals("{1,3,5}", set.toString());
        assertTrue(set.contains(3));
        assertFalse(set.contains(2));
    }

    @Test
    void testEqualityIgnoresInsertionOrder() {
        StateSet a = StateSet.of(3, 2, 1);
        StateSet b = StateSet.of(List.of(1, 2, 3, 2));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        Map<StateSet, Integer> map = new HashMap<>();
        map.put(a, 7);
        assertEquals(7, map.get(b));
        assertNotEquals(a, StateSet.of(1, 2));
    }

    @Test
    void testEmpty() {
        assertSame(StateSet.EMPTY, StateSet.of());
        assertTrue(StateSet.of(List.of()).isEmpty());
        assertFalse(StateSet.EMPTY.iterator().hasNext());
    }

    @Test
    void testToArrayIsCopy() {
        StateSet set = StateSet.of(1, 2);
        int[] array = set.toArray();
        array[0] = 99;
        assertEquals(1, set.get(0));
    }

}
