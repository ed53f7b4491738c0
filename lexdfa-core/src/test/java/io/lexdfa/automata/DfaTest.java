package io.lexdfa.automata;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DfaTest {

    @Test
    void testResizePreservesStates() {
        Dfa dfa = new Dfa(4);
        assertEquals(1, dfa.getSize());
        dfa.resize(2);
        dfa.setTransition(0, 1, 3);
        dfa.setStop(1, 7);
        dfa.resize(40);
        assertEquals(40, dfa.getSize());
        assertEquals(1, dfa.getTransition(0, 3));
        assertTrue(dfa.isStop(1));
        assertEquals(7, dfa.getStopLabel(1));
        assertFalse(dfa.isStop(39));
        assertEquals(Dfa.NONE, dfa.getStopLabel(39));
        assertEquals(Dfa.NONE, dfa.getTransition(39, 0));
        dfa.resize(3);
        assertEquals(40, dfa.getSize());
    }

    @Test
    void testTransitionIsSetOnlyOnce() {
        Dfa dfa = new Dfa(2, 2);
        dfa.setTransition(0, 1, 0);
        AutomatonException e = assertThrows(AutomatonException.class, () -> dfa.setTransition(0, 0, 0));
        assertEquals(AutomatonException.Kind.DUPLICATE_TRANSITION, e.getKind());
        assertThrows(AutomatonException.class, () -> dfa.setTransition(0, 1, 0));
        assertEquals(1, dfa.getTransition(0, 0));
    }

    @Test
    void testBoundsChecks() {
        Dfa dfa = new Dfa(2);
        assertThrows(IllegalArgumentException.class, () -> dfa.setTransition(0, 1, 0));
        assertThrows(AutomatonException.class, () -> dfa.setTransition(0, 0, 2));
        assertThrows(IllegalArgumentException.class, () -> dfa.isStop(1));
    }

    @Test
    void testStopWithoutLabel() {
        Dfa dfa = new Dfa(2);
        dfa.setStop(0);
        assertTrue(dfa.isStop(0));
        assertEquals(Dfa.NONE, dfa.getStopLabel(0));
    }

    @Test
    void testFinishedDfaIsReadOnly() {
        Dfa dfa = new Dfa(2);
        dfa.finish();
        assertTrue(dfa.isFinished());
        assertThrows(IllegalStateException.class, () -> dfa.resize(2));
        assertThrows(IllegalStateException.class, () -> dfa.setStop(0));
        assertThrows(IllegalStateException.class, () -> dfa.setTransition(0, 0, 0));
    }

    @Test
    void testNextOnRawChars() {
        Dfa dfa = new Dfa(128, 2);
        dfa.setTransition(0, 1, 'a');
        assertEquals(1, dfa.next(0, 'a'));
        assertEquals(Dfa.NONE, dfa.next(0, 'b'));
        assertEquals(Dfa.NONE, dfa.next(0, '\u00e9'));
    }

    @Test
    void testJson() {
        Dfa dfa = new Dfa(3, 3);
        dfa.setTransition(0, 1, 0);
        dfa.setTransition(1, 2, 2);
        dfa.setTransition(2, 2, 2);
        dfa.setStop(2, 5);
        dfa.finish();
        String json = dfa.toJson();
        assertTrue(json.startsWith("{"));
        Dfa copy = Dfa.fromJson(json);
        assertTrue(copy.isFinished());
        assertEquals(3, copy.getSize());
        assertEquals(3, copy.getTransitionCount());
        assertEquals(2, copy.getTransition(1, 2));
        assertFalse(copy.isStop(1));
        assertEquals(5, copy.getStopLabel(2));
        assertEquals(json, copy.toJson());
    }

    @Test
    void testJsonRejectsBrokenTables() {
        assertThrows(AutomatonException.class, () -> Dfa.fromJson("{"));
        assertThrows(AutomatonException.class, () -> Dfa.fromJson("[]"));
        assertThrows(AutomatonException.class, () -> Dfa.fromJson("{\"alphabet\":2}"));
        assertThrows(AutomatonException.class,
                () -> Dfa.fromJson("{\"alphabet\":2,\"transitions\":[[0]],\"labels\":[null]}"));
        AutomatonException e = assertThrows(AutomatonException.class,
                () -> Dfa.fromJson("{\"alphabet\":2,\"transitions\":[[0,3]],\"labels\":[null]}"));
        assertEquals(AutomatonException.Kind.MALFORMED_AUTOMATON, e.getKind());
        assertMalformed("{\"alphabet\":2,\"transitions\":[[\"x\",null]],\"labels\":[null]}");
        assertMalformed("{\"alphabet\":2,\"transitions\":[[-1,null]],\"labels\":[null]}");
        assertMalformed("{\"alphabet\":2,\"transitions\":[[-1,-1]],\"labels\":[\"a\"]}");
        assertMalformed("{\"alphabet\":2,\"transitions\":[[-1,-1]],\"labels\":[-2]}");
        assertMalformed("{\"alphabet\":0,\"transitions\":[[]],\"labels\":[null]}");
        assertMalformed("{\"alphabet\":-3,\"transitions\":[[]],\"labels\":[null]}");
    }

    @Test
    void testJsonKeepsStopWithoutLabel() {
        Dfa dfa = Dfa.fromJson("{\"alphabet\":2,\"transitions\":[[-1,-1]],\"labels\":[-1]}");
        assertTrue(dfa.isStop(0));
        assertEquals(Dfa.NONE, dfa.getStopLabel(0));
    }

    private static void assertMalformed(String json) {
        AutomatonException e = assertThrows(AutomatonException.class, () -> Dfa.fromJson(json));
        assertEquals(AutomatonException.Kind.MALFORMED_AUTOMATON, e.getKind());
    }

}
