package io.lexdfa.automata;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeterminizerTest {

    private static final int A = 0;
    private static final int B = 1;
    private static final int C = 2;

    // a b* over the alphabet {a, b, c}
    private static Nfa abStar() {
        Nfa nfa = new Nfa(3);
        int s0 = nfa.addState();
        int s1 = nfa.addState();
        nfa.addStart(s0);
        nfa.addTransition(s0, A, s1);
        nfa.addTransition(s1, B, s1);
        nfa.markAccepting(s1, 0);
        return nfa;
    }

    @Test
    void testEmptyNfa() {
        Dfa dfa = Determinizer.toDfa(new Nfa());
        assertEquals(1, dfa.getSize());
        assertFalse(dfa.isStop(0));
        assertEquals(0, dfa.getTransitionCount());
        assertTrue(dfa.isFinished());
    }

    @Test
    void testEmptyNfaWithSinkState() {
        Dfa dfa = new Determinizer(true, 0).determinize(new Nfa(3));
        assertEquals(1, dfa.getSize());
        for (int symbol = 0; symbol < 3; symbol++) {
            assertEquals(0, dfa.getTransition(0, symbol));
        }
    }

    @Test
    void testSimpleChain() {
        Dfa dfa = Determinizer.toDfa(abStar());
        assertEquals(2, dfa.getSize());
        assertFalse(dfa.isStop(0));
        int afterA = dfa.getTransition(0, A);
        assertEquals(1, afterA);
        assertTrue(dfa.isStop(afterA));
        assertEquals(0, dfa.getStopLabel(afterA));
        assertEquals(afterA, dfa.getTransition(afterA, B));
        assertEquals(Dfa.NONE, dfa.getTransition(0, B));
        assertEquals(Dfa.NONE, dfa.getTransition(afterA, A));
        assertEquals(Dfa.NONE, dfa.getTransition(afterA, C));
    }

    @Test
    void testKeepInvalidAddsSink() {
        Dfa dfa = new Determinizer(true, 0).determinize(abStar());
        assertEquals(3, dfa.getSize());
        int sink = dfa.getTransition(0, B);
        assertNotEquals(Dfa.NONE, sink);
        assertFalse(dfa.isStop(sink));
        for (int state = 0; state < dfa.getSize(); state++) {
            for (int symbol = 0; symbol < 3; symbol++) {
                assertNotEquals(Dfa.NONE, dfa.getTransition(state, symbol));
            }
        }
        for (int symbol = 0; symbol < 3; symbol++) {
            assertEquals(sink, dfa.getTransition(sink, symbol));
        }
    }

    @Test
    void testNondeterminismCollapses() {
        // 0 -a-> 1, 0 -a-> 2, 1 -b-> 3, 2 -c-> 3
        Nfa nfa = new Nfa(3);
        for (int i = 0; i < 4; i++) {
            nfa.addState();
        }
        nfa.addStart(0);
        nfa.addTransition(0, A, 1);
        nfa.addTransition(0, A, 2);
        nfa.addTransition(1, B, 3);
        nfa.addTransition(2, C, 3);
        nfa.markAccepting(3, 0);
        Dfa dfa = Determinizer.toDfa(nfa);
        assertEquals(3, dfa.getSize());
        int both = dfa.getTransition(0, A);
        int end = dfa.getTransition(both, B);
        assertEquals(end, dfa.getTransition(both, C));
        assertTrue(dfa.isStop(end));
    }

    @Test
    void testHighestPrecedenceLabelWins() {
        Nfa nfa = new Nfa(3);
        for (int i = 0; i < 4; i++) {
            nfa.addState();
        }
        nfa.addStart(0);
        nfa.addTransition(0, A, 1);
        nfa.addTransition(0, A, 2);
        nfa.addTransition(0, B, 3);
        nfa.markAccepting(1, 5);
        nfa.markAccepting(2, 2);
        nfa.markAccepting(3, 5);
        Dfa dfa = Determinizer.toDfa(nfa);
        assertEquals(2, dfa.getStopLabel(dfa.getTransition(0, A)));
        assertEquals(5, dfa.getStopLabel(dfa.getTransition(0, B)));
    }

    @Test
    void testAcceptingStartState() {
        Nfa nfa = abStar();
        nfa.markAccepting(0, 1);
        Dfa dfa = Determinizer.toDfa(nfa);
        assertTrue(dfa.isStop(0));
        assertEquals(1, dfa.getStopLabel(0));
    }

    @Test
    void testEpsilonCycleTerminates() {
        Nfa nfa = new Nfa(3);
        for (int i = 0; i < 3; i++) {
            nfa.addState();
        }
        nfa.addStart(0);
        nfa.addEpsilon(0, 1);
        nfa.addEpsilon(1, 0);
        nfa.addTransition(1, A, 2);
        nfa.addEpsilon(2, 0);
        nfa.markAccepting(2, 0);
        Dfa dfa = Determinizer.toDfa(nfa);
        assertEquals(2, dfa.getSize());
        int s = dfa.getTransition(0, A);
        assertEquals(s, dfa.getTransition(s, A));
    }

    @Test
    void testEachSubsetBecomesOneState() {
        // (a|b)* a (a|b) (a|b): the classic blow-up, 8 reachable subsets
        Nfa nfa = new Nfa(2);
        for (int i = 0; i < 4; i++) {
            nfa.addState();
        }
        nfa.addStart(0);
        nfa.addTransition(0, A, 0);
        nfa.addTransition(0, B, 0);
        nfa.addTransition(0, A, 1);
        nfa.addTransition(1, A, 2);
        nfa.addTransition(1, B, 2);
        nfa.addTransition(2, A, 3);
        nfa.addTransition(2, B, 3);
        nfa.markAccepting(3, 0);
        Determinizer determinizer = new Determinizer();
        Dfa dfa = determinizer.determinize(nfa);
        assertEquals(8, dfa.getSize());
        assertEquals(dfa.getSize(), determinizer.getInsertions());
        // the start subset is inserted without a lookup
        assertEquals(determinizer.getLookups() + 1, determinizer.getInsertions() + determinizer.getHits());
        assertEquals(dfa.getSize() * 2, determinizer.getLookups());
    }

    @Test
    void testCountersResetBetweenRuns() {
        Determinizer determinizer = new Determinizer();
        determinizer.determinize(abStar());
        int lookups = determinizer.getLookups();
        determinizer.determinize(abStar());
        assertEquals(lookups, determinizer.getLookups());
        assertEquals(2, determinizer.getInsertions());
    }

    @Test
    void testMalformedNfaFailsAtBuild() {
        Nfa nfa = abStar();
        nfa.addTransition(1, C, 42);
        AutomatonException e = assertThrows(AutomatonException.class, () -> Determinizer.toDfa(nfa));
        assertEquals(AutomatonException.Kind.MALFORMED_AUTOMATON, e.getKind());
    }

    @Test
    void testStateLimit() {
        AutomatonException e = assertThrows(AutomatonException.class,
                () -> new Determinizer(false, 1).determinize(abStar()));
        assertEquals(AutomatonException.Kind.RESOURCE_EXHAUSTION, e.getKind());
        assertEquals(2, new Determinizer(false, 2).determinize(abStar()).getSize());
    }

}
