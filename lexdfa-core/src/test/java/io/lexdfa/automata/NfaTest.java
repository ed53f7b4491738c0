package io.lexdfa.automata;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NfaTest {

    @Test
    void testEpsilonClosureIncludesInput() {
        Nfa nfa = new Nfa();
        int s0 = nfa.addState();
        int s1 = nfa.addState();
        int s2 = nfa.addState();
        nfa.addEpsilon(s0, s1);
        assertEquals(StateSet.of(s0, s1), nfa.epsilonClosure(StateSet.of(s0)));
        assertEquals(StateSet.of(s2), nfa.epsilonClosure(StateSet.of(s2)));
    }

    @Test
    void testEpsilonClosureTerminatesOnCycles() {
        Nfa nfa = new Nfa();
        for (int i = 0; i < 4; i++) {
            nfa.addState();
        }
        nfa.addEpsilon(0, 1);
        nfa.addEpsilon(1, 2);
        nfa.addEpsilon(2, 0);
        nfa.addEpsilon(2, 2);
        assertEquals(StateSet.of(0, 1, 2), nfa.epsilonClosure(StateSet.of(1)));
    }

    @Test
    void testGetNextUnionsDestinationsAndCloses() {
        Nfa nfa = new Nfa();
        for (int i = 0; i < 4; i++) {
            nfa.addState();
        }
        nfa.addTransition(0, 'a', 1);
        nfa.addTransition(0, 'a', 2);
        nfa.addEpsilon(2, 3);
        assertEquals(StateSet.of(1, 2, 3), nfa.getNext('a', StateSet.of(0)));
        assertTrue(nfa.getNext('b', StateSet.of(0)).isEmpty());
        assertTrue(nfa.getNext('a', StateSet.EMPTY).isEmpty());
    }

    @Test
    void testGetStartIsClosureOfAllStarts() {
        Nfa nfa = new Nfa();
        for (int i = 0; i < 5; i++) {
            nfa.addState();
        }
        nfa.addStart(0);
        nfa.addStart(3);
        nfa.addEpsilon(3, 4);
        assertEquals(StateSet.of(0, 3), nfa.getStarts());
        assertEquals(StateSet.of(0, 3, 4), nfa.getStart());
        assertTrue(new Nfa().getStart().isEmpty());
    }

    @Test
    void testAccepting() {
        Nfa nfa = new Nfa();
        int s0 = nfa.addState();
        int s1 = nfa.addState();
        nfa.markAccepting(s1, 4);
        assertFalse(nfa.isStop(s0));
        assertTrue(nfa.isStop(s1));
        assertEquals(4, nfa.getPriority(s1));
        assertEquals(List.of(s1), nfa.getAcceptingStates());
        assertThrows(IllegalArgumentException.class, () -> nfa.getPriority(s0));
    }

    @Test
    void testSymbolOutsideAlphabet() {
        Nfa nfa = new Nfa(2);
        nfa.addState();
        nfa.addTransition(0, 1, 0);
        AutomatonException e = assertThrows(AutomatonException.class, () -> nfa.addTransition(0, 2, 0));
        assertEquals(AutomatonException.Kind.INVALID_SYMBOL, e.getKind());
        assertThrows(AutomatonException.class, () -> nfa.getNext(-1, StateSet.of(0)));
    }

    @Test
    void testValidateReportsDanglingReferences() {
        Nfa nfa = new Nfa();
        nfa.addState();
        nfa.addTransition(0, 'a', 5);
        AutomatonException e = assertThrows(AutomatonException.class, nfa::validate);
        assertEquals(AutomatonException.Kind.MALFORMED_AUTOMATON, e.getKind());

        Nfa eps = new Nfa();
        eps.addState();
        eps.addEpsilon(0, 1);
        assertThrows(AutomatonException.class, eps::validate);
        eps.addState();
        eps.validate();
    }

    @Test
    void testUnknownSourceStateIsRejected() {
        Nfa nfa = new Nfa();
        assertThrows(IllegalArgumentException.class, () -> nfa.addTransition(0, 'a', 0));
        assertThrows(IllegalArgumentException.class, () -> nfa.addStart(0));
    }

    @Test
    void testStateLimit() {
        Nfa nfa = new Nfa(Nfa.DEFAULT_ALPHABET_SIZE, 2);
        nfa.addState();
        nfa.addState();
        AutomatonException e = assertThrows(AutomatonException.class, nfa::addState);
        assertEquals(AutomatonException.Kind.RESOURCE_EXHAUSTION, e.getKind());
    }

    @Test
    void testAppendBeyondLimitCopiesNothing() {
        Nfa nfa = new Nfa(Nfa.DEFAULT_ALPHABET_SIZE, 3);
        nfa.addState();
        Nfa fragment = new Nfa();
        fragment.addState();
        fragment.addState();
        fragment.addState();
        AutomatonException e = assertThrows(AutomatonException.class, () -> nfa.append(fragment));
        assertEquals(AutomatonException.Kind.RESOURCE_EXHAUSTION, e.getKind());
        assertEquals(1, nfa.size());
        Nfa small = new Nfa();
        small.addState();
        small.addState();
        assertEquals(1, nfa.append(small));
        assertEquals(3, nfa.size());
    }

    @Test
    void testArenaGrowsPastInitialCapacity() {
        Nfa nfa = new Nfa();
        for (int i = 0; i < 100; i++) {
            assertEquals(i, nfa.addState());
        }
        for (int i = 0; i < 99; i++) {
            nfa.addEpsilon(i, i + 1);
        }
        assertEquals(100, nfa.epsilonClosure(StateSet.of(0)).size());
    }

    @Test
    void testAppendShiftsIndices() {
        Nfa fragment = new Nfa();
        int f0 = fragment.addState();
        int f1 = fragment.addState();
        fragment.addTransition(f0, 'x', f1);
        fragment.addEpsilon(f1, f0);
        fragment.markAccepting(f1, 9);
        fragment.addStart(f0);

        Nfa master = new Nfa();
        master.addState();
        int offset = master.append(fragment);
        assertEquals(1, offset);
        assertEquals(3, master.size());
        assertEquals(StateSet.of(2, 1), master.getNext('x', StateSet.of(1)));
        assertTrue(master.isStop(2));
        assertEquals(9, master.getPriority(2));
        assertTrue(master.getStarts().isEmpty());
    }

    @Test
    void testAppendRejectsWiderAlphabet() {
        Nfa master = new Nfa(2);
        Nfa fragment = new Nfa(128);
        assertThrows(AutomatonException.class, () -> master.append(fragment));
    }

}
