/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.lexdfa.automata;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static io.lexdfa.automata.AutomatonException.Kind.*;

/**
 * Nondeterministic finite automaton over a fixed alphabet of
 * {@code alphabetSize} symbols. States live in a dense arena and are
 * addressed by index; transitions store destination indices.
 * <p>
 * Accepting states carry a priority, lower value meaning higher precedence.
 */
public class Nfa {

    public static final int DEFAULT_ALPHABET_SIZE = 128;

    private static final int MIN_CAPACITY = 16;

    private static final class State {

        final Map<Integer, TreeSet<Integer>> transitions = new HashMap<>();
        final TreeSet<Integer> epsilons = new TreeSet<>();
        boolean accepting;
        int priority;

    }

    private final int alphabetSize;
    private final int maxStates;
    private final TreeSet<Integer> starts = new TreeSet<>();

    private State[] states;
    private int count;

    public Nfa() {
        this(DEFAULT_ALPHABET_SIZE, 0);
    }

    public Nfa(int alphabetSize) {
        this(alphabetSize, 0);
    }

    /**
     * @param alphabetSize number of symbols, transitions use {@code 0..alphabetSize-1}
     * @param maxStates    capacity limit for {@link #addState()}, 0 for none
     */
    public Nfa(int alphabetSize, int maxStates) {
        if (alphabetSize <= 0) {
            throw new IllegalArgumentException("alphabet size must be positive: " + alphabetSize);
        }
        if (maxStates < 0) {
            throw new IllegalArgumentException("max states must not be negative: " + maxStates);
        }
        this.alphabetSize = alphabetSize;
        this.maxStates = maxStates;
        this.states = new State[MIN_CAPACITY];
    }

    // ========== Construction ==========

    public int addState() {
        if (maxStates > 0 && count >= maxStates) {
            throw new AutomatonException(RESOURCE_EXHAUSTION, "nfa state limit reached: " + maxStates);
        }
        if (count >= states.length) {
            states = Arrays.copyOf(states, states.length * 2);
        }
        states[count] = new State();
        return count++;
    }

    public void addTransition(int from, int symbol, int to) {
        checkSymbol(symbol);
        state(from).transitions.computeIfAbsent(symbol, k -> new TreeSet<>()).add(to);
    }

    public void addEpsilon(int from, int to) {
        state(from).epsilons.add(to);
    }

    public void addStart(int state) {
        state(state);
        starts.add(state);
    }

    public void markAccepting(int state, int priority) {
        State s = state(state);
        s.accepting = true;
        s.priority = priority;
    }

    /**
     * Copies every state of the fragment into this automaton. The fragment's
     * start states are not made start states here; callers add their own
     * entry edges using the returned offset.
     *
     * @return the index in this automaton of the fragment's state 0
     * @throws AutomatonException if the fragment does not fit, nothing is copied then
     */
    public int append(Nfa fragment) {
        if (fragment.alphabetSize > alphabetSize) {
            throw new AutomatonException(INVALID_SYMBOL, "fragment alphabet " + fragment.alphabetSize
                    + " exceeds alphabet " + alphabetSize);
        }
        if (maxStates > 0 && count + fragment.count > maxStates) {
            throw new AutomatonException(RESOURCE_EXHAUSTION, "nfa state limit reached: " + maxStates
                    + ", cannot append " + fragment.count + " states to " + count);
        }
        int offset = count;
        for (int i = 0; i < fragment.count; i++) {
            addState();
        }
        for (int i = 0; i < fragment.count; i++) {
            State src = fragment.states[i];
            State dest = states[offset + i];
            for (Map.Entry<Integer, TreeSet<Integer>> entry : src.transitions.entrySet()) {
                TreeSet<Integer> targets = new TreeSet<>();
                for (int to : entry.getValue()) {
                    targets.add(to + offset);
                }
                dest.transitions.put(entry.getKey(), targets);
            }
            for (int to : src.epsilons) {
                dest.epsilons.add(to + offset);
            }
            dest.accepting = src.accepting;
            dest.priority = src.priority;
        }
        return offset;
    }

    // ========== Queries ==========

    public int getAlphabetSize() {
        return alphabetSize;
    }

    public int size() {
        return count;
    }

    public StateSet getStarts() {
        return StateSet.of(starts);
    }

    public boolean isStop(int state) {
        return state(state).accepting;
    }

    public int getPriority(int state) {
        State s = state(state);
        if (!s.accepting) {
            throw new IllegalArgumentException("state " + state + " is not accepting");
        }
        return s.priority;
    }

    public List<Integer> getAcceptingStates() {
        List<Integer> list = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            if (states[i].accepting) {
                list.add(i);
            }
        }
        return list;
    }

    /**
     * States reachable from the given set through zero or more epsilon edges,
     * the input set included. Each state is visited at most once, so epsilon
     * cycles terminate.
     */
    public StateSet epsilonClosure(StateSet set) {
        BitSet visited = new BitSet(count);
        int[] stack = new int[Math.max(set.size(), MIN_CAPACITY)];
        int top = 0;
        for (int s : set.toArray()) {
            checkReference(s);
            if (!visited.get(s)) {
                visited.set(s);
                stack[top++] = s;
            }
        }
        while (top > 0) {
            int s = stack[--top];
            for (int to : states[s].epsilons) {
                checkReference(to);
                if (!visited.get(to)) {
                    visited.set(to);
                    if (top == stack.length) {
                        stack = Arrays.copyOf(stack, stack.length * 2);
                    }
                    stack[top++] = to;
                }
            }
        }
        return StateSet.of(visited.stream().toArray());
    }

    public StateSet getStart() {
        return epsilonClosure(getStarts());
    }

    public StateSet getNext(int symbol, StateSet set) {
        checkSymbol(symbol);
        BitSet targets = new BitSet(count);
        for (int s : set.toArray()) {
            checkReference(s);
            TreeSet<Integer> dests = states[s].transitions.get(symbol);
            if (dests != null) {
                for (int to : dests) {
                    checkReference(to);
                    targets.set(to);
                }
            }
        }
        if (targets.isEmpty()) {
            return StateSet.EMPTY;
        }
        return epsilonClosure(StateSet.of(targets.stream().toArray()));
    }

    /**
     * Checks that every edge and start state refers to an existing state.
     *
     * @throws AutomatonException with kind MALFORMED_AUTOMATON on the first dangling reference
     */
    public void validate() {
        for (int start : starts) {
            checkReference(start);
        }
        for (int i = 0; i < count; i++) {
            State s = states[i];
            for (Map.Entry<Integer, TreeSet<Integer>> entry : s.transitions.entrySet()) {
                for (int to : entry.getValue()) {
                    if (to < 0 || to >= count) {
                        throw new AutomatonException(MALFORMED_AUTOMATON, "transition " + i + " --"
                                + entry.getKey() + "--> " + to + " references a missing state");
                    }
                }
            }
            for (int to : s.epsilons) {
                if (to < 0 || to >= count) {
                    throw new AutomatonException(MALFORMED_AUTOMATON, "epsilon " + i + " --> "
                            + to + " references a missing state");
                }
            }
        }
    }

    private State state(int index) {
        if (index < 0 || index >= count) {
            throw new IllegalArgumentException("no such nfa state: " + index);
        }
        return states[index];
    }

    private void checkReference(int index) {
        if (index < 0 || index >= count) {
            throw new AutomatonException(MALFORMED_AUTOMATON, "reference to missing nfa state: " + index);
        }
    }

    private void checkSymbol(int symbol) {
        if (symbol < 0 || symbol >= alphabetSize) {
            throw new AutomatonException(INVALID_SYMBOL, "symbol " + symbol
                    + " outside alphabet of size " + alphabetSize);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("nfa states: ").append(count).append(", starts: ").append(getStarts());
        for (int i = 0; i < count; i++) {
            State s = states[i];
            sb.append('\n').append(i);
            if (s.accepting) {
                sb.append(" [accept ").append(s.priority).append(']');
            }
            new TreeSet<>(s.transitions.keySet()).forEach(sym ->
                    sb.append(' ').append(sym).append("->").append(s.transitions.get(sym)));
            if (!s.epsilons.isEmpty()) {
                sb.append(" eps->").append(s.epsilons);
            }
        }
        return sb.toString();
    }

}
