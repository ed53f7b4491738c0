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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

import static io.lexdfa.automata.AutomatonException.Kind.*;

/**
 * Subset construction. Every reachable epsilon-closed set of NFA states
 * becomes exactly one DFA state; DFA state 0 is the closure of the NFA start
 * states.
 * <p>
 * When several accepting NFA states fall into one subset, the lowest
 * priority value wins, and among equal priorities the lowest NFA state index
 * (the first in canonical order).
 * <p>
 * A determinizer instance keeps the counters of its last run and is not
 * meant to be shared between threads.
 */
public class Determinizer {

    static final Logger logger = LoggerFactory.getLogger(Determinizer.class);

    private final boolean keepInvalid;
    private final int maxStates;

    private int insertions;
    private int lookups;
    private int hits;

    public Determinizer() {
        this(false, 0);
    }

    /**
     * @param keepInvalid keep empty transitions as edges into a non-accepting sink state
     * @param maxStates   DFA state limit, 0 for none
     */
    public Determinizer(boolean keepInvalid, int maxStates) {
        if (maxStates < 0) {
            throw new IllegalArgumentException("max states must not be negative: " + maxStates);
        }
        this.keepInvalid = keepInvalid;
        this.maxStates = maxStates;
    }

    public static Dfa toDfa(Nfa nfa) {
        return new Determinizer().determinize(nfa);
    }

    public Dfa determinize(Nfa nfa) {
        nfa.validate();
        insertions = 0;
        lookups = 0;
        hits = 0;
        int alphabetSize = nfa.getAlphabetSize();
        Dfa dfa = new Dfa(alphabetSize);
        Map<StateSet, Integer> ids = new HashMap<>();
        Deque<StateSet> work = new ArrayDeque<>();
        StateSet start = nfa.getStart();
        ids.put(start, 0);
        insertions++;
        markStop(nfa, start, dfa, 0);
        work.push(start);
        while (!work.isEmpty()) {
            StateSet current = work.pop();
            int currentId = ids.get(current);
            for (int symbol = 0; symbol < alphabetSize; symbol++) {
                StateSet next = nfa.getNext(symbol, current);
                if (next.isEmpty() && !keepInvalid) {
                    continue;
                }
                lookups++;
                Integer nextId = ids.get(next);
                if (nextId == null) {
                    nextId = dfa.getSize();
                    if (maxStates > 0 && nextId >= maxStates) {
                        throw new AutomatonException(RESOURCE_EXHAUSTION, "dfa state limit reached: " + maxStates);
                    }
                    ids.put(next, nextId);
                    insertions++;
                    dfa.resize(nextId + 1);
                    markStop(nfa, next, dfa, nextId);
                    work.push(next);
                } else {
                    hits++;
                }
                dfa.setTransition(currentId, nextId, symbol);
            }
        }
        dfa.finish();
        if (logger.isDebugEnabled()) {
            logger.debug("determinized {} nfa states into {} dfa states, {} transitions (subsets: {} inserted, {} lookups, {} hits)",
                    nfa.size(), dfa.getSize(), dfa.getTransitionCount(), insertions, lookups, hits);
        }
        return dfa;
    }

    private static void markStop(Nfa nfa, StateSet set, Dfa dfa, int id) {
        int winner = Dfa.NONE;
        boolean accepting = false;
        for (int state : set) {
            if (!nfa.isStop(state)) {
                continue;
            }
            int priority = nfa.getPriority(state);
            // iteration is ascending by state index, strict < keeps the first on ties
            if (!accepting || priority < winner) {
                winner = priority;
                accepting = true;
            }
        }
        if (accepting) {
            dfa.setStop(id, winner);
        }
    }

    /**
     * Number of distinct subsets recorded in the last run, equal to the
     * number of DFA states created.
     */
    public int getInsertions() {
        return insertions;
    }

    public int getLookups() {
        return lookups;
    }

    /**
     * Lookups in the last run that found an already recorded subset.
     */
    public int getHits() {
        return hits;
    }

}
