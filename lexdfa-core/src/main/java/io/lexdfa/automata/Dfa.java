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

import net.minidev.json.JSONValue;
import net.minidev.json.parser.JSONParser;
import net.minidev.json.parser.ParseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.lexdfa.automata.AutomatonException.Kind.*;

/**
 * Deterministic finite automaton stored as a dense table
 * {@code [state][symbol] -> state} plus a parallel stop-label array.
 * A missing transition is {@link #NONE}, a non-accepting state has label
 * {@link #NONE}.
 * <p>
 * Mutable while being built. Once {@link #finish()} has been called the
 * automaton is read-only and can be shared between threads.
 */
public class Dfa {

    public static final int NONE = -1;

    private final int alphabetSize;

    private int[][] transitions;
    private int[] labels;
    private boolean[] stops;
    private int size;
    private boolean finished;

    public Dfa(int alphabetSize) {
        this(alphabetSize, 1);
    }

    public Dfa(int alphabetSize, int initialSize) {
        if (alphabetSize <= 0) {
            throw new IllegalArgumentException("alphabet size must be positive: " + alphabetSize);
        }
        this.alphabetSize = alphabetSize;
        this.transitions = new int[0][];
        this.labels = new int[0];
        this.stops = new boolean[0];
        resize(initialSize);
    }

    // ========== Building ==========

    /**
     * Grows to at least {@code n} states. Existing states are kept, new ones
     * have no transitions and are not accepting. Never shrinks.
     */
    public void resize(int n) {
        checkMutable();
        if (n <= size) {
            return;
        }
        if (n > transitions.length) {
            int capacity = Math.max(n, transitions.length * 2);
            transitions = Arrays.copyOf(transitions, capacity);
            labels = Arrays.copyOf(labels, capacity);
            stops = Arrays.copyOf(stops, capacity);
        }
        for (int i = size; i < n; i++) {
            int[] row = new int[alphabetSize];
            Arrays.fill(row, NONE);
            transitions[i] = row;
            labels[i] = NONE;
            stops[i] = false;
        }
        size = n;
    }

    /**
     * Records the transition {@code from --symbol--> to}. A pair may be set
     * only once.
     */
    public void setTransition(int from, int to, int symbol) {
        checkMutable();
        checkState(from);
        checkState(to);
        checkSymbol(symbol);
        int current = transitions[from][symbol];
        if (current != NONE) {
            throw new AutomatonException(DUPLICATE_TRANSITION, "transition from " + from + " on symbol "
                    + symbol + " already set to " + current + ", cannot set to " + to);
        }
        transitions[from][symbol] = to;
    }

    public void setStop(int state) {
        setStop(state, NONE);
    }

    public void setStop(int state, int label) {
        checkMutable();
        checkState(state);
        stops[state] = true;
        labels[state] = label;
    }

    public void finish() {
        finished = true;
    }

    public boolean isFinished() {
        return finished;
    }

    // ========== Queries ==========

    public int getSize() {
        return size;
    }

    public int getAlphabetSize() {
        return alphabetSize;
    }

    public int getTransition(int state, int symbol) {
        checkState(state);
        checkSymbol(symbol);
        return transitions[state][symbol];
    }

    /**
     * Transition on a raw input character, {@link #NONE} for characters
     * outside the alphabet.
     */
    public int next(int state, char c) {
        if (c >= alphabetSize) {
            return NONE;
        }
        return transitions[state][c];
    }

    public boolean isStop(int state) {
        checkState(state);
        return stops[state];
    }

    public int getStopLabel(int state) {
        checkState(state);
        return labels[state];
    }

    public int getTransitionCount() {
        int total = 0;
        for (int i = 0; i < size; i++) {
            for (int to : transitions[i]) {
                if (to != NONE) {
                    total++;
                }
            }
        }
        return total;
    }

    private void checkMutable() {
        if (finished) {
            throw new IllegalStateException("dfa is finished and can no longer be modified");
        }
    }

    private void checkState(int state) {
        if (state < 0 || state >= size) {
            throw new IllegalArgumentException("no such dfa state: " + state);
        }
    }

    private void checkSymbol(int symbol) {
        if (symbol < 0 || symbol >= alphabetSize) {
            throw new AutomatonException(INVALID_SYMBOL, "symbol " + symbol
                    + " outside alphabet of size " + alphabetSize);
        }
    }

    // ========== Serialization ==========

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("alphabet", alphabetSize);
        List<List<Integer>> rows = new ArrayList<>(size);
        List<Integer> labelList = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            List<Integer> row = new ArrayList<>(alphabetSize);
            for (int to : transitions[i]) {
                row.add(to);
            }
            rows.add(row);
            labelList.add(stops[i] ? labels[i] : null);
        }
        map.put("transitions", rows);
        map.put("labels", labelList);
        return map;
    }

    /**
     * Dense JSON form: {@code {"alphabet":n,"transitions":[[...]],"labels":[...]}}
     * where -1 is a missing transition and null a non-accepting state.
     */
    public String toJson() {
        return JSONValue.toJSONString(toMap());
    }

    public static Dfa fromJson(String json) {
        Object parsed;
        try {
            parsed = new JSONParser(JSONParser.MODE_RFC4627).parse(json);
        } catch (ParseException e) {
            throw new AutomatonException(MALFORMED_AUTOMATON, "invalid dfa json: " + e.getMessage());
        }
        if (!(parsed instanceof Map<?, ?> map)) {
            throw new AutomatonException(MALFORMED_AUTOMATON, "dfa json must be an object");
        }
        return fromMap(map);
    }

    public static Dfa fromMap(Map<?, ?> map) {
        if (!(map.get("alphabet") instanceof Number alphabet)
                || !(map.get("transitions") instanceof List<?> rows)
                || !(map.get("labels") instanceof List<?> labelList)) {
            throw new AutomatonException(MALFORMED_AUTOMATON, "dfa json needs 'alphabet', 'transitions' and 'labels'");
        }
        if (rows.isEmpty() || rows.size() != labelList.size()) {
            throw new AutomatonException(MALFORMED_AUTOMATON, "dfa json has " + rows.size()
                    + " transition rows and " + labelList.size() + " labels");
        }
        if (alphabet.intValue() <= 0) {
            throw new AutomatonException(MALFORMED_AUTOMATON, "dfa json alphabet must be positive: " + alphabet);
        }
        Dfa dfa = new Dfa(alphabet.intValue(), rows.size());
        for (int i = 0; i < rows.size(); i++) {
            if (!(rows.get(i) instanceof List<?> row) || row.size() != dfa.alphabetSize) {
                throw new AutomatonException(MALFORMED_AUTOMATON, "dfa row " + i + " must have "
                        + dfa.alphabetSize + " entries");
            }
            for (int sym = 0; sym < row.size(); sym++) {
                if (!(row.get(sym) instanceof Number target)) {
                    throw new AutomatonException(MALFORMED_AUTOMATON, "dfa row " + i + " has a non-numeric entry at "
                            + sym + ": " + row.get(sym));
                }
                int to = target.intValue();
                if (to == NONE) {
                    continue;
                }
                if (to < 0 || to >= dfa.size) {
                    throw new AutomatonException(MALFORMED_AUTOMATON, "dfa row " + i
                            + " references missing state " + to);
                }
                dfa.setTransition(i, to, sym);
            }
            Object label = labelList.get(i);
            if (label != null) {
                // -1 is a stop state without a label
                if (!(label instanceof Number n) || n.intValue() < NONE) {
                    throw new AutomatonException(MALFORMED_AUTOMATON, "dfa state " + i + " has an invalid label: " + label);
                }
                dfa.setStop(i, n.intValue());
            }
        }
        dfa.finish();
        return dfa;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("dfa states: ").append(size);
        for (int i = 0; i < size; i++) {
            sb.append('\n').append(i);
            if (stops[i]) {
                sb.append(" [stop ").append(labels[i]).append(']');
            }
            for (int sym = 0; sym < alphabetSize; sym++) {
                if (transitions[i][sym] != NONE) {
                    sb.append(' ').append(sym).append("->").append(transitions[i][sym]);
                }
            }
        }
        return sb.toString();
    }

}
