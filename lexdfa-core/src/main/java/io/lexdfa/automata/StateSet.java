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

import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Immutable set of NFA state indices in canonical form (sorted, no
 * duplicates). Equality and hash code depend on the elements only, so a
 * StateSet can key the subset-to-DFA-state map of the determinizer.
 */
public final class StateSet implements Iterable<Integer> {

    public static final StateSet EMPTY = new StateSet(new int[0]);

    private final int[] states;
    private final int hash;

    private StateSet(int[] sorted) {
        this.states = sorted;
        this.hash = Arrays.hashCode(sorted);
    }

    public static StateSet of(int... states) {
        if (states.length == 0) {
            return EMPTY;
        }
        int[] copy = states.clone();
        Arrays.sort(copy);
        int count = 1;
        for (int i = 1; i < copy.length; i++) {
            if (copy[i] != copy[count - 1]) {
                copy[count++] = copy[i];
            }
        }
        return new StateSet(count == copy.length ? copy : Arrays.copyOf(copy, count));
    }

    public static StateSet of(Collection<Integer> states) {
        int[] array = new int[states.size()];
        int i = 0;
        for (Integer state : states) {
            array[i++] = state;
        }
        return of(array);
    }

    public boolean contains(int state) {
        return Arrays.binarySearch(states, state) >= 0;
    }

    public int size() {
        return states.length;
    }

    public boolean isEmpty() {
        return states.length == 0;
    }

    public int get(int index) {
        return states[index];
    }

    public int[] toArray() {
        return states.clone();
    }

    @Override
    public Iterator<Integer> iterator() {
        return new Iterator<>() {
            private int index = 0;

            @Override
            public boolean hasNext() {
                return index < states.length;
            }

            @Override
            public Integer next() {
                if (index >= states.length) {
                    throw new NoSuchElementException();
                }
                return states[index++];
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateSet other)) {
            return false;
        }
        return hash == other.hash && Arrays.equals(states, other.states);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < states.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(states[i]);
        }
        return sb.append('}').toString();
    }

}
