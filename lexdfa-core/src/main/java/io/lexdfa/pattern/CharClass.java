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
package io.lexdfa.pattern;

import java.util.BitSet;

/**
 * Set of symbols bounded by an alphabet size. Symbols at or beyond the
 * alphabet size are silently dropped, so a class written for a wider
 * alphabet still compiles for a narrow one.
 */
public class CharClass {

    private final int alphabetSize;
    private final BitSet symbols;

    public CharClass(int alphabetSize) {
        this.alphabetSize = alphabetSize;
        this.symbols = new BitSet(alphabetSize);
    }

    public static CharClass of(int alphabetSize, char c) {
        CharClass cc = new CharClass(alphabetSize);
        cc.add(c);
        return cc;
    }

    public static CharClass any(int alphabetSize) {
        CharClass cc = new CharClass(alphabetSize);
        cc.addRange(0, alphabetSize - 1);
        cc.symbols.clear('\n');
        return cc;
    }

    public static CharClass digits(int alphabetSize) {
        CharClass cc = new CharClass(alphabetSize);
        cc.addRange('0', '9');
        return cc;
    }

    public static CharClass word(int alphabetSize) {
        CharClass cc = new CharClass(alphabetSize);
        cc.addRange('a', 'z');
        cc.addRange('A', 'Z');
        cc.addRange('0', '9');
        cc.add('_');
        return cc;
    }

    public static CharClass space(int alphabetSize) {
        CharClass cc = new CharClass(alphabetSize);
        for (char c : " \t\n\r\f".toCharArray()) {
            cc.add(c);
        }
        return cc;
    }

    public void add(int symbol) {
        if (symbol >= 0 && symbol < alphabetSize) {
            symbols.set(symbol);
        }
    }

    public void addRange(int from, int to) {
        int end = Math.min(to, alphabetSize - 1);
        if (from <= end) {
            symbols.set(Math.max(from, 0), end + 1);
        }
    }

    public void addAll(CharClass other) {
        symbols.or(other.symbols);
    }

    public CharClass negate() {
        CharClass cc = new CharClass(alphabetSize);
        cc.symbols.set(0, alphabetSize);
        cc.symbols.andNot(symbols);
        return cc;
    }

    public boolean contains(int symbol) {
        return symbol >= 0 && symbols.get(symbol);
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public int[] toArray() {
        return symbols.stream().toArray();
    }

    @Override
    public String toString() {
        return symbols.toString();
    }

}
