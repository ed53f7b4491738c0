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
package io.lexdfa.lexer;

import io.lexdfa.automata.Dfa;

import java.util.ArrayList;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy token sequence over one input. Nothing is scanned until iteration,
 * and every {@link #iterator()} call starts a new scan from offset 0.
 */
public class TokenStream implements Iterable<Token> {

    private final Dfa dfa;
    private final CharSequence input;
    private final String[] names;
    private final boolean[] zeroWidth;
    private final ErrorMode mode;

    TokenStream(Dfa dfa, CharSequence input, String[] names, boolean[] zeroWidth, ErrorMode mode) {
        this.dfa = dfa;
        this.input = input;
        this.names = names;
        this.zeroWidth = zeroWidth;
        this.mode = mode;
    }

    @Override
    public Scanner iterator() {
        return new Scanner(dfa, input, names, zeroWidth, mode);
    }

    public Stream<Token> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(),
                Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE), false);
    }

    /**
     * Scans the whole input. In recover mode the errors are dropped, use
     * {@link #iterator()} and {@link Scanner#getErrors()} to see them.
     */
    public List<Token> toList() {
        List<Token> list = new ArrayList<>();
        for (Token token : this) {
            list.add(token);
        }
        return list;
    }

    public CharSequence getInput() {
        return input;
    }

    public ErrorMode getMode() {
        return mode;
    }

}
