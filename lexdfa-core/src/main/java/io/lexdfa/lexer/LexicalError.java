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

/**
 * A per-token scan failure. In {@link ErrorMode#RECOVER} these are collected
 * by the scanner and scanning continues; in {@link ErrorMode#STRICT} the
 * first one is thrown wrapped in a {@link LexerException}.
 */
public class LexicalError {

    public final LexerException.Kind kind;
    public final int offset;
    public final String message;

    // zero-based, exposed one-based by getLine() and getColumn()
    private final int line;
    private final int col;

    public LexicalError(LexerException.Kind kind, int offset, int line, int col, String message) {
        this.kind = kind;
        this.offset = offset;
        this.line = line;
        this.col = col;
        this.message = message;
    }

    public int getLine() {
        return line + 1;
    }

    public int getColumn() {
        return col + 1;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return "[" + getLine() + ":" + getColumn() + "] " + message;
    }

}
