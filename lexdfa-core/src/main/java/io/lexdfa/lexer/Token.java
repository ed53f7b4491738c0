/*
 * The MIT License
 *
 * Copyright 2024 Karate Labs Inc.
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

import java.util.Objects;

/**
 * Immutable match produced by a {@link Scanner}. Offsets are char indexes
 * into the scanned input, {@code end} is exclusive. Line and column are
 * zero-based.
 */
public class Token {

    public final int id;
    public final String name;
    public final int start;
    public final int end;
    public final int line;
    public final int col;
    public final String text;

    public Token(int id, String name, int start, int end, int line, int col, String text) {
        this.id = id;
        this.name = name;
        this.start = start;
        this.end = end;
        this.line = line;
        this.col = col;
        this.text = text;
    }

    public int length() {
        return end - start;
    }

    public boolean isZeroWidth() {
        return end == start;
    }

    public String getPositionDisplay() {
        return (line + 1) + ":" + (col + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token other)) {
            return false;
        }
        return id == other.id && start == other.start && end == other.end && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, start, end, text);
    }

    @Override
    public String toString() {
        return (name == null ? String.valueOf(id) : name) + "[" + start + "," + end + ")'" + text + "'";
    }

}
