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

public class LexerException extends RuntimeException {

    public enum Kind {
        UNMATCHED_INPUT,
        ZERO_LENGTH_MATCH,
        BUILD_AFTER_FINALIZE,
        RESOURCE_EXHAUSTION,
        INVALID_PATTERN
    }

    private final Kind kind;
    private final LexicalError error;

    public LexerException(Kind kind, String message) {
        this(kind, message, null);
    }

    public LexerException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.error = null;
    }

    public LexerException(LexicalError error) {
        super(error.toString());
        this.kind = error.kind;
        this.error = error;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the scan failure behind this exception, null for build-time errors
     */
    public LexicalError getError() {
        return error;
    }

    public int getOffset() {
        return error == null ? -1 : error.offset;
    }

    public int getLine() {
        return error == null ? -1 : error.getLine();
    }

    public int getColumn() {
        return error == null ? -1 : error.getColumn();
    }

}
