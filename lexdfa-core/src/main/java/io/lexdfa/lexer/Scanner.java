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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static io.lexdfa.lexer.LexerException.Kind.*;

/**
 * Walks a finished DFA over an input with maximal munch: from the cursor the
 * DFA runs as far as it can, and the last accepting position seen becomes
 * the token end. The DFA stop label is the token id.
 * <p>
 * A match of length zero is only a token when its pattern is declared
 * zero-width, and then at most once per cursor position, so every pull
 * either consumes input or ends the scan.
 * <p>
 * The DFA is only read, so any number of scanners may share one. A single
 * scanner is not thread-safe.
 */
public class Scanner implements Iterator<Token> {

    static final Logger logger = LoggerFactory.getLogger(Scanner.class);

    private final Dfa dfa;
    private final CharSequence input;
    private final int length;
    private final String[] names;
    private final boolean[] zeroWidth;
    private final ErrorMode mode;
    private final List<LexicalError> errors = new ArrayList<>();

    private int pos;
    private int line;
    private int col;
    private int zeroWidthPos = -1;

    private Token buffered;
    private boolean done;

    // result of the last match() call
    private int matchEnd;
    private int matchLabel;

    public Scanner(Dfa dfa, CharSequence input) {
        this(dfa, input, new String[0], new boolean[0], ErrorMode.STRICT);
    }

    /**
     * @param names     token name by id, ids without an entry get a null name
     * @param zeroWidth zero-width capability by id, ids without an entry are not
     */
    public Scanner(Dfa dfa, CharSequence input, String[] names, boolean[] zeroWidth, ErrorMode mode) {
        if (!dfa.isFinished()) {
            throw new IllegalArgumentException("dfa must be finished before scanning");
        }
        this.dfa = dfa;
        this.input = input;
        this.length = input.length();
        this.names = names;
        this.zeroWidth = zeroWidth;
        this.mode = mode;
    }

    // ========== Iteration ==========

    @Override
    public boolean hasNext() {
        if (buffered != null) {
            return true;
        }
        if (done) {
            return false;
        }
        buffered = scan();
        if (buffered == null) {
            done = true;
            return false;
        }
        return true;
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Token token = buffered;
        buffered = null;
        return token;
    }

    /**
     * Same as {@link #next()} but returns null at the end instead of throwing.
     * A token already fetched by {@link #hasNext()} is returned first.
     *
     * @return the token, or null when the input is exhausted
     * @throws LexerException in strict mode on the first failure
     */
    public Token nextToken() {
        return hasNext() ? next() : null;
    }

    // skips and records failures in recover mode
    private Token scan() {
        while (pos < length) {
            LexerException.Kind failure = match(pos);
            if (failure == null) {
                return emit();
            }
            LexicalError error = new LexicalError(failure, pos, line, col, describe(failure));
            if (mode == ErrorMode.STRICT) {
                done = true;
                throw new LexerException(error);
            }
            errors.add(error);
            if (logger.isTraceEnabled()) {
                logger.trace("skipping one character after: {}", error);
            }
            advanceTo(pos + 1);
        }
        return null;
    }

    // ========== Maximal munch ==========

    private LexerException.Kind match(int from) {
        int state = 0;
        int p = from;
        int lastEnd = -1;
        int lastLabel = Dfa.NONE;
        while (true) {
            if (dfa.isStop(state)) {
                lastEnd = p;
                lastLabel = dfa.getStopLabel(state);
            }
            if (p >= length) {
                break;
            }
            int next = dfa.next(state, input.charAt(p));
            if (next == Dfa.NONE) {
                break;
            }
            state = next;
            p++;
        }
        if (lastEnd == -1) {
            return UNMATCHED_INPUT;
        }
        if (lastEnd == from) {
            if (!isZeroWidth(lastLabel)) {
                matchLabel = lastLabel;
                return ZERO_LENGTH_MATCH;
            }
            if (zeroWidthPos == from) {
                // already emitted an empty token here, the cursor has to move
                return UNMATCHED_INPUT;
            }
        }
        matchEnd = lastEnd;
        matchLabel = lastLabel;
        return null;
    }

    private Token emit() {
        int start = pos;
        Token token = new Token(matchLabel, nameOf(matchLabel), start, matchEnd, line, col,
                input.subSequence(start, matchEnd).toString());
        if (matchEnd == start) {
            zeroWidthPos = start;
        } else {
            advanceTo(matchEnd);
        }
        return token;
    }

    private void advanceTo(int target) {
        while (pos < target) {
            char c = input.charAt(pos++);
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
    }

    private boolean isZeroWidth(int label) {
        return label >= 0 && label < zeroWidth.length && zeroWidth[label];
    }

    private String nameOf(int label) {
        return label >= 0 && label < names.length ? names[label] : null;
    }

    private String describe(LexerException.Kind failure) {
        if (failure == ZERO_LENGTH_MATCH) {
            String name = nameOf(matchLabel);
            return "zero-length match for pattern " + (name == null ? matchLabel : "'" + name + "'")
                    + " at offset " + pos;
        }
        return "unmatched input '" + display(input.charAt(pos)) + "' at offset " + pos;
    }

    private static String display(char c) {
        return switch (c) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            default -> c < ' ' ? String.format("\\u%04x", (int) c) : String.valueOf(c);
        };
    }

    // ========== State ==========

    public int getPosition() {
        return pos;
    }

    /**
     * @return errors recorded so far in recover mode
     */
    public List<LexicalError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

}
