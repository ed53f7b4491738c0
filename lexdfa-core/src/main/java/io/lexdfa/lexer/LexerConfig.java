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

import io.lexdfa.automata.Nfa;

import java.util.List;
import java.util.Map;

/**
 * Settings for building and running a {@link Lexer}.
 * <p>
 * Example:
 * <pre>
 * LexerConfig config = new LexerConfig();
 * config.configure("alphabetSize", 256);
 * config.configure(Map.of("errorMode", "recover", "maxStates", 10000));
 * </pre>
 * A lexer takes a copy of its config, later changes to the original have no
 * effect on it.
 */
public class LexerConfig {

    public static final List<String> KEYS = List.of("alphabetSize", "keepInvalid", "maxStates", "errorMode");

    private int alphabetSize = Nfa.DEFAULT_ALPHABET_SIZE;
    // empty transitions become edges into a non-accepting sink state
    private boolean keepInvalid;
    // applies to both the master nfa and the dfa, 0 is unbounded
    private int maxStates;
    private ErrorMode errorMode = ErrorMode.STRICT;

    public LexerConfig copy() {
        LexerConfig copy = new LexerConfig();
        copy.alphabetSize = this.alphabetSize;
        copy.keepInvalid = this.keepInvalid;
        copy.maxStates = this.maxStates;
        copy.errorMode = this.errorMode;
        return copy;
    }

    /**
     * Apply a single setting.
     *
     * @throws IllegalArgumentException if the key is not recognized or the value is invalid
     */
    public void configure(String key, Object value) {
        key = key != null ? key.trim() : "";
        switch (key) {
            case "alphabetSize" -> {
                int size = toInt(key, value);
                if (size <= 0) {
                    throw new IllegalArgumentException("alphabetSize must be positive: " + size);
                }
                this.alphabetSize = size;
            }
            case "keepInvalid" -> this.keepInvalid = toBoolean(value);
            case "maxStates" -> {
                int max = toInt(key, value);
                if (max < 0) {
                    throw new IllegalArgumentException("maxStates must not be negative: " + max);
                }
                this.maxStates = max;
            }
            case "errorMode" -> this.errorMode = toErrorMode(value);
            default -> throw new IllegalArgumentException("unexpected lexer config key: '" + key + "'");
        }
    }

    public void configure(Map<String, ?> values) {
        values.forEach(this::configure);
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number: '" + s + "'", e);
            }
        }
        throw new IllegalArgumentException(key + " must be a number: " + value);
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString().trim());
    }

    private static ErrorMode toErrorMode(Object value) {
        if (value instanceof ErrorMode mode) {
            return mode;
        }
        if (value == null) {
            throw new IllegalArgumentException("errorMode must not be null");
        }
        try {
            return ErrorMode.valueOf(value.toString().trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("errorMode must be one of strict, recover: '" + value + "'", e);
        }
    }

    public int getAlphabetSize() {
        return alphabetSize;
    }

    public boolean isKeepInvalid() {
        return keepInvalid;
    }

    public int getMaxStates() {
        return maxStates;
    }

    public ErrorMode getErrorMode() {
        return errorMode;
    }

}
