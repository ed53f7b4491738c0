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

import io.lexdfa.automata.Nfa;

/**
 * Compiles a small regular expression dialect into an NFA using Thompson's
 * construction. Every intermediate fragment has a single entry and a single
 * exit state, joined with epsilon edges.
 * <pre>
 * alternation := concat ('|' concat)*
 * concat      := repeat*
 * repeat      := atom ('*' | '+' | '?')*
 * atom        := '(' alternation ')' | '[' class ']' | '.' | '\' escape | literal
 * </pre>
 * Escapes: {@code \d \w \s} and their negations {@code \D \W \S},
 * {@code \n \t \r \f}, and any escaped non-alphanumeric character as a
 * literal. {@code .} matches every symbol except newline. A literal outside
 * the alphabet is an error, classes keep only the symbols inside it.
 */
public class RegexCompiler implements PatternCompiler {

    public static final RegexCompiler INSTANCE = new RegexCompiler();

    private static final class Fragment {

        final int start;
        final int end;

        Fragment(int start, int end) {
            this.start = start;
            this.end = end;
        }

    }

    @Override
    public Nfa compile(String pattern, int alphabetSize) {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern must not be null");
        }
        return new Parser(pattern, new Nfa(alphabetSize)).parse();
    }

    // one instance per compile call
    private static final class Parser {

        private final String pattern;
        private final int length;
        private final Nfa nfa;
        private final int alphabetSize;
        private int pos;

        Parser(String pattern, Nfa nfa) {
            this.pattern = pattern;
            this.length = pattern.length();
            this.nfa = nfa;
            this.alphabetSize = nfa.getAlphabetSize();
        }

        Nfa parse() {
            Fragment fragment = alternation();
            if (pos < length) {
                // only an unbalanced ')' stops the top level early
                throw error("unmatched ')'");
            }
            nfa.addStart(fragment.start);
            nfa.markAccepting(fragment.end, 0);
            return nfa;
        }

        // ========== Grammar ==========

        private Fragment alternation() {
            Fragment left = concat();
            while (peek() == '|') {
                pos++;
                Fragment right = concat();
                int start = nfa.addState();
                int end = nfa.addState();
                nfa.addEpsilon(start, left.start);
                nfa.addEpsilon(start, right.start);
                nfa.addEpsilon(left.end, end);
                nfa.addEpsilon(right.end, end);
                left = new Fragment(start, end);
            }
            return left;
        }

        private Fragment concat() {
            Fragment result = null;
            while (pos < length && peek() != '|' && peek() != ')') {
                Fragment next = repeat();
                if (result == null) {
                    result = next;
                } else {
                    nfa.addEpsilon(result.end, next.start);
                    result = new Fragment(result.start, next.end);
                }
            }
            return result == null ? empty() : result;
        }

        private Fragment repeat() {
            Fragment atom = atom();
            while (pos < length) {
                char c = peek();
                if (c != '*' && c != '+' && c != '?') {
                    break;
                }
                pos++;
                int start = nfa.addState();
                int end = nfa.addState();
                nfa.addEpsilon(start, atom.start);
                nfa.addEpsilon(atom.end, end);
                if (c != '+') {
                    nfa.addEpsilon(start, end);
                }
                if (c != '?') {
                    nfa.addEpsilon(atom.end, atom.start);
                }
                atom = new Fragment(start, end);
            }
            return atom;
        }

        private Fragment atom() {
            int atomPos = pos;
            char c = pattern.charAt(pos++);
            return switch (c) {
                case '(' -> group(atomPos);
                case '[' -> symbols(charClass(atomPos));
                case '.' -> symbols(CharClass.any(alphabetSize));
                case '\\' -> symbols(escape(false));
                case '*', '+', '?' -> throw new PatternException("nothing to repeat", pattern, atomPos);
                default -> symbols(literal(c, atomPos));
            };
        }

        // literals must fit the alphabet, classes drop what does not
        private CharClass literal(char c, int at) {
            if (c >= alphabetSize) {
                throw new PatternException(String.format("symbol U+%04X is outside the alphabet of %d",
                        (int) c, alphabetSize), pattern, at);
            }
            return CharClass.of(alphabetSize, c);
        }

        private Fragment group(int openPos) {
            Fragment inner = alternation();
            if (peek() != ')') {
                throw new PatternException("unclosed group", pattern, openPos);
            }
            pos++;
            return inner;
        }

        private CharClass charClass(int openPos) {
            boolean negated = false;
            if (peek() == '^') {
                negated = true;
                pos++;
            }
            CharClass cc = new CharClass(alphabetSize);
            boolean first = true;
            while (true) {
                if (pos >= length) {
                    throw new PatternException("unclosed character class", pattern, openPos);
                }
                char c = pattern.charAt(pos);
                if (c == ']' && !first) {
                    pos++;
                    break;
                }
                first = false;
                pos++;
                if (c == '\\') {
                    CharClass escaped = escape(true);
                    int[] single = escaped.toArray();
                    if (single.length == 1 && peek() == '-' && peek(1) != ']' && pos + 1 < length) {
                        pos++;
                        cc.addRange(single[0], rangeEnd(single[0]));
                    } else {
                        cc.addAll(escaped);
                    }
                } else if (peek() == '-' && peek(1) != ']' && pos + 1 < length) {
                    pos++;
                    cc.addRange(c, rangeEnd(c));
                } else {
                    cc.add(c);
                }
            }
            return negated ? cc.negate() : cc;
        }

        private int rangeEnd(int from) {
            int endPos = pos;
            char c = pattern.charAt(pos++);
            int to = c;
            if (c == '\\') {
                int[] single = escape(true).toArray();
                if (single.length != 1) {
                    throw new PatternException("invalid range end", pattern, endPos);
                }
                to = single[0];
            }
            if (to < from) {
                throw new PatternException("invalid range " + (char) from + "-" + (char) to, pattern, endPos);
            }
            return to;
        }

        private CharClass escape(boolean inClass) {
            if (pos >= length) {
                throw new PatternException("dangling escape", pattern, pos - 1);
            }
            char c = pattern.charAt(pos++);
            return switch (c) {
                case 'd' -> CharClass.digits(alphabetSize);
                case 'D' -> CharClass.digits(alphabetSize).negate();
                case 'w' -> CharClass.word(alphabetSize);
                case 'W' -> CharClass.word(alphabetSize).negate();
                case 's' -> CharClass.space(alphabetSize);
                case 'S' -> CharClass.space(alphabetSize).negate();
                case 'n' -> CharClass.of(alphabetSize, '\n');
                case 't' -> CharClass.of(alphabetSize, '\t');
                case 'r' -> CharClass.of(alphabetSize, '\r');
                case 'f' -> CharClass.of(alphabetSize, '\f');
                default -> {
                    if (Character.isLetterOrDigit(c)) {
                        throw new PatternException("unknown escape \\" + c
                                + (inClass ? " in character class" : ""), pattern, pos - 2);
                    }
                    yield inClass ? CharClass.of(alphabetSize, c) : literal(c, pos - 2);
                }
            };
        }

        // ========== Fragments ==========

        private Fragment symbols(CharClass cc) {
            int start = nfa.addState();
            int end = nfa.addState();
            for (int symbol : cc.toArray()) {
                nfa.addTransition(start, symbol, end);
            }
            return new Fragment(start, end);
        }

        private Fragment empty() {
            int start = nfa.addState();
            int end = nfa.addState();
            nfa.addEpsilon(start, end);
            return new Fragment(start, end);
        }

        private char peek() {
            return pos >= length ? '\0' : pattern.charAt(pos);
        }

        private char peek(int offset) {
            int index = pos + offset;
            return index >= length ? '\0' : pattern.charAt(index);
        }

        private PatternException error(String message) {
            return new PatternException(message, pattern, pos);
        }

    }

}
