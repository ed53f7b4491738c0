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

import io.lexdfa.automata.AutomatonException;
import io.lexdfa.automata.Determinizer;
import io.lexdfa.automata.Dfa;
import io.lexdfa.automata.Nfa;
import io.lexdfa.pattern.PatternCompiler;
import io.lexdfa.pattern.PatternException;
import io.lexdfa.pattern.RegexCompiler;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.JSONParser;
import net.minidev.json.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.lexdfa.lexer.LexerException.Kind.*;

/**
 * Registers named token patterns and tokenizes input with the DFA built
 * from them.
 * <p>
 * Token ids are assigned 0, 1, 2, ... in registration order and double as
 * pattern priorities: when two patterns match the same longest prefix, the
 * one registered first wins. A longer match always beats a shorter one
 * regardless of priority.
 * <pre>
 * Lexer lexer = new Lexer();
 * int kwIf = lexer.addPattern("IF", "if");
 * int ident = lexer.addPattern("IDENT", "[a-z]+");
 * lexer.addPattern("WS", "\\s+");
 * for (Token token : lexer.tokenize("if foo")) {
 *     ...
 * }
 * </pre>
 * After {@link #build()} the lexer is frozen; grammar rule ids of a parser
 * layered on top should start at {@link #maxTokenId()} + 1.
 */
public class Lexer {

    static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    private final LexerConfig config;
    private final PatternCompiler compiler;
    private final List<String> names = new ArrayList<>();
    private final List<Boolean> zeroWidth = new ArrayList<>();
    private final Map<String, Integer> ids = new HashMap<>();

    private Nfa nfa;
    private int root;
    private Dfa dfa;

    private String[] nameArray;
    private boolean[] zeroWidthArray;

    public Lexer() {
        this(new LexerConfig());
    }

    public Lexer(LexerConfig config) {
        this(config, RegexCompiler.INSTANCE);
    }

    public Lexer(LexerConfig config, PatternCompiler compiler) {
        this.config = config.copy();
        this.compiler = compiler;
        this.nfa = new Nfa(this.config.getAlphabetSize(), this.config.getMaxStates());
        this.root = nfa.addState();
        nfa.addStart(root);
    }

    // ========== Registration ==========

    public int addPattern(String name, String pattern) {
        return addPattern(name, pattern, false);
    }

    /**
     * @param zeroWidth true if the pattern may produce tokens that consume no input
     */
    public int addPattern(String name, String pattern, boolean zeroWidth) {
        checkOpen(name);
        Nfa fragment;
        try {
            fragment = compiler.compile(pattern, config.getAlphabetSize());
        } catch (PatternException e) {
            throw new LexerException(INVALID_PATTERN, "pattern '" + name + "': " + e.getMessage(), e);
        }
        return register(name, fragment, zeroWidth);
    }

    public int addPattern(String name, Nfa fragment) {
        return addPattern(name, fragment, false);
    }

    /**
     * Folds a pre-built fragment into the master automaton. The fragment's
     * start states become reachable from the master start by epsilon edges
     * and its accepting states are re-marked with the new token id.
     *
     * @throws AutomatonException if the fragment references missing states
     */
    public int addPattern(String name, Nfa fragment, boolean zeroWidth) {
        checkOpen(name);
        return register(name, fragment, zeroWidth);
    }

    private int register(String name, Nfa fragment, boolean zeroWidthCapable) {
        fragment.validate();
        int id = names.size();
        int offset;
        try {
            offset = nfa.append(fragment);
            for (int start : fragment.getStarts()) {
                nfa.addEpsilon(root, start + offset);
            }
        } catch (AutomatonException e) {
            throw wrap(e);
        }
        List<Integer> accepting = fragment.getAcceptingStates();
        for (int state : accepting) {
            nfa.markAccepting(state + offset, id);
        }
        if (fragment.getStarts().isEmpty() || accepting.isEmpty()) {
            logger.warn("pattern '{}' can never match: {} start states, {} accepting states",
                    name, fragment.getStarts().size(), accepting.size());
        }
        names.add(name);
        zeroWidth.add(zeroWidthCapable);
        ids.put(name, id);
        return id;
    }

    private void checkOpen(String name) {
        if (dfa != null) {
            throw new LexerException(BUILD_AFTER_FINALIZE, "cannot add pattern '" + name
                    + "', lexer is already built");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("pattern name must not be null or blank");
        }
        if (ids.containsKey(name)) {
            throw new IllegalArgumentException("duplicate pattern name: '" + name + "'");
        }
    }

    private static RuntimeException wrap(AutomatonException e) {
        if (e.getKind() == AutomatonException.Kind.RESOURCE_EXHAUSTION) {
            return new LexerException(RESOURCE_EXHAUSTION, e.getMessage(), e);
        }
        return e;
    }

    // ========== Build ==========

    /**
     * Determinizes the registered patterns. Runs once, later calls return the
     * same DFA. The master NFA is released afterwards.
     */
    public Dfa build() {
        if (dfa != null) {
            return dfa;
        }
        Determinizer determinizer = new Determinizer(config.isKeepInvalid(), config.getMaxStates());
        try {
            dfa = determinizer.determinize(nfa);
        } catch (AutomatonException e) {
            throw wrap(e);
        }
        logger.debug("built lexer with {} patterns: {} nfa states -> {} dfa states",
                names.size(), nfa.size(), dfa.getSize());
        nfa = null;
        freeze();
        return dfa;
    }

    private void freeze() {
        nameArray = names.toArray(new String[0]);
        zeroWidthArray = new boolean[zeroWidth.size()];
        for (int i = 0; i < zeroWidthArray.length; i++) {
            zeroWidthArray[i] = zeroWidth.get(i);
        }
    }

    public boolean isBuilt() {
        return dfa != null;
    }

    // ========== Tokenize ==========

    public TokenStream tokenize(CharSequence input) {
        return tokenize(input, config.getErrorMode());
    }

    public TokenStream tokenize(CharSequence input, ErrorMode mode) {
        if (input == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        build();
        return new TokenStream(dfa, input, nameArray, zeroWidthArray, mode);
    }

    // ========== Token ids ==========

    /**
     * @return highest assigned token id, -1 when no pattern is registered
     */
    public int maxTokenId() {
        return names.size() - 1;
    }

    public int getPatternCount() {
        return names.size();
    }

    public String getTokenName(int id) {
        if (id < 0 || id >= names.size()) {
            throw new IllegalArgumentException("no such token id: " + id);
        }
        return names.get(id);
    }

    /**
     * @return the id registered for the name, -1 if unknown
     */
    public int getTokenId(String name) {
        Integer id = ids.get(name);
        return id == null ? -1 : id;
    }

    public boolean isZeroWidth(int id) {
        if (id < 0 || id >= zeroWidth.size()) {
            throw new IllegalArgumentException("no such token id: " + id);
        }
        return zeroWidth.get(id);
    }

    public LexerConfig getConfig() {
        return config.copy();
    }

    // ========== Persistence ==========

    /**
     * Serializes the built lexer: pattern names, zero-width flags and the DFA
     * table. Builds first if needed.
     */
    public String toJson() {
        build();
        List<Map<String, Object>> patterns = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            Map<String, Object> pattern = new LinkedHashMap<>();
            pattern.put("name", names.get(i));
            pattern.put("zeroWidth", zeroWidth.get(i));
            patterns.add(pattern);
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("patterns", patterns);
        map.put("dfa", dfa.toMap());
        return JSONValue.toJSONString(map);
    }

    /**
     * Restores a lexer written by {@link #toJson()} without determinizing
     * again. The result is already built, the alphabet size comes from the
     * stored DFA.
     *
     * @throws IllegalArgumentException if the json is not a valid lexer, including
     *                                  a DFA whose stop labels are not pattern ids
     */
    public static Lexer fromJson(String json, LexerConfig config) {
        Object parsed;
        try {
            parsed = new JSONParser(JSONParser.MODE_RFC4627).parse(json);
        } catch (ParseException e) {
            throw new IllegalArgumentException("invalid lexer json: " + e.getMessage(), e);
        }
        if (!(parsed instanceof Map<?, ?> map)
                || !(map.get("patterns") instanceof List<?> patterns)
                || !(map.get("dfa") instanceof Map<?, ?> dfaMap)) {
            throw new IllegalArgumentException("lexer json needs 'patterns' and 'dfa'");
        }
        Dfa dfa;
        try {
            dfa = Dfa.fromMap(dfaMap);
        } catch (AutomatonException e) {
            throw new IllegalArgumentException("invalid lexer json: " + e.getMessage(), e);
        }
        for (int state = 0; state < dfa.getSize(); state++) {
            int label = dfa.getStopLabel(state);
            if (dfa.isStop(state) && (label < 0 || label >= patterns.size())) {
                throw new IllegalArgumentException("invalid lexer json: dfa state " + state + " has label "
                        + label + " but only " + patterns.size() + " patterns are defined");
            }
        }
        LexerConfig copy = config.copy();
        copy.configure("alphabetSize", dfa.getAlphabetSize());
        Lexer lexer = new Lexer(copy);
        for (Object item : patterns) {
            if (!(item instanceof Map<?, ?> pattern) || !(pattern.get("name") instanceof String name)) {
                throw new IllegalArgumentException("invalid pattern entry in lexer json: " + item);
            }
            lexer.checkOpen(name);
            lexer.ids.put(name, lexer.names.size());
            lexer.names.add(name);
            lexer.zeroWidth.add(Boolean.TRUE.equals(pattern.get("zeroWidth")));
        }
        lexer.nfa = null;
        lexer.dfa = dfa;
        lexer.freeze();
        return lexer;
    }

}
