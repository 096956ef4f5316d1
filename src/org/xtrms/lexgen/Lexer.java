/*
 * @LICENSE@
 */

package org.xtrms.lexgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * A multi-pattern scanner. Each category is a regex compiled to its own
 * {@link DFA}; {@link #tokenize(CharSequence)} repeatedly takes the longest
 * prefix of the remaining input matched by any category, and among
 * categories matching the same longest prefix, the one declared first.
 * <p>
 * <code><pre>
 * Lexer lexer = new Lexer.Builder()
 *     .add(&quot;IF&quot;, &quot;if&quot;)
 *     .add(&quot;ID&quot;, &quot;[a-z]+&quot;)
 *     .add(&quot;WS&quot;, &quot;' '+&quot;)
 *     .build();
 * lexer.tokenize(&quot;if iffy&quot;);   // IF "if", WS " ", ID "iffy"
 * </pre></code>
 * Lexers are immutable and may be shared between threads.
 */
public final class Lexer {

    private static final Logger logger = Logger.getLogger("org.xtrms.lexgen");
    private static final Level level = Level.FINE;

    /**
     * One lexeme: the winning category, the matched text and its start offset.
     */
    public static final class Token {

        private final String category;
        private final String lexeme;
        private final int start;

        public Token(String category, String lexeme, int start) {
            if (category == null) throw new NullPointerException("category");
            if (lexeme == null) throw new NullPointerException("lexeme");
            this.category = category;
            this.lexeme = lexeme;
            this.start = start;
        }

        public String category() {
            return category;
        }

        public String lexeme() {
            return lexeme;
        }

        public int start() {
            return start;
        }

        /**
         * @return the offset just past the lexeme.
         */
        public int end() {
            return start + lexeme.length();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Token)) return false;
            Token t = (Token) o;
            return start == t.start
                && category.equals(t.category)
                && lexeme.equals(t.lexeme);
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = 1;
            result = prime * result + category.hashCode();
            result = prime * result + lexeme.hashCode();
            result = prime * result + start;
            return result;
        }

        @Override
        public String toString() {
            return "(" + category + ",\"" + Misc.Esc.JAVA.esc(lexeme) + "\")@" + start;
        }
    }

    /**
     * Thrown when a category cannot be added: its regex is malformed, its
     * automaton is too large, or its name is empty or already taken. The
     * cause, when there is one, is the underlying
     * {@link PatternSyntaxException} or {@link DFA.ConstructionException}.
     */
    public static class ConfigurationException extends IllegalArgumentException {

        private static final long serialVersionUID = 2838421785071695614L;

        private final String category;

        public ConfigurationException(String category, String message, Throwable cause) {
            super(message, cause);
            this.category = category;
        }

        public String category() {
            return category;
        }
    }

    /**
     * Collects (category, regex) pairs in priority order.
     */
    public static final class Builder {

        private final Map<String, String> rules = new LinkedHashMap<String, String>();

        public Builder add(String category, String regex) {
            if (category == null) throw new NullPointerException("category");
            if (regex == null) throw new NullPointerException("regex");
            if (category.length() == 0) {
                throw new ConfigurationException(category, "empty category name", null);
            }
            if (rules.containsKey(category)) {
                throw new ConfigurationException(category,
                    "duplicate category: " + category, null);
            }
            rules.put(category, regex);
            return this;
        }

        /**
         * @throws ConfigurationException
         *             if any regex fails to compile.
         */
        public Lexer build() {
            return new Lexer(rules);
        }
    }

    private final List<String> categories;
    private final List<Pattern> patterns;

    private Lexer(Map<String, String> rules) {
        List<String> cats = new ArrayList<String>(rules.size());
        List<Pattern> pats = new ArrayList<Pattern>(rules.size());
        for (Map.Entry<String, String> e : rules.entrySet()) {
            String category = e.getKey();
            Pattern p;
            try {
                p = Pattern.compile(e.getValue());
            } catch (PatternSyntaxException ex) {
                throw new ConfigurationException(category,
                    "category " + category + ": " + ex.getMessage(), ex);
            } catch (DFA.ConstructionException ex) {
                throw new ConfigurationException(category,
                    "category " + category + ": " + ex.getMessage(), ex);
            }
            if (logger.isLoggable(level)) {
                logger.log(level, "category: " + category
                    + " regex: " + Misc.Esc.JAVA.esc(e.getValue())
                    + " prenex: " + Misc.Esc.JAVA.esc(p.prenex())
                    + " dfa states: " + p.dfa().size());
            }
            cats.add(category);
            pats.add(p);
        }
        this.categories = Collections.unmodifiableList(cats);
        this.patterns = Collections.unmodifiableList(pats);
    }

    /**
     * Builds a lexer from an ordered map of category to regex; the iteration
     * order of the map is the priority order, so pass a
     * {@link LinkedHashMap}.
     *
     * @throws ConfigurationException
     *             if a category name is empty or a regex fails to compile.
     */
    public static Lexer compile(Map<String, String> rules) {
        if (rules == null) throw new NullPointerException("rules");
        Builder builder = new Builder();
        for (Map.Entry<String, String> e : rules.entrySet()) {
            builder.add(e.getKey(), e.getValue());
        }
        return builder.build();
    }

    /**
     * @return the category names, highest priority first.
     */
    public List<String> categories() {
        return categories;
    }

    /**
     * @return the automaton of <code>category</code>.
     * @throws IllegalArgumentException
     *             if there is no such category.
     */
    public DFA dfa(String category) {
        int i = categories.indexOf(category);
        if (i < 0) throw new IllegalArgumentException("no such category: " + category);
        return patterns.get(i).dfa();
    }

    /**
     * Splits the whole of <code>input</code> into tokens.
     *
     * @throws NoViableAlternativeException
     *             at the first position where no category matches a
     *             non-empty prefix.
     */
    public List<Token> tokenize(CharSequence input) {

        if (input == null) throw new NullPointerException("input");

        final int len = input.length();
        final List<Token> tokens = new ArrayList<Token>();
        int start = 0;

        while (start < len) {
            int bestEnd = -1;       // inclusive
            int bestCategory = -1;
            int furthest = start;

            for (int k = 0; k < patterns.size(); ++k) {
                final DFA dfa = patterns.get(k).dfa();
                int state = dfa.start();
                int lastAccept = -1;
                int i = start;
                for (; i < len; ++i) {
                    state = dfa.step(state, input.charAt(i));
                    if (state == DFA.UNDEFINED || dfa.isSink(state)) break;
                    if (dfa.isAccepting(state)) lastAccept = i;
                }
                furthest = Math.max(furthest, i);
                /*
                 * strictly greater: on a tie the earlier category stays
                 */
                if (lastAccept > bestEnd) {
                    bestEnd = lastAccept;
                    bestCategory = k;
                }
            }

            if (bestCategory < 0) {
                NoViableAlternativeException e =
                    new NoViableAlternativeException(input, furthest);
                if (logger.isLoggable(level)) {
                    logger.log(level, "lexical error at index " + furthest
                        + ": " + e.getMessage());
                }
                throw e;
            }

            tokens.add(new Token(categories.get(bestCategory),
                input.subSequence(start, bestEnd + 1).toString(), start));
            start = bestEnd + 1;
        }
        return tokens;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int k = 0; k < categories.size(); ++k) {
            sb.append(categories.get(k)).append(" -> ")
              .append(patterns.get(k)).append(Misc.LS);
        }
        return sb.toString();
    }
}
