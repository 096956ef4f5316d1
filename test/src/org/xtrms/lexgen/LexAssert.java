/*@LICENSE@
 */

package org.xtrms.lexgen;

import static junit.framework.Assert.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Static assertions shared by the test cases of both test packages.
 *
 * @author ndw
 */
public final class LexAssert {

    private LexAssert() {}   // not instantiable.

    /*
     * acceptance
     */
    public static void assertMatches(String regex, String... inputs) {
        Pattern p = Pattern.compile(regex);
        for (String input : inputs) {
            assertTrue(esc(regex) + " should match \"" + esc(input) + "\"",
                p.matches(input));
            assertTrue("nfa disagrees with dfa on \"" + esc(input) + "\"",
                p.nfa().accepts(input));
        }
    }

    public static void assertRejects(String regex, String... inputs) {
        Pattern p = Pattern.compile(regex);
        for (String input : inputs) {
            assertFalse(esc(regex) + " should not match \"" + esc(input) + "\"",
                p.matches(input));
            assertFalse("nfa disagrees with dfa on \"" + esc(input) + "\"",
                p.nfa().accepts(input));
        }
    }

    /**
     * Every string over <code>alphabet</code> of length at most
     * <code>maxLength</code>, shortest first.
     */
    public static List<String> allStrings(String alphabet, int maxLength) {
        List<String> ret = new ArrayList<String>();
        ret.add("");
        int from = 0;
        for (int len = 1; len <= maxLength; ++len) {
            int to = ret.size();
            for (int i = from; i < to; ++i) {
                for (char c : alphabet.toCharArray()) {
                    ret.add(ret.get(i) + c);
                }
            }
            from = to;
        }
        return ret;
    }

    /**
     * Compares a pattern with an equivalent {@link java.util.regex.Pattern}
     * on every string over <code>alphabet</code> up to <code>maxLength</code>.
     */
    public static void assertSameLanguage(Pattern p, String javaRegex,
            String alphabet, int maxLength) {
        java.util.regex.Pattern jp = java.util.regex.Pattern.compile(javaRegex);
        for (String s : allStrings(alphabet, maxLength)) {
            assertEquals(p + " vs " + javaRegex + " on \"" + esc(s) + "\"",
                jp.matcher(s).matches(), p.matches(s));
        }
    }

    public static void assertSameLanguage(String regex, String javaRegex,
            String alphabet, int maxLength) {
        assertSameLanguage(Pattern.compile(regex), javaRegex, alphabet, maxLength);
    }

    /**
     * Compares two patterns on every string over <code>alphabet</code> up to
     * <code>maxLength</code>.
     */
    public static void assertSameLanguage(Pattern expected, Pattern actual,
            String alphabet, int maxLength) {
        for (String s : allStrings(alphabet, maxLength)) {
            assertEquals(expected + " vs " + actual + " on \"" + esc(s) + "\"",
                expected.matches(s), actual.matches(s));
        }
    }

    /*
     * automata structure
     */

    /**
     * A DFA is total: it has a non-accepting sink which loops on every
     * symbol, and every (state, symbol) pair has a target in range.
     */
    public static void assertTotal(DFA dfa) {
        char[] sigma = dfa.alphabet();
        int sink = dfa.sink();
        assertTrue("sink out of range", 0 <= sink && sink < dfa.size());
        assertTrue(dfa.isSink(sink));
        assertFalse("sink accepts", dfa.isAccepting(sink));
        for (int s = 0; s < dfa.size(); ++s) {
            for (char c : sigma) {
                int t = dfa.step(s, c);
                assertTrue("undefined transition " + s + " on " + c,
                    0 <= t && t < dfa.size());
            }
        }
        for (char c : sigma) {
            assertEquals(sink, dfa.step(sink, c));
        }
    }

    /**
     * An NFA has dense ids, one start, one accept and reflexive closures.
     */
    public static void assertWellFormed(NFA nfa) {
        int n = nfa.size();
        assertTrue(0 <= nfa.start() && nfa.start() < n);
        assertTrue(0 <= nfa.accept() && nfa.accept() < n);
        assertTrue(nfa.start() != nfa.accept());
        assertEquals(n, nfa.states().size());
        for (NFA.Transition t : nfa.transitions()) {
            assertTrue(t.toString(), 0 <= t.from && t.from < n);
            assertTrue(t.toString(), 0 <= t.to && t.to < n);
        }
        for (int s = 0; s < n; ++s) {
            assertTrue("closure of " + s + " is not reflexive",
                nfa.closure(s).contains(s));
        }
    }

    /*
     * lexing
     */

    /**
     * @param expected
     *            alternating category and lexeme.
     */
    public static void assertTokens(Lexer lexer, CharSequence input, String... expected) {
        assertTrue("category/lexeme pairs expected", expected.length % 2 == 0);
        List<Lexer.Token> tokens = lexer.tokenize(input);
        assertEquals("token count for \"" + esc(input.toString()) + "\": " + tokens,
            expected.length / 2, tokens.size());
        int offset = 0;
        for (int i = 0; i < tokens.size(); ++i) {
            Lexer.Token t = tokens.get(i);
            assertEquals(expected[2 * i], t.category());
            assertEquals(expected[2 * i + 1], t.lexeme());
            assertEquals(offset, t.start());
            offset = t.end();
        }
        assertEquals(input.length(), offset);
    }

    /**
     * @param column
     *            the expected 1-based column, or -1 for end of input.
     */
    public static NoViableAlternativeException assertLexError(
            Lexer lexer, CharSequence input, int line, int column) {
        try {
            lexer.tokenize(input);
            fail("should throw: \"" + esc(input.toString()) + "\"");
            return null;
        } catch (NoViableAlternativeException e) {
            assertEquals("line", line, e.line());
            if (column < 0) {
                assertTrue("expected EOF", e.isEOF());
                assertEquals("No viable alternative at character EOF, line " + line,
                    e.getMessage());
            } else {
                assertFalse("unexpected EOF", e.isEOF());
                assertEquals("column", column, e.column());
                assertEquals("No viable alternative at character " + column
                    + ", line " + line, e.getMessage());
            }
            return e;
        }
    }

    private static String esc(String s) {
        return Misc.Esc.JAVA.esc(s);
    }
}
