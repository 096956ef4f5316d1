/* @LICENSE@
 */

package org.xtrms.lexgen;

import static org.xtrms.lexgen.LexAssert.*;

import java.util.Arrays;

public class DFATestCase extends AbstractLexTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(DFATestCase.class);
    }

    public DFATestCase(String name) {
        super(name);
    }

    private static DFA dfa(String regex) {
        return Pattern.compile(regex).dfa();
    }

    public void testAtom() {
        DFA dfa = dfa("a");
        assertTotal(dfa);
        assertEquals(3, dfa.size());
        assertEquals(0, dfa.start());
        assertTrue(Arrays.equals(new char[] {'a'}, dfa.alphabet()));
        int s1 = dfa.step(0, 'a');
        assertEquals(1, s1);
        assertTrue(dfa.isAccepting(s1));
        assertFalse(dfa.isAccepting(0));
        /*
         * the empty subset is discovered third and is the sink
         */
        assertEquals(2, dfa.step(s1, 'a'));
        assertEquals(2, dfa.sink());
        assertTrue(dfa.subset(2).isEmpty());
        assertEquals(DFA.UNDEFINED, dfa.step(0, 'b'));
        assertEquals(StateSet.of(1), dfa.acceptStates());
    }

    public void testStartSubsetIsStartClosure() {
        Pattern p = Pattern.compile("(a|b)*abb");
        assertEquals(p.nfa().closure(p.nfa().start()), p.dfa().subset(0));
        assertTotal(p.dfa());
    }

    public void testSynthesizedSink() {
        /*
         * a* never reaches the empty subset, so the sink is appended
         */
        DFA dfa = dfa("a*");
        assertTotal(dfa);
        assertEquals(3, dfa.size());
        assertEquals(2, dfa.sink());
        assertTrue(dfa.subset(2).isEmpty());
        assertTrue(dfa.isAccepting(0));
        assertTrue(dfa.isAccepting(1));
        assertEquals(1, dfa.step(1, 'a'));
        assertFalse(dfa.isSink(1));
    }

    public void testEmptyAlphabet() {
        DFA eps = dfa("eps");
        assertTotal(eps);
        assertEquals(0, eps.alphabet().length);
        assertEquals(2, eps.size());
        assertEquals(1, eps.sink());
        assertTrue(eps.accepts(""));
        assertFalse(eps.accepts("a"));

        DFA none = dfa("void");
        assertTotal(none);
        assertEquals(1, none.size());
        assertTrue(none.isSink(none.start()));
        assertFalse(none.accepts(""));
    }

    public void testAccepts() {
        DFA dfa = dfa("(a|b)*abb");
        assertTrue(dfa.accepts("abb"));
        assertTrue(dfa.accepts("babb"));
        assertTrue(dfa.accepts("aababb"));
        assertFalse(dfa.accepts("ab"));
        assertFalse(dfa.accepts("abba"));
        assertFalse(dfa.accepts("abbc"));
    }

    public void testTotality() {
        String[] regexes = {
            "a", "ab", "a|b", "a*", "a+", "a?", "(a|b)*abb", "[a-c]+x?",
            "eps", "void", "void|a", "(ab|a)(bc|c)", "a**", "' '+",
        };
        for (String regex : regexes) {
            assertTotal(dfa(regex));
        }
    }

    public void testBfsOrderIsDeterministic() {
        assertEquals(dfa("(ab|a)(bc|c)").toString(), dfa("(ab|a)(bc|c)").toString());
    }

    public void testToString() {
        String dump = dfa("a").toString();
        assertTrue(dump, dump.startsWith("total states: 3 total arcs 3"));
        assertTrue(dump, dump.contains("(start)"));
        assertTrue(dump, dump.contains("(accept)"));
        assertTrue(dump, dump.contains("(sink)"));
    }

    public void testStateLimitCountsAppendedSink() {
        String saved = System.getProperty(DFA.MAX_STATES_PROPERTY);
        try {
            /*
             * a* has two subsets and needs an appended sink
             */
            System.setProperty(DFA.MAX_STATES_PROPERTY, "2");
            try {
                dfa("a*");
                fail("should throw");
            } catch (DFA.ConstructionException e) {}
            System.setProperty(DFA.MAX_STATES_PROPERTY, "3");
            assertEquals(3, dfa("a*").size());
        } finally {
            if (saved == null) {
                System.clearProperty(DFA.MAX_STATES_PROPERTY);
            } else {
                System.setProperty(DFA.MAX_STATES_PROPERTY, saved);
            }
        }
    }

    public void testDeadEndsGoToSink() {
        DFA dfa = dfa("ab|c");
        assertTotal(dfa);
        for (int s = 0; s < dfa.size(); ++s) {
            if (!dfa.isAccepting(s)) continue;
            for (char c : dfa.alphabet()) {
                assertEquals(dfa.sink(), dfa.step(s, c));
            }
        }
    }

    public void testStateLimit() {
        String saved = System.getProperty(DFA.MAX_STATES_PROPERTY);
        System.setProperty(DFA.MAX_STATES_PROPERTY, "3");
        try {
            assertEquals(3, DFA.maxStateCount());
            dfa("a");       // exactly three
            try {
                dfa("(a|b)*abb");
                fail("should throw");
            } catch (DFA.ConstructionException e) {
                assertTrue(e.getMessage(), e.getMessage().contains("3"));
            }
        } finally {
            if (saved == null) {
                System.clearProperty(DFA.MAX_STATES_PROPERTY);
            } else {
                System.setProperty(DFA.MAX_STATES_PROPERTY, saved);
            }
        }
        assertEquals(100000, DFA.maxStateCount());
    }
}
