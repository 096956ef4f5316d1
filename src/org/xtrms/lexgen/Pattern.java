/*
 * @LICENSE@
 */

package org.xtrms.lexgen;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

import org.xtrms.lexgen.AST.Node;

/**
 * A compiled regular expression: the whole pipeline from regex text through
 * prenex form, expression tree and {@link NFA} to a complete {@link DFA}, run
 * once at construction. Like {@link java.util.regex.Pattern}, instances are
 * immutable and thread safe.
 * <p>
 * <strong>Syntax.</strong> The accepted language is deliberately small:
 * <ul>
 * <li>any character not listed below is a literal, a space included;</li>
 * <li><code>'x'</code> is the literal <code>x</code>, whatever it is;
 * <code>'\n'</code>, <code>'\t'</code>, <code>'\r'</code>, <code>'\f'</code>,
 * <code>'\0'</code>, <code>'\\'</code> and <code>'\''</code> are escapes;</li>
 * <li><code>\x</code> outside quotes is also the literal <code>x</code>, with
 * <code>\n</code>, <code>\t</code>, <code>\r</code> and <code>\f</code>
 * naming control characters;</li>
 * <li><code>eps</code> matches the empty string and <code>void</code> matches
 * nothing at all;</li>
 * <li><code>|</code> is union, <code>.</code> or juxtaposition is
 * concatenation, <code>*</code>, <code>+</code> and <code>?</code> are postfix
 * repetition, and parentheses group;</li>
 * <li><code>[a-zA-Z_]</code> is the union of the listed characters and
 * inclusive ranges. There is no negation.</li>
 * </ul>
 * Repetition binds tighter than concatenation, which binds tighter than
 * union.
 * <p>
 * Matching is always against the whole input; there is no search, no
 * anchors and no capture.
 */
public final class Pattern {

    private static final Logger logger = Logger.getLogger("org.xtrms.lexgen");
    private static final Level level = Level.FINER;

    private final String regex;     // null when built from prenex
    private final String prenex;
    private final Node root;
    private final NFA nfa;
    private final DFA dfa;

    private Pattern(String regex, String prenex, Node root) {
        this.regex = regex;
        this.prenex = prenex;
        this.root = root;
        this.nfa = NFA.from(root);
        this.dfa = new DFA(nfa);
        if (logger.isLoggable(level)) {
            logger.log(level, "pattern: " + Misc.Esc.JAVA.esc(toString())
                + " nfa states: " + nfa.size() + " dfa states: " + dfa.size());
        }
    }

    /**
     * Compiles a regex.
     *
     * @throws PatternSyntaxException
     *             if <code>regex</code> is malformed. A
     *             {@link MalformedPrenexException} signals a regex which is
     *             lexically well formed but has a missing operand, for example
     *             <code>a|</code> or <code>()</code>.
     * @throws DFA.ConstructionException
     *             if the automaton is too large.
     */
    public static Pattern compile(String regex) {
        String prenex = toPrenex(regex);
        return new Pattern(regex, prenex, PrenexParser.parse(prenex));
    }

    /**
     * Builds a pattern directly from prenex form.
     *
     * @throws MalformedPrenexException
     *             if <code>prenex</code> does not encode exactly one tree.
     */
    public static Pattern fromPrenex(String prenex) {
        return new Pattern(null, prenex, PrenexParser.parse(prenex));
    }

    /**
     * Compiles a regex to prenex form without building any automaton.
     *
     * @throws PatternSyntaxException
     *             if <code>regex</code> is lexically malformed.
     */
    public static String toPrenex(String regex) {
        return new PrenexCompiler().compile(regex);
    }

    public static boolean matches(String regex, CharSequence input) {
        return compile(regex).matches(input);
    }

    /**
     * @return true if the whole of <code>input</code> is in the language.
     */
    public boolean matches(CharSequence input) {
        return dfa.accepts(input);
    }

    /**
     * @return the source regex, or null for a pattern built from prenex.
     */
    public String pattern() {
        return regex;
    }

    public String prenex() {
        return prenex;
    }

    public NFA nfa() {
        return nfa;
    }

    public DFA dfa() {
        return dfa;
    }

    /**
     * @return the expression tree, one node per line, indented by depth.
     */
    public String toTreeString() {
        return root.toTreeString();
    }

    @Override
    public String toString() {
        return regex != null ? regex : prenex;
    }
}
