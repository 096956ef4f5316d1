/*
 * @LICENSE@
 */

/**
 * <h3><b>xtrms-lexgen</b> - A finite automata based lexer generator.</h3>
 * <p>
 * <h4>Pipeline.</h4>
 * <p>
 * A regex passes through a fixed chain of representations, each one built
 * completely before the next:
 * <ol>
 * <li>the regex text, in the small syntax documented on {@link
 * org.xtrms.lexgen.Pattern};</li>
 * <li><em>prenex</em> form, a space separated prefix token stream such as
 * <code>CONCAT a STAR b</code> for <code>ab*</code>. Prenex has no grouping;
 * the arity of each keyword determines the structure. It is a stable textual
 * form other tools may produce or consume, see
 * {@link org.xtrms.lexgen.Pattern#toPrenex(String)} and
 * {@link org.xtrms.lexgen.Pattern#fromPrenex(String)};</li>
 * <li>an expression tree;</li>
 * <li>a Thompson {@link org.xtrms.lexgen.NFA} with one start and one accept
 * state and precomputed epsilon closures;</li>
 * <li>a complete {@link org.xtrms.lexgen.DFA} by subset construction, with an
 * explicit sink state.</li>
 * </ol>
 * <p>
 * <h4>Lexing.</h4>
 * <p>
 * A {@link org.xtrms.lexgen.Lexer} holds one DFA per token category, in
 * priority order. At each position every DFA is run as far as it can go; the
 * longest match wins and ties go to the category declared first. When nothing
 * matches, a {@link org.xtrms.lexgen.NoViableAlternativeException} reports the
 * line and column of the furthest character any automaton reached.
 * <p>
 * <h4>Tuning and diagnostics.</h4>
 * <p>
 * All classes log to the <code>org.xtrms.lexgen</code>
 * {@linkplain java.util.logging.Logger logger}: lexer construction at
 * <code>FINE</code>, compilation steps at <code>FINER</code> and full
 * automaton dumps at <code>FINEST</code>. The system property
 * <code>org.xtrms.lexgen.maxDfaStates</code> bounds the size of any one DFA.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>For an introduction to the theory behind regular expression and their
 * implementation as automata, see the first chapters of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book.</a></li>
 * <li>Russ Cox, <a href="http://swtch.com/~rsc/regexp/regexp1.html">Regular
 * Expression Matching Can Be Simple And Fast</a>, on Thompson's
 * construction.</li>
 * </ul>
 */
package org.xtrms.lexgen;
