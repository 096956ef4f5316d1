/* @LICENSE@
 */

package org.xtrms.lexgen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles an infix regex into prenex form, the space separated prefix token
 * stream consumed by {@link PrenexParser}. Compilation runs in three passes:
 * <ol>
 * <li>{@linkplain #preprocess(String) preprocessing} classifies the input
 * into literal and operator {@link Token}s, expanding quotes, escapes, the
 * reserved words and bracketed ranges;</li>
 * <li>{@linkplain #insertConcat(List) concatenation insertion} makes every
 * implicit concatenation explicit;</li>
 * <li>a shunting-yard pass over the reversed, bracket swapped token list
 * produces the prefix order.</li>
 * </ol>
 * Instances are not thread safe; use one per thread, or one per compile.
 */
final class PrenexCompiler {

    private static final Logger logger = Logger.getLogger("org.xtrms.lexgen");
    private static final Level level = Level.FINER;

    /**
     * A lexical atom of a regex: a literal character, the empty string, the
     * empty language, or an {@link Operator}.
     */
    static final class Token {

        final Operator op;      // null for atoms
        final int symbol;       // char, AST.Atom.EPS or AST.Atom.VOID; unused for operators

        private Token(Operator op, int symbol) {
            this.op = op;
            this.symbol = symbol;
        }

        static Token literal(char c) {
            return new Token(null, c);
        }

        static Token eps() {
            return new Token(null, AST.Atom.EPS);
        }

        static Token empty() {
            return new Token(null, AST.Atom.VOID);
        }

        static Token of(Operator op) {
            return OPERATORS[op.ordinal()];
        }

        private static final Token[] OPERATORS = new Token[Operator.values().length];
        static {
            for (Operator op : Operator.values()) {
                OPERATORS[op.ordinal()] = new Token(op, 0);
            }
        }

        boolean isAtom() {
            return op == null;
        }

        boolean is(Operator op) {
            return this.op == op;
        }

        /**
         * @return the token in prenex form: a keyword, or an atom text.
         */
        String prenexText() {
            assert op == null || !op.isGrouping() : op;
            return op != null ? op.keyword : AST.Atom.textOf(symbol);
        }

        @Override
        public String toString() {
            return op != null
                    ? String.valueOf(op.glyph)
                    : symbol < 0 ? AST.Atom.textOf(symbol) : Misc.Esc.SYMBOL.esc(symbol);
        }
    }

    private static final String ESCAPABLE_IN_QUOTES = "ntrf0\\'";

    /*
     * state for the character scanner
     */
    private String regex;
    private int iNext;
    private int iCurrent;
    private int token;

    /**
     * Compiles <code>regex</code> to prenex form.
     *
     * @throws PatternSyntaxException
     *             if the regex is empty, has an unterminated quote, a malformed
     *             range or unbalanced parentheses.
     */
    String compile(String regex) {
        List<Token> tokens = insertConcat(preprocess(regex));
        List<Token> prefix = toPrefix(tokens);
        StringBuilder sb = new StringBuilder();
        for (Token t : prefix) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(t.prenexText());
        }
        String prenex = sb.toString();
        if (logger.isLoggable(level)) {
            logger.log(level, "regex: " + Misc.Esc.JAVA.esc(regex)
                + " prenex: " + Misc.Esc.JAVA.esc(prenex));
        }
        return prenex;
    }

    /**
     * Classifies the characters of <code>regex</code> into literal and
     * operator tokens.
     */
    List<Token> preprocess(String regex) {
        if (regex == null) throw new NullPointerException("regex");
        this.regex = regex;
        iNext = 0;
        iCurrent = 0;
        if (regex.length() == 0) {
            syntaxError("empty regular expression");
        }
        List<Token> out = new ArrayList<Token>();
        while (nextRawChar()) {
            switch (token) {
            case '\'':
                out.add(Token.literal(scanQuoted()));
                break;
            case '\\':
                out.add(Token.literal(scanEscaped()));
                break;
            case '[':
                scanRange(out);
                break;
            case 'e':
                if (scanWord(AST.Atom.EPS_TEXT)) {
                    out.add(Token.eps());
                } else {
                    out.add(Token.literal('e'));
                }
                break;
            case 'v':
                if (scanWord(AST.Atom.VOID_TEXT)) {
                    out.add(Token.empty());
                } else {
                    out.add(Token.literal('v'));
                }
                break;
            default:
                Operator op = Operator.forGlyph((char) token);
                out.add(op != null ? Token.of(op) : Token.literal((char) token));
            }
        }
        return out;
    }

    /**
     * Inserts an explicit {@link Operator#CONCAT} between two adjacent tokens
     * wherever the left one ends an operand (an atom, ')' or a postfix
     * operator) and the right one starts an operand (an atom or '(').
     */
    static List<Token> insertConcat(List<Token> tokens) {
        if (tokens.size() <= 1) return tokens;
        List<Token> out = new ArrayList<Token>(2 * tokens.size());
        for (int i = 0; i < tokens.size() - 1; ++i) {
            Token t = tokens.get(i);
            Token u = tokens.get(i + 1);
            out.add(t);
            boolean endsOperand = t.isAtom()
                    || t.is(Operator.RPAREN)
                    || (t.op != null && t.op.isPostfix());
            boolean startsOperand = u.isAtom() || u.is(Operator.LPAREN);
            if (endsOperand && startsOperand) {
                out.add(Token.of(Operator.CONCAT));
            }
        }
        out.add(tokens.get(tokens.size() - 1));
        return out;
    }

    /*
     * Shunting-yard over the reversed input: reversing and swapping the
     * brackets turns the postfix output into prefix order once it is reversed
     * back.
     */
    private List<Token> toPrefix(List<Token> tokens) {
        List<Token> infix = new ArrayList<Token>(tokens.size() + 2);
        infix.add(Token.of(Operator.LPAREN));
        for (int i = tokens.size() - 1; i >= 0; --i) {
            Token t = tokens.get(i);
            if (t.is(Operator.LPAREN)) {
                infix.add(Token.of(Operator.RPAREN));
            } else if (t.is(Operator.RPAREN)) {
                infix.add(Token.of(Operator.LPAREN));
            } else {
                infix.add(t);
            }
        }
        infix.add(Token.of(Operator.RPAREN));

        List<Token> out = new ArrayList<Token>(infix.size());
        Deque<Operator> stack = new ArrayDeque<Operator>();
        for (Token t : infix) {
            if (t.isAtom()) {
                out.add(t);
            } else if (t.is(Operator.LPAREN)) {
                stack.push(Operator.LPAREN);
            } else if (t.is(Operator.RPAREN)) {
                while (!stack.isEmpty() && stack.peek() != Operator.LPAREN) {
                    out.add(Token.of(stack.pop()));
                }
                if (stack.isEmpty()) {
                    unbalanced();
                }
                stack.pop();
            } else {
                if (stack.isEmpty()) {
                    unbalanced();
                }
                /*
                 * Reversed, a repetition operator precedes its operand and
                 * is pushed as is, so a** nests as (a*)*. A binary operator
                 * pops entries of strictly higher rank, which keeps a|b|c
                 * left associative: UNION UNION a b c.
                 */
                if (!t.op.isPostfix()) {
                    while (stack.peek() != Operator.LPAREN
                            && stack.peek().rank > t.op.rank) {
                        out.add(Token.of(stack.pop()));
                    }
                }
                stack.push(t.op);
            }
        }
        if (!stack.isEmpty()) {
            unbalanced();
        }
        Collections.reverse(out);
        return out;
    }

    private void unbalanced() {
        iCurrent = regex.length();
        syntaxError("unbalanced parenthesis");
    }

    /*
     * char scanner stuff
     */

    private boolean hasNextChar() {
        return iNext < regex.length();
    }

    private boolean nextRawChar() {
        if (hasNextChar()) {
            iCurrent = iNext;
            token = regex.charAt(iNext++);
            return true;
        } else {
            return false;
        }
    }

    /*
     * 'x' is the literal x; '\n', '\t', '\r', '\f', '\0', '\\' and '\'' are
     * escapes. The opening quote has already been consumed.
     */
    private char scanQuoted() {
        final int open = iCurrent;
        if (iNext + 2 < regex.length()
                && regex.charAt(iNext) == '\\'
                && regex.charAt(iNext + 2) == '\''
                && ESCAPABLE_IN_QUOTES.indexOf(regex.charAt(iNext + 1)) != -1) {
            char c = control(regex.charAt(iNext + 1));
            iNext += 3;
            return c;
        }
        if (iNext + 1 < regex.length() && regex.charAt(iNext + 1) == '\'') {
            char c = regex.charAt(iNext);
            iNext += 2;
            return c;
        }
        iCurrent = open;
        syntaxError("unterminated quote");
        return 0;
    }

    /*
     * \x outside quotes names x literally. The backslash has been consumed.
     */
    private char scanEscaped() {
        if (!nextRawChar()) {
            return '\\';            // trailing lone backslash
        }
        return control((char) token);
    }

    private static char control(char c) {
        switch (c) {
        case 'n':
            return '\n';
        case 't':
            return '\t';
        case 'r':
            return '\r';
        case 'f':
            return '\f';
        case '0':
            return '\0';
        default:
            return c;
        }
    }

    /*
     * The first character of word has been consumed.
     */
    private boolean scanWord(String word) {
        if (regex.startsWith(word, iCurrent)) {
            iNext = iCurrent + word.length();
            return true;
        }
        return false;
    }

    /*
     * [items] where each item is a character or an inclusive range x-y.
     * Expands to ( c1 | c2 | ... | cn ) over the distinct characters in
     * ascending order. The '[' has been consumed.
     */
    private void scanRange(List<Token> out) {
        final int open = iCurrent;
        SortedSet<Character> chars = new TreeSet<Character>();
        boolean closed = false;
        while (nextRawChar()) {
            if (token == ']') {
                closed = true;
                break;
            }
            char first = rangeChar();
            if (hasNextChar() && regex.charAt(iNext) == '-') {
                nextRawChar();
                if (!nextRawChar() || token == ']') {
                    syntaxError("missing end of range in character class");
                }
                char last = rangeChar();
                if (last < first) {
                    syntaxError("non-ascending range in character class");
                }
                for (char c = first; ; ++c) {
                    chars.add(c);
                    if (c == last) break;
                }
            } else {
                chars.add(first);
            }
        }
        if (!closed) {
            iCurrent = open;
            syntaxError("character class missing end bracket");
        }
        if (chars.isEmpty()) {
            iCurrent = open;
            syntaxError("empty character class");
        }
        char[] members = new char[chars.size()];
        int i = 0;
        for (char c : chars) members[i++] = c;
        out.add(Token.of(Operator.LPAREN));
        appendUnion(out, members, 0, members.length);
        out.add(Token.of(Operator.RPAREN));
    }

    /*
     * Writes members[from..to) as a union balanced by halves. Left
     * association groups the left half without brackets, so up to three
     * members read as a plain chain: [a-c] is (a|b|c), [a-d] is (a|b|(c|d)).
     * Nesting depth, and with it every epsilon closure of the automaton,
     * stays logarithmic in the size of the class.
     */
    private static void appendUnion(List<Token> out, char[] members, int from, int to) {
        if (to - from == 1) {
            out.add(Token.literal(members[from]));
            return;
        }
        int mid = from + (to - from + 1) / 2;
        appendUnion(out, members, from, mid);
        out.add(Token.of(Operator.UNION));
        if (to - mid > 1) {
            out.add(Token.of(Operator.LPAREN));
            appendUnion(out, members, mid, to);
            out.add(Token.of(Operator.RPAREN));
        } else {
            out.add(Token.literal(members[mid]));
        }
    }

    /*
     * A character inside brackets, with \x naming x literally.
     */
    private char rangeChar() {
        if (token == '\\' && hasNextChar()) {
            nextRawChar();
            return control((char) token);
        }
        return (char) token;
    }

    private void syntaxError(String msg) {
        throw new PatternSyntaxException(msg, regex, iCurrent);
    }
}
