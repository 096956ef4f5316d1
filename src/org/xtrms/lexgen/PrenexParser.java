/* @LICENSE@
 */
package org.xtrms.lexgen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.lexgen.AST.Node;

/**
 * Builds an expression tree from prenex form. Prenex carries no grouping, so
 * structure follows from arity alone: an operator keyword is followed by the
 * encodings of its one or two operands, an atom has none. Parsing does not
 * recurse, whatever the depth of the tree.
 * <p>
 * Tokens are separated by spaces. A quote, any single character and a quote
 * is a single token naming that character, which is how a space or a quote
 * atom is written.
 */
final class PrenexParser {

    private static final Logger logger = Logger.getLogger("org.xtrms.lexgen");
    private static final Level level = Level.FINER;

    private final String prenex;
    private final List<String> tokens = new ArrayList<String>();
    private final List<Integer> offsets = new ArrayList<Integer>();
    private int iToken;

    private PrenexParser(String prenex) {
        this.prenex = prenex;
    }

    /**
     * @throws MalformedPrenexException
     *             if <code>prenex</code> does not encode exactly one tree.
     */
    static Node parse(String prenex) {
        if (prenex == null) throw new NullPointerException("prenex");
        PrenexParser parser = new PrenexParser(prenex);
        parser.tokenize();
        Node root = parser.parseNode();
        if (parser.iToken < parser.tokens.size()) {
            parser.malformed("unexpected trailing token", parser.iToken);
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "prenex: " + Misc.Esc.JAVA.esc(prenex)
                + Misc.LS + root.toTreeString());
        }
        return root;
    }

    private void tokenize() {
        int i = 0;
        final int n = prenex.length();
        while (i < n) {
            char c = prenex.charAt(i);
            if (c == ' ') {
                ++i;
            } else if (c == '\'' && i + 2 < n && prenex.charAt(i + 2) == '\''
                    && (i + 3 == n || prenex.charAt(i + 3) == ' ')) {
                tokens.add(prenex.substring(i, i + 3));
                offsets.add(i);
                i += 3;
            } else {
                int end = prenex.indexOf(' ', i);
                if (end < 0) end = n;
                tokens.add(prenex.substring(i, end));
                offsets.add(i);
                i = end;
            }
        }
    }

    /*
     * an operator still waiting for some of its operands
     */
    private static final class Pending {

        final Operator op;
        final Node[] operands;
        int filled = 0;

        Pending(Operator op) {
            this.op = op;
            this.operands = new Node[op.arity];
        }
    }

    /*
     * Operators are pushed as they are read; each completed subtree fills
     * the next operand of the operator on top, and every operator so
     * completed is reduced in turn. The stack lives on the heap, so deeply
     * nested prenex such as a long literal or a large range parses fine.
     */
    private Node parseNode() {
        final Deque<Pending> stack = new ArrayDeque<Pending>();
        while (true) {
            if (iToken >= tokens.size()) {
                malformed(tokens.isEmpty()
                        ? "empty prenex"
                        : "missing operand", iToken);
            }
            final int at = iToken;
            String token = tokens.get(iToken++);
            Operator op = Operator.forKeyword(token);
            if (op != null) {
                stack.push(new Pending(op));
                continue;
            }
            Node node = atom(token, at);
            while (true) {
                if (stack.isEmpty()) {
                    return node;
                }
                Pending top = stack.peek();
                top.operands[top.filled++] = node;
                if (top.filled < top.op.arity) {
                    break;
                }
                stack.pop();
                node = AST.node(top.op, top.operands);
            }
        }
    }

    private Node atom(String token, int at) {
        if (token.equals(AST.Atom.EPS_TEXT)) {
            return AST.eps();
        } else if (token.equals(AST.Atom.VOID_TEXT)) {
            return AST.empty();
        } else if (token.length() == 1) {
            return AST.atom(token.charAt(0));
        } else if (token.length() == 3 && token.charAt(0) == '\''
                && token.charAt(2) == '\'') {
            return AST.atom(token.charAt(1));
        }
        malformed("unknown token \"" + Misc.Esc.JAVA.esc(token) + "\"", at);
        return null;    // not reached
    }

    private void malformed(String msg, int iTok) {
        int index = iTok < offsets.size() ? offsets.get(iTok) : prenex.length();
        throw new MalformedPrenexException(msg, prenex, index);
    }
}
