/* @LICENSE@
 */
package org.xtrms.lexgen;

import static org.xtrms.lexgen.Misc.LS;
import static org.xtrms.lexgen.Misc.clear;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

import org.xtrms.lexgen.AST.Visitor.TraversalOrder;

/**
 *
 * Uninstantiable class which serves as a source container for the static
 * classes and static methods used the construction of Abstract Syntax Trees.
 * <p>
 * The node family is closed: {@link Atom}, {@link Star}, {@link Plus},
 * {@link Maybe}, {@link Cat} and {@link Alt}. Each node owns its children;
 * arity is fixed by the class and checked by the constructors.
 *
 * @author ndw
 *
 */
final class AST {

    static abstract class Node {

        final String toTreeString() {
            final StringBuilder sb = new StringBuilder();
            new AbstractTreePrinter(sb) {
                @Override
                protected Formatter newFormatter() {
                    return new Formatter() {
                        private int nspace = 0;
                        private void indent() throws IOException {
                            for (int i=0; i<nspace; ++i) {
                                a.append(' ');
                            }
                        }
                        @Override
                        void push() {
                            nspace += 4;
                        }
                        @Override
                        void pop() {
                            nspace -= 4;
                        }
                        @Override
                        void appendNonTerminal(String label) {
                            try {
                                indent();
                                a.append(label).append(LS);
                            } catch (IOException e) {
                                throw new RuntimeException(e);
                            }
                        }
                        @Override
                        void appendTerminal(int position, String label) {
                            try {
                                indent();
                                a.append(label).append(' ')
                                    .append('{')
                                        .append(Integer.toString(position))
                                    .append('}')
                                    .append(LS);
                            } catch (IOException e) {
                                throw new RuntimeException(e);
                            }
                        }
                    };
                }
            }.print(Node.this);
            return sb.toString();
        }

        /**
         * The equals relation is always the identity relation for all Node
         * subclasses.
         */
        @Override
        public final boolean equals(Object o) {
            return super.equals(o);
        }
        @Override
        public final int hashCode() {
            return super.hashCode();
        }

        /**
         * Renders the tree in prenex form: keywords and atoms in prefix order,
         * separated by single spaces.
         */
        @Override
        public final String toString() {

            return new Visitor(TraversalOrder.TOP_DOWN) {

                private final StringBuilder sb = new StringBuilder();

                @Override
                public String toString() {
                    clear(sb);
                    visit(Node.this);
                    return sb.toString();
                }

                private void append(String token) {
                    if (sb.length() > 0) sb.append(' ');
                    sb.append(token);
                }

                @Override
                protected void visit(Cat node) {
                    append(Operator.CONCAT.keyword);
                }

                @Override
                protected void visit(Alt node) {
                    append(Operator.UNION.keyword);
                }

                @Override
                protected void visit(Star node) {
                    append(Operator.STAR.keyword);
                }

                @Override
                protected void visit(Plus node) {
                    append(Operator.PLUS.keyword);
                }

                @Override
                protected void visit(Maybe node) {
                    append(Operator.MAYBE.keyword);
                }

                @Override
                protected void visit(Atom node) {
                    append(node.text());
                }
            }.toString();
        }
    }

    /**
     * A leaf: a single character, the empty string ({@link #EPS}) or the empty
     * language ({@link #VOID}).
     */
    static final class Atom extends Node {

        static final int EPS = -1;
        static final int VOID = -2;

        static final String EPS_TEXT = "eps";
        static final String VOID_TEXT = "void";

        final int symbol;

        private Atom(int symbol) {
            if (symbol < VOID || symbol > Character.MAX_VALUE) {
                throw new IllegalArgumentException("bad atom symbol: " + symbol);
            }
            this.symbol = symbol;
        }

        boolean isEpsilon() {
            return symbol == EPS;
        }

        boolean isVoid() {
            return symbol == VOID;
        }

        String text() {
            return textOf(symbol);
        }

        /**
         * The prenex token for an atom symbol. Characters which would not
         * survive the space delimited encoding, and the quote itself, are
         * written between quotes.
         */
        static String textOf(int symbol) {
            switch (symbol) {
            case EPS:
                return EPS_TEXT;
            case VOID:
                return VOID_TEXT;
            default:
                char c = (char) symbol;
                return needsQuote(c) ? "'" + c + '\'' : String.valueOf(c);
            }
        }

        static boolean needsQuote(char c) {
            return c == '\''
                    || Character.isWhitespace(c)
                    || Character.isSpaceChar(c)
                    || Character.isISOControl(c);
        }
    }

    static abstract class NonTerminal extends Node {

        abstract Node[] children();
    }

    static abstract class Unary extends NonTerminal {

        final Node child;
        private Unary(Node child) {
            if (child == null) {
                throw new NullPointerException(getClass().getSimpleName() + ": null child");
            }
            this.child = child;
        }

        @Override
        final Node[] children() {
            return new Node[] {child};
        }
    }

    static abstract class Quantifier extends Unary {

        private Quantifier(Node child) {
            super(child);
        }

        abstract Operator operator();
    }

    static final class Star extends Quantifier {

        private Star(Node child) {
            super(child);
        }
        @Override
        Operator operator() {
            return Operator.STAR;
        }
    }

    static final class Plus extends Quantifier {

        private Plus(Node child) {
            super(child);
        }
        @Override
        Operator operator() {
            return Operator.PLUS;
        }
    }

    static final class Maybe extends Quantifier {

        private Maybe(Node child) {
            super(child);
        }
        @Override
        Operator operator() {
            return Operator.MAYBE;
        }
    }

    static abstract class Binary extends NonTerminal {

        final Node first, second;

        private Binary(Node first, Node second) {
            if (first == null || second == null) {
                throw new NullPointerException(getClass().getSimpleName() + ": null child");
            }
            this.first = first;
            this.second = second;
        }

        @Override
        final Node[] children() {
            return new Node[] {first, second};
        }

        abstract Operator operator();
    }

    static final class Cat extends Binary {

        private Cat(Node first, Node second) {
            super(first, second);
        }
        @Override
        Operator operator() {
            return Operator.CONCAT;
        }
    }

    static final class Alt extends Binary {

        private Alt(Node first, Node second) {
            super(first, second);
        }
        @Override
        Operator operator() {
            return Operator.UNION;
        }
    }

    static abstract class Visitor {

        enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP;
        }

        /*
         * a nonterminal whose children are being walked
         */
        private static final class Frame {

            final NonTerminal node;
            final Node[] kids;
            int next = 0;

            Frame(NonTerminal node) {
                this.node = node;
                this.kids = node.children();
            }
        }

        private final TraversalOrder order;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }

        /**
         * Walks the tree rooted at <code>root</code>. The walk keeps its own
         * stack, so the depth of a tree is limited by the heap only. Each
         * nonterminal is dispatched before its children (TOP_DOWN) or after
         * them (BOTTOM_UP), and {@link #leave(NonTerminal)} follows its last
         * child in both orders.
         */
        protected final void visit(Node root) {
            final Deque<Frame> stack = new ArrayDeque<Frame>();
            enter(root, stack);
            while (!stack.isEmpty()) {
                Frame f = stack.peek();
                if (f.next < f.kids.length) {
                    enter(f.kids[f.next++], stack);
                } else {
                    stack.pop();
                    if (order == TraversalOrder.BOTTOM_UP) {
                        dispatch(f.node);
                    }
                    leave(f.node);
                }
            }
        }

        private void enter(Node node, Deque<Frame> stack) {
            if (node instanceof NonTerminal) {
                NonTerminal nt = (NonTerminal) node;
                if (order == TraversalOrder.TOP_DOWN) {
                    dispatch(nt);
                }
                stack.push(new Frame(nt));
            } else if (node instanceof Atom) {
                visit((Atom) node);
            } else {
                error(node);
            }
        }

        /*
         * multi-dispatch:
         * - allows Visitor subclasses to deal with the exact granularity they want.
         * - "instanceof" dispatch is ugly but it's only in one place - here.
         */

        private void dispatch(NonTerminal node) {
            if (node instanceof Binary) {
                visit((Binary) node);
            } else if (node instanceof Quantifier){
                visit((Quantifier) node);
            } else {
                error(node);
            }
        }

        protected void visit(Binary node) {
            if (node instanceof Cat) {
                visit((Cat) node);
            } else if (node instanceof Alt) {
                visit((Alt) node);
            } else {
                error(node);
            }
        }

        protected void visit(Quantifier node) {
            if (node instanceof Star) {
                visit((Star) node);
            } else if (node instanceof Plus) {
                visit((Plus) node);
            } else if (node instanceof Maybe) {
                visit((Maybe) node);
            } else error(node);
        }

        protected void visit(Cat node) {}
        protected void visit(Alt node) {}

        protected void visit(Star node) {}
        protected void visit(Plus node) {}
        protected void visit(Maybe node) {}

        protected void visit(Atom node) {}

        /**
         * Called once all children of <code>node</code> have been walked.
         */
        protected void leave(NonTerminal node) {}

        private static void error(Node node) {
            throw new AssertionError("unknown node type " + node.getClass());
        }
    }

    static abstract class AbstractTreePrinter extends Visitor {

        protected abstract class Formatter {

            abstract void appendNonTerminal(String label);
            abstract void appendTerminal(int position, String label);
            abstract void push();
            abstract void pop();
        }

        protected final Appendable a;

        protected AbstractTreePrinter(Appendable a) {
            super(TraversalOrder.TOP_DOWN);
            this.a = a;
            formatter = newFormatter();
        }

        final void print(Node root) {
            position = 0;
            visit(root);
        }

        private final Formatter formatter;
        protected abstract Formatter newFormatter();

        protected int position = 0;

        @Override
        protected final void leave(NonTerminal node) {
            formatter.pop();
        }

        @Override
        protected final void visit(Binary node) {
            formatter.appendNonTerminal(node.operator().keyword);
            formatter.push();
        }

        @Override
        protected final void visit(Quantifier node) {
            formatter.appendNonTerminal(node.operator().keyword);
            formatter.push();
        }

        @Override
        protected final void visit(Atom node) {
            String label = node.symbol < 0
                    ? node.text()
                    : Misc.Esc.SYMBOL.esc(node.symbol);
            formatter.appendTerminal(position++, label);
        }
    }


    /*
     * static factories of convenience for parser and testing
     */

    static Atom atom(char c) {
        return new Atom(c);
    }

    static Atom eps() {
        return new Atom(Atom.EPS);
    }

    static Atom empty() {
        return new Atom(Atom.VOID);
    }

    static Node cat(Node... nodes) {
        Node root = null;
        for (Node node : nodes) {
            if (root == null) {
                root = node;
            } else {
                root = new Cat(root, node);
            }
        }
        return root;
    }

    static Node alt(Node... nodes) {
        Node root = null;
        for (Node node : nodes) {
            if (root == null) {
                root = node;
            } else {
                root = new Alt(root, node);
            }
        }
        return root;
    }

    static Star star(Node child) {
        return new Star(child);
    }

    static Plus plus(Node child) {
        return new Plus(child);
    }

    static Maybe maybe(Node child) {
        return new Maybe(child);
    }

    /**
     * Builds the node for a prenex operator over already built children.
     */
    static Node node(Operator op, Node... children) {
        if (children.length != op.arity) {
            throw new IllegalArgumentException(
                op + " takes " + op.arity + " operand(s), got " + children.length);
        }
        switch (op) {
        case UNION:
            return new Alt(children[0], children[1]);
        case CONCAT:
            return new Cat(children[0], children[1]);
        case STAR:
            return new Star(children[0]);
        case PLUS:
            return new Plus(children[0]);
        case MAYBE:
            return new Maybe(children[0]);
        default:
            throw new IllegalArgumentException("not a tree operator: " + op);
        }
    }

    private AST() {}    // uninstantiable
}
