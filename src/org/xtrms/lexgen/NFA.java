/*
 * @LICENSE@
 */

/**
 * NFA: Nondeterministic Finite Automata, Thompson style.
 */
package org.xtrms.lexgen;

import static org.xtrms.lexgen.Misc.LS;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.lexgen.AST.Alt;
import org.xtrms.lexgen.AST.Atom;
import org.xtrms.lexgen.AST.Cat;
import org.xtrms.lexgen.AST.Maybe;
import org.xtrms.lexgen.AST.Node;
import org.xtrms.lexgen.AST.Plus;
import org.xtrms.lexgen.AST.Star;
import org.xtrms.lexgen.AST.Visitor.TraversalOrder;

/**
 * An immutable Thompson NFA: dense states <code>0..size()-1</code>, exactly
 * one start state and one accept state, and a list of transitions each
 * labelled with a character or with {@link #EPSILON}. The epsilon closure of
 * every state is computed once, at construction.
 */
public final class NFA {

    private static final Logger logger = Logger.getLogger("org.xtrms.lexgen");
    private static final Level level = Level.FINEST;

    /**
     * The label of an epsilon transition.
     */
    public static final int EPSILON = -1;

    /**
     * An edge <code>from -symbol-> to</code>.
     */
    public static final class Transition {

        public final int from;
        public final int symbol;    // a char, or EPSILON
        public final int to;

        private Transition(int from, int symbol, int to) {
            this.from = from;
            this.symbol = symbol;
            this.to = to;
        }

        public boolean isEpsilon() {
            return symbol == EPSILON;
        }

        @Override
        public String toString() {
            return from + " -" + (isEpsilon() ? "eps" : Misc.Esc.SYMBOL.esc(symbol))
                + "-> " + to;
        }
    }

    /*
     * Hands out state ids for one construction. Nothing is shared between
     * builds, so independent compiles never interfere.
     */
    private static final class StateAllocator {

        private int next = 0;

        int allocate() {
            return next++;
        }

        int count() {
            return next;
        }
    }

    /*
     * A partially built automaton with a single entry and a single exit.
     */
    private static final class Fragment {

        final int start;
        final int accept;

        Fragment(int start, int accept) {
            this.start = start;
            this.accept = accept;
        }
    }

    private final int start;
    private final int accept;
    private final int size;
    private final List<Transition> transitions;
    private final List<List<Transition>> outgoing;
    private final StateSet[] closures;
    private final char[] alphabet;

    private NFA(int start, int accept, int size, List<Transition> transitions) {
        this.start = start;
        this.accept = accept;
        this.size = size;
        this.transitions = Collections.unmodifiableList(transitions);

        outgoing = new ArrayList<List<Transition>>(size);
        for (int i = 0; i < size; ++i) {
            outgoing.add(new ArrayList<Transition>());
        }
        TreeSet<Character> sigma = new TreeSet<Character>();
        for (Transition t : transitions) {
            outgoing.get(t.from).add(t);
            if (!t.isEpsilon()) sigma.add((char) t.symbol);
        }
        alphabet = new char[sigma.size()];
        int i = 0;
        for (char c : sigma) alphabet[i++] = c;

        closures = new StateSet[size];
        for (int s = 0; s < size; ++s) {
            closures[s] = computeClosure(s);
        }
    }

    /**
     * Builds the NFA for an expression tree by Thompson construction.
     */
    static NFA from(Node root) {

        if (root == null) throw new NullPointerException("root");

        final StateAllocator allocator = new StateAllocator();
        final List<Transition> transitions = new ArrayList<Transition>();

        /*
         * Children are reduced before their parent, so the fragments of the
         * operands are on top of the stack when an operator is visited.
         */
        final class Builder extends AST.Visitor {

            private final Stack<Fragment> fragments = new Stack<Fragment>();

            Builder() {
                super(TraversalOrder.BOTTOM_UP);
            }

            Fragment build(Node node) {
                visit(node);
                assert fragments.size() == 1 : fragments.size();
                return fragments.pop();
            }

            private void edge(int from, int symbol, int to) {
                transitions.add(new Transition(from, symbol, to));
            }

            private void eps(int from, int to) {
                edge(from, EPSILON, to);
            }

            @Override
            protected void visit(Atom node) {
                int s = allocator.allocate();
                int a = allocator.allocate();
                if (node.isEpsilon()) {
                    eps(s, a);
                } else if (!node.isVoid()) {
                    edge(s, node.symbol, a);
                }
                fragments.push(new Fragment(s, a));
            }

            @Override
            protected void visit(Cat node) {
                Fragment second = fragments.pop();
                Fragment first = fragments.pop();
                eps(first.accept, second.start);
                fragments.push(new Fragment(first.start, second.accept));
            }

            @Override
            protected void visit(Alt node) {
                Fragment second = fragments.pop();
                Fragment first = fragments.pop();
                int s = allocator.allocate();
                int a = allocator.allocate();
                eps(s, first.start);
                eps(s, second.start);
                eps(first.accept, a);
                eps(second.accept, a);
                fragments.push(new Fragment(s, a));
            }

            @Override
            protected void visit(Star node) {
                Fragment f = fragments.pop();
                int s = allocator.allocate();
                int a = allocator.allocate();
                eps(s, f.start);
                eps(f.accept, a);
                eps(s, a);
                eps(f.accept, f.start);
                fragments.push(new Fragment(s, a));
            }

            @Override
            protected void visit(Plus node) {
                Fragment f = fragments.pop();
                int s = allocator.allocate();
                int a = allocator.allocate();
                eps(s, f.start);
                eps(f.accept, a);
                eps(f.accept, f.start);
                fragments.push(new Fragment(s, a));
            }

            @Override
            protected void visit(Maybe node) {
                Fragment f = fragments.peek();
                eps(f.start, f.accept);
            }
        }

        Fragment f = new Builder().build(root);
        NFA nfa = new NFA(f.start, f.accept, allocator.count(), transitions);
        if (logger.isLoggable(level)) {
            logger.log(level, "nfa: " + root + LS + nfa);
        }
        return nfa;
    }

    /*
     * Depth first over epsilon edges, with a visited set private to this
     * computation.
     */
    private StateSet computeClosure(int s) {
        BitSet visited = new BitSet(size);
        Deque<Integer> stack = new ArrayDeque<Integer>();
        stack.push(s);
        visited.set(s);
        while (!stack.isEmpty()) {
            int u = stack.pop();
            for (Transition t : outgoing.get(u)) {
                if (t.isEpsilon() && !visited.get(t.to)) {
                    visited.set(t.to);
                    stack.push(t.to);
                }
            }
        }
        return StateSet.of(visited);
    }

    public int start() {
        return start;
    }

    public int accept() {
        return accept;
    }

    public int size() {
        return size;
    }

    /**
     * @return all state ids, <code>{0..size()-1}</code>.
     */
    public StateSet states() {
        BitSet bits = new BitSet(size);
        bits.set(0, size);
        return StateSet.of(bits);
    }

    /**
     * @return the transitions in the order they were created.
     */
    public List<Transition> transitions() {
        return transitions;
    }

    /**
     * @return the states reachable from <code>state</code> over zero or more
     *         epsilon edges; always contains <code>state</code> itself.
     */
    public StateSet closure(int state) {
        return closures[state];
    }

    /**
     * @return the direct targets of the edges labelled <code>c</code> leaving
     *         <code>state</code>. No closure is applied.
     */
    public StateSet next(int state, char c) {
        BitSet bits = new BitSet(size);
        for (Transition t : outgoing.get(state)) {
            if (t.symbol == c) bits.set(t.to);
        }
        return StateSet.of(bits);
    }

    /**
     * One step of the subset simulation: the closure of everything reachable
     * from a member of <code>states</code> on <code>c</code>.
     */
    StateSet move(StateSet states, char c) {
        BitSet bits = new BitSet(size);
        for (int s : states) {
            for (Transition t : outgoing.get(s)) {
                if (t.symbol == c) closures[t.to].addTo(bits);
            }
        }
        return StateSet.of(bits);
    }

    /**
     * {@link #move(StateSet, char)} for every symbol of the alphabet at once.
     * The edges leaving <code>states</code> are grouped by symbol in one
     * pass, so the cost depends on the edges present rather than on the size
     * of the alphabet.
     *
     * @return the successors indexed like {@link #alphabet()}; null where no
     *         edge carries the symbol.
     */
    StateSet[] successors(StateSet states) {
        final Map<Integer, List<Integer>> targets = new HashMap<Integer, List<Integer>>();
        for (int s : states) {
            for (Transition t : outgoing.get(s)) {
                if (t.isEpsilon()) continue;
                int k = Arrays.binarySearch(alphabet, (char) t.symbol);
                List<Integer> to = targets.get(k);
                if (to == null) {
                    to = new ArrayList<Integer>();
                    targets.put(k, to);
                }
                to.add(t.to);
            }
        }
        StateSet[] ret = new StateSet[alphabet.length];
        BitSet bits = new BitSet(size);
        for (Map.Entry<Integer, List<Integer>> e : targets.entrySet()) {
            for (int to : e.getValue()) {
                closures[to].addTo(bits);
            }
            ret[e.getKey()] = StateSet.of(bits);
            bits.clear();
        }
        return ret;
    }

    /**
     * @return the distinct non-epsilon symbols, ascending.
     */
    public char[] alphabet() {
        return alphabet.clone();
    }

    /**
     * Simulates the automaton on the whole of <code>input</code>.
     */
    public boolean accepts(CharSequence input) {
        StateSet current = closures[start];
        for (int i = 0; i < input.length() && !current.isEmpty(); ++i) {
            current = move(current, input.charAt(i));
        }
        return current.contains(accept);
    }

    /*
     * (non-Javadoc)
     * @see java.lang.Object#toString()
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb
            .append("total states: ").append(size)
            .append(" total arcs ").append(transitions.size())
            .append(LS);
        for (int s = 0; s < size; ++s) {
            sb.append("state: ").append(s);
            if (s == start) sb.append(" (start)");
            if (s == accept) sb.append(" (accept)");
            sb.append(" closure: ").append(closures[s]).append(LS);
            for (Transition t : outgoing.get(s)) {
                sb.append("    ").append(t).append(LS);
            }
        }
        return sb.toString();
    }
}
