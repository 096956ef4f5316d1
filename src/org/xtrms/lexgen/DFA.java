/* @LICENSE@
 */
package org.xtrms.lexgen;

import static org.xtrms.lexgen.Misc.LS;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A complete DFA obtained from an {@link NFA} by subset construction.
 * <p>
 * States are dense, numbered in breadth first discovery order, and the start
 * state is always 0. The transition table is total over the
 * {@linkplain #alphabet() alphabet}: every state has exactly one successor
 * for every symbol. The {@linkplain #sink() sink} is the non-accepting state
 * which loops to itself on every symbol; once entered, no accepting state is
 * reachable.
 */
public final class DFA {

    private static final Logger logger = Logger.getLogger("org.xtrms.lexgen");
    private static final Level level = Level.FINEST;

    /**
     * The result of {@link #step(int, char)} for a character outside the
     * alphabet.
     */
    public static final int UNDEFINED = -1;

    /**
     * The system property holding the largest number of states a construction
     * may create.
     */
    public static final String MAX_STATES_PROPERTY = "org.xtrms.lexgen.maxDfaStates";

    /*
     * one state per member of the largest class, [\0-\uffff], still fits
     */
    private static final int DEFAULT_MAX_STATE_COUNT = 100 * 1000;

    /**
     * Thrown when the subset construction would exceed the state limit.
     */
    public static class ConstructionException extends RuntimeException {

        private static final long serialVersionUID = 5305946214712372390L;

        public ConstructionException(String message) {
            super(message);
        }
    }

    private final char[] alphabet;
    private final int[][] delta;        // [state][index into alphabet]
    private final boolean[] accept;
    private final StateSet[] subsets;   // null for a synthesized sink
    private final int sink;

    /**
     * Construct a complete DFA from an NFA.
     *
     * @throws ConstructionException
     *             if more than {@link #maxStateCount()} states are needed.
     */
    public DFA(final NFA nfa) {

        if (nfa == null) throw new NullPointerException("nfa");

        final int maxStateCount = maxStateCount();
        alphabet = nfa.alphabet();

        final class StateFactory {

            private final Map<StateSet, Integer> map =
                new LinkedHashMap<StateSet, Integer>();
            private final List<StateSet> queue = new ArrayList<StateSet>();

            private int stateFrom(StateSet nfaStates) {
                Integer id = map.get(nfaStates);
                if (id == null) {
                    if (map.size() >= maxStateCount) {
                        throw new ConstructionException(
                            "DFA state count exceeded: " + maxStateCount);
                    }
                    id = map.size();
                    map.put(nfaStates, id);
                    queue.add(nfaStates);
                }
                return id;
            }
        }
        final StateFactory factory = new StateFactory();

        /*
         * Subset construction as breadth first search. The queue only grows;
         * its index is the id of the subset being expanded. Subsets with no
         * outgoing edge at all share one row, all of it leading to the empty
         * subset.
         */
        final List<int[]> rows = new ArrayList<int[]>();
        int[] deadRow = null;
        factory.stateFrom(nfa.closure(nfa.start()));
        for (int i = 0; i < factory.queue.size(); ++i) {
            StateSet[] next = nfa.successors(factory.queue.get(i));
            boolean anyEdge = false;
            for (StateSet t : next) {
                if (t != null) {
                    anyEdge = true;
                    break;
                }
            }
            if (!anyEdge && alphabet.length > 0) {
                if (deadRow == null) {
                    deadRow = new int[alphabet.length];
                    Arrays.fill(deadRow, factory.stateFrom(StateSet.EMPTY));
                }
                rows.add(deadRow);
                continue;
            }
            int[] row = new int[alphabet.length];
            for (int k = 0; k < alphabet.length; ++k) {
                row[k] = factory.stateFrom(next[k] != null ? next[k] : StateSet.EMPTY);
            }
            rows.add(row);
        }

        final int n = factory.queue.size();
        int found = UNDEFINED;
        for (int i = 0; i < n && found == UNDEFINED; ++i) {
            if (!factory.queue.get(i).contains(nfa.accept())
                    && loopsOnEverySymbol(i, rows.get(i))) {
                found = i;
            }
        }

        final int total = found == UNDEFINED ? n + 1 : n;
        if (total > maxStateCount) {
            throw new ConstructionException(
                "DFA state count exceeded: " + maxStateCount);
        }
        delta = new int[total][];
        accept = new boolean[total];
        subsets = new StateSet[total];
        for (int i = 0; i < n; ++i) {
            delta[i] = rows.get(i);
            subsets[i] = factory.queue.get(i);
            accept[i] = subsets[i].contains(nfa.accept());
        }
        if (found == UNDEFINED) {
            /*
             * No natural sink: append one. Subset construction already
             * yields a total table, so no row needs filling.
             */
            found = n;
            delta[n] = new int[alphabet.length];
            Arrays.fill(delta[n], n);
        }
        sink = found;

        assert new Object() {
            boolean test() {
                for (int[] row : delta) {
                    if (row.length != alphabet.length) return false;
                    for (int t : row) {
                        if (t < 0 || t >= delta.length) return false;
                    }
                }
                return !accept[sink];
            }
        }.test();

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa: " + toString());
        }
    }

    private static boolean loopsOnEverySymbol(int state, int[] row) {
        for (int t : row) {
            if (t != state) return false;
        }
        return true;
    }

    /**
     * @return the configured state limit, from the {@value #MAX_STATES_PROPERTY}
     *         system property.
     */
    public static int maxStateCount() {
        return Integer.getInteger(MAX_STATES_PROPERTY, DEFAULT_MAX_STATE_COUNT);
    }

    public int size() {
        return delta.length;
    }

    public int start() {
        return 0;
    }

    public int sink() {
        return sink;
    }

    public char[] alphabet() {
        return alphabet.clone();
    }

    public boolean isAccepting(int state) {
        return accept[state];
    }

    public boolean isSink(int state) {
        return state == sink;
    }

    /**
     * @return the accepting states, ascending.
     */
    public StateSet acceptStates() {
        List<Integer> ids = new ArrayList<Integer>();
        for (int i = 0; i < accept.length; ++i) {
            if (accept[i]) ids.add(i);
        }
        int[] a = new int[ids.size()];
        for (int i = 0; i < a.length; ++i) a[i] = ids.get(i);
        return StateSet.of(a);
    }

    /**
     * @return the NFA states making up <code>state</code>; empty for an
     *         appended sink.
     */
    public StateSet subset(int state) {
        StateSet s = subsets[state];
        return s != null ? s : StateSet.EMPTY;
    }

    /**
     * @return the successor of <code>state</code> on <code>c</code>, or
     *         {@link #UNDEFINED} when <code>c</code> is not in the alphabet.
     */
    public int step(int state, char c) {
        int k = Arrays.binarySearch(alphabet, c);
        return k >= 0 ? delta[state][k] : UNDEFINED;
    }

    /**
     * Runs the whole of <code>input</code> from the start state.
     */
    public boolean accepts(CharSequence input) {
        int state = start();
        for (int i = 0; i < input.length(); ++i) {
            state = step(state, input.charAt(i));
            if (state == UNDEFINED || state == sink) return false;
        }
        return accept[state];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb
            .append("total states: ").append(size())
            .append(" total arcs ").append(size() * alphabet.length)
            .append(LS);
        for (int i = 0; i < delta.length; ++i) {
            sb.append("state: ").append(i).append(' ').append(subset(i));
            if (i == start())   sb.append(" (start)");
            if (accept[i])      sb.append(" (accept)");
            if (i == sink)      sb.append(" (sink)");
            sb.append(LS);
            for (int k = 0; k < alphabet.length; ++k) {
                sb.append("    ").append(Misc.Esc.SYMBOL.esc(alphabet[k]))
                  .append(" -> ").append(delta[i][k]).append(LS);
            }
        }
        return sb.toString();
    }
}
