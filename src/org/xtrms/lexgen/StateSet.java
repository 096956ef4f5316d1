/* @LICENSE@
 */
package org.xtrms.lexgen;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * An immutable, sorted set of automaton state ids. Equality and hashing are by
 * value, so instances serve directly as the canonical key of a subset during
 * the powerset construction.
 */
public final class StateSet implements Iterable<Integer>, Comparable<StateSet> {

    public static final StateSet EMPTY = new StateSet(new int[0]);

    private final int[] ids;    // strictly ascending

    private StateSet(int[] ids) {
        this.ids = ids;
    }

    static StateSet of(BitSet bits) {
        if (bits.isEmpty()) return EMPTY;
        int[] ids = new int[bits.cardinality()];
        int i = 0;
        for (int id = bits.nextSetBit(0); id >= 0; id = bits.nextSetBit(id + 1)) {
            ids[i++] = id;
        }
        return new StateSet(ids);
    }

    public static StateSet of(int... ids) {
        BitSet bits = new BitSet();
        for (int id : ids) {
            if (id < 0) throw new IllegalArgumentException("negative state id: " + id);
            bits.set(id);
        }
        return of(bits);
    }

    public int size() {
        return ids.length;
    }

    public boolean isEmpty() {
        return ids.length == 0;
    }

    public boolean contains(int id) {
        return Arrays.binarySearch(ids, id) >= 0;
    }

    /**
     * @return the <code>i</code>th smallest id.
     */
    public int get(int i) {
        return ids[i];
    }

    public int[] toArray() {
        return ids.clone();
    }

    /**
     * Adds every member to <code>bits</code>.
     */
    void addTo(BitSet bits) {
        for (int id : ids) bits.set(id);
    }

    public Iterator<Integer> iterator() {
        return new Iterator<Integer>() {
            private int i = 0;

            public boolean hasNext() {
                return i < ids.length;
            }

            public Integer next() {
                if (!hasNext()) throw new NoSuchElementException();
                return ids[i++];
            }

            public void remove() {
                throw new UnsupportedOperationException();
            }
        };
    }

    /**
     * Lexicographic order over the ascending id sequences.
     */
    public int compareTo(StateSet o) {
        int n = Math.min(ids.length, o.ids.length);
        for (int i = 0; i < n; ++i) {
            if (ids[i] != o.ids[i]) return ids[i] < o.ids[i] ? -1 : 1;
        }
        return ids.length - o.ids.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateSet)) return false;
        return Arrays.equals(ids, ((StateSet) o).ids);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(ids);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        for (int i = 0; i < ids.length; ++i) {
            if (i > 0) sb.append(',');
            sb.append(ids[i]);
        }
        return sb.append('}').toString();
    }
}
