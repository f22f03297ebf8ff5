// file: core/src/main/java/io/kwaymerge/core/BoundaryLedger.java
package io.kwaymerge.core;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Ordered list of run boundaries inside an {@link OutputBuffer}.
 * <p>
 * Consecutive positions {@code [p_i, p_i+1)} bound one sorted run. The first
 * position is the start of the buffer and the last is its end once the first
 * round has been recorded.
 * <p>
 * Representation: an arena-backed singly-linked list. {@code positions[n]} is the
 * buffer index stored in node {@code n} and {@code next[n]} the following node
 * (or -1). Removing an interior entry only relinks its predecessor, so a pass
 * of the reduction phase can drop every consumed boundary in O(1) each.
 * <p>
 * Invariants:
 *  - positions are strictly increasing from head to tail,
 *  - the head is never removed.
 * <p>
 * Not thread safe. Only the coordinating thread touches a ledger; merge tasks
 * receive plain int positions.
 */
final class BoundaryLedger {

    private static final int NIL = -1;

    private int[] positions;
    private int[] next;
    private int used;
    private int tail = NIL;
    private int size;

    private BoundaryLedger(int capacity) {
        this.positions = new int[Math.max(capacity, 2)];
        this.next = new int[positions.length];
    }

    /** New ledger holding only the start sentinel. */
    static BoundaryLedger startingAt(int start, int expectedEntries) {
        if (start < 0) throw new IllegalArgumentException("start must be >= 0");
        var ledger = new BoundaryLedger(expectedEntries);
        ledger.append(start);
        return ledger;
    }

    /** Append a boundary after the current tail. Must be greater than the tail. */
    void append(int position) {
        if (tail != NIL && position <= positions[tail]) {
            throw new IllegalArgumentException(
                    "boundary %d must be greater than the last boundary %d".formatted(position, positions[tail]));
        }
        if (used == positions.length) {
            int grown = positions.length * 2;
            positions = Arrays.copyOf(positions, grown);
            next = Arrays.copyOf(next, grown);
        }
        int node = used++;
        positions[node] = position;
        next[node] = NIL;
        if (tail != NIL) {
            next[tail] = node;
        }
        tail = node;
        size++;
    }

    int size() {
        return size;
    }

    /** Number of runs bounded by this ledger. */
    int segmentCount() {
        return Math.max(size - 1, 0);
    }

    int first() {
        if (size == 0) throw new NoSuchElementException("empty ledger");
        return positions[0];
    }

    int last() {
        if (size == 0) throw new NoSuchElementException("empty ledger");
        return positions[tail];
    }

    /** Cursor positioned on the head entry. */
    Cursor cursor() {
        if (size == 0) throw new NoSuchElementException("empty ledger");
        return new Cursor();
    }

    /** Snapshot of the live positions, head to tail. */
    int[] toArray() {
        int[] out = new int[size];
        int i = 0;
        for (int n = size == 0 ? NIL : 0; n != NIL; n = next[n]) {
            out[i++] = positions[n];
        }
        return out;
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }

    /**
     * Forward-only view over the ledger. Supports dropping the entry right after
     * the current one, which is how a merged boundary disappears.
     */
    final class Cursor {
        private int node = 0;

        int position() {
            return positions[node];
        }

        boolean hasNext() {
            return next[node] != NIL;
        }

        /** True when the current entry and the two after it exist. */
        boolean hasTriple() {
            int n1 = next[node];
            return n1 != NIL && next[n1] != NIL;
        }

        int nextPosition() {
            int n1 = next[node];
            if (n1 == NIL) throw new NoSuchElementException("no entry after " + positions[node]);
            return positions[n1];
        }

        void advance() {
            int n1 = next[node];
            if (n1 == NIL) throw new NoSuchElementException("cursor at tail");
            node = n1;
        }

        /** Unlink the entry after the current one. The tail cannot be removed. */
        void removeNext() {
            int n1 = next[node];
            if (n1 == NIL || next[n1] == NIL) {
                throw new IllegalStateException("only interior boundaries can be removed");
            }
            next[node] = next[n1];
            size--;
        }
    }
}
