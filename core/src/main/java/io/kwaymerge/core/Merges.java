// file: core/src/main/java/io/kwaymerge/core/Merges.java
package io.kwaymerge.core;

import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;

/**
 * Stable merge primitives over a raw {@code Object[]} store.
 * <p>
 * Stability rule everywhere: when two elements compare equal, the one coming
 * from the left input (or the left run) is placed first.
 */
final class Merges {

    private Merges() {
        // utility
    }

    /**
     * Copy {@code src} into {@code dst[from, to)}.
     *
     * @return the index one past the last written slot
     * @throws IllegalStateException if {@code src} yields more than {@code to - from} elements
     */
    static int copy(Collection<?> src, Object[] dst, int from, int to) {
        int k = from;
        for (Object e : src) {
            checkRoom(k, to);
            dst[k++] = e;
        }
        return k;
    }

    /**
     * Two-way merge of sorted {@code left} and {@code right} into {@code dst[from, to)}.
     *
     * @return the index one past the last written slot
     * @throws IllegalStateException if the inputs yield more than {@code to - from} elements
     */
    static <T> int merge(
            Collection<? extends T> left,
            Collection<? extends T> right,
            Object[] dst,
            int from,
            int to,
            Comparator<? super T> comparator
    ) {
        Iterator<? extends T> ia = left.iterator();
        Iterator<? extends T> ib = right.iterator();
        boolean hasA = ia.hasNext();
        boolean hasB = ib.hasNext();
        T a = hasA ? ia.next() : null;
        T b = hasB ? ib.next() : null;
        int k = from;

        while (hasA && hasB) {
            checkRoom(k, to);
            // strict: an equal right element waits for the left one
            if (comparator.compare(b, a) < 0) {
                dst[k++] = b;
                hasB = ib.hasNext();
                if (hasB) b = ib.next();
            } else {
                dst[k++] = a;
                hasA = ia.hasNext();
                if (hasA) a = ia.next();
            }
        }
        while (hasA) {
            checkRoom(k, to);
            dst[k++] = a;
            hasA = ia.hasNext();
            if (hasA) a = ia.next();
        }
        while (hasB) {
            checkRoom(k, to);
            dst[k++] = b;
            hasB = ib.hasNext();
            if (hasB) b = ib.next();
        }
        return k;
    }

    // ---------- in-place merges of a[lo, mid) and a[mid, hi) ----------

    /**
     * Merge using a temporary copy of the shorter run.
     * O(hi - lo) comparisons, O(min(mid - lo, hi - mid)) extra space.
     */
    static <T> void mergeInPlaceBuffered(Object[] a, int lo, int mid, int hi, Comparator<? super T> comparator) {
        if (lo >= mid || mid >= hi) return;
        // Runs already in order.
        if (comparator.compare(Merges.<T>at(a, mid), Merges.<T>at(a, mid - 1)) >= 0) return;

        // Left elements not greater than the first right element are already in place,
        // and so are right elements not less than the last left element.
        lo = upperBound(a, lo, mid, Merges.<T>at(a, mid), comparator);
        hi = lowerBound(a, mid, hi, Merges.<T>at(a, mid - 1), comparator);

        if (mid - lo <= hi - mid) {
            mergeLo(a, lo, mid, hi, comparator);
        } else {
            mergeHi(a, lo, mid, hi, comparator);
        }
    }

    /**
     * Merge without a temporary array: split the longer run in half, binary search
     * the matching cut in the other run, rotate the middle blocks and recurse.
     * O((hi - lo) log(hi - lo)) element moves, O(log(hi - lo)) stack.
     */
    static <T> void mergeInPlaceRotating(Object[] a, int lo, int mid, int hi, Comparator<? super T> comparator) {
        while (true) {
            int len1 = mid - lo;
            int len2 = hi - mid;
            if (len1 == 0 || len2 == 0) return;
            if (len1 + len2 == 2) {
                if (comparator.compare(Merges.<T>at(a, mid), Merges.<T>at(a, lo)) < 0) {
                    swap(a, lo, mid);
                }
                return;
            }

            int firstCut;
            int secondCut;
            if (len1 > len2) {
                firstCut = lo + len1 / 2;
                secondCut = lowerBound(a, mid, hi, Merges.<T>at(a, firstCut), comparator);
            } else {
                secondCut = mid + len2 / 2;
                firstCut = upperBound(a, lo, mid, Merges.<T>at(a, secondCut), comparator);
            }
            rotate(a, firstCut, mid, secondCut);
            int newMid = firstCut + (secondCut - mid);

            // Recurse on the smaller half, loop on the other.
            if ((newMid - lo) <= (hi - newMid)) {
                mergeInPlaceRotating(a, lo, firstCut, newMid, comparator);
                lo = newMid;
                mid = secondCut;
            } else {
                mergeInPlaceRotating(a, newMid, secondCut, hi, comparator);
                hi = newMid;
                mid = firstCut;
            }
        }
    }

    // ---------- helpers ----------

    private static <T> void mergeLo(Object[] a, int lo, int mid, int hi, Comparator<? super T> comparator) {
        int len1 = mid - lo;
        Object[] tmp = new Object[len1];
        System.arraycopy(a, lo, tmp, 0, len1);

        int i = 0;
        int j = mid;
        int k = lo;
        while (i < len1 && j < hi) {
            if (comparator.compare(Merges.<T>at(a, j), Merges.<T>at(tmp, i)) < 0) {
                a[k++] = a[j++];
            } else {
                a[k++] = tmp[i++];
            }
        }
        // Whatever is left of the right run already sits at the end.
        System.arraycopy(tmp, i, a, k, len1 - i);
    }

    private static <T> void mergeHi(Object[] a, int lo, int mid, int hi, Comparator<? super T> comparator) {
        int len2 = hi - mid;
        Object[] tmp = new Object[len2];
        System.arraycopy(a, mid, tmp, 0, len2);

        int i = mid - 1;
        int j = len2 - 1;
        int k = hi - 1;
        while (i >= lo && j >= 0) {
            // filling from the back: on ties the right element goes last
            if (comparator.compare(Merges.<T>at(tmp, j), Merges.<T>at(a, i)) < 0) {
                a[k--] = a[i--];
            } else {
                a[k--] = tmp[j--];
            }
        }
        System.arraycopy(tmp, 0, a, lo, j + 1);
    }

    /** First index in [lo, hi) whose element is not less than {@code key}. */
    static <T> int lowerBound(Object[] a, int lo, int hi, T key, Comparator<? super T> comparator) {
        while (lo < hi) {
            int m = (lo + hi) >>> 1;
            if (comparator.compare(Merges.<T>at(a, m), key) < 0) {
                lo = m + 1;
            } else {
                hi = m;
            }
        }
        return lo;
    }

    /** First index in [lo, hi) whose element is greater than {@code key}. */
    static <T> int upperBound(Object[] a, int lo, int hi, T key, Comparator<? super T> comparator) {
        while (lo < hi) {
            int m = (lo + hi) >>> 1;
            if (comparator.compare(key, Merges.<T>at(a, m)) < 0) {
                hi = m;
            } else {
                lo = m + 1;
            }
        }
        return lo;
    }

    /** Rotate a[lo, hi) so that a[mid] moves to a[lo] (three reversals). */
    static void rotate(Object[] a, int lo, int mid, int hi) {
        if (lo == mid || mid == hi) return;
        reverse(a, lo, mid);
        reverse(a, mid, hi);
        reverse(a, lo, hi);
    }

    private static void reverse(Object[] a, int lo, int hi) {
        for (int i = lo, j = hi - 1; i < j; i++, j--) {
            swap(a, i, j);
        }
    }

    private static void swap(Object[] a, int i, int j) {
        Object t = a[i];
        a[i] = a[j];
        a[j] = t;
    }

    @SuppressWarnings("unchecked")
    private static <T> T at(Object[] a, int i) {
        return (T) a[i];
    }

    private static void checkRoom(int k, int to) {
        if (k >= to) {
            throw new IllegalStateException("sequence size changed during merge: slice ends at " + to);
        }
    }
}
