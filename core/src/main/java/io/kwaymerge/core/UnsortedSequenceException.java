// file: core/src/main/java/io/kwaymerge/core/UnsortedSequenceException.java
package io.kwaymerge.core;

/**
 * Thrown when input validation finds a sequence that is not sorted under the
 * merge comparator.
 */
public final class UnsortedSequenceException extends IllegalArgumentException {

    private final int sequenceIndex;
    private final long offset;

    public UnsortedSequenceException(int sequenceIndex, long offset) {
        super("precondition violated: sequence %d is not sorted at offset %d".formatted(sequenceIndex, offset));
        this.sequenceIndex = sequenceIndex;
        this.offset = offset;
    }

    /** Position of the offending sequence in the input collection. */
    public int sequenceIndex() {
        return sequenceIndex;
    }

    /** Offset of the first element that is smaller than its predecessor. */
    public long offset() {
        return offset;
    }
}
