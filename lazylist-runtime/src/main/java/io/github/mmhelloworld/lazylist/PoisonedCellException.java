package io.github.mmhelloworld.lazylist;

/**
 * Thrown when a cell is forced after its producer terminated abnormally. The producer is never run twice, so the
 * cell stays unusable for the rest of its lifetime.
 */
public final class PoisonedCellException extends LazyListException {
    public PoisonedCellException(String message) {
        super(message);
    }
}
