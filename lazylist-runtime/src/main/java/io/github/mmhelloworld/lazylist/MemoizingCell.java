package io.github.mmhelloworld.lazylist;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * A value computed at most once, on first demand, and cached for the lifetime of the cell.
 *
 * <p>A cell starts out holding a one-shot producer. The first {@link #force()} runs it and caches the result. If the
 * producer throws, the exception reaches the caller and the cell is poisoned: every later force throws
 * {@link PoisonedCellException}.
 *
 * <p>A force issued by the producer itself, while the same cell is still being computed on the current thread,
 * returns {@link Optional#empty()} instead of recursing or blocking. Self-referential producers rely on this to
 * observe "not yet available" for their own position.
 *
 * @param <T> the cached value type, never {@code null}
 */
public interface MemoizingCell<T> {

    static <T> MemoizingCell<T> of(Supplier<? extends T> producer) {
        return of(producer, LazyListConfig.getDefaultEvaluationMode());
    }

    static <T> MemoizingCell<T> of(Supplier<? extends T> producer, EvaluationMode mode) {
        return mode.newCell(producer);
    }

    static <T> MemoizingCell<T> evaluated(T value) {
        return evaluated(value, LazyListConfig.getDefaultEvaluationMode());
    }

    static <T> MemoizingCell<T> evaluated(T value, EvaluationMode mode) {
        return mode.evaluatedCell(value);
    }

    /**
     * Returns the cached value, computing it first if needed.
     *
     * @return the value, or empty when this cell is already being computed further up the current call stack
     * @throws PoisonedCellException if an earlier computation of this cell failed
     */
    Optional<T> force();

    boolean isEvaluated();

    boolean isPoisoned();

    EvaluationMode getEvaluationMode();
}
