package io.github.mmhelloworld.lazylist;

import java.util.function.Supplier;

/**
 * How the cells of a list guard their one-time evaluation.
 */
public enum EvaluationMode {
    /**
     * No locking. Only one logical caller at a time may force cells; reentrant forcing from within a producer is
     * still detected.
     */
    SINGLE_THREADED {
        @Override
        public <T> MemoizingCell<T> newCell(Supplier<? extends T> producer) {
            return new UnsynchronizedCell<>(producer);
        }

        @Override
        public <T> MemoizingCell<T> evaluatedCell(T value) {
            return UnsynchronizedCell.evaluated(value);
        }
    },

    /**
     * Cells may be forced from several threads. One thread runs the producer while the others wait for its result.
     */
    CONCURRENT {
        @Override
        public <T> MemoizingCell<T> newCell(Supplier<? extends T> producer) {
            return new SynchronizedCell<>(producer);
        }

        @Override
        public <T> MemoizingCell<T> evaluatedCell(T value) {
            return SynchronizedCell.evaluated(value);
        }
    };

    public abstract <T> MemoizingCell<T> newCell(Supplier<? extends T> producer);

    public abstract <T> MemoizingCell<T> evaluatedCell(T value);
}
