package io.github.mmhelloworld.lazylist;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-safe cell. The producer runs while holding the cell's monitor, so threads forcing concurrently wait for the
 * winner and then read its cached value. The producing thread is recorded so that a reentrant force from the
 * producer itself reports "not yet available" rather than re-entering the monitor.
 */
public final class SynchronizedCell<T> extends AbstractMemoizingCell<T> {
    private volatile Thread producingThread;

    public SynchronizedCell(Supplier<? extends T> producer) {
        super(producer);
    }

    private SynchronizedCell(T value) {
        super(value);
    }

    public static <T> SynchronizedCell<T> evaluated(T value) {
        return new SynchronizedCell<>(value);
    }

    @Override
    Optional<T> forceSlowPath() {
        synchronized (this) {
            return evaluate();
        }
    }

    @Override
    boolean isProducingOnCurrentThread() {
        return producingThread == Thread.currentThread();
    }

    @Override
    void enterProduction() {
        producingThread = Thread.currentThread();
    }

    @Override
    void exitProduction() {
        producingThread = null;
    }

    @Override
    public EvaluationMode getEvaluationMode() {
        return EvaluationMode.CONCURRENT;
    }
}
