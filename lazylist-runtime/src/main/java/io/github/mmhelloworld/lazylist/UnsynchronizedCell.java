package io.github.mmhelloworld.lazylist;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cell for single-threaded use. The in-progress state is the only reentrancy guard.
 */
public final class UnsynchronizedCell<T> extends AbstractMemoizingCell<T> {

    public UnsynchronizedCell(Supplier<? extends T> producer) {
        super(producer);
    }

    private UnsynchronizedCell(T value) {
        super(value);
    }

    public static <T> UnsynchronizedCell<T> evaluated(T value) {
        return new UnsynchronizedCell<>(value);
    }

    @Override
    Optional<T> forceSlowPath() {
        return evaluate();
    }

    @Override
    boolean isProducingOnCurrentThread() {
        return getState() == State.IN_PROGRESS;
    }

    @Override
    public EvaluationMode getEvaluationMode() {
        return EvaluationMode.SINGLE_THREADED;
    }
}
