package io.github.mmhelloworld.lazylist;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

abstract class AbstractMemoizingCell<T> implements MemoizingCell<T> {
    private static final Logger LOGGER = LogManager.getLogger(AbstractMemoizingCell.class);

    enum State {
        EMPTY,
        IN_PROGRESS,
        DONE,
        POISONED
    }

    private Supplier<? extends T> producer;
    private T value;
    // written after value so that a DONE read publishes it
    private volatile State state;

    AbstractMemoizingCell(Supplier<? extends T> producer) {
        this.producer = requireNonNull(producer, "producer");
        this.state = State.EMPTY;
    }

    AbstractMemoizingCell(T value) {
        this.value = requireNonNull(value, "value");
        this.state = State.DONE;
    }

    @Override
    public final Optional<T> force() {
        if (state == State.DONE) {
            return Optional.of(value);
        }
        if (isProducingOnCurrentThread()) {
            return Optional.empty();
        }
        return forceSlowPath();
    }

    /**
     * Called when the value is not yet cached and the current thread is not the one producing it. Implementations
     * establish whatever exclusion they need and then call {@link #evaluate()}.
     */
    abstract Optional<T> forceSlowPath();

    abstract boolean isProducingOnCurrentThread();

    void enterProduction() {
    }

    void exitProduction() {
    }

    final State getState() {
        return state;
    }

    final Optional<T> evaluate() {
        switch (state) {
            case DONE:
                return Optional.of(value);
            case IN_PROGRESS:
                return Optional.empty();
            case POISONED:
                throw new PoisonedCellException("Memoizing cell has previously been poisoned");
            default:
                return Optional.of(produce());
        }
    }

    private T produce() {
        Supplier<? extends T> current = producer;
        producer = null;
        state = State.IN_PROGRESS;
        enterProduction();
        boolean completed = false;
        try {
            T result = requireNonNull(current.get(), "Memoizing cell producer returned null");
            value = result;
            completed = true;
            return result;
        } finally {
            state = completed ? State.DONE : State.POISONED;
            exitProduction();
            if (!completed) {
                LOGGER.debug("Producer terminated abnormally, poisoning {}", this);
            }
        }
    }

    @Override
    public final boolean isEvaluated() {
        return state == State.DONE;
    }

    @Override
    public final boolean isPoisoned() {
        return state == State.POISONED;
    }

    @Override
    public String toString() {
        State current = state;
        String content;
        switch (current) {
            case DONE:
                content = "value=" + value;
                break;
            case IN_PROGRESS:
                content = "<in progress>";
                break;
            case POISONED:
                content = "<poisoned>";
                break;
            default:
                content = "<pending>";
                break;
        }
        return getClass().getSimpleName() + "{" + content + "}";
    }
}
