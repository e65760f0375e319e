package io.github.mmhelloworld.lazylist;

import java.util.Iterator;
import java.util.function.Supplier;

final class IteratorGenerator<T> implements Supplier<ListContent<T>> {
    private final EvaluationMode mode;
    private Iterator<? extends T> source;

    IteratorGenerator(Iterator<? extends T> source, EvaluationMode mode) {
        this.source = source;
        this.mode = mode;
    }

    @Override
    public ListContent<T> get() {
        Iterator<? extends T> remaining = source;
        if (remaining == null) {
            throw new IllegalStateException("Iterator generator already consumed");
        }
        // the rest of the source now belongs to the next node
        source = null;
        if (!remaining.hasNext()) {
            return ListContent.terminated();
        }
        T item = remaining.next();
        LazyList<T> next = new LazyList<>(mode.newCell(new IteratorGenerator<T>(remaining, mode)));
        return ListContent.evaluated(item, next);
    }
}
