package io.github.mmhelloworld.lazylist;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.ref.WeakReference;
import java.util.Optional;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Producer for the nodes of a self-referential list.
 *
 * <p>The first node's generator is owned by that node's cell and can only reach the cell through a
 * {@link WeakReference}; a strong reference would make the cell and its producer keep each other alive. The cell is
 * running this generator while it is upgraded, so it cannot have been reclaimed at that point. The resulting strong
 * root handle is handed to the generators of later nodes so the root stays reachable while any of them is pending.
 */
final class CyclicGenerator<T> implements Supplier<ListContent<T>> {
    private static final Logger LOGGER = LogManager.getLogger(CyclicGenerator.class);

    private final CyclicStep<T> step;
    private final EvaluationMode mode;
    private WeakReference<MemoizingCell<ListContent<T>>> rootCell;
    private LazyList<T> root;

    private CyclicGenerator(CyclicStep<T> step, EvaluationMode mode, LazyList<T> root) {
        this.step = step;
        this.mode = mode;
        this.root = root;
    }

    static <T> LazyList<T> newCyclicList(CyclicStep<T> step, EvaluationMode mode) {
        requireNonNull(step, "step");
        requireNonNull(mode, "mode");
        CyclicGenerator<T> generator = new CyclicGenerator<>(step, mode, null);
        MemoizingCell<ListContent<T>> cell = mode.newCell(generator);
        generator.rootCell = new WeakReference<>(cell);
        return new LazyList<>(cell);
    }

    @Override
    public ListContent<T> get() {
        LazyList<T> list = upgrade();
        root = null;
        Optional<T> item = step.next(list);
        if (item.isEmpty()) {
            LOGGER.trace("Cyclic step ended the list");
            return ListContent.terminated();
        }
        CyclicGenerator<T> next = new CyclicGenerator<>(step, mode, list);
        return ListContent.evaluated(item.get(), new LazyList<>(mode.newCell(next)));
    }

    private LazyList<T> upgrade() {
        if (root != null) {
            return root;
        }
        MemoizingCell<ListContent<T>> cell = rootCell == null ? null : rootCell.get();
        if (cell == null) {
            throw new IllegalStateException("Dangling self-reference: cyclic list was reclaimed during generation");
        }
        return new LazyList<>(cell);
    }
}
