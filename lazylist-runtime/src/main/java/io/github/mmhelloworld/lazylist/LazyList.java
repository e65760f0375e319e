package io.github.mmhelloworld.lazylist;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.util.Objects.requireNonNull;

/**
 * A lazy, memoizing, persistent singly-linked list.
 *
 * <p>Each {@code LazyList} is a handle to one node, whose content is computed on first access and then shared by
 * every holder of the handle. Lists share tails by reference: {@link #prepend(Object)} never copies.
 *
 * <p>Lists can be built from a finite source ({@link #fromIterable(Iterable)}), by prepending to
 * {@link #empty()}, or self-referentially with {@link #cyclic(CyclicStep)}, where each element is computed from the
 * elements before it.
 *
 * <p>Traversals stop early at a node whose content is being computed on the current thread. That is what a
 * {@link CyclicStep} sees when it walks the list it is building. Elements are never {@code null}.
 *
 * @param <T> element type
 */
public final class LazyList<T> implements Iterable<T> {
    private final MemoizingCell<ListContent<T>> cell;

    LazyList(MemoizingCell<ListContent<T>> cell) {
        this.cell = cell;
    }

    public static <T> LazyList<T> empty() {
        return empty(LazyListConfig.getDefaultEvaluationMode());
    }

    public static <T> LazyList<T> empty(EvaluationMode mode) {
        return new LazyList<>(mode.evaluatedCell(ListContent.<T>terminated()));
    }

    @SafeVarargs
    public static <T> LazyList<T> of(T... values) {
        return fromIterable(Arrays.asList(values));
    }

    public static <T> LazyList<T> fromIterable(Iterable<? extends T> iterable) {
        return fromIterator(iterable.iterator());
    }

    public static <T> LazyList<T> fromIterable(Iterable<? extends T> iterable, EvaluationMode mode) {
        return fromIterator(iterable.iterator(), mode);
    }

    /**
     * Creates a list that pulls one element from {@code source} each time a new node is first forced. The list takes
     * over the iterator; it must not be advanced by anyone else afterwards.
     */
    public static <T> LazyList<T> fromIterator(Iterator<? extends T> source) {
        return fromIterator(source, LazyListConfig.getDefaultEvaluationMode());
    }

    public static <T> LazyList<T> fromIterator(Iterator<? extends T> source, EvaluationMode mode) {
        requireNonNull(source, "source");
        return new LazyList<>(mode.newCell(new IteratorGenerator<T>(source, mode)));
    }

    /**
     * Creates a self-referential list. {@code step} is called once per element with the list itself, and may read
     * every element produced before the one it is computing.
     */
    public static <T> LazyList<T> cyclic(CyclicStep<T> step) {
        return cyclic(step, LazyListConfig.getDefaultEvaluationMode());
    }

    public static <T> LazyList<T> cyclic(CyclicStep<T> step, EvaluationMode mode) {
        return CyclicGenerator.newCyclicList(step, mode);
    }

    /**
     * Returns a new list with {@code value} in front of this one. This list is unchanged and becomes the tail of the
     * result.
     */
    public LazyList<T> prepend(T value) {
        return new LazyList<>(cell.getEvaluationMode().evaluatedCell(ListContent.evaluated(value, this)));
    }

    public Optional<T> get(int index) {
        if (index < 0) {
            return Optional.empty();
        }
        LazyList<T> current = this;
        for (int i = 0; i < index; i++) {
            Optional<ListContent.Evaluated<T>> content = current.evaluatedContent();
            if (content.isEmpty()) {
                return Optional.empty();
            }
            current = content.get().getTail();
        }
        return current.head();
    }

    /**
     * Like {@link #get(int)} but fails when there is no element at {@code index}.
     *
     * @throws IndexOutOfBoundsException if the list ends (or is still being computed) before {@code index}
     */
    public T elementAt(int index) {
        return get(index).orElseThrow(() -> new IndexOutOfBoundsException("Index out of range: " + index));
    }

    public Optional<T> head() {
        return evaluatedContent().map(ListContent.Evaluated::getHead);
    }

    public Optional<LazyList<T>> tail() {
        return evaluatedContent().map(ListContent.Evaluated::getTail);
    }

    /**
     * Forces only the first node.
     */
    public boolean isEmpty() {
        return cell.force().map(ListContent::isTerminated).orElse(false);
    }

    /**
     * Counts the elements, forcing every node. Never returns for an infinite list.
     */
    public int size() {
        int size = 0;
        for (Iterator<T> iterator = iterator(); iterator.hasNext(); iterator.next()) {
            size++;
        }
        return size;
    }

    public EvaluationMode getEvaluationMode() {
        return cell.getEvaluationMode();
    }

    /**
     * Returns a new iterator starting from the first element. Each step forces at most one node.
     */
    @Override
    public Iterator<T> iterator() {
        return new LazyIterator<>(this);
    }

    public Stream<T> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(),
            Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE), false);
    }

    private Optional<ListContent.Evaluated<T>> evaluatedContent() {
        return cell.force()
            .filter(content -> !content.isTerminated())
            .map(content -> (ListContent.Evaluated<T>) content);
    }

    /**
     * Renders the elements computed so far without forcing anything.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("[");
        LazyList<T> current = this;
        boolean first = true;
        while (true) {
            if (!current.cell.isEvaluated()) {
                builder.append(first ? "..." : ", ...");
                break;
            }
            ListContent<T> content = current.cell.force().orElseThrow();
            if (content.isTerminated()) {
                break;
            }
            ListContent.Evaluated<T> evaluated = (ListContent.Evaluated<T>) content;
            if (!first) {
                builder.append(", ");
            }
            builder.append(evaluated.getHead());
            first = false;
            current = evaluated.getTail();
        }
        return builder.append("]").toString();
    }

    private static final class LazyIterator<T> implements Iterator<T> {
        private LazyList<T> current;
        private ListContent.Evaluated<T> pending;

        private LazyIterator(LazyList<T> start) {
            this.current = start;
        }

        @Override
        public boolean hasNext() {
            if (pending == null && current != null) {
                Optional<ListContent.Evaluated<T>> content = current.evaluatedContent();
                if (content.isPresent()) {
                    pending = content.get();
                } else {
                    current = null;
                }
            }
            return pending != null;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ListContent.Evaluated<T> evaluated = pending;
            pending = null;
            current = evaluated.getTail();
            return evaluated.getHead();
        }
    }
}
