package io.github.mmhelloworld.lazylist;

import static java.util.Objects.requireNonNull;

/**
 * The computed content of one list node: either the end of the list or an element followed by the rest of the list.
 */
public abstract class ListContent<T> {
    private ListContent() {
    }

    public static <T> ListContent<T> terminated() {
        return new Terminated<>();
    }

    public static <T> ListContent<T> evaluated(T head, LazyList<T> tail) {
        return new Evaluated<>(head, tail);
    }

    public abstract boolean isTerminated();

    public static final class Terminated<T> extends ListContent<T> {
        private Terminated() {
        }

        @Override
        public boolean isTerminated() {
            return true;
        }

        @Override
        public String toString() {
            return "Terminated";
        }
    }

    public static final class Evaluated<T> extends ListContent<T> {
        private final T head;
        private final LazyList<T> tail;

        private Evaluated(T head, LazyList<T> tail) {
            this.head = requireNonNull(head, "List elements must not be null");
            this.tail = requireNonNull(tail, "tail");
        }

        public T getHead() {
            return head;
        }

        public LazyList<T> getTail() {
            return tail;
        }

        @Override
        public boolean isTerminated() {
            return false;
        }

        @Override
        public String toString() {
            return "Evaluated(" + head + ", ..)";
        }
    }
}
