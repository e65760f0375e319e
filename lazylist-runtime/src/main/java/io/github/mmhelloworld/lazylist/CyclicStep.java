package io.github.mmhelloworld.lazylist;

import java.util.Optional;

/**
 * Computes the next element of a self-referential list from the elements produced so far.
 *
 * <p>The list passed in is the whole list under construction, starting from its first element. Reading it yields
 * only the elements already produced: traversal stops at the position currently being computed, and {@code get} on
 * that position is empty. Implementations should depend on nothing but that observable prefix.
 */
@FunctionalInterface
public interface CyclicStep<T> {
    /**
     * @return the next element, or empty to end the list
     */
    Optional<T> next(LazyList<T> soFar);
}
