package io.github.mmhelloworld.lazylist;

public class LazyListException extends RuntimeException {
    public LazyListException(String message) {
        super(message);
    }
}
