package com.pavan.reversemap.collection;

import java.util.Objects;

/**
 * Outcome of a single pull on a {@link ReverseIterableIterator}: either a produced value
 * or the terminal marker.
 *
 * @param <T> the type of produced values
 */
public final class IteratorResult<T> {
    
    private static final IteratorResult<?> DONE = new IteratorResult<>(null, true);
    
    private final T value;
    private final boolean done;
    
    private IteratorResult(T value, boolean done) {
        this.value = value;
        this.done = done;
    }
    
    /**
     * Returns a result carrying a produced value. The value itself may be null.
     */
    public static <T> IteratorResult<T> of(T value) {
        return new IteratorResult<>(value, false);
    }
    
    /**
     * Returns the terminal result.
     */
    @SuppressWarnings("unchecked")
    public static <T> IteratorResult<T> done() {
        return (IteratorResult<T>) DONE;
    }
    
    /**
     * Returns the produced value, or null for the terminal result.
     */
    public T getValue() {
        return value;
    }
    
    public boolean isDone() {
        return done;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IteratorResult)) {
            return false;
        }
        IteratorResult<?> other = (IteratorResult<?>) o;
        return done == other.done && Objects.equals(value, other.value);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(value, done);
    }
    
    @Override
    public String toString() {
        return done ? "IteratorResult{done}" : "IteratorResult{value=" + value + "}";
    }
}
