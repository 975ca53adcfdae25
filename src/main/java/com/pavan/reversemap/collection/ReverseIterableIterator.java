package com.pavan.reversemap.collection;

import java.util.Iterator;

/**
 * A cursor over the entries of a {@link ReverseIterableMap} that can run forwards or backwards.
 *
 * <p>The iterator is its own {@link Iterable}, so it can be handed straight to a for-each loop:
 * <pre>{@code
 * for (Map.Entry<String, Integer> entry : map.iteratorFor("b").reverseIterator()) {
 *     ...
 * }
 * }</pre>
 *
 * <p>Iterators are single-use. Once exhausted they keep reporting exhaustion; request a fresh
 * one from the map for another traversal.
 *
 * @param <T> the type of produced elements
 */
public interface ReverseIterableIterator<T> extends Iterator<T>, Iterable<T> {
    
    /**
     * Advances the cursor and returns the element it was positioned on, or
     * {@link IteratorResult#done()} when the cursor has run off the end of the chain.
     * Calling this on an exhausted iterator keeps returning the terminal result.
     */
    IteratorResult<T> nextResult();
    
    /**
     * Switches this iterator to backward traversal and rewinds the cursor to its start position:
     * the key it was created for, or the last entry when it was created without one.
     * The same iterator is returned so the call can be chained before the first pull.
     *
     * @return this iterator
     */
    ReverseIterableIterator<T> reverseIterator();
    
    /**
     * Returns this iterator.
     */
    @Override
    default Iterator<T> iterator() {
        return this;
    }
}
