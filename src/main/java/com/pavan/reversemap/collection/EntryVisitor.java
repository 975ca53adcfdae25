package com.pavan.reversemap.collection;

/**
 * Callback invoked once per entry by {@link ReverseIterableMap#forEach(EntryVisitor)}
 * and {@link ReverseIterableMap#forEachReverse(EntryVisitor)}.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface EntryVisitor<K, V> {
    
    void visit(V value, K key, ReverseIterableMap<K, V> map);
}
