package com.pavan.reversemap.collection;

/**
 * Entry callback that receives a caller-supplied context object with every invocation.
 *
 * @param <C> the type of the context object
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface ContextualEntryVisitor<C, K, V> {
    
    void visit(C context, V value, K key, ReverseIterableMap<K, V> map);
}
