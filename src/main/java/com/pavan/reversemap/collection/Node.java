package com.pavan.reversemap.collection;

/**
 * Doubly linked node for key-value storage.
 * The key is immutable; the value is updated in place when its key is set again,
 * and the links are rewired by the owning map.
 *
 * @param <K> the type of key
 * @param <V> the type of value
 */
class Node<K, V> {
    
    private final K key;
    private V value;
    Node<K, V> prev;
    Node<K, V> next;
    
    Node(K key, V value) {
        this.key = key;
        this.value = value;
    }
    
    K getKey() {
        return key;
    }
    
    V getValue() {
        return value;
    }
    
    void setValue(V value) {
        this.value = value;
    }
}
