package com.pavan.reversemap.collection;

import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * {@link ReverseIterableIterator} walking the node chain of a {@link ReverseIterableMap}.
 * Reads nodes directly; nothing is copied up front.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @param <T> the type produced from each node
 */
class NodeIterator<K, V, T> implements ReverseIterableIterator<T> {
    
    private final Function<Node<K, V>, T> projection;
    private final Node<K, V> startNode; // null when created without a start key
    private final Node<K, V> lastNode;  // tail at creation time
    private Node<K, V> currentNode;
    private boolean forwards;
    
    /**
     * @param projection maps the current node to the produced element
     * @param startNode explicit start position, or null to start at {@code firstNode}
     * @param firstNode the map's head at creation time
     * @param lastNode the map's tail at creation time
     */
    NodeIterator(Function<Node<K, V>, T> projection, Node<K, V> startNode,
                 Node<K, V> firstNode, Node<K, V> lastNode) {
        this.projection = projection;
        this.startNode = startNode;
        this.lastNode = lastNode;
        this.currentNode = startNode != null ? startNode : firstNode;
        this.forwards = true;
    }
    
    @Override
    public IteratorResult<T> nextResult() {
        if (currentNode == null) {
            return IteratorResult.done();
        }
        return IteratorResult.of(advance());
    }
    
    @Override
    public boolean hasNext() {
        return currentNode != null;
    }
    
    @Override
    public T next() {
        if (currentNode == null) {
            throw new NoSuchElementException();
        }
        return advance();
    }
    
    @Override
    public ReverseIterableIterator<T> reverseIterator() {
        currentNode = startNode != null ? startNode : lastNode;
        forwards = false;
        return this;
    }
    
    private T advance() {
        T value = projection.apply(currentNode);
        currentNode = forwards ? currentNode.next : currentNode.prev;
        return value;
    }
}
