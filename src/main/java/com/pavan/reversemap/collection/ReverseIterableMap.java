package com.pavan.reversemap.collection;

import java.lang.reflect.Array;
import java.util.AbstractMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Hash map that keeps its entries in a doubly linked chain so they can be traversed in
 * insertion order, in reverse insertion order, or in either direction starting from any key.
 * Lookup, insertion at either end and removal are O(1) on average.
 *
 * <p>Keys follow {@link HashMap} equality. Values may be null; use {@link #has(Object)} to tell
 * a null value from an absent key.
 *
 * <p>Not thread-safe. Iterators read the live chain and are not invalidated by mutation;
 * what they observe after a concurrent change is unspecified.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class ReverseIterableMap<K, V> implements Iterable<Map.Entry<K, V>> {

    private final Map<K, Node<K, V>> index;
    private Node<K, V> head; // First in insertion order
    private Node<K, V> tail; // Last in insertion order

    public ReverseIterableMap() {
        this.index = new HashMap<>();
    }

    /**
     * Creates a map holding the given entries, appended in the order the source yields them.
     * Another {@code ReverseIterableMap} is a valid source.
     *
     * @param entries the initial entries
     */
    public ReverseIterableMap(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        this();
        Objects.requireNonNull(entries, "entries");
        for (Map.Entry<? extends K, ? extends V> entry : entries) {
            set(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Creates a map holding the entries of {@code source}, appended in its iteration order.
     *
     * @param source the map to copy
     */
    public ReverseIterableMap(Map<? extends K, ? extends V> source) {
        this(Objects.requireNonNull(source, "source").entrySet());
    }

    /**
     * Creates a map from an untyped sequence of array-like pairs ({@code Object[]}, primitive
     * arrays or {@link List}s). Position 0 is the key and position 1 the value; missing positions
     * read as null and extra positions are ignored.
     *
     * <p>Construction is not transactional: pairs preceding a malformed element have already
     * been appended when the exception is thrown, but the partially built map is unreachable.
     *
     * @param pairs the source sequence
     * @return a new map holding the pairs in source order
     * @throws MalformedEntryException if an element is not array-like
     */
    @SuppressWarnings("unchecked")
    public static <K, V> ReverseIterableMap<K, V> fromPairs(Iterable<?> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        ReverseIterableMap<K, V> map = new ReverseIterableMap<>();
        for (Object element : pairs) {
            if (element instanceof List) {
                List<?> list = (List<?>) element;
                map.set((K) elementAt(list, 0), (V) elementAt(list, 1));
            } else if (element != null && element.getClass().isArray()) {
                map.set((K) elementAt(element, 0), (V) elementAt(element, 1));
            } else {
                throw new MalformedEntryException(element);
            }
        }
        return map;
    }

    /**
     * Returns the number of entries.
     */
    public int size() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    /**
     * Removes all entries.
     */
    public void clear() {
        index.clear();
        head = null;
        tail = null;
    }

    /**
     * Checks whether an entry exists for the key, regardless of its value.
     *
     * @param key the key to look up
     * @return true if the key is present
     */
    public boolean has(K key) {
        return index.containsKey(key);
    }

    /**
     * Retrieves a value by key.
     *
     * @param key the key to look up
     * @return the value associated with the key, or null if not found
     */
    public V get(K key) {
        Node<K, V> node = index.get(key);
        return node != null ? node.getValue() : null;
    }

    /**
     * Appends an entry after the last one, or updates the value of an existing key without
     * moving it.
     *
     * @param key the key to insert or update
     * @param value the value to associate with the key
     * @return this map
     */
    public ReverseIterableMap<K, V> set(K key, V value) {
        if (updateExisting(key, value)) {
            return this;
        }

        Node<K, V> node = new Node<>(key, value);
        index.put(key, node);
        addToBack(node);
        return this;
    }

    /**
     * Prepends an entry before the first one, or updates the value of an existing key without
     * moving it.
     *
     * @param key the key to insert or update
     * @param value the value to associate with the key
     * @return this map
     */
    public ReverseIterableMap<K, V> setFirst(K key, V value) {
        if (updateExisting(key, value)) {
            return this;
        }

        Node<K, V> node = new Node<>(key, value);
        index.put(key, node);
        addToFront(node);
        return this;
    }

    /**
     * Removes the entry for a key.
     *
     * @param key the key to remove
     * @return true if an entry was removed, false if the key was not present
     */
    public boolean delete(K key) {
        Node<K, V> node = index.remove(key);
        if (node == null) {
            return false;
        }
        unlink(node);
        return true;
    }

    /**
     * Returns the first entry in insertion order, or null if the map is empty.
     */
    public Map.Entry<K, V> firstEntry() {
        return head != null ? toEntry(head) : null;
    }

    /**
     * Returns the last entry in insertion order, or null if the map is empty.
     */
    public Map.Entry<K, V> lastEntry() {
        return tail != null ? toEntry(tail) : null;
    }

    /**
     * Calls the visitor once per entry in insertion order.
     */
    public void forEach(EntryVisitor<K, V> visitor) {
        Objects.requireNonNull(visitor, "visitor");
        for (Node<K, V> node : nodes()) {
            visitor.visit(node.getValue(), node.getKey(), this);
        }
    }

    /**
     * Calls the visitor once per entry in insertion order, passing {@code context} along.
     */
    public <C> void forEach(ContextualEntryVisitor<C, K, V> visitor, C context) {
        Objects.requireNonNull(visitor, "visitor");
        for (Node<K, V> node : nodes()) {
            visitor.visit(context, node.getValue(), node.getKey(), this);
        }
    }

    /**
     * Calls the visitor once per entry in reverse insertion order.
     */
    public void forEachReverse(EntryVisitor<K, V> visitor) {
        Objects.requireNonNull(visitor, "visitor");
        for (Node<K, V> node : nodes().reverseIterator()) {
            visitor.visit(node.getValue(), node.getKey(), this);
        }
    }

    /**
     * Calls the visitor once per entry in reverse insertion order, passing {@code context} along.
     */
    public <C> void forEachReverse(ContextualEntryVisitor<C, K, V> visitor, C context) {
        Objects.requireNonNull(visitor, "visitor");
        for (Node<K, V> node : nodes().reverseIterator()) {
            visitor.visit(context, node.getValue(), node.getKey(), this);
        }
    }

    /**
     * Same as {@link #entries()}.
     */
    @Override
    public ReverseIterableIterator<Map.Entry<K, V>> iterator() {
        return entries();
    }

    /**
     * Returns an iterator over the entries in insertion order. Call
     * {@link ReverseIterableIterator#reverseIterator()} on it to walk them backwards instead.
     * Produced entries are immutable snapshots.
     */
    public ReverseIterableIterator<Map.Entry<K, V>> entries() {
        return new NodeIterator<>(ReverseIterableMap::toEntry, null, head, tail);
    }

    /**
     * Returns an iterator over the keys in insertion order.
     */
    public ReverseIterableIterator<K> keys() {
        return new NodeIterator<>(Node::getKey, null, head, tail);
    }

    /**
     * Returns an iterator over the values in insertion order.
     */
    public ReverseIterableIterator<V> values() {
        return new NodeIterator<>(Node::getValue, null, head, tail);
    }

    /**
     * Returns an iterator over the entries in reverse insertion order.
     */
    public ReverseIterableIterator<Map.Entry<K, V>> reverseIterator() {
        return entries().reverseIterator();
    }

    /**
     * Returns an iterator over the entries in insertion order starting with the entry for
     * {@code key}. Reversing it walks from that entry back to the first one. If the key is
     * absent the iterator is already exhausted.
     *
     * @param key the key of the entry to start from
     */
    public ReverseIterableIterator<Map.Entry<K, V>> iteratorFor(K key) {
        Node<K, V> startNode = index.get(key);
        if (startNode == null) {
            // No chain to walk in either direction
            return new NodeIterator<K, V, Map.Entry<K, V>>(ReverseIterableMap::toEntry, null, null, null);
        }
        return new NodeIterator<>(ReverseIterableMap::toEntry, startNode, head, tail);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Node<K, V> node = head; node != null; node = node.next) {
            if (node != head) {
                sb.append(", ");
            }
            sb.append(node.getKey() == this ? "(this Map)" : node.getKey());
            sb.append('=');
            sb.append(node.getValue() == this ? "(this Map)" : node.getValue());
        }
        return sb.append('}').toString();
    }

    private ReverseIterableIterator<Node<K, V>> nodes() {
        return new NodeIterator<>(Function.identity(), null, head, tail);
    }

    // Helper: Overwrite the value of an existing node in place, keeping its position
    private boolean updateExisting(K key, V value) {
        Node<K, V> node = index.get(key);
        if (node == null) {
            return false;
        }
        node.setValue(value);
        return true;
    }

    // Helper: Link node after the current tail
    private void addToBack(Node<K, V> node) {
        if (tail != null) {
            node.prev = tail;
            tail.next = node;
        }
        if (head == null) {
            head = node;
        }
        tail = node;
    }

    // Helper: Link node before the current head
    private void addToFront(Node<K, V> node) {
        if (head != null) {
            node.next = head;
            head.prev = node;
        }
        if (tail == null) {
            tail = node;
        }
        head = node;
    }

    // Helper: Remove node from its current position in the chain
    private void unlink(Node<K, V> node) {
        if (node.prev != null && node.next != null) {
            // Middle
            node.prev.next = node.next;
            node.next.prev = node.prev;
        } else if (node.prev != null) {
            // Tail; its predecessor becomes the new tail
            node.prev.next = null;
            tail = node.prev;
        } else if (node.next != null) {
            // Head; its successor becomes the new head
            node.next.prev = null;
            head = node.next;
        } else {
            // Sole entry
            head = null;
            tail = null;
        }
    }

    private static <K, V> Map.Entry<K, V> toEntry(Node<K, V> node) {
        return new AbstractMap.SimpleImmutableEntry<>(node.getKey(), node.getValue());
    }

    private static Object elementAt(List<?> list, int position) {
        return position < list.size() ? list.get(position) : null;
    }

    private static Object elementAt(Object array, int position) {
        return position < Array.getLength(array) ? Array.get(array, position) : null;
    }
}
