package com.pavan.reversemap.collection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ReverseIterableIteratorTest {

    private ReverseIterableMap<Integer, String> map;

    @BeforeEach
    void setUp() {
        map = new ReverseIterableMap<Integer, String>()
                .set(0, "Hello?")
                .set(1, "Are you still there?")
                .set(2, "I see you");
    }

    @Test
    void testEntriesPullProtocol() {
        ReverseIterableIterator<Map.Entry<Integer, String>> iterator = map.entries();

        IteratorResult<Map.Entry<Integer, String>> result = iterator.nextResult();
        assertFalse(result.isDone());
        assertEquals(0, result.getValue().getKey());
        assertEquals("Hello?", result.getValue().getValue());

        result = iterator.nextResult();
        assertFalse(result.isDone());
        assertEquals(1, result.getValue().getKey());

        result = iterator.nextResult();
        assertFalse(result.isDone());
        assertEquals(2, result.getValue().getKey());
        assertEquals("I see you", result.getValue().getValue());

        result = iterator.nextResult();
        assertTrue(result.isDone());
        assertNull(result.getValue());
    }

    @Test
    void testReversedEntriesPullProtocol() {
        ReverseIterableIterator<Map.Entry<Integer, String>> iterator = map.entries().reverseIterator();

        assertEquals(IteratorResult.of(Map.entry(2, "I see you")), iterator.nextResult());
        assertEquals(IteratorResult.of(Map.entry(1, "Are you still there?")), iterator.nextResult());
        assertEquals(IteratorResult.of(Map.entry(0, "Hello?")), iterator.nextResult());
        assertEquals(IteratorResult.done(), iterator.nextResult());
    }

    @Test
    void testKeysPullProtocol() {
        ReverseIterableIterator<Integer> iterator = map.keys();

        assertEquals(IteratorResult.of(0), iterator.nextResult());
        assertEquals(IteratorResult.of(1), iterator.nextResult());
        assertEquals(IteratorResult.of(2), iterator.nextResult());
        assertTrue(iterator.nextResult().isDone());
    }

    @Test
    void testValuesPullProtocol() {
        ReverseIterableIterator<String> iterator = map.values();

        assertEquals("Hello?", iterator.nextResult().getValue());
        assertEquals("Are you still there?", iterator.nextResult().getValue());
        assertEquals("I see you", iterator.nextResult().getValue());
        assertTrue(iterator.nextResult().isDone());
    }

    @Test
    void testExhaustionIsIdempotent() {
        ReverseIterableIterator<Integer> iterator = map.keys();
        while (!iterator.nextResult().isDone()) {
            // drain
        }

        for (int i = 0; i < 5; i++) {
            IteratorResult<Integer> result = iterator.nextResult();
            assertTrue(result.isDone());
            assertNull(result.getValue());
            assertFalse(iterator.hasNext());
        }
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    void testJavaIteratorView() {
        ReverseIterableIterator<String> iterator = map.values();

        assertTrue(iterator.hasNext());
        assertEquals("Hello?", iterator.next());
        assertEquals("Are you still there?", iterator.next());
        assertEquals("I see you", iterator.next());
        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    void testPullProtocolAndIteratorViewShareCursor() {
        ReverseIterableIterator<Integer> iterator = map.keys();

        assertEquals(0, iterator.next());
        assertEquals(IteratorResult.of(1), iterator.nextResult());
        assertEquals(2, iterator.next());
        assertTrue(iterator.nextResult().isDone());
    }

    @Test
    void testIteratorIsItsOwnIterable() {
        ReverseIterableIterator<Integer> iterator = map.keys();

        assertSame(iterator, iterator.iterator());

        List<Integer> keys = new ArrayList<>();
        for (Integer key : iterator) {
            keys.add(key);
        }
        assertEquals(List.of(0, 1, 2), keys);

        // Not restartable
        assertFalse(iterator.iterator().hasNext());
    }

    @Test
    void testReverseIteratorReturnsSameInstance() {
        ReverseIterableIterator<Integer> iterator = map.keys();

        assertSame(iterator, iterator.reverseIterator());
    }

    @Test
    void testReverseAfterPullsRewindsToStart() {
        ReverseIterableIterator<Integer> fromHead = map.keys();
        fromHead.next();
        fromHead.next();
        fromHead.reverseIterator();

        // Without a start key the rewind goes to the last entry
        assertEquals(List.of(2, 1, 0), drain(fromHead));

        ReverseIterableIterator<Map.Entry<Integer, String>> fromKey = map.iteratorFor(1);
        fromKey.next();
        fromKey.next();
        fromKey.reverseIterator();

        assertEquals(List.of(Map.entry(1, "Are you still there?"), Map.entry(0, "Hello?")), drain(fromKey));
    }

    @Test
    void testIteratorForFirstAndLastKeys() {
        assertEquals(List.of(0, 1, 2), keysOf(drain(map.iteratorFor(0))));
        assertEquals(List.of(0), keysOf(drain(map.iteratorFor(0).reverseIterator())));
        assertEquals(List.of(2), keysOf(drain(map.iteratorFor(2))));
        assertEquals(List.of(2, 1, 0), keysOf(drain(map.iteratorFor(2).reverseIterator())));
    }

    @Test
    void testReverseCapturesTailAtCreation() {
        ReverseIterableIterator<Integer> iterator = map.keys();

        map.set(3, "appended later");
        iterator.reverseIterator();

        assertEquals(List.of(2, 1, 0), drain(iterator));
    }

    @Test
    void testIteratorSeesLiveValues() {
        ReverseIterableIterator<String> iterator = map.values();

        map.set(1, "updated");

        assertEquals(List.of("Hello?", "updated", "I see you"), drain(iterator));
    }

    @Test
    void testIndependentIterators() {
        ReverseIterableIterator<Integer> forward = map.keys();
        ReverseIterableIterator<Integer> backward = map.keys().reverseIterator();

        assertEquals(0, forward.next());
        assertEquals(2, backward.next());
        assertEquals(1, forward.next());
        assertEquals(1, backward.next());
        assertEquals(2, forward.next());
        assertEquals(0, backward.next());
        assertFalse(forward.hasNext());
        assertFalse(backward.hasNext());
    }

    @Test
    void testNullValuesDoNotTerminate() {
        ReverseIterableMap<String, String> withNulls = new ReverseIterableMap<String, String>()
                .set("a", null)
                .set("b", "B")
                .set("c", null);
        ReverseIterableIterator<String> iterator = withNulls.values();

        IteratorResult<String> first = iterator.nextResult();
        assertFalse(first.isDone());
        assertNull(first.getValue());
        assertEquals("B", iterator.nextResult().getValue());
        assertFalse(iterator.nextResult().isDone());
        assertTrue(iterator.nextResult().isDone());
    }

    @Test
    void testRemoveIsUnsupported() {
        ReverseIterableIterator<Integer> iterator = map.keys();
        iterator.next();

        assertThrows(UnsupportedOperationException.class, iterator::remove);
    }

    @Test
    void testIteratorResultToString() {
        assertEquals("IteratorResult{value=x}", IteratorResult.of("x").toString());
        assertEquals("IteratorResult{done}", IteratorResult.done().toString());
        assertNotEquals(IteratorResult.of(null), IteratorResult.done());
    }

    private static <T> List<T> drain(ReverseIterableIterator<T> iterator) {
        List<T> result = new ArrayList<>();
        IteratorResult<T> step = iterator.nextResult();
        while (!step.isDone()) {
            result.add(step.getValue());
            step = iterator.nextResult();
        }
        return result;
    }

    private static <K, V> List<K> keysOf(List<Map.Entry<K, V>> entries) {
        List<K> keys = new ArrayList<>();
        for (Map.Entry<K, V> entry : entries) {
            keys.add(entry.getKey());
        }
        return keys;
    }
}
