package com.pavan.reversemap.demo;

import com.pavan.reversemap.collection.ReverseIterableIterator;
import com.pavan.reversemap.collection.ReverseIterableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scripted tour of the {@link ReverseIterableMap} API. Each step records the statement
 * being demonstrated followed by what it printed, and every recorded line is logged.
 */
public class ExampleWalkthrough {

    private static final Logger logger = LoggerFactory.getLogger(ExampleWalkthrough.class);

    static final String COMMAND_PREFIX = "> ";

    private final List<String> lines = new ArrayList<>();

    /**
     * Runs the whole tour.
     *
     * @return the recorded lines, commands prefixed with {@value #COMMAND_PREFIX}
     */
    public List<String> run() {
        lines.clear();
        basicTraversal();
        mutation();
        startingFromKey();
        copyingOtherSources();
        return List.copyOf(lines);
    }

    private void basicTraversal() {
        command("map = new ReverseIterableMap<>()");
        ReverseIterableMap<String, String> map = new ReverseIterableMap<>();
        output(map);

        command("map.set(\"key1\", \"1\").set(\"key2\", \"2\").set(\"key3\", \"3\")");
        map.set("key1", "1").set("key2", "2").set("key3", "3");

        command("for (entry : map)");
        for (Map.Entry<String, String> entry : map) {
            log(entry.getKey(), ":", entry.getValue());
        }

        command("for (key : map.keys())");
        for (String key : map.keys()) {
            log(key);
        }

        command("for (value : map.values())");
        for (String value : map.values()) {
            log(value);
        }

        command("for (entry : map.reverseIterator())");
        for (Map.Entry<String, String> entry : map.reverseIterator()) {
            log(entry.getKey(), ":", entry.getValue());
        }

        command("for (key : map.keys().reverseIterator())");
        for (String key : map.keys().reverseIterator()) {
            log(key);
        }

        command("for (value : map.values().reverseIterator())");
        for (String value : map.values().reverseIterator()) {
            log(value);
        }

        command("map.entries()");
        output(map.entries());
        command("map.entries().reverseIterator()");
        output(map.entries().reverseIterator());
        command("map.keys().reverseIterator()");
        output(map.keys().reverseIterator());
        command("map.values().reverseIterator()");
        output(map.values().reverseIterator());
    }

    private void mutation() {
        ReverseIterableMap<String, String> map = new ReverseIterableMap<String, String>()
                .set("key1", "1")
                .set("key2", "2")
                .set("key3", "3");

        command("map.size()");
        output(map.size());

        command("map.delete(\"key2\")");
        output(map.delete("key2"));

        command("map.size()");
        output(map.size());

        command("map.set(\"key2\", \"2\").set(\"key4\", \"4\").set(\"key5\", \"5\")");
        map.set("key2", "2").set("key4", "4").set("key5", "5");

        command("map.values()");
        output(map.values());

        command("map.setFirst(\"key0\", \"0\")");
        map.setFirst("key0", "0");

        command("map.keys()");
        output(map.keys());

        command("map.forEach((value, key, m) -> log(key, \":\", value))");
        map.forEach((value, key, m) -> log(key, ":", value));

        command("map.forEachReverse((value, key, m) -> log(key, \":\", value))");
        map.forEachReverse((value, key, m) -> log(key, ":", value));

        command("map.toString()");
        output(map.toString());
    }

    private void startingFromKey() {
        ReverseIterableMap<String, String> map = new ReverseIterableMap<String, String>()
                .set("key1", "1")
                .set("key3", "3")
                .set("key2", "2")
                .set("key4", "4")
                .set("key5", "5");

        command("it = map.iteratorFor(\"key4\").reverseIterator()");
        ReverseIterableIterator<Map.Entry<String, String>> it = map.iteratorFor("key4").reverseIterator();
        for (int i = 0; i < 3; i++) {
            command("it.nextResult().getValue()");
            output(it.nextResult().getValue());
        }

        command("map2 = ReverseIterableMap.fromPairs(List.of(List.of(0, \"1\"), List.of(1, \"2\"), List.of(2, \"3\")))");
        ReverseIterableMap<Integer, String> map2 =
                ReverseIterableMap.fromPairs(List.of(List.of(0, "1"), List.of(1, "2"), List.of(2, "3")));
        output(map2);

        command("it2 = map2.iteratorFor(1)");
        ReverseIterableIterator<Map.Entry<Integer, String>> it2 = map2.iteratorFor(1);
        for (int i = 0; i < 3; i++) {
            command("it2.nextResult().getValue()");
            output(it2.nextResult().getValue());
        }
    }

    private void copyingOtherSources() {
        Map<Integer, String> builtInMap = new LinkedHashMap<>();
        builtInMap.put(0, "a");
        builtInMap.put(1, "b");
        builtInMap.put(2, "c");

        command("map3 = new ReverseIterableMap<>(builtInMap)");
        ReverseIterableMap<Integer, String> map3 = new ReverseIterableMap<>(builtInMap);
        output(map3);

        command("map4 = new ReverseIterableMap<>(map3)");
        ReverseIterableMap<Integer, String> map4 = new ReverseIterableMap<>(map3);
        output(map4.reverseIterator());
    }

    private void command(String text) {
        record(COMMAND_PREFIX + text);
    }

    private void output(Object value) {
        record(ValueFormatter.format(value));
    }

    private void log(Object... parts) {
        List<String> rendered = new ArrayList<>();
        for (Object part : parts) {
            rendered.add(String.valueOf(part));
        }
        record(String.join(" ", rendered));
    }

    private void record(String line) {
        lines.add(line);
        logger.info("{}", line);
    }
}
