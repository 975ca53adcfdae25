package com.pavan.reversemap.demo;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders values the way browser developer tools print them:
 * strings are quoted, lists, arrays and map entries print as {@code [ a, b ]}.
 */
public final class ValueFormatter {
    
    private ValueFormatter() {
    }
    
    public static String format(Object input) {
        if (input instanceof String) {
            return "\"" + input + "\"";
        }
        if (input instanceof Map.Entry) {
            Map.Entry<?, ?> entry = (Map.Entry<?, ?>) input;
            return formatElements(List.of(format(entry.getKey()), format(entry.getValue())));
        }
        if (input instanceof Iterable) {
            List<String> parts = new ArrayList<>();
            for (Object element : (Iterable<?>) input) {
                parts.add(format(element));
            }
            return formatElements(parts);
        }
        if (input != null && input.getClass().isArray()) {
            List<String> parts = new ArrayList<>();
            for (int i = 0; i < Array.getLength(input); i++) {
                parts.add(format(Array.get(input, i)));
            }
            return formatElements(parts);
        }
        return String.valueOf(input);
    }
    
    private static String formatElements(List<String> parts) {
        return parts.isEmpty() ? "[ ]" : "[ " + String.join(", ", parts) + " ]";
    }
}
