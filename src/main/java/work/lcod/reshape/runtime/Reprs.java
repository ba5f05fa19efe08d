package work.lcod.reshape.runtime;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Compact, quote-aware renderings of targets and specs for error messages and traces.
 */
public final class Reprs {
    private static final String ELLIPSIS = "...";

    private Reprs() {}

    public static String repr(Object value) {
        return repr(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /**
     * {@code open} holds the containers currently being rendered; meeting one again prints
     * {@code {...}} or {@code [...]} instead of recursing.
     */
    private static String repr(Object value, Set<Object> open) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return quote(value.toString());
        }
        if (value instanceof Map<?, ?> map) {
            if (!open.add(map)) {
                return "{" + ELLIPSIS + "}";
            }
            var joiner = new StringJoiner(", ", "{", "}");
            for (var entry : map.entrySet()) {
                joiner.add(repr(entry.getKey(), open) + ": " + repr(entry.getValue(), open));
            }
            open.remove(map);
            return joiner.toString();
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            if (!open.add(value)) {
                return "[" + ELLIPSIS + "]";
            }
            var joiner = new StringJoiner(", ", "[", "]");
            if (value instanceof Collection<?> items) {
                for (var item : items) {
                    joiner.add(repr(item, open));
                }
            } else {
                for (int i = 0; i < Array.getLength(value); i++) {
                    joiner.add(repr(Array.get(value, i), open));
                }
            }
            open.remove(value);
            return joiner.toString();
        }
        if (value instanceof Class<?> type) {
            return type.getSimpleName();
        }
        if (value.getClass().isSynthetic()) {
            return "<function>";
        }
        return String.valueOf(value);
    }

    /**
     * Renders an argument list, e.g. {@code 'a', 1} for {@code List.of("a", 1)}.
     */
    public static String args(List<?> values) {
        var joiner = new StringJoiner(", ");
        for (var value : values) {
            joiner.add(repr(value));
        }
        return joiner.toString();
    }

    public static String path(List<?> segments) {
        return repr(segments == null ? List.of() : segments);
    }

    /**
     * Human-readable path segment for a pipeline step: path strings stay bare.
     */
    public static Object segment(Object spec) {
        if (spec instanceof String str) {
            return str;
        }
        return repr(spec);
    }

    public static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    public static String truncate(String text, int width) {
        if (text == null || width <= 0 || text.length() <= width) {
            return text;
        }
        if (width <= ELLIPSIS.length()) {
            return text.substring(0, width);
        }
        return text.substring(0, width - ELLIPSIS.length()) + ELLIPSIS;
    }

    static List<Object> append(List<Object> base, Object segment) {
        var copy = new ArrayList<>(base);
        copy.add(segment);
        return List.copyOf(copy);
    }

    private static String quote(String text) {
        return "'" + text.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
