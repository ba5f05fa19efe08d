package work.lcod.reshape.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.tomlj.TomlArray;
import org.tomlj.TomlTable;
import work.lcod.reshape.spec.Literal;

/**
 * Conversions from parsed documents (Jackson trees read as plain Java values, TOML tables)
 * to targets and specs.
 */
final class SpecDocuments {
    private SpecDocuments() {}

    /**
     * Reads a JSON or YAML document as a spec: strings are paths, objects are mappings,
     * arrays are templates and other scalars are literals.
     */
    static Object toSpec(Object document) {
        if (document instanceof String) {
            return document;
        }
        if (document instanceof Map<?, ?> map) {
            Map<Object, Object> spec = new LinkedHashMap<>();
            map.forEach((key, value) -> spec.put(key, toSpec(value)));
            return spec;
        }
        if (document instanceof List<?> list) {
            List<Object> spec = new ArrayList<>(list.size());
            for (Object item : list) {
                spec.add(toSpec(item));
            }
            return spec;
        }
        return Literal.of(document);
    }

    static Map<String, Object> convertTomlMap(Map<String, Object> source) {
        Map<String, Object> converted = new LinkedHashMap<>();
        for (var entry : source.entrySet()) {
            converted.put(String.valueOf(entry.getKey()), convertTomlValue(entry.getValue()));
        }
        return converted;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlMap(table.toMap());
        }
        if (value instanceof TomlArray array) {
            List<Object> items = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                items.add(convertTomlValue(array.get(i)));
            }
            return items;
        }
        return value;
    }
}
