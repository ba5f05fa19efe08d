package work.lcod.reshape.runtime;

import java.lang.reflect.Array;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Seed registrations shared by {@code Reshaper.create()} and tests: generic objects,
 * maps, lists, arrays, other iterables and {@code null}.
 */
public final class DefaultTargetTypes {
    private DefaultTargetTypes() {}

    public static TypeRegistry register(TypeRegistry registry) {
        registry.register(Object.class, DefaultTargetTypes::readMember);
        registry.register(Map.class, DefaultTargetTypes::readKey, target -> ((Map<?, ?>) target).keySet(), DefaultTargetTypes::writeKey);
        registry.register(List.class, DefaultTargetTypes::readIndex, null, DefaultTargetTypes::writeIndex);
        registry.register(Object[].class, DefaultTargetTypes::readArrayIndex);
        registry.register(Iterable.class, DefaultTargetTypes::readMember);
        registry.register(Void.class, DefaultTargetTypes::readNull, null, null, true);
        return registry;
    }

    /**
     * Reads a record component, a {@code getX}/{@code isX} getter, or a public field named
     * {@code key}; failing those, a public method of that name is returned as a
     * {@link BoundMethod} for a following call step.
     */
    public static Object readMember(Object target, Object key) throws Exception {
        var name = String.valueOf(key);
        var type = target.getClass();
        if (type.isRecord()) {
            for (var component : type.getRecordComponents()) {
                if (component.getName().equals(name)) {
                    var accessor = Invoker.accessible(type, component.getAccessor());
                    if (accessor != null) {
                        return accessor.invoke(target);
                    }
                }
            }
        }
        if (!name.isEmpty()) {
            var suffix = name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
            for (var prefix : List.of("get", "is")) {
                var getter = Invoker.findMethod(type, prefix + suffix, List.of());
                if (getter != null && getter.getReturnType() != void.class) {
                    return getter.invoke(target);
                }
            }
        }
        for (var field : type.getFields()) {
            if (field.getName().equals(name) && !Modifier.isStatic(field.getModifiers())) {
                return field.get(target);
            }
        }
        if (Invoker.hasMethod(type, name)) {
            return new BoundMethod(target, name);
        }
        throw new NoSuchFieldException("'" + type.getSimpleName() + "' has no member '" + name + "'");
    }

    static Object readKey(Object target, Object key) {
        var map = (Map<?, ?>) target;
        if (!map.containsKey(key)) {
            throw new NoSuchElementException("no key " + Reprs.repr(key));
        }
        return map.get(key);
    }

    @SuppressWarnings("unchecked")
    static void writeKey(Object target, Object key, Object value) {
        ((Map<Object, Object>) target).put(key, value);
    }

    static Object readIndex(Object target, Object key) {
        var list = (List<?>) target;
        return list.get(position(key, list.size()));
    }

    @SuppressWarnings("unchecked")
    static void writeIndex(Object target, Object key, Object value) {
        var list = (List<Object>) target;
        list.set(position(key, list.size()), value);
    }

    static Object readArrayIndex(Object target, Object key) {
        return Array.get(target, position(key, Array.getLength(target)));
    }

    static Object readNull(Object target, Object key) {
        throw new NullPointerException("cannot read " + Reprs.repr(key) + " from null");
    }

    /**
     * Integer (or numeric string) index; negative values count from the end.
     */
    private static int position(Object key, int size) {
        int index;
        if (key instanceof Number number) {
            index = number.intValue();
        } else {
            index = Integer.parseInt(String.valueOf(key).trim());
        }
        var resolved = index < 0 ? size + index : index;
        if (resolved < 0 || resolved >= size) {
            throw new IndexOutOfBoundsException("index " + index + " out of range for length " + size);
        }
        return resolved;
    }
}
