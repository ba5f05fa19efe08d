package work.lcod.reshape.runtime;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.reshape.errors.RegistrationException;
import work.lcod.reshape.errors.UnregisteredTargetException;

/**
 * Maps target types to {@link TargetHandler}s and resolves unregistered subtypes to their
 * most specific registered ancestor.
 *
 * <p>Non-exact registrations are kept in a specificity forest whose invariant is that a
 * node's type is an ancestor of all of its children. Registration is synchronized and
 * copy-on-write, so {@link #resolve(Object)} can run concurrently without locking.
 * Primitive arrays resolve as {@code Object[]}.
 */
public final class TypeRegistry {
    public static final String READ = "read";
    public static final String ITERATE = "iterate";
    public static final String WRITE = "write";

    private static final Logger LOG = LoggerFactory.getLogger(TypeRegistry.class);

    private final TypeHierarchy hierarchy;
    private volatile State state = new State(Map.of(), List.of());

    public TypeRegistry() {
        this(TypeHierarchy.JAVA);
    }

    public TypeRegistry(TypeHierarchy hierarchy) {
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
    }

    public TypeRegistry register(Class<?> type, TargetHandler.ReadHandler read) {
        return register(type, read, null, null, false);
    }

    public TypeRegistry register(Class<?> type, TargetHandler.ReadHandler read, TargetHandler.IterateHandler iterate) {
        return register(type, read, iterate, null, false);
    }

    public TypeRegistry register(
        Class<?> type,
        TargetHandler.ReadHandler read,
        TargetHandler.IterateHandler iterate,
        TargetHandler.WriteHandler write
    ) {
        return register(type, read, iterate, write, false);
    }

    /**
     * Installs handlers for {@code type}. A {@code null} {@code iterate} is replaced by a
     * structural probe when the type is iterable. With {@code exact}, subtypes of
     * {@code type} do not resolve to it.
     *
     * @throws RegistrationException if {@code type} would be both ancestor and descendant
     *         of an already-registered type; the registry is left unchanged
     */
    public synchronized TypeRegistry register(
        Class<?> type,
        TargetHandler.ReadHandler read,
        TargetHandler.IterateHandler iterate,
        TargetHandler.WriteHandler write,
        boolean exact
    ) {
        Objects.requireNonNull(type, "type");
        var current = state;
        for (var existing : current.handlers().keySet()) {
            if (existing != type && hierarchy.isSubtype(type, existing) && hierarchy.isSubtype(existing, type)) {
                throw new RegistrationException("Cannot register " + type.getName()
                    + ": it is both ancestor and descendant of registered type " + existing.getName());
            }
        }
        var handler = new TargetHandler(type, read, iterate == null ? structuralIterate(type) : iterate, write);
        List<Node> nextForest = current.forest();
        if (!exact) {
            var copy = copyOf(nextForest);
            insert(copy, type);
            nextForest = Collections.unmodifiableList(copy);
        }
        var nextHandlers = new LinkedHashMap<>(current.handlers());
        nextHandlers.remove(type);
        nextHandlers.put(type, handler);
        state = new State(Collections.unmodifiableMap(nextHandlers), nextForest);
        LOG.debug("Registered target type {} (read={}, iterate={}, write={}, exact={})",
            type.getName(), read != null, handler.iterate() != null, write != null, exact);
        return this;
    }

    /**
     * Returns the handler for {@code value}'s exact type, else the handler of its most
     * specific registered ancestor, else {@link TargetHandler#UNREGISTERED}.
     */
    public TargetHandler resolve(Object value) {
        var snapshot = state;
        Class<?> type = value == null ? Void.class : value.getClass();
        if (type.isArray() && type.getComponentType().isPrimitive()) {
            type = Object[].class;
        }
        var exact = snapshot.handlers().get(type);
        if (exact != null) {
            return exact;
        }
        if (value == null) {
            return TargetHandler.UNREGISTERED;
        }
        var match = closest(snapshot.forest(), type, 0);
        if (match == null) {
            return TargetHandler.UNREGISTERED;
        }
        return snapshot.handlers().getOrDefault(match.type(), TargetHandler.UNREGISTERED);
    }

    public boolean isEmpty() {
        return state.handlers().isEmpty();
    }

    public Map<Class<?>, TargetHandler> handlers() {
        return state.handlers();
    }

    /**
     * Sorted simple names of registered types supporting {@code operation}.
     */
    public List<String> registeredTypes(String operation) {
        var names = new ArrayList<String>();
        for (var handler : state.handlers().values()) {
            if (handler.supports(operation)) {
                names.add(handler.type().getSimpleName());
            }
        }
        Collections.sort(names);
        return names;
    }

    public UnregisteredTargetException unsupported(String operation, Object target) {
        var type = target == null ? Void.class : target.getClass();
        return new UnregisteredTargetException(operation, type, registeredTypes(operation), isEmpty());
    }

    private void insert(List<Node> level, Class<?> type) {
        boolean placed = false;
        Node adopter = null;
        for (var node : List.copyOf(level)) {
            if (node.type == type) {
                placed = true;
            } else if (hierarchy.isSubtype(node.type, type)) {
                level.remove(node);
                if (adopter == null) {
                    adopter = nodeFor(level, type);
                }
                adopter.children.add(node);
                placed = true;
            } else if (hierarchy.isSubtype(type, node.type)) {
                insert(node.children, type);
                placed = true;
            }
        }
        if (!placed) {
            level.add(new Node(type));
        }
    }

    private static Node nodeFor(List<Node> level, Class<?> type) {
        for (var node : level) {
            if (node.type == type) {
                return node;
            }
        }
        var created = new Node(type);
        level.add(created);
        return created;
    }

    private Match closest(List<Node> level, Class<?> type, int depth) {
        Match best = null;
        for (var node : level) {
            if (!hierarchy.isSubtype(type, node.type)) {
                continue;
            }
            var deeper = closest(node.children, type, depth + 1);
            var candidate = deeper != null ? deeper : new Match(node.type, depth);
            // later siblings were registered more recently and win ties
            if (best == null || candidate.depth() >= best.depth()) {
                best = candidate;
            }
        }
        return best;
    }

    private static List<Node> copyOf(List<Node> level) {
        var copy = new ArrayList<Node>(level.size());
        for (var node : level) {
            var cloned = new Node(node.type);
            cloned.children.addAll(copyOf(node.children));
            copy.add(cloned);
        }
        return copy;
    }

    private static TargetHandler.IterateHandler structuralIterate(Class<?> type) {
        if (type.isArray()) {
            return target -> {
                var items = new ArrayList<>();
                for (int i = 0; i < Array.getLength(target); i++) {
                    items.add(Array.get(target, i));
                }
                return items;
            };
        }
        if (Iterable.class.isAssignableFrom(type) && !CharSequence.class.isAssignableFrom(type)) {
            return target -> (Iterable<?>) target;
        }
        return null;
    }

    private static final class Node {
        private final Class<?> type;
        private final List<Node> children = new ArrayList<>();

        private Node(Class<?> type) {
            this.type = type;
        }
    }

    private record Match(Class<?> type, int depth) {}

    private record State(Map<Class<?>, TargetHandler> handlers, List<Node> forest) {}
}
