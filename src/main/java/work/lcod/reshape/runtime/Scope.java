package work.lcod.reshape.runtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.reshape.errors.UnboundVariableException;

/**
 * One frame of the evaluation environment. Frames form a parent-linked chain created on
 * each evaluation step; lookups walk outwards, writes land in the innermost frame unless
 * an ancestor {@link Level} is named.
 */
public final class Scope {
    private final Scope parent;
    private final Map<ScopeKey<?>, Object> ambient = new HashMap<>();
    private final Map<String, Object> variables = new LinkedHashMap<>();
    private Scope lastChild;

    private Scope(Scope parent) {
        this.parent = parent;
    }

    /**
     * Creates a root frame bound to {@code evaluator}, in structural mode with an empty path.
     */
    public static Scope root(Evaluator evaluator) {
        var root = new Scope(null);
        root.set(ScopeKey.EVALUATOR, evaluator);
        root.set(ScopeKey.MODE, ModeHandler.STRUCTURAL);
        root.set(ScopeKey.PATH, List.of());
        return root;
    }

    /**
     * Creates a frame under this one and remembers it as {@link #lastChild()}.
     */
    public Scope child() {
        var child = new Scope(this);
        this.lastChild = child;
        return child;
    }

    public Scope parent() {
        return parent;
    }

    public Scope root() {
        var current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    /**
     * The frame most recently created under this one, or this frame if none was.
     */
    public Scope lastChild() {
        return lastChild == null ? this : lastChild;
    }

    @SuppressWarnings("unchecked")
    public <T> T get(ScopeKey<T> key) {
        for (var frame = this; frame != null; frame = frame.parent) {
            if (frame.ambient.containsKey(key)) {
                return (T) frame.ambient.get(key);
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public <T> T local(ScopeKey<T> key) {
        return (T) ambient.get(key);
    }

    public boolean hasLocal(ScopeKey<?> key) {
        return ambient.containsKey(key);
    }

    public <T> Scope set(ScopeKey<T> key, T value) {
        ambient.put(key, value);
        return this;
    }

    /**
     * @throws UnboundVariableException if no frame in the chain binds {@code name}
     */
    public Object var(String name) {
        for (var frame = this; frame != null; frame = frame.parent) {
            if (frame.variables.containsKey(name)) {
                return frame.variables.get(name);
            }
        }
        throw new UnboundVariableException(name);
    }

    public boolean isBound(String name) {
        for (var frame = this; frame != null; frame = frame.parent) {
            if (frame.variables.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    public Scope bind(String name, Object value) {
        variables.put(name, value);
        return this;
    }

    public Scope bind(Level level, String name, Object value) {
        var frame = switch (level) {
            case LOCAL -> this;
            case PARENT -> parent == null ? this : parent;
            case ROOT -> root();
        };
        frame.variables.put(name, value);
        return this;
    }

    /**
     * All visible variables, inner bindings shadowing outer ones.
     */
    public Map<String, Object> variables() {
        var merged = new LinkedHashMap<String, Object>();
        var frames = chain();
        for (int i = frames.size() - 1; i >= 0; i--) {
            merged.putAll(frames.get(i).variables);
        }
        return merged;
    }

    /**
     * Frames from this one out to the root.
     */
    public List<Scope> chain() {
        var frames = new ArrayList<Scope>();
        for (var frame = this; frame != null; frame = frame.parent) {
            frames.add(frame);
        }
        return frames;
    }

    public Object target() {
        return get(ScopeKey.TARGET);
    }

    public Object spec() {
        return get(ScopeKey.SPEC);
    }

    public List<Object> path() {
        var path = get(ScopeKey.PATH);
        return path == null ? List.of() : path;
    }

    public ModeHandler mode() {
        var mode = get(ScopeKey.MODE);
        return mode == null ? ModeHandler.STRUCTURAL : mode;
    }

    public Evaluator evaluator() {
        var evaluator = get(ScopeKey.EVALUATOR);
        if (evaluator == null) {
            throw new IllegalStateException("scope is not attached to an evaluator");
        }
        return evaluator;
    }

    public TypeRegistry registry() {
        return evaluator().registry();
    }

    /**
     * Evaluates {@code spec} against {@code target} in a new frame under this one.
     */
    public Object evaluate(Object target, Object spec) {
        return evaluator().step(target, spec, this);
    }

    /**
     * Evaluates {@code spec} under the frame left by the previous sibling evaluation, so
     * variables bound there are visible.
     */
    public Object evaluateChained(Object target, Object spec) {
        return evaluator().step(target, spec, lastChild());
    }

    public enum Level {
        LOCAL,
        PARENT,
        ROOT
    }
}
