package work.lcod.reshape.runtime;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.reshape.errors.PathAccessException;
import work.lcod.reshape.errors.ReshapeException;
import work.lcod.reshape.errors.SpecTypeException;
import work.lcod.reshape.spec.Call;
import work.lcod.reshape.spec.Inspect;
import work.lcod.reshape.spec.Literal;
import work.lcod.reshape.spec.Path;
import work.lcod.reshape.spec.Pipeline;
import work.lcod.reshape.spec.Sentinel;
import work.lcod.reshape.spec.SubSpec;
import work.lcod.reshape.spec.TargetExpr;

/**
 * Recursive spec interpreter. Each {@link #step} creates a scope frame, applies
 * instrumentation, defers to the active mode when it is not structural, and otherwise
 * dispatches on the spec's shape.
 */
public final class Evaluator {
    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final TypeRegistry registry;

    public Evaluator(TypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public TypeRegistry registry() {
        return registry;
    }

    public Object evaluate(Object target, Object spec, Map<String, Object> variables) {
        var root = Scope.root(this);
        if (variables != null) {
            variables.forEach(root::bind);
        }
        return step(target, spec, root);
    }

    public Object step(Object target, Object spec, Scope parent) {
        return step(target, spec, parent, null);
    }

    /**
     * Evaluates {@code spec} in a new frame under {@code parent}. A non-null {@code path}
     * becomes the new frame's own path.
     */
    public Object step(Object target, Object spec, Scope parent, List<Object> path) {
        var scope = parent.child();
        scope.set(ScopeKey.TARGET, target);
        scope.set(ScopeKey.SPEC, spec);
        if (path != null) {
            scope.set(ScopeKey.PATH, path);
        }
        try {
            var inspector = activeInspector(parent);
            if (inspector == null) {
                return dispatch(target, spec, scope);
            }
            return instrumented(inspector, target, spec, scope);
        } catch (ReshapeException ex) {
            throw ex.attach(scope, scope.path());
        }
    }

    private Object instrumented(Inspect inspector, Object target, Object spec, Scope scope) {
        inspector.beforeStep(scope);
        Object result;
        try {
            result = dispatch(target, spec, scope);
        } catch (RuntimeException | Error ex) {
            inspector.afterFailure(scope, ex);
            throw ex;
        }
        inspector.afterStep(scope, result);
        return result;
    }

    /**
     * The inspector applying to a step under {@code parent}: the one set directly on the
     * parent frame, or the nearest recursive one further out.
     */
    private static Inspect activeInspector(Scope parent) {
        var direct = parent.local(ScopeKey.INSPECTOR);
        if (direct != null) {
            return direct;
        }
        var inherited = parent.get(ScopeKey.INSPECTOR);
        return inherited != null && inherited.recursive() ? inherited : null;
    }

    private Object dispatch(Object target, Object spec, Scope scope) {
        if (spec instanceof Inspect inspect) {
            scope.set(ScopeKey.INSPECTOR, inspect);
            return step(target, inspect.wrapped(), scope);
        }
        var mode = scope.mode();
        if (mode != ModeHandler.STRUCTURAL) {
            return mode.apply(target, spec, scope);
        }
        return structural(target, spec, scope);
    }

    /**
     * The default interpretation of spec shapes, used when no other mode is active.
     */
    @SuppressWarnings("unchecked")
    public Object structural(Object target, Object spec, Scope scope) {
        if (spec instanceof Map<?, ?> mapping) {
            return mapping(target, mapping, scope);
        }
        if (spec instanceof List<?> template) {
            return template(target, template, scope);
        }
        if (spec instanceof Pipeline pipeline) {
            return pipeline(target, pipeline, scope);
        }
        if (spec instanceof TargetExpr expr) {
            return expr.evaluate(target, scope);
        }
        if (spec instanceof Call call) {
            return call.evaluate(target, scope);
        }
        if (spec instanceof Function<?, ?> function) {
            return ((Function<Object, Object>) function).apply(target);
        }
        if (spec instanceof String dotted) {
            return access(target, Path.split(dotted), scope);
        }
        if (spec instanceof Path path) {
            return access(target, path.keys(), scope);
        }
        if (spec instanceof Directive directive) {
            return directive.evaluate(target, scope);
        }
        if (spec instanceof Literal literal) {
            return literal.value();
        }
        if (spec instanceof SubSpec subSpec) {
            return step(target, subSpec.spec(), scope);
        }
        throw new SpecTypeException("expected spec to be a Map, List, Pipeline, TargetExpr, Call, Function,"
            + " String, Path, Directive, Literal or SubSpec, not: " + Reprs.repr(spec)
            + " (" + Reprs.typeName(spec) + ")");
    }

    private Map<Object, Object> mapping(Object target, Map<?, ?> spec, Scope scope) {
        var result = newMapping(spec);
        for (var entry : spec.entrySet()) {
            var value = step(target, entry.getValue(), scope);
            if (value == Sentinel.OMIT) {
                continue;
            }
            result.put(entry.getKey(), value);
        }
        return result;
    }

    /**
     * Output mapping of the same kind as the spec: sorted specs keep their ordering,
     * everything else keeps declaration order.
     */
    @SuppressWarnings("unchecked")
    private static Map<Object, Object> newMapping(Map<?, ?> spec) {
        if (spec instanceof SortedMap<?, ?> sorted) {
            return new TreeMap<>((Comparator<Object>) sorted.comparator());
        }
        return new LinkedHashMap<>();
    }

    private List<Object> template(Object target, List<?> spec, Scope scope) {
        if (spec.size() != 1) {
            throw new SpecTypeException("sequence template expects exactly one sub-spec, got " + spec.size()
                + ": " + Reprs.repr(spec));
        }
        var subSpec = spec.get(0);
        var handler = registry.resolve(target);
        if (handler.iterate() == null) {
            throw registry.unsupported(TypeRegistry.ITERATE, target);
        }
        Iterable<?> elements;
        try {
            elements = handler.iterate().iterate(target);
        } catch (Exception ex) {
            throw new SpecTypeException("failed to iterate on instance of type " + Reprs.typeName(target)
                + " at " + Reprs.path(scope.path()) + " (got " + ex + ")");
        }
        var results = new ArrayList<>();
        var base = scope.path();
        int index = 0;
        for (var element : elements) {
            var value = step(element, subSpec, scope, Reprs.append(base, index++));
            if (value == Sentinel.OMIT) {
                continue;
            }
            if (value == Sentinel.STOP) {
                LOG.trace("Template iteration stopped after {} element(s)", index);
                break;
            }
            results.add(value);
        }
        return results;
    }

    private Object pipeline(Object target, Pipeline spec, Scope scope) {
        Object current = target;
        var path = scope.path();
        for (var subSpec : spec.steps()) {
            current = step(current, subSpec, scope, path);
            if (!(subSpec instanceof List<?>)) {
                path = Reprs.append(path, Reprs.segment(subSpec));
            }
        }
        return current;
    }

    private Object access(Object target, List<Object> keys, Scope scope) {
        Object current = target;
        for (int i = 0; i < keys.size(); i++) {
            var handler = registry.resolve(current);
            if (handler.read() == null) {
                throw registry.unsupported(TypeRegistry.READ, current);
            }
            try {
                current = handler.read().read(current, keys.get(i));
            } catch (Exception ex) {
                throw new PathAccessException(ex, keys, i, Path.render(keys));
            }
        }
        return current;
    }
}
