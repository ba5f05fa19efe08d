package work.lcod.reshape.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import work.lcod.reshape.runtime.Directive;
import work.lcod.reshape.runtime.Reprs;
import work.lcod.reshape.runtime.Scope;

/**
 * Binds variables, readable later through {@code TargetExpr.S}. Each binding spec is
 * evaluated against the current target; the target itself passes through unchanged.
 */
public final class Let implements Directive {
    private final Map<String, Object> bindings;
    private final Scope.Level level;

    private Let(Map<String, ?> bindings, Scope.Level level) {
        if (bindings.isEmpty()) {
            throw new IllegalArgumentException("Let requires at least one binding");
        }
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.level = level;
    }

    /**
     * Binds into the enclosing frame, visible to the following steps of a pipeline.
     */
    public static Let of(Map<String, ?> bindings) {
        return new Let(bindings, Scope.Level.PARENT);
    }

    /**
     * Binds into the root frame, visible for the rest of the evaluation.
     */
    public static Let global(Map<String, ?> bindings) {
        return new Let(bindings, Scope.Level.ROOT);
    }

    @Override
    public Object evaluate(Object target, Scope scope) {
        for (var entry : bindings.entrySet()) {
            var value = scope.evaluate(target, entry.getValue());
            scope.bind(level, entry.getKey(), value);
        }
        return target;
    }

    @Override
    public String toString() {
        var joiner = new StringJoiner(", ", level == Scope.Level.ROOT ? "Let.global(" : "Let(", ")");
        bindings.forEach((name, spec) -> joiner.add(name + "=" + Reprs.repr(spec)));
        return joiner.toString();
    }
}
