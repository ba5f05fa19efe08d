package work.lcod.reshape.runtime;

import java.util.List;
import work.lcod.reshape.spec.Inspect;

/**
 * Well-known ambient keys carried by {@link Scope} frames. The set is closed, so ambient
 * state can never collide with user variables, which live in their own namespace.
 */
public final class ScopeKey<T> {
    public static final ScopeKey<Object> TARGET = new ScopeKey<>("target");
    public static final ScopeKey<Object> SPEC = new ScopeKey<>("spec");
    public static final ScopeKey<List<Object>> PATH = new ScopeKey<>("path");
    public static final ScopeKey<ModeHandler> MODE = new ScopeKey<>("mode");
    public static final ScopeKey<Inspect> INSPECTOR = new ScopeKey<>("inspector");
    public static final ScopeKey<Evaluator> EVALUATOR = new ScopeKey<>("evaluator");

    private final String name;

    private ScopeKey(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "ScopeKey(" + name + ")";
    }
}
