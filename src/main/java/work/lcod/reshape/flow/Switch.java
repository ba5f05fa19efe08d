package work.lcod.reshape.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.reshape.errors.ReshapeException;
import work.lcod.reshape.runtime.Directive;
import work.lcod.reshape.runtime.Reprs;
import work.lcod.reshape.runtime.Scope;

/**
 * Picks the value spec of the first case whose key spec evaluates without a
 * {@link ReshapeException}. The value spec runs in the scope left by its key spec, so
 * variables bound while matching are visible to it.
 */
public final class Switch implements Directive {
    private static final Logger LOG = LoggerFactory.getLogger(Switch.class);
    private static final Object NO_DEFAULT = new Object();

    private final List<Case> cases;
    private final Object defaultValue;

    private Switch(List<Case> cases, Object defaultValue) {
        if (cases.isEmpty()) {
            throw new IllegalArgumentException("Switch requires at least one case");
        }
        this.cases = cases;
        this.defaultValue = defaultValue;
    }

    public static Switch of(Map<?, ?> cases) {
        var list = new ArrayList<Case>();
        cases.forEach((key, value) -> list.add(new Case(key, value)));
        return new Switch(Collections.unmodifiableList(list), NO_DEFAULT);
    }

    public static Switch cases(Case... cases) {
        return new Switch(List.of(cases), NO_DEFAULT);
    }

    public static Case when(Object keySpec, Object valueSpec) {
        return new Case(keySpec, valueSpec);
    }

    public Switch orElse(Object value) {
        return new Switch(cases, value);
    }

    @Override
    public Object evaluate(Object target, Scope scope) {
        for (var candidate : cases) {
            try {
                scope.evaluate(target, candidate.keySpec());
            } catch (ReshapeException ex) {
                LOG.trace("Switch case {} did not match: {}", candidate.keySpec(), ex.getMessage());
                continue;
            }
            return scope.evaluateChained(target, candidate.valueSpec());
        }
        if (defaultValue != NO_DEFAULT) {
            return defaultValue;
        }
        throw new ReshapeException("no matches for target in " + this);
    }

    @Override
    public String toString() {
        var rendered = new ArrayList<String>();
        for (var candidate : cases) {
            rendered.add("(" + Reprs.repr(candidate.keySpec()) + ", " + Reprs.repr(candidate.valueSpec()) + ")");
        }
        return "Switch([" + String.join(", ", rendered) + "])";
    }

    public record Case(Object keySpec, Object valueSpec) {}
}
