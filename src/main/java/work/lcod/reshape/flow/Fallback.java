package work.lcod.reshape.flow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import work.lcod.reshape.errors.FallbackExhaustedException;
import work.lcod.reshape.errors.ReshapeException;
import work.lcod.reshape.runtime.Directive;
import work.lcod.reshape.runtime.Reprs;
import work.lcod.reshape.runtime.Scope;

/**
 * Ordered alternatives, the first one that neither fails nor is skipped wins (like SQL
 * {@code COALESCE}).
 *
 * <p>An alternative is skipped when it raises one of the {@link #skipOn} types (by default
 * {@link ReshapeException}) or when the value it returns matches the skip predicate.
 * Exceptions are checked first; the predicate only ever sees values that were returned.
 * When every alternative is skipped, the default is returned if configured, otherwise a
 * {@link FallbackExhaustedException} lists what was skipped, in order.
 */
public final class Fallback implements Directive {
    private static final Object NO_DEFAULT = new Object();
    private static final Predicate<Object> NEVER = value -> false;

    private final List<Object> alternatives;
    private final Object defaultValue;
    private final Predicate<Object> skip;
    private final String skipLabel;
    private final Set<Class<? extends Throwable>> skipOn;

    private Fallback(List<Object> alternatives, Object defaultValue, Predicate<Object> skip, String skipLabel, Set<Class<? extends Throwable>> skipOn) {
        this.alternatives = alternatives;
        this.defaultValue = defaultValue;
        this.skip = skip;
        this.skipLabel = skipLabel;
        this.skipOn = skipOn;
    }

    public static Fallback of(Object... alternatives) {
        return new Fallback(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(alternatives))),
            NO_DEFAULT, NEVER, null, Set.of(ReshapeException.class));
    }

    /**
     * Returns {@code value} instead of failing when every alternative is skipped.
     */
    public Fallback orElse(Object value) {
        return new Fallback(alternatives, value, skip, skipLabel, skipOn);
    }

    public Fallback skipping(Predicate<Object> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return new Fallback(alternatives, defaultValue, predicate, "a predicate", skipOn);
    }

    /**
     * Skips results equal to any of {@code values}.
     */
    public Fallback skipValues(Object... values) {
        var skipped = Arrays.asList(values);
        return new Fallback(alternatives, defaultValue, skipped::contains, Reprs.repr(skipped), skipOn);
    }

    @SafeVarargs
    public final Fallback skipOn(Class<? extends Throwable>... types) {
        return new Fallback(alternatives, defaultValue, skip, skipLabel, Set.of(types));
    }

    public List<Object> alternatives() {
        return alternatives;
    }

    public boolean hasDefault() {
        return defaultValue != NO_DEFAULT;
    }

    @Override
    public Object evaluate(Object target, Scope scope) {
        var skipped = new ArrayList<Object>();
        for (var alternative : alternatives) {
            Object value;
            try {
                value = scope.evaluate(target, alternative);
            } catch (RuntimeException ex) {
                if (!skippable(ex)) {
                    throw ex;
                }
                skipped.add(ex);
                continue;
            }
            if (skip.test(value)) {
                skipped.add(value);
                continue;
            }
            return value;
        }
        if (hasDefault()) {
            return defaultValue;
        }
        throw new FallbackExhaustedException(Reprs.args(alternatives), skipped, policy());
    }

    private boolean skippable(Throwable error) {
        for (var type : skipOn) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    private String policy() {
        var parts = new ArrayList<String>();
        if (skipLabel != null) {
            parts.add("skip set to " + skipLabel);
        }
        if (!skipOn.equals(Set.of(ReshapeException.class))) {
            var names = new ArrayList<String>();
            skipOn.forEach(type -> names.add(type.getSimpleName()));
            Collections.sort(names);
            parts.add("skipOn set to (" + String.join(", ", names) + ")");
        }
        return String.join(", ", parts);
    }

    @Override
    public String toString() {
        var text = new StringBuilder("Fallback(").append(Reprs.args(alternatives));
        if (hasDefault()) {
            text.append(", default=").append(Reprs.repr(defaultValue));
        }
        return text.append(')').toString();
    }
}
