package work.lcod.reshape.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.reshape.errors.ReshapeException;

/**
 * Immutable options for a single {@link Reshaper#reshape(Object, Object, EvaluationOptions)} call.
 *
 * <p>When a default is configured, errors of one of the {@code skipOn} types are replaced by it;
 * {@code skipOn} falls back to {@link ReshapeException} when left empty. Without a default every
 * error is re-raised.
 */
public record EvaluationOptions(
    Object defaultValue,
    boolean hasDefault,
    Set<Class<? extends Throwable>> skipOn,
    Map<String, Object> variables
) {
    private static final EvaluationOptions DEFAULTS = builder().build();

    public EvaluationOptions {
        Objects.requireNonNull(skipOn, "skipOn");
        Objects.requireNonNull(variables, "variables");
        skipOn = skipOn.isEmpty() ? Set.of(ReshapeException.class) : Collections.unmodifiableSet(new LinkedHashSet<>(skipOn));
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static EvaluationOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether {@code error} should be answered with the default value.
     */
    public boolean swallows(Throwable error) {
        if (!hasDefault) {
            return false;
        }
        for (var type : skipOn) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    public static final class Builder {
        private Object defaultValue;
        private boolean hasDefault;
        private Set<Class<? extends Throwable>> skipOn = new LinkedHashSet<>();
        private final Map<String, Object> variables = new LinkedHashMap<>();

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            this.hasDefault = true;
            return this;
        }

        @SafeVarargs
        public final Builder skipOn(Class<? extends Throwable>... types) {
            this.skipOn = new LinkedHashSet<>(List.of(types));
            return this;
        }

        public Builder variable(String name, Object value) {
            this.variables.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder variables(Map<String, ?> variables) {
            this.variables.putAll(variables);
            return this;
        }

        public EvaluationOptions build() {
            return new EvaluationOptions(defaultValue, hasDefault, skipOn, variables);
        }
    }
}
