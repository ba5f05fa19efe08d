package work.lcod.reshape.api;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.reshape.runtime.DefaultTargetTypes;
import work.lcod.reshape.runtime.Evaluator;
import work.lcod.reshape.runtime.TypeRegistry;

/**
 * Entry point: evaluates a spec against a target using its own {@link TypeRegistry}.
 * <pre>{@code
 * var reshaper = Reshaper.create();
 * reshaper.reshape(Map.of("a", Map.of("b", "c")), "a.b");   // "c"
 * }</pre>
 */
public final class Reshaper {
    private static final Logger LOG = LoggerFactory.getLogger(Reshaper.class);

    private final TypeRegistry registry;
    private final Evaluator evaluator;

    /**
     * Uses {@code registry} as is; an empty registry cannot read anything.
     */
    public Reshaper(TypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.evaluator = new Evaluator(registry);
    }

    /**
     * A reshaper over a registry seeded with maps, lists, arrays, iterables and plain objects.
     */
    public static Reshaper create() {
        var registry = new TypeRegistry();
        DefaultTargetTypes.register(registry);
        return new Reshaper(registry);
    }

    public TypeRegistry registry() {
        return registry;
    }

    public Evaluator evaluator() {
        return evaluator;
    }

    public Object reshape(Object target, Object spec) {
        return reshape(target, spec, EvaluationOptions.defaults());
    }

    public Object reshape(Object target, Object spec, EvaluationOptions options) {
        Objects.requireNonNull(options, "options");
        try {
            return evaluator.evaluate(target, spec, options.variables());
        } catch (RuntimeException ex) {
            if (!options.swallows(ex)) {
                throw ex;
            }
            LOG.debug("Returning default value after {}: {}", ex.getClass().getSimpleName(), ex.getMessage());
            return options.defaultValue();
        }
    }
}
