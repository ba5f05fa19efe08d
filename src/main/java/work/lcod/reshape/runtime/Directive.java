package work.lcod.reshape.runtime;

/**
 * Extension point for spec types with their own evaluation rules. {@code scope} is the frame
 * created for this step; sub-specs are evaluated with {@link Scope#evaluate(Object, Object)}.
 */
@FunctionalInterface
public interface Directive {
    Object evaluate(Object target, Scope scope);
}
