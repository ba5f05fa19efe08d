package work.lcod.reshape.runtime;

/**
 * Interpretation strategy for specs. When a frame's mode is anything but
 * {@link #STRUCTURAL}, the evaluator hands the whole step to it; alternate grammars recurse
 * through {@link Scope#evaluate(Object, Object)} and must fail with a
 * {@code ReshapeException} so fallbacks compose over them.
 */
@FunctionalInterface
public interface ModeHandler {
    ModeHandler STRUCTURAL = (target, spec, scope) -> scope.evaluator().structural(target, spec, scope);

    Object apply(Object target, Object spec, Scope scope);
}
