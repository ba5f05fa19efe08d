package work.lcod.reshape.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import work.lcod.reshape.errors.ReshapeException;
import work.lcod.reshape.runtime.Reprs;
import work.lcod.reshape.runtime.Scope;
import work.lcod.reshape.runtime.ScopeKey;
import work.lcod.reshape.spec.Path;
import work.lcod.reshape.spec.TargetExpr;

/**
 * Renders the scope chain captured by an evaluation, outermost step first.
 * <pre>{@code
 * /Map!LinkedHashMap/Pipeline/List!ArrayList<'items'>/'n'!LinkedHashMap<1>
 * }</pre>
 */
public final class Tracer {
    private static final String NO_TRACE = "(no trace)";

    private Tracer() {}

    /**
     * One line, one {@code /} segment per step: the spec, {@code !Type} when the target's
     * type changed, and {@code <a->b>} when the step entered new path segments.
     */
    public static String lineStack(Scope scope) {
        var frames = frames(scope);
        if (frames.isEmpty()) {
            return NO_TRACE;
        }
        var text = new StringBuilder();
        Class<?> previousType = null;
        List<Object> previousPath = List.of();
        boolean first = true;
        for (var frame : frames) {
            text.append('/').append(specToken(frame.local(ScopeKey.SPEC)));
            var target = frame.local(ScopeKey.TARGET);
            var type = target == null ? Void.class : target.getClass();
            if (first || type != previousType) {
                text.append('!').append(Reprs.typeName(target));
            }
            if (frame.hasLocal(ScopeKey.PATH)) {
                var path = frame.local(ScopeKey.PATH);
                var added = added(previousPath, path);
                if (!added.isEmpty()) {
                    var joiner = new StringJoiner("->", "<", ">");
                    added.forEach(segment -> joiner.add(Reprs.repr(segment)));
                    text.append(joiner);
                }
                previousPath = path;
            }
            previousType = type;
            first = false;
        }
        return text.toString();
    }

    /**
     * One {@code target:} / {@code spec:} pair per step, values cut to {@code width}
     * characters. A target equal to the previous step's is not repeated.
     */
    public static String shortStack(Scope scope, int width) {
        var frames = frames(scope);
        if (frames.isEmpty()) {
            return NO_TRACE;
        }
        var lines = new ArrayList<String>();
        Object previous = null;
        boolean first = true;
        for (var frame : frames) {
            var target = frame.local(ScopeKey.TARGET);
            if (first || !Objects.equals(previous, target)) {
                lines.add("target: " + Reprs.truncate(Reprs.repr(target), width));
            }
            lines.add("spec: " + Reprs.truncate(Reprs.repr(frame.local(ScopeKey.SPEC)), width));
            previous = target;
            first = false;
        }
        return String.join(System.lineSeparator(), lines);
    }

    public static String tallStack(Scope scope) {
        return shortStack(scope, 0);
    }

    public static String lineStack(ReshapeException error) {
        return lineStack(error.scope());
    }

    public static String shortStack(ReshapeException error, int width) {
        return shortStack(error.scope(), width);
    }

    private static List<Scope> frames(Scope scope) {
        if (scope == null) {
            return List.of();
        }
        var frames = new ArrayList<Scope>();
        for (var frame : scope.chain()) {
            if (frame.hasLocal(ScopeKey.SPEC)) {
                frames.add(frame);
            }
        }
        Collections.reverse(frames);
        return frames;
    }

    private static String specToken(Object spec) {
        if (spec instanceof TargetExpr || spec instanceof Path || spec instanceof String) {
            return Reprs.repr(spec);
        }
        if (spec instanceof Map<?, ?>) {
            return "Map";
        }
        if (spec instanceof List<?>) {
            return "List";
        }
        if (spec != null && spec.getClass().isSynthetic()) {
            return "<function>";
        }
        return Reprs.typeName(spec);
    }

    private static List<Object> added(List<Object> previous, List<Object> current) {
        if (current.size() >= previous.size() && current.subList(0, previous.size()).equals(previous)) {
            return current.subList(previous.size(), current.size());
        }
        return current;
    }
}
