package work.lcod.reshape.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import work.lcod.reshape.runtime.Reprs;

/**
 * A key, field, index or deferred-expression step could not be resolved against the
 * current target. {@link #parts()} is the full key (or operation) sequence and
 * {@link #index()} the zero-based position that failed.
 */
public class PathAccessException extends ReshapeException {
    private final List<?> parts;
    private final int index;
    private final String rendered;

    public PathAccessException(Throwable cause, List<?> parts, int index, String rendered) {
        super(describe(cause, parts, index, rendered), cause);
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
        this.index = index;
        this.rendered = rendered;
    }

    public List<?> parts() {
        return parts;
    }

    public int index() {
        return index;
    }

    public Object failingSegment() {
        return parts.get(index);
    }

    /**
     * Rendering of the accessed sequence, e.g. {@code Path('a', 'b', 'c')} or {@code T['a']['b']}.
     */
    public String rendered() {
        return rendered;
    }

    private static String describe(Throwable cause, List<?> parts, int index, String rendered) {
        var segment = index >= 0 && index < parts.size() ? Reprs.repr(parts.get(index)) : "?";
        var error = cause == null ? "unknown" : cause.getClass().getSimpleName()
            + (cause.getMessage() == null ? "" : "(" + cause.getMessage() + ")");
        return "could not access " + segment + ", index " + index + " in path " + rendered + ", got error: " + error;
    }
}
