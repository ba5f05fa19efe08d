package work.lcod.reshape.errors;

import java.util.List;
import work.lcod.reshape.runtime.Reprs;
import work.lcod.reshape.runtime.Scope;

/**
 * Base of every error raised by spec evaluation. Carries the evaluation path and the
 * innermost scope frame active when the error was raised, for tracing.
 */
public class ReshapeException extends RuntimeException {
    private List<Object> path = List.of();
    private Scope scope;

    public ReshapeException(String message) {
        super(message);
    }

    public ReshapeException(String message, Throwable cause) {
        super(message, cause);
    }

    public List<Object> path() {
        return path;
    }

    public Scope scope() {
        return scope;
    }

    /**
     * Records where the error happened. Only the first (innermost) call has an effect.
     */
    public ReshapeException attach(Scope raisedIn, List<Object> evaluationPath) {
        if (this.scope == null && raisedIn != null) {
            this.scope = raisedIn;
            this.path = evaluationPath == null ? List.of() : List.copyOf(evaluationPath);
        }
        return this;
    }

    @Override
    public String getMessage() {
        var message = super.getMessage();
        if (path.isEmpty()) {
            return message;
        }
        return message + " (at " + Reprs.path(path) + ")";
    }
}
