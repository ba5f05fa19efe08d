package work.lcod.reshape.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Every alternative of a fallback failed or was skipped and no default was configured.
 * {@link #skipped()} holds, in alternative order, either the skipped value or the
 * exception that was raised.
 */
public class FallbackExhaustedException extends ReshapeException {
    private final List<Object> skipped;

    public FallbackExhaustedException(String alternatives, List<Object> skipped, String policy) {
        super(describe(alternatives, skipped, policy));
        this.skipped = Collections.unmodifiableList(new ArrayList<>(skipped));
    }

    public List<Object> skipped() {
        return skipped;
    }

    private static String describe(String alternatives, List<Object> skipped, String policy) {
        var labels = new ArrayList<String>();
        for (var entry : skipped) {
            if (entry instanceof Throwable error) {
                labels.add(error.getClass().getSimpleName());
            } else {
                labels.add("<skipped " + (entry == null ? "null" : entry.getClass().getSimpleName()) + ">");
            }
        }
        var message = "no valid values found. Tried (" + alternatives + ") and got (" + String.join(", ", labels) + ")";
        return policy == null || policy.isBlank() ? message : message + ", " + policy;
    }
}
