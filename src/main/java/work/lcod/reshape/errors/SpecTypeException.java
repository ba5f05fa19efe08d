package work.lcod.reshape.errors;

/**
 * A spec value does not match any recognized spec shape.
 */
public class SpecTypeException extends ReshapeException {
    public SpecTypeException(String message) {
        super(message);
    }
}
