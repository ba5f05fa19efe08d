package work.lcod.reshape.errors;

/**
 * Rejected type registration, e.g. a type that would be both ancestor and descendant
 * of an already-registered type.
 */
public class RegistrationException extends IllegalArgumentException {
    public RegistrationException(String message) {
        super(message);
    }
}
