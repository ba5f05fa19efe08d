package work.lcod.reshape.errors;

import java.util.List;

/**
 * The registry has no handler supporting the requested operation ({@code read},
 * {@code iterate} or {@code write}) for the target's type.
 */
public class UnregisteredTargetException extends ReshapeException {
    private final String operation;
    private final Class<?> targetType;
    private final List<String> registeredTypes;

    public UnregisteredTargetException(String operation, Class<?> targetType, List<String> registeredTypes, boolean emptyRegistry) {
        super(describe(operation, targetType, registeredTypes, emptyRegistry));
        this.operation = operation;
        this.targetType = targetType;
        this.registeredTypes = List.copyOf(registeredTypes);
    }

    public String operation() {
        return operation;
    }

    public Class<?> targetType() {
        return targetType;
    }

    /**
     * Simple names of the registered types that do support {@link #operation()}, sorted.
     */
    public List<String> registeredTypes() {
        return registeredTypes;
    }

    private static String describe(String operation, Class<?> targetType, List<String> registered, boolean emptyRegistry) {
        if (emptyRegistry) {
            return "reshape called without registering any types, see TypeRegistry.register()";
        }
        var typeName = targetType == null ? "null" : targetType.getSimpleName();
        return "target type '" + typeName + "' not registered for '" + operation
            + "', expected one of registered types: (" + String.join(", ", registered) + ")";
    }
}
