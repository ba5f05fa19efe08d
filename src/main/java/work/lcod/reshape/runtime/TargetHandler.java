package work.lcod.reshape.runtime;

/**
 * Capabilities registered for a target type. A {@code null} capability means the
 * operation is not supported for that type.
 */
public record TargetHandler(Class<?> type, ReadHandler read, IterateHandler iterate, WriteHandler write) {
    public static final TargetHandler UNREGISTERED = new TargetHandler(null, null, null, null);

    public boolean supports(String operation) {
        return switch (operation) {
            case TypeRegistry.READ -> read != null;
            case TypeRegistry.ITERATE -> iterate != null;
            case TypeRegistry.WRITE -> write != null;
            default -> false;
        };
    }

    @FunctionalInterface
    public interface ReadHandler {
        Object read(Object target, Object key) throws Exception;
    }

    @FunctionalInterface
    public interface IterateHandler {
        Iterable<?> iterate(Object target) throws Exception;
    }

    @FunctionalInterface
    public interface WriteHandler {
        void write(Object target, Object key, Object value) throws Exception;
    }
}
