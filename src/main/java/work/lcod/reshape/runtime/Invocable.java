package work.lcod.reshape.runtime;

import java.util.List;
import java.util.Map;

/**
 * Callable accepting positional and keyword arguments, for call steps and {@code Call} specs
 * that need more than the {@code java.util.function} shapes.
 */
@FunctionalInterface
public interface Invocable {
    Object invoke(List<Object> args, Map<String, Object> kwargs);
}
