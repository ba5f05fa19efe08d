package work.lcod.reshape.runtime;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import work.lcod.reshape.errors.SpecTypeException;

/**
 * Invokes callables found in specs or produced by call steps. Exceptions thrown by the
 * callee are never wrapped; only a callee that cannot take the arguments is reported,
 * as a {@link SpecTypeException}.
 */
public final class Invoker {
    private static final Map<Class<?>, Class<?>> BOXES = Map.of(
        boolean.class, Boolean.class,
        byte.class, Byte.class,
        char.class, Character.class,
        short.class, Short.class,
        int.class, Integer.class,
        long.class, Long.class,
        float.class, Float.class,
        double.class, Double.class
    );

    private Invoker() {}

    @SuppressWarnings("unchecked")
    public static Object invoke(Object callee, List<Object> args, Map<String, Object> kwargs) {
        if (callee instanceof Invocable invocable) {
            return invocable.invoke(args, kwargs);
        }
        if (!kwargs.isEmpty()) {
            throw new SpecTypeException(Reprs.repr(callee) + " does not accept keyword arguments " + kwargs.keySet());
        }
        if (callee instanceof BoundMethod method) {
            return invokeMethod(method, args);
        }
        if (callee instanceof Function<?, ?> function && args.size() == 1) {
            return ((Function<Object, Object>) function).apply(args.get(0));
        }
        if (callee instanceof Supplier<?> supplier && args.isEmpty()) {
            return supplier.get();
        }
        if (callee instanceof BiFunction<?, ?, ?> function && args.size() == 2) {
            return ((BiFunction<Object, Object, Object>) function).apply(args.get(0), args.get(1));
        }
        if (callee instanceof Runnable runnable && args.isEmpty()) {
            runnable.run();
            return null;
        }
        throw new SpecTypeException("expected a callable accepting " + args.size()
            + " argument(s), not: " + Reprs.repr(callee));
    }

    private static Object invokeMethod(BoundMethod bound, List<Object> args) {
        var receiver = bound.receiver();
        var method = findMethod(receiver.getClass(), bound.name(), args);
        if (method == null) {
            throw new SpecTypeException("no accessible method " + Reprs.typeName(receiver) + "." + bound.name()
                + " accepting " + args.size() + " argument(s)");
        }
        try {
            return method.invoke(receiver, args.toArray());
        } catch (InvocationTargetException ex) {
            var cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new UndeclaredThrowableException(cause);
        } catch (IllegalAccessException ex) {
            throw new SpecTypeException("method " + method + " is not accessible: " + ex.getMessage());
        }
    }

    static Method findMethod(Class<?> type, String name, List<Object> args) {
        for (var candidate : type.getMethods()) {
            if (!candidate.getName().equals(name) || Modifier.isStatic(candidate.getModifiers())) {
                continue;
            }
            if (!accepts(candidate, args)) {
                continue;
            }
            var accessible = accessible(type, candidate);
            if (accessible != null) {
                return accessible;
            }
        }
        return null;
    }

    static boolean hasMethod(Class<?> type, String name) {
        for (var candidate : type.getMethods()) {
            if (candidate.getName().equals(name) && !Modifier.isStatic(candidate.getModifiers())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds a version of {@code method} that can be invoked from here: the method itself when
     * its declaring class is public or reflection may open it, otherwise the same signature
     * declared on a public supertype.
     */
    static Method accessible(Class<?> type, Method method) {
        if (Modifier.isPublic(method.getDeclaringClass().getModifiers()) || method.trySetAccessible()) {
            return method;
        }
        var pending = new ArrayDeque<Class<?>>();
        pending.add(type);
        while (!pending.isEmpty()) {
            var current = pending.poll();
            if (Modifier.isPublic(current.getModifiers())) {
                for (var declared : current.getMethods()) {
                    if (declared.getName().equals(method.getName())
                        && Arrays.equals(declared.getParameterTypes(), method.getParameterTypes())
                        && Modifier.isPublic(declared.getDeclaringClass().getModifiers())) {
                        return declared;
                    }
                }
            }
            if (current.getSuperclass() != null) {
                pending.add(current.getSuperclass());
            }
            pending.addAll(List.of(current.getInterfaces()));
        }
        return null;
    }

    private static boolean accepts(Method method, List<Object> args) {
        var params = method.getParameterTypes();
        if (params.length != args.size()) {
            return false;
        }
        for (int i = 0; i < params.length; i++) {
            var arg = args.get(i);
            var param = params[i].isPrimitive() ? BOXES.get(params[i]) : params[i];
            if (arg == null ? params[i].isPrimitive() : !param.isInstance(arg)) {
                return false;
            }
        }
        return true;
    }
}
