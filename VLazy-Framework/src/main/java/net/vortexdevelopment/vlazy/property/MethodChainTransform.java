package net.vortexdevelopment.vlazy.property;

import lombok.Getter;
import net.vortexdevelopment.vlazy.exception.TransformException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Transform that calls a chain of no-argument methods on the value itself.
 * Example: {@code "trim"} calls {@code value.trim()}, {@code "getName.length"} calls
 * {@code value.getName().length()}. A {@code null} anywhere in the chain yields {@code null}.
 */
public class MethodChainTransform implements ValueTransform<Object> {
    @Getter
    private final String methodChain;
    private final String[] methods;

    public MethodChainTransform(String methodChain) {
        if (methodChain == null || methodChain.isBlank()) {
            throw new IllegalArgumentException("Method chain must not be blank");
        }
        this.methodChain = methodChain;
        this.methods = methodChain.split("\\.");
    }

    @Override
    public Object apply(Object record, Object value) {
        Object current = value;
        for (String methodName : methods) {
            if (current == null) {
                return null;
            }
            Method method = findMethod(current.getClass(), methodName);
            if (method == null) {
                throw new TransformException("No method `" + methodName + "` on " + current.getClass().getName()
                        + " (chain `" + methodChain + "`)");
            }
            try {
                current = method.invoke(current);
            } catch (IllegalAccessException e) {
                throw new TransformException("Cannot access `" + methodName + "` on " + current.getClass().getName(), e);
            } catch (InvocationTargetException e) {
                throw new TransformException("`" + methodName + "` failed on " + current.getClass().getName(), e.getCause());
            }
        }
        return current;
    }

    /**
     * Find a method by name, trying the exact name first and then get/is prefixes.
     * Only public methods declared by public types are considered, so JDK implementation
     * classes resolve to their public interface methods.
     */
    static Method findMethod(Class<?> clazz, String methodName) {
        Method method = findPublicMethod(clazz, methodName);
        if (method != null) {
            return method;
        }

        String capitalized = Character.toUpperCase(methodName.charAt(0)) + methodName.substring(1);
        method = findPublicMethod(clazz, "get" + capitalized);
        if (method != null) {
            return method;
        }
        return findPublicMethod(clazz, "is" + capitalized);
    }

    private static Method findPublicMethod(Class<?> clazz, String methodName) {
        Deque<Class<?>> queue = new ArrayDeque<>();
        Set<Class<?>> visited = new HashSet<>();
        queue.add(clazz);
        while (!queue.isEmpty()) {
            Class<?> type = queue.poll();
            if (!visited.add(type)) {
                continue;
            }
            if (Modifier.isPublic(type.getModifiers())) {
                for (Method method : type.getMethods()) {
                    if (method.getName().equals(methodName)
                            && method.getParameterCount() == 0
                            && Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
                        return method;
                    }
                }
            }
            if (type.getSuperclass() != null) {
                queue.add(type.getSuperclass());
            }
            for (Class<?> iface : type.getInterfaces()) {
                queue.add(iface);
            }
        }
        return null;
    }
}
