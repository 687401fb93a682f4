package io.github.cyfko.exprfilter.core.evaluation;

import io.github.cyfko.exprfilter.core.exception.ExpressionEvaluationException;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Objects;

/**
 * Reads a named member of an object by reflection.
 * <p>
 * Lookup order, first match wins:
 * </p>
 * <ul>
 *   <li>public getter {@code getName()}, or {@code isName()} returning {@code boolean}/{@code Boolean}</li>
 *   <li>public no-arg method {@code name()} (record components)</li>
 *   <li>field {@code name}, declared on the class or one of its superclasses</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class MemberResolver {

    private MemberResolver() {
        throw new UnsupportedOperationException("MemberResolver is a utility class and cannot be instantiated");
    }

    /**
     * @param target the object to read from, not {@code null}
     * @param member the member name
     * @return the member value, possibly {@code null}
     * @throws ExpressionEvaluationException if no such member exists or it cannot be read
     */
    public static Object read(Object target, String member) {
        Objects.requireNonNull(target, "target must not be null");
        Class<?> type = target.getClass();
        String capitalized = Character.toUpperCase(member.charAt(0)) + member.substring(1);

        Method accessor = findNoArgMethod(type, "get" + capitalized);
        if (accessor == null) {
            Method isAccessor = findNoArgMethod(type, "is" + capitalized);
            if (isAccessor != null && (isAccessor.getReturnType() == boolean.class
                    || isAccessor.getReturnType() == Boolean.class)) {
                accessor = isAccessor;
            }
        }
        if (accessor == null) {
            accessor = findNoArgMethod(type, member);
        }
        if (accessor != null) {
            try {
                return accessor.invoke(target);
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new ExpressionEvaluationException(String.format(
                        "Cannot read member '%s' of %s", member, type.getName()), e);
            }
        }

        Field field = findField(type, member);
        if (field == null) {
            throw new ExpressionEvaluationException(String.format(
                    "No member '%s' on %s", member, type.getName()));
        }
        try {
            field.setAccessible(true);
            return field.get(target);
        } catch (IllegalAccessException | RuntimeException e) {
            throw new ExpressionEvaluationException(String.format(
                    "Cannot read field '%s' of %s", member, type.getName()), e);
        }
    }

    private static Method findNoArgMethod(Class<?> type, String name) {
        for (Method method : type.getMethods()) {
            if (method.getName().equals(name)
                    && method.getParameterCount() == 0
                    && method.getReturnType() != void.class
                    && !Modifier.isStatic(method.getModifiers())) {
                // public method of a non-public class, e.g. a private nested record
                method.trySetAccessible();
                return method;
            }
        }
        return null;
    }

    private static Field findField(Class<?> type, String name) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (field.getName().equals(name) && !Modifier.isStatic(field.getModifiers())) {
                    return field;
                }
            }
        }
        return null;
    }
}
