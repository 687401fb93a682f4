package io.github.cyfko.exprfilter.core.expr;

import io.github.cyfko.exprfilter.core.exception.CapabilityMissingException;

import java.util.Objects;

/**
 * Scalar methods that expression trees may invoke, bound at compile time.
 * <p>
 * Each constant names the method, the scalar type declaring it and the in-memory
 * implementation. Builders resolve the capability they need once, through
 * {@link #resolve(String, Class)}, before assembling any tree; backends lower the
 * constant to their native equivalent (e.g. {@code LIKE} for a JPA adapter).
 * </p>
 *
 * <pre>{@code
 * ScalarMethod contains = ScalarMethod.resolve("contains", String.class);
 * contains.invoke("Chery", "e");                 // true
 * ScalarMethod.resolve("contains", Integer.class); // CapabilityMissingException
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum ScalarMethod {

    /** Exact, case-sensitive substring containment: {@link String#contains(CharSequence)}. */
    CONTAINS("contains", String.class, CharSequence.class) {
        @Override
        Object apply(Object target, Object[] arguments) {
            return ((String) target).contains((CharSequence) arguments[0]);
        }
    };

    private final String methodName;
    private final Class<?> declaringType;
    private final int arity;
    private final Class<?>[] argumentTypes;

    ScalarMethod(String methodName, Class<?> declaringType, Class<?>... argumentTypes) {
        this.methodName = methodName;
        this.declaringType = declaringType;
        this.arity = argumentTypes.length;
        this.argumentTypes = argumentTypes;
    }

    public String getMethodName() {
        return methodName;
    }

    public Class<?> getDeclaringType() {
        return declaringType;
    }

    public int getArity() {
        return arity;
    }

    /**
     * Checks whether values of {@code scalarType} can receive this method.
     *
     * @param scalarType the receiver type
     * @return {@code true} if {@code scalarType} is the declaring type or a subtype of it
     */
    public boolean supports(Class<?> scalarType) {
        return scalarType != null && declaringType.isAssignableFrom(scalarType);
    }

    /**
     * Invokes the in-memory implementation.
     *
     * @param target the receiver, must be an instance of the declaring type
     * @param arguments the arguments
     * @return the method result
     * @throws CapabilityMissingException if the receiver type is not supported
     * @throws IllegalArgumentException if the arguments do not match the method's parameters
     */
    public Object invoke(Object target, Object... arguments) {
        Objects.requireNonNull(target, "target must not be null");
        if (!supports(target.getClass())) {
            throw new CapabilityMissingException(String.format(
                    "Method '%s' is not available on %s", methodName, target.getClass().getName()));
        }
        if (arguments.length != arity) {
            throw new IllegalArgumentException(String.format(
                    "Method '%s' expects %d argument(s), got %d", methodName, arity, arguments.length));
        }
        for (int i = 0; i < arity; i++) {
            if (!argumentTypes[i].isInstance(arguments[i])) {
                throw new IllegalArgumentException(String.format(
                        "Method '%s' expects a %s as argument %d, got %s", methodName,
                        argumentTypes[i].getSimpleName(), i,
                        arguments[i] == null ? "null" : arguments[i].getClass().getName()));
            }
        }
        return apply(target, arguments);
    }

    abstract Object apply(Object target, Object[] arguments);

    /**
     * Resolves a scalar method by name for a receiver type.
     *
     * @param methodName method name, e.g. {@code "contains"}
     * @param scalarType receiver type
     * @return the bound method
     * @throws CapabilityMissingException if no method of that name is available on {@code scalarType}
     */
    public static ScalarMethod resolve(String methodName, Class<?> scalarType) {
        Objects.requireNonNull(methodName, "methodName must not be null");
        for (ScalarMethod method : values()) {
            if (method.methodName.equals(methodName) && method.supports(scalarType)) {
                return method;
            }
        }
        throw new CapabilityMissingException(String.format(
                "Method '%s' not found for scalar type %s",
                methodName, scalarType == null ? "null" : scalarType.getName()));
    }
}
