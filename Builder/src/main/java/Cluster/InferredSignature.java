package Cluster;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parameter types, in declaration order, and return type of a callable.
 *
 * When the callable was read from Java sources, the declared Java type names
 * are kept as well, since several Java types share one parameter type
 * (short and int are both int, char is a string).
 */
public class InferredSignature {
    private final LinkedHashMap<String, ParameterType> parameters;
    private final ParameterType returnType;

    /* parameter name -> declared Java type, absent when not known */
    private final Map<String, String> declaredParameterTypes;
    private final String declaredReturnType;

    public InferredSignature(LinkedHashMap<String, ParameterType> parameters, ParameterType returnType) {
        this(parameters, returnType, Collections.emptyMap(), null);
    }

    public InferredSignature(LinkedHashMap<String, ParameterType> parameters, ParameterType returnType,
                             Map<String, String> declaredParameterTypes, String declaredReturnType) {
        this.parameters = new LinkedHashMap<>(parameters);
        this.returnType = returnType == null ? ParameterType.unknown() : returnType;
        this.declaredParameterTypes = new LinkedHashMap<>(declaredParameterTypes);
        this.declaredReturnType = declaredReturnType;
    }

    public static InferredSignature of(ParameterType returnType, ParameterType... parameterTypes) {
        LinkedHashMap<String, ParameterType> params = new LinkedHashMap<>();
        for (int i = 0; i < parameterTypes.length; i++) {
            params.put("arg" + i, parameterTypes[i]);
        }
        return new InferredSignature(params, returnType);
    }

    public Map<String, ParameterType> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public ParameterType getReturnType() {
        return returnType;
    }

    /**
     * @return the Java type the parameter was declared with, or null
     */
    public String getDeclaredParameterType(String parameterName) {
        return declaredParameterTypes.get(parameterName);
    }

    public String getDeclaredReturnType() {
        return declaredReturnType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        InferredSignature that = (InferredSignature) o;
        return parameters.equals(that.parameters) && returnType.equals(that.returnType)
                && declaredParameterTypes.equals(that.declaredParameterTypes)
                && Objects.equals(declaredReturnType, that.declaredReturnType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameters, returnType, declaredParameterTypes, declaredReturnType);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (Map.Entry<String, ParameterType> entry : parameters.entrySet()) {
            if (sb.length() > 1)
                sb.append(", ");
            sb.append(entry.getKey()).append(": ").append(entry.getValue());
        }
        return sb.append(") -> ").append(returnType).toString();
    }
}
