package Cluster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Declared type of a parameter, a return value or a variable in a test case.
 * Either a concrete type, a union of concrete types, the none type, or unknown.
 */
public final class ParameterType {

    public enum Kind {
        CONCRETE,
        UNION,
        NONE_TYPE,
        UNKNOWN
    }

    public static final ParameterType INT = new ParameterType(Kind.CONCRETE, "int", null);
    public static final ParameterType FLOAT = new ParameterType(Kind.CONCRETE, "float", null);
    public static final ParameterType BOOLEAN = new ParameterType(Kind.CONCRETE, "boolean", null);
    public static final ParameterType STRING = new ParameterType(Kind.CONCRETE, "java.lang.String", null);

    /* fixed set of primitive types, in draw order */
    public static final List<ParameterType> PRIMITIVES =
            Collections.unmodifiableList(Arrays.asList(INT, FLOAT, BOOLEAN, STRING));

    private static final ParameterType NONE = new ParameterType(Kind.NONE_TYPE, "None", null);
    private static final ParameterType UNKNOWN_TYPE = new ParameterType(Kind.UNKNOWN, "?", null);

    private final Kind kind;
    private final String name;
    private final List<ParameterType> arms;

    private ParameterType(Kind kind, String name, List<ParameterType> arms) {
        this.kind = kind;
        this.name = name;
        this.arms = arms;
    }

    public static ParameterType concrete(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("A concrete type needs a name");
        }
        for (ParameterType primitive : PRIMITIVES) {
            if (primitive.name.equals(name)) {
                return primitive;
            }
        }
        return new ParameterType(Kind.CONCRETE, name, null);
    }

    /**
     * Builds a union. Nested unions are flattened and duplicate arms dropped;
     * a single remaining arm is returned as is.
     */
    public static ParameterType union(List<ParameterType> types) {
        List<ParameterType> flat = new ArrayList<>();
        for (ParameterType type : types) {
            if (type.isUnion()) {
                for (ParameterType arm : type.arms) {
                    if (!flat.contains(arm))
                        flat.add(arm);
                }
            } else if (!type.isUnknown() && !flat.contains(type)) {
                flat.add(type);
            }
        }
        if (flat.isEmpty()) {
            return UNKNOWN_TYPE;
        }
        if (flat.size() == 1) {
            return flat.get(0);
        }
        StringBuilder sb = new StringBuilder();
        for (ParameterType arm : flat) {
            if (sb.length() > 0)
                sb.append(" | ");
            sb.append(arm.name);
        }
        return new ParameterType(Kind.UNION, sb.toString(), Collections.unmodifiableList(flat));
    }

    public static ParameterType union(ParameterType... types) {
        return union(Arrays.asList(types));
    }

    public static ParameterType noneType() {
        return NONE;
    }

    public static ParameterType unknown() {
        return UNKNOWN_TYPE;
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getSimpleName() {
        int idx = name.lastIndexOf('.');
        return idx < 0 ? name : name.substring(idx + 1);
    }

    /**
     * @return the arms of a union, or an empty list for any other kind
     */
    public List<ParameterType> getArms() {
        return arms == null ? Collections.emptyList() : arms;
    }

    public boolean isConcrete() {
        return kind == Kind.CONCRETE;
    }

    public boolean isUnion() {
        return kind == Kind.UNION;
    }

    public boolean isNoneType() {
        return kind == Kind.NONE_TYPE;
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }

    public boolean isPrimitive() {
        return kind == Kind.CONCRETE && PRIMITIVES.contains(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ParameterType that = (ParameterType) o;
        if (kind != that.kind)
            return false;
        if (kind == Kind.UNION)
            return arms.equals(that.arms);
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return kind == Kind.UNION ? Objects.hash(kind, arms) : Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
