package Cluster;

import java.util.Objects;

public class GenericField extends GenericAccessibleObject {
    private final ParameterType fieldType;
    private final String declaredType;

    public GenericField(ParameterType owner, String name, ParameterType fieldType) {
        this(owner, name, fieldType, null);
    }

    public GenericField(ParameterType owner, String name, ParameterType fieldType, String declaredType) {
        super(owner, name);
        this.fieldType = fieldType;
        this.declaredType = declaredType;
    }

    public ParameterType getFieldType() {
        return fieldType;
    }

    /**
     * @return the Java type the field was declared with, or null
     */
    public String getDeclaredType() {
        return declaredType;
    }

    @Override
    public ParameterType getGeneratedType() {
        return fieldType;
    }

    @Override
    public boolean isField() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        GenericField that = (GenericField) o;
        return owner.equals(that.owner) && name.equals(that.name) && fieldType.equals(that.fieldType)
                && Objects.equals(declaredType, that.declaredType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, name, fieldType, declaredType);
    }

    @Override
    public String toString() {
        return owner + "." + name + ": " + fieldType;
    }
}
