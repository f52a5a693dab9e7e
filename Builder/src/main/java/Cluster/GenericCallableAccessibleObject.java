package Cluster;

import java.util.Objects;

public abstract class GenericCallableAccessibleObject extends GenericAccessibleObject {
    protected final InferredSignature inferredSignature;

    protected GenericCallableAccessibleObject(ParameterType owner, String name, InferredSignature inferredSignature) {
        super(owner, name);
        this.inferredSignature = inferredSignature;
    }

    public InferredSignature getInferredSignature() {
        return inferredSignature;
    }

    public int getNumParameters() {
        return inferredSignature.getParameters().size();
    }

    @Override
    public ParameterType getGeneratedType() {
        return inferredSignature.getReturnType();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        GenericCallableAccessibleObject that = (GenericCallableAccessibleObject) o;
        return Objects.equals(owner, that.owner)
                && Objects.equals(name, that.name)
                && inferredSignature.equals(that.inferredSignature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), owner, name, inferredSignature);
    }
}
