package Cluster;

public class GenericMethod extends GenericCallableAccessibleObject {

    public GenericMethod(ParameterType owner, String name, InferredSignature inferredSignature) {
        super(owner, name, inferredSignature);
    }

    @Override
    public boolean isMethod() {
        return true;
    }

    @Override
    public String toString() {
        return owner + "." + name + inferredSignature;
    }
}
