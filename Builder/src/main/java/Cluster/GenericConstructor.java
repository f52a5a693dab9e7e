package Cluster;

public class GenericConstructor extends GenericCallableAccessibleObject {

    public GenericConstructor(ParameterType owner, InferredSignature inferredSignature) {
        super(owner, "<init>", inferredSignature);
    }

    /* a constructor always produces its owner, whatever the signature claims */
    @Override
    public ParameterType getGeneratedType() {
        return owner;
    }

    @Override
    public boolean isConstructor() {
        return true;
    }

    @Override
    public String toString() {
        return owner + inferredSignature.toString();
    }
}
