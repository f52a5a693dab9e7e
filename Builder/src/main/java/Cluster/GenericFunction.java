package Cluster;

/**
 * A callable without a receiver. The owner, when known, is only the declaring
 * type used to qualify the call.
 */
public class GenericFunction extends GenericCallableAccessibleObject {

    public GenericFunction(ParameterType owner, String name, InferredSignature inferredSignature) {
        super(owner, name, inferredSignature);
    }

    public GenericFunction(String name, InferredSignature inferredSignature) {
        this(null, name, inferredSignature);
    }

    @Override
    public boolean isFunction() {
        return true;
    }

    @Override
    public String toString() {
        return (owner == null ? "" : owner + ".") + name + inferredSignature;
    }
}
