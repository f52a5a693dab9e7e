package Cluster;

/**
 * A constructor, method, function or field that can produce a value in a test case.
 */
public abstract class GenericAccessibleObject {
    protected final ParameterType owner;
    protected final String name;

    protected GenericAccessibleObject(ParameterType owner, String name) {
        this.owner = owner;
        this.name = name;
    }

    /**
     * @return the declaring type, null for functions without one
     */
    public ParameterType getOwner() {
        return owner;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the type of the value this object produces
     */
    public abstract ParameterType getGeneratedType();

    public boolean isConstructor() {
        return false;
    }

    public boolean isMethod() {
        return false;
    }

    public boolean isFunction() {
        return false;
    }

    public boolean isField() {
        return false;
    }
}
