package Cluster;

import java.util.Set;

/**
 * Known generators of the subject program, indexed by the type they produce.
 */
public interface AccessibleObjectCatalog {

    /**
     * @return the generators producing a value of the given type, possibly empty
     */
    Set<GenericAccessibleObject> getGeneratorsFor(ParameterType type);

    /**
     * @return every type with at least one known generator, in registration order
     */
    Set<ParameterType> getGeneratorTypes();
}
