package Cluster;

import utils.Randomness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory catalog: generators per produced type and the accessible objects
 * under test.
 */
public class TestCluster implements AccessibleObjectCatalog {

    /**
     * Key: produced type
     * Value: objects producing it
     */
    private final Map<ParameterType, Set<GenericAccessibleObject>> generators = new LinkedHashMap<>();

    private final Set<GenericAccessibleObject> accessibleObjectsUnderTest = new LinkedHashSet<>();

    /**
     * Registers an object as generator of its produced type. Objects producing
     * nothing (none type) or an unknown type are not generators. An object
     * producing a union is registered under each arm, since requests always
     * ask for a single arm.
     *
     * @return true if the object was not registered before
     */
    public boolean addGenerator(GenericAccessibleObject generator) {
        ParameterType type = generator.getGeneratedType();
        if (type == null || type.isNoneType() || type.isUnknown()) {
            return false;
        }
        if (!type.isUnion()) {
            return generators.computeIfAbsent(type, k -> new LinkedHashSet<>()).add(generator);
        }
        boolean added = false;
        for (ParameterType arm : type.getArms()) {
            added |= generators.computeIfAbsent(arm, k -> new LinkedHashSet<>()).add(generator);
        }
        return added;
    }

    public void addAccessibleObjectUnderTest(GenericAccessibleObject object) {
        accessibleObjectsUnderTest.add(object);
    }

    @Override
    public Set<GenericAccessibleObject> getGeneratorsFor(ParameterType type) {
        Set<GenericAccessibleObject> result = generators.get(type);
        if (result == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public Set<ParameterType> getGeneratorTypes() {
        return Collections.unmodifiableSet(generators.keySet());
    }

    public Set<GenericAccessibleObject> getAccessibleObjectsUnderTest() {
        return Collections.unmodifiableSet(accessibleObjectsUnderTest);
    }

    public int getNumAccessibleObjectsUnderTest() {
        return accessibleObjectsUnderTest.size();
    }

    public GenericAccessibleObject getRandomAccessible(Randomness randomness) {
        if (accessibleObjectsUnderTest.isEmpty()) {
            return null;
        }
        List<GenericAccessibleObject> objects = new ArrayList<>(accessibleObjectsUnderTest);
        return randomness.choice(objects);
    }

    @Override
    public String toString() {
        return "TestCluster{generators=" + generators.keySet()
                + ", underTest=" + accessibleObjectsUnderTest.size() + '}';
    }
}
