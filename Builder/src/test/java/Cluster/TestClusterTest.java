package Cluster;

import org.junit.jupiter.api.Test;
import utils.Randomness;

import static org.junit.jupiter.api.Assertions.*;

public class TestClusterTest {
    private static final ParameterType FOO = ParameterType.concrete("com.example.Foo");

    @Test
    public void generatorsAreIndexedByProducedType() {
        TestCluster cluster = new TestCluster();
        GenericConstructor constructor = new GenericConstructor(FOO, InferredSignature.of(FOO, ParameterType.INT));
        GenericMethod size = new GenericMethod(FOO, "size", InferredSignature.of(ParameterType.INT));

        assertTrue(cluster.addGenerator(constructor));
        assertFalse(cluster.addGenerator(constructor));
        assertTrue(cluster.addGenerator(size));

        assertEquals(1, cluster.getGeneratorsFor(FOO).size());
        assertTrue(cluster.getGeneratorsFor(ParameterType.INT).contains(size));
        assertTrue(cluster.getGeneratorsFor(ParameterType.STRING).isEmpty());
        assertEquals(2, cluster.getGeneratorTypes().size());
    }

    @Test
    public void unionProducersAreIndexedUnderEachArm() {
        TestCluster cluster = new TestCluster();
        ParameterType circle = ParameterType.concrete("com.example.Circle");
        ParameterType square = ParameterType.concrete("com.example.Square");
        GenericFunction make = new GenericFunction(ParameterType.concrete("com.example.Shapes"), "make",
                InferredSignature.of(ParameterType.union(circle, square)));

        assertTrue(cluster.addGenerator(make));
        assertFalse(cluster.addGenerator(make));

        assertTrue(cluster.getGeneratorsFor(circle).contains(make));
        assertTrue(cluster.getGeneratorsFor(square).contains(make));
        assertTrue(cluster.getGeneratorsFor(ParameterType.union(circle, square)).isEmpty());
        assertEquals(2, cluster.getGeneratorTypes().size());
    }

    @Test
    public void voidAndUnknownProducersAreNotGenerators() {
        TestCluster cluster = new TestCluster();
        GenericMethod clear = new GenericMethod(FOO, "clear", InferredSignature.of(ParameterType.noneType()));
        GenericMethod get = new GenericMethod(FOO, "get", InferredSignature.of(null));

        assertFalse(cluster.addGenerator(clear));
        assertFalse(cluster.addGenerator(get));
        assertTrue(cluster.getGeneratorTypes().isEmpty());
    }

    @Test
    public void randomAccessibleComesFromObjectsUnderTest() {
        TestCluster cluster = new TestCluster();
        Randomness randomness = new Randomness(5L);
        assertNull(cluster.getRandomAccessible(randomness));

        GenericField field = new GenericField(FOO, "count", ParameterType.INT);
        cluster.addAccessibleObjectUnderTest(field);
        assertEquals(1, cluster.getNumAccessibleObjectsUnderTest());
        assertSame(field, cluster.getRandomAccessible(randomness));
    }
}
