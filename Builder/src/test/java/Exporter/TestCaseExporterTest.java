package Exporter;

import Cluster.GenericAccessibleObject;
import Cluster.GenericConstructor;
import Cluster.GenericField;
import Cluster.GenericFunction;
import Cluster.GenericMethod;
import Cluster.InferredSignature;
import Cluster.ParameterType;
import Cluster.SpoonClusterBuilder;
import Cluster.TestCluster;
import Sequence.DefaultTestCase;
import Sequence.TestCase;
import Sequence.VariableReference;
import Sequence.Statements.ConstructorStatement;
import Sequence.Statements.FieldStatement;
import Sequence.Statements.FloatPrimitiveStatement;
import Sequence.Statements.FunctionStatement;
import Sequence.Statements.IntPrimitiveStatement;
import Sequence.Statements.MethodStatement;
import Sequence.Statements.NoneStatement;
import Sequence.Statements.StringPrimitiveStatement;
import Sequence.Statements.BooleanPrimitiveStatement;
import org.junit.jupiter.api.Test;
import spoon.reflect.declaration.CtClass;
import spoon.reflect.declaration.CtMethod;
import utils.Pair;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class TestCaseExporterTest {
    private static final ParameterType FOO = ParameterType.concrete("com.example.Foo");
    private static final ParameterType BAZ = ParameterType.concrete("com.example.Baz");

    private static final GenericConstructor FOO_INIT =
            new GenericConstructor(FOO, InferredSignature.of(FOO, ParameterType.INT));
    private static final GenericMethod FOO_COMPUTE =
            new GenericMethod(FOO, "compute", InferredSignature.of(ParameterType.FLOAT, ParameterType.INT));
    private static final GenericMethod FOO_RESET =
            new GenericMethod(FOO, "reset", InferredSignature.of(ParameterType.noneType()));
    private static final GenericField FOO_COUNT = new GenericField(FOO, "count", ParameterType.INT);
    private static final GenericFunction FOO_OF =
            new GenericFunction(FOO, "of", InferredSignature.of(FOO, ParameterType.STRING, BAZ));

    private static TestCase sample() {
        DefaultTestCase testCase = new DefaultTestCase();
        VariableReference five = testCase.addStatement(new IntPrimitiveStatement(testCase, 5));
        VariableReference foo = testCase.addStatement(
                new ConstructorStatement(testCase, FOO_INIT, Collections.singletonList(five)));
        testCase.addStatement(new MethodStatement(testCase, FOO_COMPUTE, foo, Collections.singletonList(five)));
        testCase.addStatement(new MethodStatement(testCase, FOO_RESET, foo));
        testCase.addStatement(new FieldStatement(testCase, FOO_COUNT, foo));
        VariableReference text = testCase.addStatement(new StringPrimitiveStatement(testCase, "hello"));
        VariableReference none = testCase.addStatement(new NoneStatement(testCase, BAZ));
        testCase.addStatement(new FunctionStatement(testCase, FOO_OF, Arrays.asList(text, none)));
        testCase.addStatement(new FloatPrimitiveStatement(testCase, Double.NaN));
        return testCase;
    }

    @Test
    public void methodHasOneStatementPerTestCaseStatement() {
        TestCaseExporter exporter = new TestCaseExporter();
        CtMethod<Void> method = exporter.exportMethod(sample(), "testSample");

        assertEquals("testSample", method.getSimpleName());
        assertEquals(9, method.getBody().getStatements().size());
        assertEquals(1, method.getAnnotations().size());
        assertEquals(TestCaseExporter.TEST_ANNOTATION,
                method.getAnnotations().get(0).getAnnotationType().getQualifiedName());
    }

    @Test
    public void printedClassReadsLikeJava() {
        TestCaseExporter exporter = new TestCaseExporter();
        Pair<CtClass<Object>, String> exported =
                exporter.exportClass(Arrays.asList(sample(), sample()), "FooGeneratedTest");
        String source = exported.getValue();

        assertEquals("FooGeneratedTest", exported.getKey().getSimpleName());
        assertNotNull(exported.getKey().getMethod("test0"));
        assertNotNull(exported.getKey().getMethod("test1"));
        assertTrue(source.contains("class FooGeneratedTest"), source);
        assertTrue(source.contains("int0 = 5"), source);
        assertTrue(source.contains("foo0 = new "), source);
        assertTrue(source.contains("Foo(int0)"), source);
        assertTrue(source.contains("foo0.compute(int0)"), source);
        assertTrue(source.contains("foo0.reset()"), source);
        assertTrue(source.contains("foo0.count"), source);
        assertTrue(source.contains("\"hello\""), source);
        assertTrue(source.contains("baz0 = null"), source);
        assertTrue(source.contains("of(string0, baz0)"), source);
        assertTrue(source.contains("Double.NaN"), source);
    }

    @Test
    public void narrowJavaTypesAreCastOrConverted() {
        TestCluster cluster = SpoonClusterBuilder.fromSource(String.join("\n",
                "package com.example;",
                "public class A {",
                "    public A(short s, float f, char c) { }",
                "    public char initial() { return 'a'; }",
                "    public void label(String text, Boolean flag) { }",
                "}")).build();
        GenericConstructor init = null;
        GenericMethod initial = null;
        GenericMethod label = null;
        for (GenericAccessibleObject object : cluster.getAccessibleObjectsUnderTest()) {
            if (object.isConstructor()) {
                init = (GenericConstructor) object;
            } else if (object.getName().equals("initial")) {
                initial = (GenericMethod) object;
            } else if (object.getName().equals("label")) {
                label = (GenericMethod) object;
            }
        }
        assertNotNull(init);
        assertNotNull(initial);
        assertNotNull(label);

        DefaultTestCase testCase = new DefaultTestCase();
        VariableReference seven = testCase.addStatement(new IntPrimitiveStatement(testCase, 7));
        VariableReference half = testCase.addStatement(new FloatPrimitiveStatement(testCase, 0.5));
        VariableReference text = testCase.addStatement(new StringPrimitiveStatement(testCase, "x"));
        VariableReference a = testCase.addStatement(
                new ConstructorStatement(testCase, init, Arrays.asList(seven, half, text)));
        VariableReference letter = testCase.addStatement(new MethodStatement(testCase, initial, a));
        VariableReference flag = testCase.addStatement(new BooleanPrimitiveStatement(testCase, true));
        testCase.addStatement(new MethodStatement(testCase, label, a, Arrays.asList(letter, flag)));

        String source = new TestCaseExporter()
                .exportClass(Collections.singletonList(testCase), "AGeneratedTest").getValue();

        assertFalse(source.contains("A(int0, float0, string0)"), source);
        assertTrue(source.contains("(short)"), source);
        assertTrue(source.contains("(float)"), source);
        assertTrue(source.contains("string0.charAt(0)"), source);
        assertTrue(source.contains("char char0 = a0.initial()"), source);
        assertTrue(source.contains("label(String.valueOf(char0), boolean0)"), source);
    }

    @Test
    public void namesAreUniquePerType() {
        TestCaseExporter exporter = new TestCaseExporter();
        assertEquals("int0", exporter.nextName(ParameterType.INT));
        assertEquals("int1", exporter.nextName(ParameterType.INT));
        assertEquals("foo0", exporter.nextName(FOO));
        assertEquals("string0", exporter.nextName(ParameterType.STRING));
        assertEquals("object0", exporter.nextName(ParameterType.unknown()));
        assertEquals("object1", exporter.nextName(ParameterType.union(FOO, BAZ)));
    }

    @Test
    public void declaredTypesFollowParameterTypes() {
        TestCaseExporter exporter = new TestCaseExporter();
        assertEquals("int", exporter.toTypeReference(ParameterType.INT).getQualifiedName());
        assertEquals("double", exporter.toTypeReference(ParameterType.FLOAT).getQualifiedName());
        assertEquals("java.lang.String", exporter.toTypeReference(ParameterType.STRING).getQualifiedName());
        assertEquals("com.example.Foo", exporter.toTypeReference(FOO).getQualifiedName());
        assertEquals("java.lang.Object", exporter.toTypeReference(ParameterType.noneType()).getQualifiedName());
    }
}
