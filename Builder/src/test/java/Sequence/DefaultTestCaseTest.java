package Sequence;

import Cluster.GenericConstructor;
import Cluster.GenericMethod;
import Cluster.InferredSignature;
import Cluster.ParameterType;
import Sequence.Statements.ConstructorStatement;
import Sequence.Statements.IntPrimitiveStatement;
import Sequence.Statements.MethodStatement;
import Sequence.Statements.NoneStatement;
import Sequence.Statements.ParametrizedStatement;
import Sequence.Statements.StringPrimitiveStatement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultTestCaseTest {
    private static final ParameterType FOO = ParameterType.concrete("com.example.Foo");
    private static final GenericConstructor FOO_INIT =
            new GenericConstructor(FOO, InferredSignature.of(FOO, ParameterType.INT));
    private static final GenericMethod FOO_LENGTH =
            new GenericMethod(FOO, "length", InferredSignature.of(ParameterType.INT, ParameterType.STRING));

    /* int0 = 5; foo0 = new Foo(int0); string0 = "abc"; int1 = foo0.length(string0) */
    private static DefaultTestCase sample() {
        DefaultTestCase testCase = new DefaultTestCase();
        VariableReference five = testCase.addStatement(new IntPrimitiveStatement(testCase, 5));
        VariableReference foo = testCase.addStatement(
                new ConstructorStatement(testCase, FOO_INIT, Collections.singletonList(five)));
        VariableReference text = testCase.addStatement(new StringPrimitiveStatement(testCase, "abc"));
        testCase.addStatement(new MethodStatement(testCase, FOO_LENGTH, foo, Collections.singletonList(text)));
        return testCase;
    }

    @Test
    public void insertionShiftsLaterStatements() {
        DefaultTestCase testCase = new DefaultTestCase();
        assertTrue(testCase.isEmpty());
        IntPrimitiveStatement first = new IntPrimitiveStatement(testCase, 1);
        IntPrimitiveStatement second = new IntPrimitiveStatement(testCase, 2);
        testCase.addStatement(first);
        testCase.addStatement(second, 0);

        assertEquals(2, testCase.size());
        assertSame(second, testCase.getStatement(0));
        assertEquals(1, first.getPosition());
        assertEquals(1, first.getReturnValue().getStPosition());
        assertThrows(IndexOutOfBoundsException.class,
                () -> testCase.addStatement(new IntPrimitiveStatement(testCase, 3), 5));
        assertThrows(IndexOutOfBoundsException.class, () -> testCase.getStatement(2));
    }

    @Test
    public void statementsOfOtherTestCasesAreRejected() {
        DefaultTestCase testCase = new DefaultTestCase();
        DefaultTestCase other = new DefaultTestCase();
        assertThrows(IllegalArgumentException.class,
                () -> testCase.addStatement(new IntPrimitiveStatement(other, 1)));
        assertNotEquals(testCase.getId(), other.getId());
    }

    @Test
    public void objectsAreFilteredByTypeAndPosition() {
        DefaultTestCase testCase = sample();
        assertEquals(1, testCase.getObjects(ParameterType.INT, 3).size());
        assertEquals(2, testCase.getObjects(ParameterType.INT, testCase.size()).size());
        assertEquals(0, testCase.getObjects(FOO, 1).size());
        assertSame(testCase.getStatement(1).getReturnValue(), testCase.getObjects(FOO, 2).get(0));
        assertTrue(testCase.getObjects(ParameterType.unknown(), 4).isEmpty());
        assertTrue(testCase.getObjects(null, 4).isEmpty());
        assertEquals(3, testCase.getAllObjects(3).size());
    }

    @Test
    public void unionValuesMatchEachOfTheirArms() {
        ParameterType bar = ParameterType.concrete("com.example.Bar");
        DefaultTestCase testCase = new DefaultTestCase();
        VariableReference value = testCase.addStatement(new NoneStatement(testCase, ParameterType.union(FOO, bar)));

        assertEquals(Collections.singletonList(value), testCase.getObjects(FOO, 1));
        assertEquals(Collections.singletonList(value), testCase.getObjects(bar, 1));
        assertTrue(testCase.getObjects(ParameterType.STRING, 1).isEmpty());
    }

    @Test
    public void removeAndChop() {
        DefaultTestCase testCase = sample();
        testCase.remove(42);
        assertEquals(4, testCase.size());

        testCase.chop(1);
        assertEquals(2, testCase.size());
        assertTrue(testCase.getStatement(1) instanceof ConstructorStatement);

        testCase.remove(0);
        assertEquals(1, testCase.size());
    }

    @Test
    public void dependenciesFollowArguments() {
        DefaultTestCase testCase = sample();
        VariableReference result = testCase.getStatement(3).getReturnValue();
        Set<VariableReference> dependencies = testCase.getDependencies(result);

        assertEquals(4, dependencies.size());
        for (int i = 0; i < 4; i++) {
            assertTrue(dependencies.contains(testCase.getStatement(i).getReturnValue()));
        }
        assertEquals(1, testCase.getDependencies(testCase.getStatement(2).getReturnValue()).size());
    }

    @Test
    public void validityRequiresDefinitionBeforeUse() {
        assertTrue(sample().isValid());

        DefaultTestCase testCase = new DefaultTestCase();
        IntPrimitiveStatement late = new IntPrimitiveStatement(testCase, 7);
        testCase.addStatement(new ConstructorStatement(testCase, FOO_INIT,
                Collections.singletonList(late.getReturnValue())));
        testCase.addStatement(late);
        assertFalse(testCase.isValid());
    }

    @Test
    public void cloneIsStructurallyEqualAndIndependent() {
        DefaultTestCase original = sample();
        DefaultTestCase copy = original.clone();

        assertEquals(original, copy);
        assertEquals(original.hashCode(), copy.hashCode());
        assertTrue(copy.isValid());

        ParametrizedStatement constructor = (ParametrizedStatement) copy.getStatement(1);
        assertSame(copy.getStatement(0).getReturnValue(), constructor.getArgs().get(0));
        assertNotSame(original.getStatement(0).getReturnValue(), constructor.getArgs().get(0));

        copy.addStatement(new IntPrimitiveStatement(copy, 9));
        assertEquals(4, original.size());
        assertNotEquals(original, copy);
    }

    @Test
    public void differentLiteralsAreNotEqual() {
        DefaultTestCase left = new DefaultTestCase();
        left.addStatement(new IntPrimitiveStatement(left, 1));
        DefaultTestCase right = new DefaultTestCase();
        right.addStatement(new IntPrimitiveStatement(right, 2));
        assertNotEquals(left, right);
    }

    @Test
    public void appendCopiesAnotherTestCase() {
        DefaultTestCase target = new DefaultTestCase();
        target.addStatement(new StringPrimitiveStatement(target, "x"));
        target.appendTestCase(sample());

        assertEquals(5, target.size());
        assertTrue(target.isValid());
        for (int i = 0; i < target.size(); i++) {
            assertSame(target, target.getStatement(i).getTestCase());
        }
        assertEquals(Arrays.asList(target.getStatement(0).getReturnValue(), target.getStatement(3).getReturnValue()),
                target.getObjects(ParameterType.STRING, 5));
    }
}
