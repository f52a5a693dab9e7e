package Exporter;

import Cluster.GenericConstructor;
import Cluster.GenericField;
import Cluster.GenericFunction;
import Cluster.GenericMethod;
import Cluster.InferredSignature;
import Cluster.ParameterType;
import Sequence.TestCase;
import Sequence.VariableReference;
import Sequence.Statements.ConstructorStatement;
import Sequence.Statements.FieldStatement;
import Sequence.Statements.FunctionStatement;
import Sequence.Statements.MethodStatement;
import Sequence.Statements.NoneStatement;
import Sequence.Statements.PrimitiveStatement;
import Sequence.Statements.Statement;
import Sequence.Statements.StatementVisitor;
import spoon.Launcher;
import spoon.reflect.code.CtBlock;
import spoon.reflect.code.CtExpression;
import spoon.reflect.code.CtInvocation;
import spoon.reflect.code.CtLocalVariable;
import spoon.reflect.declaration.CtAnnotation;
import spoon.reflect.declaration.CtClass;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.ModifierKind;
import spoon.reflect.factory.Factory;
import spoon.reflect.reference.CtExecutableReference;
import spoon.reflect.reference.CtTypeReference;
import spoon.reflect.visitor.DefaultJavaPrettyPrinter;
import utils.Config;
import utils.Pair;

import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders test cases as JUnit test methods built with Spoon. Every statement
 * becomes one local variable, except calls of void methods.
 *
 * Where a callable carries the Java types it was declared with, results are
 * declared at those types and arguments are cast or converted to them.
 */
public class TestCaseExporter implements StatementVisitor {
    public static final String TEST_ANNOTATION = "org.junit.jupiter.api.Test";

    private static final Map<String, String> UNBOXED = new HashMap<>();
    static {
        UNBOXED.put("java.lang.Integer", "int");
        UNBOXED.put("java.lang.Long", "long");
        UNBOXED.put("java.lang.Short", "short");
        UNBOXED.put("java.lang.Byte", "byte");
        UNBOXED.put("java.lang.Float", "float");
        UNBOXED.put("java.lang.Double", "double");
        UNBOXED.put("java.lang.Boolean", "boolean");
        UNBOXED.put("java.lang.Character", "char");
    }

    private static final Set<String> PRIMITIVE_NAMES = new HashSet<>(UNBOXED.values());

    private static final Set<String> CHAR_SEQUENCES = new HashSet<>(Arrays.asList(
            "java.lang.String", "java.lang.CharSequence"));

    private final Launcher launcher;
    private final Factory factory;

    /* state of the method being rendered */
    private CtBlock<?> body;
    private final Map<VariableReference, CtLocalVariable<?>> variables = new IdentityHashMap<>();
    private final Map<String, Integer> nameCounters = new HashMap<>();

    public TestCaseExporter() {
        launcher = new Launcher();
        launcher.getEnvironment().setNoClasspath(true);
        launcher.getEnvironment().setAutoImports(false);
        factory = launcher.getFactory();
    }

    private static void debugLog(String message) {
        if (Config.DEBUG_CONSTRUCTION) {
            System.out.println("[TestCaseExporter] " + message);
        }
    }

    public Factory getFactory() {
        return factory;
    }

    /**
     * Builds a public void test method holding the statements of a test case.
     */
    public CtMethod<Void> exportMethod(TestCase testCase, String methodName) {
        body = factory.createBlock();
        variables.clear();
        nameCounters.clear();

        for (Statement statement : testCase.getStatements()) {
            statement.accept(this);
        }

        CtMethod<Void> testMethod = factory.createMethod();
        testMethod.setSimpleName(methodName);
        Set<ModifierKind> methodModifiers = new HashSet<>();
        methodModifiers.add(ModifierKind.PUBLIC);
        testMethod.setModifiers(methodModifiers);
        testMethod.setType(factory.Type().voidPrimitiveType());

        Set<CtTypeReference<? extends Throwable>> thrownTypes = new HashSet<>();
        thrownTypes.add(factory.Type().createReference(Throwable.class));
        testMethod.setThrownTypes(thrownTypes);

        CtTypeReference<Annotation> testReference = factory.Type().createReference(TEST_ANNOTATION);
        CtAnnotation<Annotation> testAnno = factory.createAnnotation(testReference);
        testMethod.addAnnotation(testAnno);

        testMethod.setBody(body);
        debugLog("Exported " + testCase.size() + " statements to " + methodName);
        return testMethod;
    }

    /**
     * Builds a public test class with one method per test case, named test0,
     * test1, ..., and prints it.
     *
     * @return the class and its source code
     */
    public Pair<CtClass<Object>, String> exportClass(List<TestCase> testCases, String className) {
        CtClass<Object> testClass = factory.Core().createClass();
        testClass.setSimpleName(className);
        Set<ModifierKind> classModifiers = new HashSet<>();
        classModifiers.add(ModifierKind.PUBLIC);
        testClass.setModifiers(classModifiers);

        for (int i = 0; i < testCases.size(); i++) {
            testClass.addMethod(exportMethod(testCases.get(i), "test" + i));
        }

        DefaultJavaPrettyPrinter printer = new DefaultJavaPrettyPrinter(launcher.getEnvironment());
        String source = printer.prettyprint(testClass);
        return new Pair<>(testClass, source);
    }

    @Override
    public void visitConstructorStatement(ConstructorStatement statement) {
        GenericConstructor constructor = statement.getConstructor();
        CtTypeReference<Object> type = toTypeReference(constructor.getOwner());
        CtExpression<?>[] args = convertAll(statement.getArgs(), constructor.getInferredSignature());
        declare(statement.getReturnValue(), factory.createConstructorCall(type, args), null);
    }

    @Override
    public void visitMethodStatement(MethodStatement statement) {
        GenericMethod method = statement.getMethod();
        CtExecutableReference<Object> executable = factory.Executable().createReference(
                toTypeReference(method.getOwner()),
                toTypeReference(method.getGeneratedType()),
                method.getName(),
                parameterTypes(method.getInferredSignature()));
        CtInvocation<Object> invocation = factory.createInvocation(read(statement.getCallee()), executable,
                convertAll(statement.getArgs(), method.getInferredSignature()));
        declareOrCall(statement.getReturnValue(), invocation, method.getInferredSignature().getDeclaredReturnType());
    }

    @Override
    public void visitFunctionStatement(FunctionStatement statement) {
        GenericFunction function = statement.getFunction();
        CtTypeReference<Object> owner = function.getOwner() == null ? null : toTypeReference(function.getOwner());
        CtExecutableReference<Object> executable = factory.Executable().createReference(
                owner,
                true,
                toTypeReference(function.getGeneratedType()),
                function.getName(),
                parameterTypes(function.getInferredSignature()));
        CtExpression<?> target = owner == null ? null : factory.createTypeAccess(owner);
        CtInvocation<Object> invocation = factory.createInvocation(target, executable,
                convertAll(statement.getArgs(), function.getInferredSignature()));
        declareOrCall(statement.getReturnValue(), invocation,
                function.getInferredSignature().getDeclaredReturnType());
    }

    @Override
    public void visitFieldStatement(FieldStatement statement) {
        GenericField field = statement.getField();
        CtLocalVariable<?> source = variables.get(statement.getSource());
        String owner = source == null ? "null" : source.getSimpleName();
        declare(statement.getReturnValue(), factory.createCodeSnippetExpression(owner + "." + field.getName()),
                field.getDeclaredType());
    }

    @Override
    public void visitPrimitiveStatement(PrimitiveStatement<?> statement) {
        Object value = statement.getValue();
        CtExpression<?> literal;
        if (value instanceof Double && (((Double) value).isNaN() || ((Double) value).isInfinite())) {
            literal = factory.createCodeSnippetExpression(nonFiniteConstant((Double) value));
        } else {
            literal = factory.createLiteral(value);
        }
        declare(statement.getReturnValue(), literal, null);
    }

    @Override
    public void visitNoneStatement(NoneStatement statement) {
        declare(statement.getReturnValue(), factory.createLiteral(null), null);
    }

    private static String nonFiniteConstant(Double value) {
        if (value.isNaN()) {
            return "Double.NaN";
        }
        return value > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
    }

    /**
     * Declares a local holding a value, at the declared Java type when one is
     * given (unboxed) and at the Java type of its parameter type otherwise.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    private void declare(VariableReference value, CtExpression<?> expression, String declaredType) {
        CtTypeReference<?> localType;
        String name;
        if (declaredType != null) {
            String javaType = unbox(declaredType);
            localType = factory.Type().createReference(javaType);
            name = nextName(ParameterType.concrete(javaType));
        } else {
            localType = toTypeReference(value.getType());
            name = nextName(value.getType());
        }
        CtLocalVariable local = factory.createLocalVariable((CtTypeReference) localType, name,
                (CtExpression) expression);
        body.addStatement(local);
        variables.put(value, local);
    }

    /* void calls have no value to keep */
    private void declareOrCall(VariableReference value, CtInvocation<?> invocation, String declaredType) {
        if (value.isNoneType()) {
            body.addStatement(invocation);
        } else {
            declare(value, invocation, declaredType);
        }
    }

    private CtExpression<?> read(VariableReference reference) {
        CtLocalVariable<?> local = variables.get(reference);
        if (local == null) {
            return factory.createLiteral(null);
        }
        return factory.createVariableRead(local.getReference(), false);
    }

    /* arguments in parameter order, each fitted to its declared Java type */
    private CtExpression<?>[] convertAll(List<VariableReference> references, InferredSignature signature) {
        List<String> names = new ArrayList<>(signature.getParameters().keySet());
        CtExpression<?>[] expressions = new CtExpression<?>[references.size()];
        for (int i = 0; i < references.size(); i++) {
            String declared = i < names.size() ? signature.getDeclaredParameterType(names.get(i)) : null;
            expressions[i] = convert(references.get(i), declared);
        }
        return expressions;
    }

    /**
     * Reads a value for a parameter declared with the given Java type. Numbers
     * are cast to the declared width, strings become a char by their first
     * character, and other references are cast to the declared type.
     */
    private CtExpression<?> convert(VariableReference reference, String declaredType) {
        CtExpression<?> expression = read(reference);
        CtLocalVariable<?> local = variables.get(reference);
        if (declaredType == null || local == null || "java.lang.Object".equals(declaredType)) {
            return expression;
        }
        String source = local.getType().getQualifiedName();
        String target = unbox(declaredType);
        if (source.equals(declaredType) || source.equals(target)) {
            return expression;
        }
        String name = local.getSimpleName();
        if ("java.lang.String".equals(target)) {
            if (PRIMITIVE_NAMES.contains(source) || CHAR_SEQUENCES.contains(source)) {
                return factory.createCodeSnippetExpression("String.valueOf(" + name + ")");
            }
            return expression;
        }
        if ("char".equals(target) && CHAR_SEQUENCES.contains(source)) {
            return factory.createCodeSnippetExpression(
                    "(" + name + ".length() == 0 ? ' ' : " + name + ".charAt(0))");
        }
        if (CHAR_SEQUENCES.contains(source) || "boolean".equals(source) || "boolean".equals(target)) {
            return expression;
        }
        if (PRIMITIVE_NAMES.contains(source) != PRIMITIVE_NAMES.contains(target)
                && !"java.lang.Object".equals(source)) {
            return expression;
        }
        expression.addTypeCast(factory.Type().createReference(target));
        return expression;
    }

    private static String unbox(String javaType) {
        String primitive = UNBOXED.get(javaType);
        return primitive == null ? javaType : primitive;
    }

    private CtTypeReference<?>[] parameterTypes(InferredSignature signature) {
        List<CtTypeReference<?>> references = new ArrayList<>();
        for (Map.Entry<String, ParameterType> parameter : signature.getParameters().entrySet()) {
            String declared = signature.getDeclaredParameterType(parameter.getKey());
            references.add(declared != null ? factory.Type().createReference(declared)
                    : toTypeReference(parameter.getValue()));
        }
        return references.toArray(new CtTypeReference<?>[0]);
    }

    /**
     * Java type used to declare a value. Unions, unknown and none types are
     * declared as Object.
     */
    @SuppressWarnings("unchecked")
    CtTypeReference<Object> toTypeReference(ParameterType type) {
        CtTypeReference<?> reference;
        if (ParameterType.INT.equals(type)) {
            reference = factory.Type().integerPrimitiveType();
        } else if (ParameterType.FLOAT.equals(type)) {
            reference = factory.Type().doublePrimitiveType();
        } else if (ParameterType.BOOLEAN.equals(type)) {
            reference = factory.Type().booleanPrimitiveType();
        } else if (ParameterType.STRING.equals(type)) {
            reference = factory.Type().stringType();
        } else if (type != null && type.isConcrete()) {
            reference = factory.Type().createReference(type.getName());
        } else {
            reference = factory.Type().objectType();
        }
        return (CtTypeReference<Object>) reference;
    }

    /* int0, int1, foo0, ... */
    String nextName(ParameterType type) {
        String base = type != null && type.isConcrete() ? type.getSimpleName() : "object";
        base = base.replaceAll("[^A-Za-z0-9_]", "");
        if (base.isEmpty()) {
            base = "object";
        }
        base = Character.toLowerCase(base.charAt(0)) + base.substring(1);
        int counter = nameCounters.getOrDefault(base, 0);
        nameCounters.put(base, counter + 1);
        return base + counter;
    }
}
