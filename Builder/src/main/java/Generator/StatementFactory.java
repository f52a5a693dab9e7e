package Generator;

import Cluster.AccessibleObjectCatalog;
import Cluster.GenericAccessibleObject;
import Cluster.GenericConstructor;
import Cluster.GenericField;
import Cluster.GenericFunction;
import Cluster.GenericMethod;
import Cluster.ParameterType;
import Generator.ConstructionFailedException.Reason;
import Sequence.TestCase;
import Sequence.VariableReference;
import Sequence.Statements.BooleanPrimitiveStatement;
import Sequence.Statements.ConstructorStatement;
import Sequence.Statements.FieldStatement;
import Sequence.Statements.FloatPrimitiveStatement;
import Sequence.Statements.FunctionStatement;
import Sequence.Statements.IntPrimitiveStatement;
import Sequence.Statements.MethodStatement;
import Sequence.Statements.NoneStatement;
import Sequence.Statements.PrimitiveStatement;
import Sequence.Statements.Statement;
import Sequence.Statements.StringPrimitiveStatement;
import utils.Config;
import utils.Randomness;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds statements producing values of requested types and inserts them into
 * a test case. Parameters are satisfied recursively, either by reusing a value
 * already defined before the insertion position or by constructing a new one
 * in front of it, so a test case never refers forward.
 *
 * A factory holds no state besides its catalog and its context; it must not be
 * used on the same test case from two threads at once.
 */
public class StatementFactory {
    private final AccessibleObjectCatalog catalog;
    private final ConstructionContext context;

    public StatementFactory(AccessibleObjectCatalog catalog, ConstructionContext context) {
        if (catalog == null || context == null) {
            throw new IllegalArgumentException("catalog and context are required");
        }
        this.catalog = catalog;
        this.context = context;
    }

    public AccessibleObjectCatalog getCatalog() {
        return catalog;
    }

    public ConstructionContext getContext() {
        return context;
    }

    private static void debugLog(String message) {
        if (Config.DEBUG_CONSTRUCTION) {
            System.out.println("[StatementFactory] " + message);
        }
    }

    /**
     * Appends a statement like the given template at the end of a test case,
     * building new values for its parameters.
     *
     * @param allowNone whether parameter variables can hold null values
     * @return the value defined by the appended statement
     */
    public VariableReference appendStatement(TestCase testCase, Statement statement, boolean allowNone)
            throws ConstructionFailedException {
        if (statement instanceof ConstructorStatement) {
            return addConstructor(testCase, ((ConstructorStatement) statement).getConstructor(),
                    testCase.size(), 0, allowNone);
        } else if (statement instanceof MethodStatement) {
            return addMethod(testCase, ((MethodStatement) statement).getMethod(),
                    testCase.size(), 0, allowNone);
        } else if (statement instanceof FunctionStatement) {
            return addFunction(testCase, ((FunctionStatement) statement).getFunction(),
                    testCase.size(), 0, allowNone);
        } else if (statement instanceof FieldStatement) {
            return addField(testCase, ((FieldStatement) statement).getField(), testCase.size(), 0);
        } else if (statement instanceof PrimitiveStatement) {
            return addPrimitive(testCase, (PrimitiveStatement<?>) statement, testCase.size());
        }
        throw new ConstructionFailedException(Reason.UNKNOWN_VARIANT, "Unknown statement type: " + statement);
    }

    /**
     * Inserts a call of a constructor, method or function, or a field access.
     *
     * @param position insertion position, negative means the end of the test case
     * @return the value defined by the inserted statement
     */
    public VariableReference appendGenericStatement(TestCase testCase, GenericAccessibleObject accessibleObject,
                                                    int position, int recursionDepth, boolean allowNone)
            throws ConstructionFailedException {
        int newPosition = position < 0 ? testCase.size() : position;
        if (accessibleObject instanceof GenericConstructor) {
            return addConstructor(testCase, (GenericConstructor) accessibleObject, newPosition,
                    recursionDepth, allowNone);
        } else if (accessibleObject instanceof GenericMethod) {
            return addMethod(testCase, (GenericMethod) accessibleObject, newPosition,
                    recursionDepth, allowNone);
        } else if (accessibleObject instanceof GenericFunction) {
            return addFunction(testCase, (GenericFunction) accessibleObject, newPosition,
                    recursionDepth, allowNone);
        } else if (accessibleObject instanceof GenericField) {
            return addField(testCase, (GenericField) accessibleObject, newPosition, recursionDepth);
        }
        throw new ConstructionFailedException(Reason.UNKNOWN_VARIANT,
                "Unknown statement type: " + accessibleObject);
    }

    /**
     * Adds a constructor call at the given position, preceded by the
     * statements built for its parameters. Any construction failure while
     * satisfying the parameters is reported as a failure of this constructor.
     */
    public VariableReference addConstructor(TestCase testCase, GenericConstructor constructor, int position,
                                            int recursionDepth, boolean allowNone)
            throws ConstructionFailedException {
        debugLog("Adding constructor " + constructor);
        checkRecursion(recursionDepth);
        position = resolvePosition(testCase, position);

        int length = testCase.size();
        try {
            List<VariableReference> parameters = satisfyParameters(testCase,
                    constructor.getInferredSignature().getParameters(), null, position,
                    recursionDepth + 1, allowNone, true);
            int newPosition = position + testCase.size() - length;

            ConstructorStatement statement = new ConstructorStatement(testCase, constructor, parameters);
            return testCase.addStatement(statement, newPosition);
        } catch (ConstructionFailedException e) {
            discardInserted(testCase, position, length);
            throw new ConstructionFailedException(Reason.CONSTRUCTOR_FAILED,
                    "Failed to add constructor for " + constructor + " due to " + e.getMessage() + ".", e);
        }
    }

    /**
     * Adds a method call at the given position. The callee is reused or
     * constructed first, then the parameters.
     */
    public VariableReference addMethod(TestCase testCase, GenericMethod method, int position,
                                       int recursionDepth, boolean allowNone)
            throws ConstructionFailedException {
        debugLog("Adding method " + method);
        checkRecursion(recursionDepth);
        position = resolvePosition(testCase, position);

        int length = testCase.size();
        try {
            VariableReference callee = createOrReuseVariable(testCase, method.getOwner(), position,
                    recursionDepth, true, null);
            if (callee == null) {
                throw new ConstructionFailedException(Reason.NO_RECEIVER,
                        "The callee of " + method + " must not be null");
            }
            List<VariableReference> parameters = satisfyParameters(testCase,
                    method.getInferredSignature().getParameters(), null, position,
                    recursionDepth + 1, allowNone, true);
            int newPosition = position + testCase.size() - length;

            MethodStatement statement = new MethodStatement(testCase, method, callee, parameters);
            return testCase.addStatement(statement, newPosition);
        } catch (ConstructionFailedException e) {
            discardInserted(testCase, position, length);
            throw e;
        }
    }

    /**
     * Adds a field access at the given position. The owner is reused or
     * constructed first and is never null.
     */
    public VariableReference addField(TestCase testCase, GenericField field, int position, int recursionDepth)
            throws ConstructionFailedException {
        debugLog("Adding field " + field);
        checkRecursion(recursionDepth);
        position = resolvePosition(testCase, position);

        int length = testCase.size();
        try {
            VariableReference callee = createOrReuseVariable(testCase, field.getOwner(), position,
                    recursionDepth, false, null);
            if (callee == null) {
                throw new ConstructionFailedException(Reason.NO_RECEIVER,
                        "The owner of " + field + " must not be null");
            }
            int newPosition = position + testCase.size() - length;
            FieldStatement statement = new FieldStatement(testCase, field, callee);
            return testCase.addStatement(statement, newPosition);
        } catch (ConstructionFailedException e) {
            discardInserted(testCase, position, length);
            throw e;
        }
    }

    /**
     * Adds a function call at the given position, preceded by the statements
     * built for its parameters.
     */
    public VariableReference addFunction(TestCase testCase, GenericFunction function, int position,
                                         int recursionDepth, boolean allowNone)
            throws ConstructionFailedException {
        debugLog("Adding function " + function);
        checkRecursion(recursionDepth);
        position = resolvePosition(testCase, position);

        int length = testCase.size();
        try {
            List<VariableReference> parameters = satisfyParameters(testCase,
                    function.getInferredSignature().getParameters(), null, position,
                    recursionDepth + 1, allowNone, true);
            int newPosition = position + testCase.size() - length;

            FunctionStatement statement = new FunctionStatement(testCase, function, parameters);
            return testCase.addStatement(statement, newPosition);
        } catch (ConstructionFailedException e) {
            discardInserted(testCase, position, length);
            throw e;
        }
    }

    /**
     * Copies a literal into the test case. Never fails.
     */
    public VariableReference addPrimitive(TestCase testCase, PrimitiveStatement<?> primitive, int position) {
        position = resolvePosition(testCase, position);
        debugLog("Adding primitive " + primitive);
        Statement statement = primitive.clone(testCase, new HashMap<VariableReference, VariableReference>());
        return testCase.addStatement(statement, position);
    }

    /**
     * Satisfies a list of parameters by reusing or creating variables.
     *
     * @param parameterTypes declared parameters, in order
     * @param callee value that must not be reused as a parameter, may be null
     * @param canReuseExistingVariables false forces a new value for every parameter
     * @return one reference per parameter, in declaration order
     */
    public List<VariableReference> satisfyParameters(TestCase testCase, Map<String, ParameterType> parameterTypes,
                                                     VariableReference callee, int position, int recursionDepth,
                                                     boolean allowNone, boolean canReuseExistingVariables)
            throws ConstructionFailedException {
        position = resolvePosition(testCase, position);
        debugLog("Trying to satisfy " + parameterTypes.size() + " parameters at position " + position);

        int start = position;
        int length = testCase.size();
        List<VariableReference> parameters = new ArrayList<>();
        try {
            for (ParameterType parameterType : parameterTypes.values()) {
                debugLog("Current parameter type: " + parameterType);
                int previousLength = testCase.size();

                VariableReference var;
                if (canReuseExistingVariables) {
                    var = createOrReuseVariable(testCase, parameterType, position, recursionDepth,
                            allowNone, callee);
                } else {
                    var = createVariable(testCase, parameterType, position, recursionDepth, allowNone);
                }
                if (var == null) {
                    throw new ConstructionFailedException(Reason.UNSATISFIABLE_PARAMETER,
                            "Failed to create variable for type " + parameterType + " at position " + position);
                }
                parameters.add(var);
                position += testCase.size() - previousLength;
            }
        } catch (ConstructionFailedException e) {
            discardInserted(testCase, start, length);
            throw e;
        }
        debugLog("Satisfied " + parameters.size() + " parameters");
        return parameters;
    }

    /**
     * Reuses a value of the requested type visible before position, or builds
     * a new one. Falls back to a value of a random type, then to null.
     *
     * @param exclude value that must not be picked for reuse, may be null
     */
    VariableReference createOrReuseVariable(TestCase testCase, ParameterType parameterType, int position,
                                            int recursionDepth, boolean allowNone, VariableReference exclude)
            throws ConstructionFailedException {
        Randomness randomness = context.getRandomness();
        ParameterType type = parameterType == null ? ParameterType.unknown() : parameterType;
        if (type.isUnion()) {
            type = selectFromUnion(type);
        }

        double reuse = randomness.nextFloat();
        List<VariableReference> objects = testCase.getObjects(type, position);
        if (exclude != null) {
            objects.remove(exclude);
        }
        boolean isPrimitive = type.isPrimitive();
        if (isPrimitive && !objects.isEmpty() && reuse <= context.getPrimitiveReuseProbability()) {
            debugLog("Looking for existing object of type " + type);
            return randomness.choice(objects);
        }
        if (!isPrimitive && !objects.isEmpty() && reuse <= context.getObjectReuseProbability()) {
            debugLog("Choosing from " + objects.size() + " existing objects " + objects);
            return randomness.choice(objects);
        }
        if (!testCase.isEmpty() && type.isUnknown() && objects.isEmpty()) {
            debugLog("Picking a random object from test case as parameter value");
            List<VariableReference> variables = testCase.getAllObjects(position);
            if (exclude != null) {
                variables.remove(exclude);
            }
            if (!variables.isEmpty()) {
                return randomness.choice(variables);
            }
        }

        VariableReference created = createVariable(testCase, type, position, recursionDepth, allowNone);
        if (created != null) {
            return created;
        }

        if (objects.isEmpty()) {
            if (randomness.nextFloat() <= context.getRandomTypeProbability()) {
                return createRandomTypeVariable(testCase, position, recursionDepth, allowNone);
            }
            if (allowNone) {
                return createNone(testCase, type, position, recursionDepth);
            }
            throw new ConstructionFailedException(Reason.UNSATISFIABLE_PARAMETER, "No objects for type " + type);
        }

        debugLog("Use existing object of type " + type + ", nothing new could be built");
        return randomness.choice(objects);
    }

    /**
     * Builds a new value of the requested type.
     *
     * @return the new value, or null when none can be built at this level
     */
    VariableReference createVariable(TestCase testCase, ParameterType parameterType, int position,
                                     int recursionDepth, boolean allowNone)
            throws ConstructionFailedException {
        return attemptGeneration(testCase, parameterType, position, recursionDepth, allowNone);
    }

    private VariableReference attemptGeneration(TestCase testCase, ParameterType parameterType, int position,
                                                int recursionDepth, boolean allowNone)
            throws ConstructionFailedException {
        if (parameterType == null || parameterType.isUnknown()) {
            return null;
        }
        ParameterType type = parameterType.isUnion() ? selectFromUnion(parameterType) : parameterType;

        if (type.isPrimitive()) {
            return createPrimitive(testCase, type, position, recursionDepth);
        }
        Set<GenericAccessibleObject> typeGenerators = catalog.getGeneratorsFor(type);
        if (!typeGenerators.isEmpty()) {
            return attemptGenerationForType(testCase, position, recursionDepth, allowNone, typeGenerators);
        }
        if (allowNone && context.getRandomness().nextFloat() <= context.getNoneProbability()) {
            return createNone(testCase, type, position, recursionDepth);
        }
        return null;
    }

    private VariableReference attemptGenerationForType(TestCase testCase, int position, int recursionDepth,
                                                       boolean allowNone,
                                                       Set<GenericAccessibleObject> typeGenerators)
            throws ConstructionFailedException {
        GenericAccessibleObject typeGenerator = context.getRandomness().choice(new ArrayList<>(typeGenerators));
        return appendGenericStatement(testCase, typeGenerator, position, recursionDepth + 1, allowNone);
    }

    private VariableReference createRandomTypeVariable(TestCase testCase, int position, int recursionDepth,
                                                       boolean allowNone)
            throws ConstructionFailedException {
        List<ParameterType> generatorTypes = new ArrayList<>(catalog.getGeneratorTypes());
        generatorTypes.addAll(ParameterType.PRIMITIVES);
        ParameterType generatorType = context.getRandomness().choice(generatorTypes);
        debugLog("Falling back to a value of random type " + generatorType);
        return createOrReuseVariable(testCase, generatorType, position, recursionDepth + 1, allowNone, null);
    }

    private VariableReference createNone(TestCase testCase, ParameterType parameterType, int position,
                                         int recursionDepth) {
        NoneStatement statement = new NoneStatement(testCase, parameterType);
        testCase.addStatement(statement, position);
        VariableReference ret = testCase.getStatement(position).getReturnValue();
        ret.setDistance(recursionDepth);
        return ret;
    }

    /**
     * Inserts a literal with a fresh random value. Types other than int,
     * float and boolean get a string literal.
     */
    public VariableReference createPrimitive(TestCase testCase, ParameterType parameterType, int position,
                                             int recursionDepth) {
        position = resolvePosition(testCase, position);
        PrimitiveStatement<?> statement;
        if (ParameterType.INT.equals(parameterType)) {
            statement = new IntPrimitiveStatement(testCase);
        } else if (ParameterType.FLOAT.equals(parameterType)) {
            statement = new FloatPrimitiveStatement(testCase);
        } else if (ParameterType.BOOLEAN.equals(parameterType)) {
            statement = new BooleanPrimitiveStatement(testCase);
        } else {
            statement = new StringPrimitiveStatement(testCase);
        }
        statement.randomizeValue(context.getRandomness(), context.getLiteralBounds());
        VariableReference ret = testCase.addStatement(statement, position);
        ret.setDistance(recursionDepth);
        return ret;
    }

    private ParameterType selectFromUnion(ParameterType parameterType) {
        if (!parameterType.isUnion()) {
            return parameterType;
        }
        return context.getRandomness().choice(parameterType.getArms());
    }

    private void checkRecursion(int recursionDepth) throws ConstructionFailedException {
        if (recursionDepth > context.getMaxRecursion()) {
            debugLog("Max recursion depth reached");
            throw new ConstructionFailedException(Reason.MAX_RECURSION, "Max recursion depth reached");
        }
    }

    private static int resolvePosition(TestCase testCase, int position) {
        if (position < 0) {
            return testCase.size();
        }
        if (position > testCase.size()) {
            throw new IllegalArgumentException(
                    "Position " + position + " is beyond the end of the test case (size " + testCase.size() + ")");
        }
        return position;
    }

    /*
     * Everything a call inserted sits contiguously from its start position on,
     * nested calls only insert at or after the position they were given.
     */
    private void discardInserted(TestCase testCase, int start, int previousLength) {
        if (context.getInsertionMode() != InsertionMode.TRANSACTIONAL) {
            return;
        }
        for (int i = testCase.size() - previousLength; i > 0; i--) {
            testCase.remove(start);
        }
    }
}
