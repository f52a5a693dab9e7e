package Cluster;

import spoon.Launcher;
import spoon.reflect.CtModel;
import spoon.reflect.declaration.CtClass;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtField;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtParameter;
import spoon.reflect.declaration.CtType;
import spoon.reflect.reference.CtArrayTypeReference;
import spoon.reflect.reference.CtTypeParameterReference;
import spoon.reflect.reference.CtTypeReference;
import spoon.support.compiler.VirtualFile;
import utils.Config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fills a {@link TestCluster} from a Spoon model of the classes under test.
 *
 * Public constructors of concrete classes, public methods, public static
 * methods and public instance fields become generators of the type they
 * produce. Declared Java types are mapped onto parameter types; an abstract
 * type implemented in the model becomes the union of its implementations.
 */
public class SpoonClusterBuilder {

    private static final Set<String> INT_TYPES = new HashSet<>(Arrays.asList(
            "int", "long", "short", "byte",
            "java.lang.Integer", "java.lang.Long", "java.lang.Short", "java.lang.Byte"));
    private static final Set<String> FLOAT_TYPES = new HashSet<>(Arrays.asList(
            "float", "double", "java.lang.Float", "java.lang.Double"));
    private static final Set<String> BOOLEAN_TYPES = new HashSet<>(Arrays.asList(
            "boolean", "java.lang.Boolean"));
    private static final Set<String> STRING_TYPES = new HashSet<>(Arrays.asList(
            "java.lang.String", "char", "java.lang.Character", "java.lang.CharSequence"));

    private final CtModel model;

    /* qualified name -> top-level type declared in the model */
    private final Map<String, CtType<?>> modelTypes = new LinkedHashMap<>();

    /**
     * Key: qualified name of an abstract class or interface
     * Value: qualified names of the concrete classes of the model extending it
     */
    private final Map<String, List<String>> abstractToImplsMap = new LinkedHashMap<>();

    public SpoonClusterBuilder(CtModel model) {
        if (model == null) {
            throw new IllegalArgumentException("A model is required");
        }
        this.model = model;
        for (CtType<?> type : model.getAllTypes()) {
            modelTypes.put(type.getQualifiedName(), type);
        }
        buildAbstractToImplsMap();
    }

    private static void debugLog(String message) {
        if (Config.DEBUG_CONSTRUCTION) {
            System.out.println("[SpoonClusterBuilder] " + message);
        }
    }

    /**
     * Parses every Java file below a path, without resolving the classpath.
     */
    public static SpoonClusterBuilder fromPath(String path) {
        Launcher launcher = new Launcher();
        spoon.compiler.Environment env = launcher.getEnvironment();
        env.setAutoImports(false);
        env.setNoClasspath(true);
        launcher.addInputResource(path);
        return new SpoonClusterBuilder(launcher.buildModel());
    }

    /**
     * Parses one compilation unit given as text.
     */
    public static SpoonClusterBuilder fromSource(String code) {
        Launcher launcher = new Launcher();
        launcher.getEnvironment().setNoClasspath(true);
        launcher.addInputResource(new VirtualFile(code));
        return new SpoonClusterBuilder(launcher.buildModel());
    }

    public CtModel getModel() {
        return model;
    }

    public List<String> getImplementations(String qualifiedName) {
        List<String> impls = abstractToImplsMap.get(qualifiedName);
        return impls == null ? new ArrayList<>() : new ArrayList<>(impls);
    }

    public TestCluster build() {
        TestCluster cluster = new TestCluster();
        for (CtType<?> type : modelTypes.values()) {
            if (type.isAnnotationType() || type.isEnum()) {
                continue;
            }
            collectConstructors(cluster, type);
            collectMethods(cluster, type);
            collectFields(cluster, type);
        }
        debugLog("Built " + cluster);
        return cluster;
    }

    private void collectConstructors(TestCluster cluster, CtType<?> type) {
        if (!(type instanceof CtClass) || type.isAbstract()) {
            return;
        }
        ParameterType owner = ParameterType.concrete(type.getQualifiedName());
        for (CtConstructor<?> constructor : ((CtClass<?>) type).getConstructors()) {
            if (!constructor.isPublic() && !constructor.isImplicit()) {
                continue;
            }
            InferredSignature signature = toSignature(constructor.getParameters(), owner, type.getQualifiedName());
            register(cluster, new GenericConstructor(owner, signature));
        }
    }

    private void collectMethods(TestCluster cluster, CtType<?> type) {
        ParameterType owner = toParameterType(type.getReference());
        for (CtMethod<?> method : type.getMethods()) {
            if (!method.isPublic()) {
                continue;
            }
            ParameterType returnType = toParameterType(method.getType());
            InferredSignature signature = toSignature(method.getParameters(), returnType,
                    declaredName(method.getType(), returnType));
            if (method.isStatic()) {
                register(cluster, new GenericFunction(ParameterType.concrete(type.getQualifiedName()),
                        method.getSimpleName(), signature));
            } else {
                register(cluster, new GenericMethod(owner, method.getSimpleName(), signature));
            }
        }
    }

    private void collectFields(TestCluster cluster, CtType<?> type) {
        ParameterType owner = toParameterType(type.getReference());
        for (CtField<?> field : type.getFields()) {
            if (!field.isPublic() || field.isStatic()) {
                continue;
            }
            ParameterType fieldType = toParameterType(field.getType());
            register(cluster, new GenericField(owner, field.getSimpleName(), fieldType,
                    declaredName(field.getType(), fieldType)));
        }
    }

    private void register(TestCluster cluster, GenericAccessibleObject object) {
        debugLog("Found " + object);
        cluster.addGenerator(object);
        cluster.addAccessibleObjectUnderTest(object);
    }

    private InferredSignature toSignature(List<CtParameter<?>> parameters, ParameterType returnType,
                                          String declaredReturnType) {
        LinkedHashMap<String, ParameterType> types = new LinkedHashMap<>();
        Map<String, String> declaredTypes = new LinkedHashMap<>();
        for (CtParameter<?> parameter : parameters) {
            ParameterType type = toParameterType(parameter.getType());
            types.put(parameter.getSimpleName(), type);
            String declared = declaredName(parameter.getType(), type);
            if (declared != null) {
                declaredTypes.put(parameter.getSimpleName(), declared);
            }
        }
        return new InferredSignature(types, returnType, declaredTypes, declaredReturnType);
    }

    /* null for type variables, Object and void, which keep no Java type */
    private static String declaredName(CtTypeReference<?> reference, ParameterType type) {
        if (reference == null || type.isUnknown() || type.isNoneType()) {
            return null;
        }
        return reference.getQualifiedName();
    }

    /**
     * Maps a declared Java type onto a parameter type.
     */
    public ParameterType toParameterType(CtTypeReference<?> reference) {
        if (reference == null || reference instanceof CtTypeParameterReference) {
            return ParameterType.unknown();
        }
        if (reference instanceof CtArrayTypeReference) {
            return ParameterType.concrete(reference.getQualifiedName());
        }
        String name = reference.getQualifiedName();
        if (name == null || name.isEmpty() || "java.lang.Object".equals(name)) {
            return ParameterType.unknown();
        }
        if ("void".equals(name) || "java.lang.Void".equals(name)) {
            return ParameterType.noneType();
        }
        if (INT_TYPES.contains(name)) {
            return ParameterType.INT;
        }
        if (FLOAT_TYPES.contains(name)) {
            return ParameterType.FLOAT;
        }
        if (BOOLEAN_TYPES.contains(name)) {
            return ParameterType.BOOLEAN;
        }
        if (STRING_TYPES.contains(name)) {
            return ParameterType.STRING;
        }

        CtType<?> declaration = modelTypes.get(name);
        if (declaration != null && (declaration.isInterface() || declaration.isAbstract())) {
            List<String> impls = abstractToImplsMap.get(name);
            if (impls != null && !impls.isEmpty()) {
                List<ParameterType> arms = new ArrayList<>();
                for (String impl : impls) {
                    arms.add(ParameterType.concrete(impl));
                }
                return ParameterType.union(arms);
            }
        }
        return ParameterType.concrete(name);
    }

    private void buildAbstractToImplsMap() {
        for (CtType<?> type : modelTypes.values()) {
            // only concrete classes
            if (type.isInterface() || type.isAbstract() || !(type instanceof CtClass)) {
                continue;
            }
            Set<String> allSuperTypes = new HashSet<>();
            collectAllSuperTypes(type, allSuperTypes);
            for (String superType : allSuperTypes) {
                CtType<?> declaration = modelTypes.get(superType);
                if (declaration == null || !(declaration.isInterface() || declaration.isAbstract())) {
                    continue;
                }
                List<String> impls = abstractToImplsMap.computeIfAbsent(superType, k -> new ArrayList<>());
                if (!impls.contains(type.getQualifiedName())) {
                    impls.add(type.getQualifiedName());
                }
            }
        }
    }

    private void collectAllSuperTypes(CtType<?> type, Set<String> collectedTypes) {
        if (type == null) {
            return;
        }
        CtTypeReference<?> superClassRef = type.getSuperclass();
        if (superClassRef != null && superClassRef.getQualifiedName() != null
                && collectedTypes.add(superClassRef.getQualifiedName())) {
            collectAllSuperTypes(modelTypes.get(superClassRef.getQualifiedName()), collectedTypes);
        }
        for (CtTypeReference<?> ifaceRef : type.getSuperInterfaces()) {
            if (ifaceRef != null && ifaceRef.getQualifiedName() != null
                    && collectedTypes.add(ifaceRef.getQualifiedName())) {
                collectAllSuperTypes(modelTypes.get(ifaceRef.getQualifiedName()), collectedTypes);
            }
        }
    }
}
