package Generator;

import Sequence.Statements.LiteralBounds;
import utils.Config;
import utils.Randomness;

/**
 * Randomness, probabilities, literal bounds and recursion ceiling used by one
 * statement factory.
 * Values are fixed at creation, so a construction request never observes a
 * change of Config midway.
 */
public class ConstructionContext {
    private final Randomness randomness;
    private final int maxRecursion;
    private final double primitiveReuseProbability;
    private final double objectReuseProbability;
    private final double noneProbability;
    private final double randomTypeProbability;
    private final InsertionMode insertionMode;
    private final LiteralBounds literalBounds;

    public ConstructionContext(Randomness randomness, int maxRecursion, double primitiveReuseProbability,
                               double objectReuseProbability, double noneProbability,
                               double randomTypeProbability, InsertionMode insertionMode) {
        this(randomness, maxRecursion, primitiveReuseProbability, objectReuseProbability, noneProbability,
                randomTypeProbability, insertionMode, LiteralBounds.fromConfig());
    }

    public ConstructionContext(Randomness randomness, int maxRecursion, double primitiveReuseProbability,
                               double objectReuseProbability, double noneProbability,
                               double randomTypeProbability, InsertionMode insertionMode,
                               LiteralBounds literalBounds) {
        if (randomness == null) {
            throw new IllegalArgumentException("randomness must not be null");
        }
        if (maxRecursion < 0) {
            throw new IllegalArgumentException("maxRecursion must not be negative: " + maxRecursion);
        }
        this.randomness = randomness;
        this.maxRecursion = maxRecursion;
        this.primitiveReuseProbability = checkProbability("primitiveReuseProbability", primitiveReuseProbability);
        this.objectReuseProbability = checkProbability("objectReuseProbability", objectReuseProbability);
        this.noneProbability = checkProbability("noneProbability", noneProbability);
        this.randomTypeProbability = checkProbability("randomTypeProbability", randomTypeProbability);
        this.insertionMode = insertionMode == null ? InsertionMode.BEST_EFFORT : insertionMode;
        this.literalBounds = literalBounds == null ? LiteralBounds.fromConfig() : literalBounds;
    }

    /**
     * Snapshot of the process-wide defaults in Config.
     */
    public static ConstructionContext fromConfig(Randomness randomness) {
        return new ConstructionContext(randomness,
                Config.MAX_RECURSION,
                Config.PRIMITIVE_REUSE_PROBABILITY,
                Config.OBJECT_REUSE_PROBABILITY,
                Config.NONE_PROBABILITY,
                Config.RANDOM_TYPE_PROBABILITY,
                Config.TRANSACTIONAL_INSERTION ? InsertionMode.TRANSACTIONAL : InsertionMode.BEST_EFFORT,
                LiteralBounds.fromConfig());
    }

    public static ConstructionContext fromConfig() {
        return fromConfig(new Randomness());
    }

    private static double checkProbability(String name, double value) {
        if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " must be in [0, 1]: " + value);
        }
        return value;
    }

    public ConstructionContext withRandomness(Randomness newRandomness) {
        return new ConstructionContext(newRandomness, maxRecursion, primitiveReuseProbability,
                objectReuseProbability, noneProbability, randomTypeProbability, insertionMode, literalBounds);
    }

    public ConstructionContext withMaxRecursion(int newMaxRecursion) {
        return new ConstructionContext(randomness, newMaxRecursion, primitiveReuseProbability,
                objectReuseProbability, noneProbability, randomTypeProbability, insertionMode, literalBounds);
    }

    public ConstructionContext withReuseProbabilities(double primitive, double object) {
        return new ConstructionContext(randomness, maxRecursion, primitive,
                object, noneProbability, randomTypeProbability, insertionMode, literalBounds);
    }

    public ConstructionContext withNoneProbability(double newNoneProbability) {
        return new ConstructionContext(randomness, maxRecursion, primitiveReuseProbability,
                objectReuseProbability, newNoneProbability, randomTypeProbability, insertionMode, literalBounds);
    }

    public ConstructionContext withRandomTypeProbability(double newRandomTypeProbability) {
        return new ConstructionContext(randomness, maxRecursion, primitiveReuseProbability,
                objectReuseProbability, noneProbability, newRandomTypeProbability, insertionMode, literalBounds);
    }

    public ConstructionContext withInsertionMode(InsertionMode newInsertionMode) {
        return new ConstructionContext(randomness, maxRecursion, primitiveReuseProbability,
                objectReuseProbability, noneProbability, randomTypeProbability, newInsertionMode, literalBounds);
    }

    public ConstructionContext withLiteralBounds(LiteralBounds newLiteralBounds) {
        return new ConstructionContext(randomness, maxRecursion, primitiveReuseProbability,
                objectReuseProbability, noneProbability, randomTypeProbability, insertionMode, newLiteralBounds);
    }

    public Randomness getRandomness() {
        return randomness;
    }

    public int getMaxRecursion() {
        return maxRecursion;
    }

    public double getPrimitiveReuseProbability() {
        return primitiveReuseProbability;
    }

    public double getObjectReuseProbability() {
        return objectReuseProbability;
    }

    public double getNoneProbability() {
        return noneProbability;
    }

    public double getRandomTypeProbability() {
        return randomTypeProbability;
    }

    public InsertionMode getInsertionMode() {
        return insertionMode;
    }

    public LiteralBounds getLiteralBounds() {
        return literalBounds;
    }
}
