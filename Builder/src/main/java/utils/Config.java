package utils;

public class Config {
    /**
     * Maximum recursion depth while searching values for parameters.
     * A request deeper than this fails with a construction failure.
     */
    public static int MAX_RECURSION = 10;

    /* probability to reuse an existing primitive instead of creating a new one */
    public static double PRIMITIVE_REUSE_PROBABILITY = 0.5;

    /* probability to reuse an existing object instead of creating a new one */
    public static double OBJECT_REUSE_PROBABILITY = 0.9;

    /* probability to use a null value when a type has no generator */
    public static double NONE_PROBABILITY = 0.1;

    /**
     * Probability to fall back to a value of a random known type when nothing
     * for the requested type can be constructed or reused.
     */
    public static double RANDOM_TYPE_PROBABILITY = 0.85;

    /* bounds for random primitive literals */
    public static int MAX_INT = 2048;

    public static int MAX_STRING_LENGTH = 20;

    /**
     * Enable/disable extreme values (MIN/MAX, NaN, infinities, empty string)
     * when randomizing primitive literals
     */
    public static boolean ENABLE_PRIMITIVE_EXTREME_VALUES = true;

    public static double PRIMITIVE_EXTREME_VALUE_PROBABILITY = 0.1;

    /**
     * When true, a failed construction removes every statement it inserted
     * before rethrowing. When false, statements created for parameters that
     * were already satisfied stay in the test case.
     */
    public static boolean TRANSACTIONAL_INSERTION = false;

    /* seed of the randomness source, null means seeded from the clock */
    public static Long SEED = null;

    public static boolean DEBUG_CONSTRUCTION = false;
}
