package Sequence.Statements;

import utils.Config;

/**
 * Limits used when drawing random primitive literals: the int and float
 * magnitude, the string length, and how often an extreme value is drawn.
 */
public class LiteralBounds {
    private final int maxInt;
    private final int maxStringLength;
    private final boolean extremeValuesEnabled;
    private final double extremeValueProbability;

    public LiteralBounds(int maxInt, int maxStringLength, boolean extremeValuesEnabled,
                         double extremeValueProbability) {
        if (maxInt < 0) {
            throw new IllegalArgumentException("maxInt must not be negative: " + maxInt);
        }
        if (maxStringLength < 0 || maxStringLength == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxStringLength out of range: " + maxStringLength);
        }
        if (extremeValueProbability < 0.0 || extremeValueProbability > 1.0 || Double.isNaN(extremeValueProbability)) {
            throw new IllegalArgumentException("extremeValueProbability must be in [0, 1]: "
                    + extremeValueProbability);
        }
        this.maxInt = maxInt;
        this.maxStringLength = maxStringLength;
        this.extremeValuesEnabled = extremeValuesEnabled;
        this.extremeValueProbability = extremeValueProbability;
    }

    /**
     * Snapshot of the literal settings in Config.
     */
    public static LiteralBounds fromConfig() {
        return new LiteralBounds(Config.MAX_INT, Config.MAX_STRING_LENGTH,
                Config.ENABLE_PRIMITIVE_EXTREME_VALUES, Config.PRIMITIVE_EXTREME_VALUE_PROBABILITY);
    }

    public int getMaxInt() {
        return maxInt;
    }

    public int getMaxStringLength() {
        return maxStringLength;
    }

    public boolean isExtremeValuesEnabled() {
        return extremeValuesEnabled;
    }

    public double getExtremeValueProbability() {
        return extremeValueProbability;
    }
}
