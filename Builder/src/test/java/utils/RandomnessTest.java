package utils;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RandomnessTest {

    @Test
    public void sameSeedGivesSameStream() {
        Randomness first = new Randomness(1234L);
        Randomness second = new Randomness(1234L);
        for (int i = 0; i < 100; i++) {
            assertEquals(first.nextFloat(), second.nextFloat());
            assertEquals(first.nextInt(-50, 50), second.nextInt(-50, 50));
        }
        assertEquals(1234L, first.getSeed());
    }

    @Test
    public void nextFloatIsInUnitInterval() {
        Randomness randomness = new Randomness(7L);
        for (int i = 0; i < 1000; i++) {
            double value = randomness.nextFloat();
            assertTrue(value >= 0.0 && value < 1.0);
        }
    }

    @Test
    public void nextIntStaysInRange() {
        Randomness randomness = new Randomness(7L);
        for (int i = 0; i < 1000; i++) {
            int value = randomness.nextInt(-3, 4);
            assertTrue(value >= -3 && value < 4, "out of range: " + value);
        }
        assertThrows(IllegalArgumentException.class, () -> randomness.nextInt(5, 5));
    }

    @Test
    public void wideRangesDoNotOverflow() {
        Randomness randomness = new Randomness(3L);
        boolean negative = false;
        boolean positive = false;
        for (int i = 0; i < 1000; i++) {
            long value = randomness.nextLong(-Integer.MAX_VALUE, Integer.MAX_VALUE + 1L);
            assertTrue(value >= -Integer.MAX_VALUE && value <= Integer.MAX_VALUE, "out of range: " + value);
            negative |= value < 0;
            positive |= value > 0;
            randomness.nextInt(Integer.MIN_VALUE, Integer.MAX_VALUE);
        }
        assertTrue(negative && positive);
        assertTrue(randomness.nextLong(0L, Long.MAX_VALUE) >= 0L);
        assertThrows(IllegalArgumentException.class, () -> randomness.nextLong(Long.MIN_VALUE, Long.MAX_VALUE));
    }

    @Test
    public void nextCharIsPrintable() {
        Randomness randomness = new Randomness(99L);
        for (int i = 0; i < 500; i++) {
            char c = randomness.nextChar();
            assertTrue(c >= 32 && c <= 126);
        }
    }

    @Test
    public void choiceReachesEveryElement() {
        Randomness randomness = new Randomness(3L);
        List<String> elements = Arrays.asList("a", "b", "c");
        HashSet<String> seen = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            seen.add(randomness.choice(elements));
        }
        assertEquals(new HashSet<>(elements), seen);
        assertEquals("x", randomness.choice(new HashSet<>(Collections.singletonList("x"))));
    }

    @Test
    public void choiceOnEmptyListFails() {
        Randomness randomness = new Randomness(3L);
        assertThrows(IllegalArgumentException.class, () -> randomness.choice(Collections.<String>emptyList()));
    }
}
