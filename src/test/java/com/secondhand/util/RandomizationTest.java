package com.secondhand.util;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class RandomizationTest {

    private Randomization randomization;

    @Before
    public void setUp() {
        randomization = new Randomization(12345L);
    }

    @Test
    public void testSameSeed_SameSequence() {
        Randomization other = new Randomization(12345L);
        for (int i = 0; i < 50; i++) {
            assertEquals("Seeded draws should repeat", randomization.roll(), other.roll(), 0.0);
        }
    }

    @Test
    public void testBoundedGaussian_StaysInRange() {
        for (int i = 0; i < 1000; i++) {
            double value = randomization.gaussianRandom(0.9, 0.5, 0.0, 1.0);
            assertTrue("Value should be within [0, 1]: " + value, value >= 0.0 && value <= 1.0);
        }
    }

    @Test
    public void testUniformRandomInt_InclusiveBounds() {
        boolean sawMin = false;
        boolean sawMax = false;
        for (int i = 0; i < 500; i++) {
            int value = randomization.uniformRandomInt(1, 3);
            assertTrue(value >= 1 && value <= 3);
            sawMin |= value == 1;
            sawMax |= value == 3;
        }
        assertTrue("Both bounds should be drawn", sawMin && sawMax);
    }

    @Test
    public void testUniformRandomInt_EqualBounds_ReturnsMin() {
        assertEquals(2, randomization.uniformRandomInt(2, 2));
    }

    @Test
    public void testWeightedChoice_ZeroWeightNeverChosen() {
        double[] weights = {0.0, 1.0, 0.0};
        for (int i = 0; i < 200; i++) {
            assertEquals(1, randomization.weightedChoice(weights));
        }
    }

    @Test
    public void testWeightedChoiceItem_ReturnsListElement() {
        List<String> items = Arrays.asList("recent", "mid", "old");
        String choice = randomization.weightedChoiceItem(items, new double[]{0.2, 0.5, 0.3});
        assertTrue(items.contains(choice));
    }

    @Test
    public void testChance_Extremes() {
        for (int i = 0; i < 100; i++) {
            assertFalse(randomization.chance(0.0));
            assertTrue(randomization.chance(1.0));
        }
    }

    @Test
    public void testFloorTo_RoundsDownToStep() {
        assertEquals(88_500, Randomization.floorTo(88_599.99, 100));
        assertEquals(0, Randomization.floorTo(99.0, 100));
        assertEquals(200, Randomization.floorTo(200.0, 100));
    }

    @Test
    public void testClamp() {
        assertEquals(0.95, Randomization.clamp(1.2, 0.01, 0.95), 1e-12);
        assertEquals(0.01, Randomization.clamp(-0.3, 0.01, 0.95), 1e-12);
        assertEquals(5, Randomization.clamp(9, 1, 5));
    }
}
