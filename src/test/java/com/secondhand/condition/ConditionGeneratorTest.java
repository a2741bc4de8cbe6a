package com.secondhand.condition;

import com.secondhand.config.MarketConfig;
import com.secondhand.util.Randomization;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ConditionGeneratorTest {

    private static final long BASE_PRICE = 120_000;

    private ConditionGenerator generator;

    @Before
    public void setUp() {
        generator = new ConditionGenerator(new Randomization(12345L), new MarketConfig() { });
    }

    @Test
    public void testGenerate_PriceNeverBelowFloor() {
        for (QualityTier quality : QualityTier.values()) {
            for (AgentTier agent : AgentTier.values()) {
                for (int i = 0; i < 200; i++) {
                    GeneratedCondition c = generator.generate(BASE_PRICE, quality, agent, null);
                    assertTrue("Price " + c.getPrice() + " below 5% of base for " + quality + "/" + agent,
                            c.getPrice() >= 0.05 * BASE_PRICE);
                }
            }
        }
    }

    @Test
    public void testGenerate_DegradationClamped() {
        for (int i = 0; i < 500; i++) {
            GeneratedCondition c = generator.generate(BASE_PRICE, QualityTier.POOR, AgentTier.LOCAL, null);
            assertTrue(c.getDamage() >= ConditionGenerator.MIN_DEGRADATION);
            assertTrue(c.getDamage() <= ConditionGenerator.MAX_DEGRADATION);
            assertTrue(c.getWear() >= ConditionGenerator.MIN_DEGRADATION);
            assertTrue(c.getWear() <= ConditionGenerator.MAX_DEGRADATION);
            assertTrue(c.getHiddenQuality() >= 0.0 && c.getHiddenQuality() <= 1.0);
        }
    }

    @Test
    public void testGenerate_SameSeed_SameRecord() {
        ConditionGenerator other = new ConditionGenerator(new Randomization(12345L), new MarketConfig() { });
        GeneratedCondition a = generator.generate(BASE_PRICE, QualityTier.GOOD, AgentTier.NATIONAL, null);
        GeneratedCondition b = other.generate(BASE_PRICE, QualityTier.GOOD, AgentTier.NATIONAL, null);
        assertEquals("Seeded generation should be deterministic", a, b);
    }

    @Test
    public void testGenerate_ForcedGeneration_AgeWithinClass() {
        for (int i = 0; i < 100; i++) {
            GeneratedCondition c = generator.generate(BASE_PRICE, QualityTier.FAIR, AgentTier.REGIONAL, Generation.OLD);
            assertEquals(Generation.OLD, c.getGeneration());
            assertTrue(c.getAge() >= 8 && c.getAge() <= 15);
            assertTrue("Hours follow age x yearly hours",
                    c.getOperatingHours() >= c.getAge() * 500 && c.getOperatingHours() <= c.getAge() * 2500);
        }
    }

    @Test
    public void testGenerate_UnknownIndices_FallBack() {
        GeneratedCondition c = generator.generate(BASE_PRICE, 42, -1);
        assertNotNull("Malformed tiers should still produce a record", c);
        // ANY tier price multiplier tops out at 0.50
        assertTrue(c.getPrice() <= BASE_PRICE * 0.50);
    }

    @Test
    public void testPrice_AgeDiscountCapped() {
        assertEquals("3% per year", 82_450, ConditionGenerator.price(100_000, 0.85, 1), 1);
        assertEquals("Discount caps at 25%", 63_750, ConditionGenerator.price(100_000, 0.85, 15), 1);
    }

    @Test
    public void testPrice_FloorAtFivePercent() {
        assertEquals(5_000, ConditionGenerator.price(100_000, 0.01, 15));
    }

    @Test
    public void testDrawReliability_WithinBounds() {
        for (int i = 0; i < 200; i++) {
            ReliabilityScores scores = generator.drawReliability(0.9);
            assertTrue(scores.getEngine() >= 0.1 && scores.getEngine() <= 1.0);
            assertTrue(scores.getHydraulic() >= 0.1 && scores.getHydraulic() <= 1.0);
            assertTrue(scores.getElectrical() >= 0.1 && scores.getElectrical() <= 1.0);
        }
    }
}
