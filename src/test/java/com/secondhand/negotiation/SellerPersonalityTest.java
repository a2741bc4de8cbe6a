package com.secondhand.negotiation;

import org.junit.Test;

import static org.junit.Assert.*;

public class SellerPersonalityTest {

    @Test
    public void testFromHiddenQuality_IsPure() {
        for (int i = 0; i < 100; i++) {
            assertEquals("q=0.85 is always immovable", SellerPersonality.IMMOVABLE,
                    SellerPersonality.fromHiddenQuality(0.85));
        }
    }

    @Test
    public void testFromHiddenQuality_Bands() {
        assertEquals(SellerPersonality.DESPERATE, SellerPersonality.fromHiddenQuality(0.0));
        assertEquals(SellerPersonality.DESPERATE, SellerPersonality.fromHiddenQuality(0.19));
        assertEquals(SellerPersonality.MOTIVATED, SellerPersonality.fromHiddenQuality(0.2));
        assertEquals(SellerPersonality.REASONABLE, SellerPersonality.fromHiddenQuality(0.5));
        assertEquals(SellerPersonality.FIRM, SellerPersonality.fromHiddenQuality(0.79));
        assertEquals(SellerPersonality.IMMOVABLE, SellerPersonality.fromHiddenQuality(0.8));
        assertEquals(SellerPersonality.IMMOVABLE, SellerPersonality.fromHiddenQuality(1.0));
    }

    @Test
    public void testFromHiddenQuality_OutOfRange_Clamped() {
        assertEquals(SellerPersonality.DESPERATE, SellerPersonality.fromHiddenQuality(-0.5));
        assertEquals(SellerPersonality.IMMOVABLE, SellerPersonality.fromHiddenQuality(1.5));
    }

    @Test
    public void testWalkAwayChances() {
        assertEquals(0.05, SellerPersonality.DESPERATE.getWalkAwayChance(), 1e-12);
        assertEquals(0.15, SellerPersonality.MOTIVATED.getWalkAwayChance(), 1e-12);
        assertEquals(0.35, SellerPersonality.REASONABLE.getWalkAwayChance(), 1e-12);
        assertEquals(0.60, SellerPersonality.FIRM.getWalkAwayChance(), 1e-12);
        assertEquals(0.90, SellerPersonality.IMMOVABLE.getWalkAwayChance(), 1e-12);
    }
}
