package model;

import config.Rarity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RandomTablesTest {

    private static final List<Map.Entry<String, Double>> A_ONLY = List.of(Map.entry("a", 1.0), Map.entry("b", 0.0));
    private static final List<Map.Entry<String, Double>> A_B    = List.of(Map.entry("a", 1.0), Map.entry("b", 3.0));

    @Test
    void zeroWeightEntryIsNeverPicked() {
        for (double roll : new double[] {0.0, 0.25, 0.5, 0.999}) {
            assertEquals("a", RandomTables.weightedPick(A_ONLY, Map.Entry::getValue, () -> roll).getKey(),
                    "roll " + roll + " must land on the only weighted entry");
        }
    }

    @Test
    void weightedPickWalksCumulativeWeights() {
        assertEquals("a", RandomTables.weightedPick(A_B, Map.Entry::getValue, () -> 0.2).getKey());
        assertEquals("b", RandomTables.weightedPick(A_B, Map.Entry::getValue, () -> 0.5).getKey());
    }

    @Test
    void emptyTablesPickNothing() {
        assertNull(RandomTables.weightedPick(List.<String>of(), s -> 1, () -> 0.5));
        assertNull(RandomTables.pickUniform(List.of(), () -> 0.5));
    }

    @Test
    void betweenIsInclusiveOnBothEnds() {
        assertEquals(1, RandomTables.between(() -> 0.0, 1, 3));
        assertEquals(3, RandomTables.between(() -> 0.9999, 1, 3));
    }

    @Test
    void luckStaysWithinBounds() {
        assertEquals(0.1, RandomTables.rollLuck(() -> 0.0), 1e-9, "floor");
        double high = RandomTables.rollLuck(() -> 0.9999);
        assertTrue(high <= 1.0 && high > 0.99);
    }

    @Test
    void rarityRollScalesFromMythicToCommon() {
        assertEquals(Rarity.MYTHIC, RandomTables.rollRarity(0.5, () -> 0.0));
        assertEquals(Rarity.COMMON, RandomTables.rollRarity(0.5, () -> 0.99));
        assertEquals(Rarity.UNCOMMON, RandomTables.rollRarity(0.0, () -> 0.15));
    }
}
