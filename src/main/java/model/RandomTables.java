package model;

import config.Rarity;

import java.util.List;
import java.util.function.ToDoubleFunction;

/** Weighted picks and the skewed luck/rarity rolls, all drawn from an injected {@link Dice}. */
public final class RandomTables {
    private RandomTables() {}

    public static boolean chance(Dice dice, double probability) {
        return dice.next() < probability;
    }

    /** Inclusive on both ends. */
    public static int between(Dice dice, int min, int max) {
        int span = max - min + 1;
        int offset = Math.min(span - 1, (int) Math.floor(dice.next() * span));
        return min + offset;
    }

    public static <T> T pickUniform(List<T> items, Dice dice) {
        if (items == null || items.isEmpty()) return null;
        int idx = Math.min(items.size() - 1, (int) Math.floor(dice.next() * items.size()));
        return items.get(idx);
    }

    /**
     * Draws u in [0, total) and walks the list subtracting weights until the remainder
     * drops to zero or below. Earlier entries win ties; falls back to the first entry.
     */
    public static <T> T weightedPick(List<T> entries, ToDoubleFunction<T> weight, Dice dice) {
        if (entries == null || entries.isEmpty()) return null;
        double total = 0;
        for (T e : entries) total += Math.max(0, weight.applyAsDouble(e));

        double remainder = dice.next() * total;
        for (T e : entries) {
            remainder -= Math.max(0, weight.applyAsDouble(e));
            if (remainder <= 0) return e;
        }
        return entries.get(0);
    }

    /** Skewed towards low values: most characters are unlucky. */
    public static double rollLuck(Dice dice) {
        double raw = Math.pow(dice.next(), 2.5);
        return Math.max(0.1, Math.min(1.0, raw));
    }

    public static Rarity rollRarity(double luck, Dice dice) {
        double roll = dice.next();
        double m = luck * 0.5;
        if (roll < 0.0001 * (1 + m * 10)) return Rarity.MYTHIC;
        if (roll < 0.001  * (1 + m * 5))  return Rarity.LEGENDARY;
        if (roll < 0.01   * (1 + m * 3))  return Rarity.EPIC;
        if (roll < 0.05   * (1 + m * 2))  return Rarity.RARE;
        if (roll < 0.20   * (1 + m))      return Rarity.UNCOMMON;
        return Rarity.COMMON;
    }
}
