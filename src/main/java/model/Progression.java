package model;

import java.util.Map;

/** XP curve, tiers and breakthrough base rates shared by every path. */
public final class Progression {
    private Progression() {}

    public static final int    MAX_LEVEL = 12;
    public static final double BASE_XP   = 100;
    public static final double SCALE     = 2.2;

    private static final double[] TIER_MULT  = {1, 5, 25};
    private static final String[] TIER_NAMES = {"Mortal", "Transcendent", "Divine"};

    private static final Map<Integer, Double> BREAKTHROUGH_RATES = Map.ofEntries(
            Map.entry(1, 0.70), Map.entry(2, 0.55), Map.entry(3, 0.40), Map.entry(4, 0.25),
            Map.entry(5, 0.50), Map.entry(6, 0.35), Map.entry(7, 0.25), Map.entry(8, 0.15),
            Map.entry(9, 0.30), Map.entry(10, 0.20), Map.entry(11, 0.10));
    private static final double DEFAULT_RATE = 0.10;

    /** Breaking through FROM these levels crosses a tier and calls down a tribulation. */
    public static boolean isTierTransition(int level) {
        return level == 4 || level == 8;
    }

    /** 1 for levels 1-4, 2 for 5-8, 3 beyond. */
    public static int tierFor(int level) {
        if (level <= 4) return 1;
        if (level <= 8) return 2;
        return 3;
    }

    public static String tierName(int level) {
        return TIER_NAMES[tierFor(level) - 1];
    }

    public static long xpRequired(int level) {
        return (long) Math.floor(BASE_XP * Math.pow(SCALE, level) * TIER_MULT[tierFor(level) - 1]);
    }

    public static double breakthroughRate(int level) {
        return BREAKTHROUGH_RATES.getOrDefault(level, DEFAULT_RATE);
    }
}
