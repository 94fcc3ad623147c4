package model;

import java.util.Locale;

/** Text helpers for log lines and snapshots. */
public final class Formats {
    private Formats() {}

    public static String number(double n) {
        if (n >= 1e9) return String.format(Locale.ROOT, "%.2fB", n / 1e9);
        if (n >= 1e6) return String.format(Locale.ROOT, "%.2fM", n / 1e6);
        if (n >= 1e3) return String.format(Locale.ROOT, "%.1fK", n / 1e3);
        return String.valueOf((long) Math.floor(n));
    }

    /** 45s, 2m 5s, 1h 30m */
    public static String duration(long seconds) {
        if (seconds < 60) return seconds + "s";
        if (seconds < 3600) return (seconds / 60) + "m " + (seconds % 60) + "s";
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }

    public static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.1f%%", fraction * 100);
    }

    public static String karmaLabel(int karma) {
        if (karma >= 500)  return "Saint";
        if (karma >= 100)  return "Righteous";
        if (karma > -100)  return "Neutral";
        if (karma > -500)  return "Wicked";
        return "Abomination";
    }

    public static String luckDescriptor(double luck) {
        if (luck <= 0.2)  return "Abysmal";
        if (luck <= 0.35) return "Terrible";
        if (luck <= 0.5)  return "Poor";
        if (luck <= 0.65) return "Average";
        if (luck <= 0.8)  return "Good";
        if (luck <= 0.9)  return "Excellent";
        return "Heaven-Blessed";
    }
}
