package model;

import java.util.ArrayDeque;
import java.util.Deque;

/** Replays queued rolls, then keeps returning {@code fallback}. 0.999 makes every small chance miss. */
public final class ScriptedDice implements Dice {
    private final Deque<Double> queued = new ArrayDeque<>();
    private final double fallback;
    private int draws;

    public ScriptedDice(double fallback, double... rolls) {
        this.fallback = fallback;
        for (double r : rolls) queued.add(r);
    }

    public static ScriptedDice quiet(double... rolls) {
        return new ScriptedDice(0.999, rolls);
    }

    public ScriptedDice then(double... rolls) {
        for (double r : rolls) queued.add(r);
        return this;
    }

    @Override
    public double next() {
        draws++;
        Double r = queued.poll();
        return r != null ? r : fallback;
    }

    public int draws() { return draws; }

    public int remaining() { return queued.size(); }
}
