package model.paths;

import model.GameState;

import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/** Behaviour attached to a path id: how fast it grows and when it opens up. */
public record PathRule(ToDoubleFunction<GameState> speed, Predicate<GameState> unlock) {

    /** Unknown ids never grow and never unlock. */
    public static final PathRule INERT = new PathRule(s -> 0, s -> false);

    public double speedFor(GameState state) { return speed.applyAsDouble(state); }

    public boolean canUnlock(GameState state) { return unlock.test(state); }
}
