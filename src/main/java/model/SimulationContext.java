package model;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/** Per-session collaborators: random source, wall clock and the log id sequence. */
public final class SimulationContext {
    public final Dice  dice;
    public final Clock clock;
    private final AtomicLong logIds = new AtomicLong(1);

    public SimulationContext(Dice dice, Clock clock) {
        this.dice = dice;
        this.clock = clock;
    }

    public SimulationContext(long seed) {
        this(Dice.seeded(seed), Clock.systemUTC());
    }

    public long now() { return clock.millis(); }

    public long nextLogId() { return logIds.getAndIncrement(); }

    /** Continue numbering after the highest id already present in a loaded save. */
    public void continueLogIds(GameState state) {
        long max = 0;
        for (LogEntry e : state.getLog()) max = Math.max(max, e.id());
        logIds.set(max + 1);
    }
}
