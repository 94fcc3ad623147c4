package model;

import java.util.List;

/** Newest-first narration shown to the player, capped at {@link #CAP} entries. */
public final class EventLog {
    public static final int CAP = 50;

    private EventLog() {}

    public static void add(GameState state, SimulationContext ctx, String text, LogType type) {
        List<LogEntry> log = state.getLog();
        log.add(0, new LogEntry(ctx.nextLogId(), text, type, ctx.now()));
        while (log.size() > CAP) log.remove(log.size() - 1);
    }

    public static void info(GameState s, SimulationContext ctx, String text)    { add(s, ctx, text, LogType.INFO); }
    public static void success(GameState s, SimulationContext ctx, String text) { add(s, ctx, text, LogType.SUCCESS); }
    public static void warning(GameState s, SimulationContext ctx, String text) { add(s, ctx, text, LogType.WARNING); }
    public static void danger(GameState s, SimulationContext ctx, String text)  { add(s, ctx, text, LogType.DANGER); }
}
