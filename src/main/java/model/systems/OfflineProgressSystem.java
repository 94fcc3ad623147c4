package model.systems;

import config.GameData;
import config.GameDefs.PathDef;
import model.ActiveBuff;
import model.EventLog;
import model.Formats;
import model.GameState;
import model.LogType;
import model.PathProgress;
import model.QiDeviation;
import model.SimulationContext;
import model.paths.PathRules;

import java.util.Iterator;
import java.util.logging.Logger;

/** Closed-form catch-up for the time the game was closed. Runs once before the scheduler starts. */
public final class OfflineProgressSystem {
    private static final Logger log = Logger.getLogger(OfflineProgressSystem.class.getName());

    public static final int MIN_SECONDS          = 5;
    public static final int STONE_EVERY_SECONDS  = 600;

    private final GameData data;
    private final PathRules rules;
    private final TravelSystem travel;
    private final SimulationContext ctx;
    private final int capSeconds;

    public OfflineProgressSystem(GameData data, PathRules rules, TravelSystem travel, SimulationContext ctx, int capSeconds) {
        this.data = data;
        this.rules = rules;
        this.travel = travel;
        this.ctx = ctx;
        this.capSeconds = capSeconds;
    }

    public OfflineReport catchUp(GameState s, long nowMillis) {
        long elapsed = Math.min((nowMillis - s.getLastSaveTimestamp()) / 1000, capSeconds);
        if (elapsed < MIN_SECONDS) return OfflineReport.NONE;

        // ---- travel suspends everything else until arrival ----
        long settled = elapsed;
        if (s.getTravel().isTraveling()) {
            long travelSecs = Math.min(elapsed, s.getTravel().getRemainingSeconds());
            travel.advance(s, travelSecs);
            settled = elapsed - travelSecs;
        }

        // ---- XP: base rate only, no buffs / click / scripture ----
        double xpGained = 0;
        PathProgress pp = settled > 0 ? TickEngine.eligiblePath(s, data) : null;
        if (pp != null) {
            double before = pp.getCurrentXp();
            boolean filled = pp.gainXp(TickEngine.baseRate(s, rules, pp.getPathId()) * settled);
            xpGained = pp.getCurrentXp() - before;
            if (filled) {
                PathDef def = data.path(pp.getPathId());
                EventLog.add(s, ctx, def.levelName(pp.getCurrentLevel()) + " XP maxed! Attempt Breakthrough!", LogType.WARNING);
            }
        }

        QiDeviation d = s.getQiDeviation();
        if (d.isActive() && settled > 0) {
            d.setRemainingSeconds((int) Math.max(0, d.getRemainingSeconds() - settled));
            if (d.getRemainingSeconds() <= 0) d.clear();
        }

        if (settled > 0) {
            int secs = (int) settled;
            Iterator<ActiveBuff> it = s.getBuffs().iterator();
            while (it.hasNext()) {
                if (it.next().countDown(secs)) it.remove();
            }
        }

        long stones = elapsed / STONE_EVERY_SECONDS;
        s.addStones(stones);

        if (xpGained > 0 || stones > 0) {
            EventLog.add(s, ctx, "Offline: " + Formats.duration(elapsed) + " (+" + Formats.number(xpGained)
                    + " XP, +" + stones + " Spirit Stones)", LogType.SYSTEM);
        }
        s.setLastSaveTimestamp(nowMillis);
        s.setTotalPlayTime(s.getTotalPlayTime() + elapsed);

        log.info(() -> "[Offline] Caught up " + elapsed + "s");
        return new OfflineReport(elapsed, xpGained, stones);
    }
}
