package model.systems;

import config.ActionType;
import config.GameData;
import config.GameDefs.ItemDef;
import config.GameDefs.PathDef;
import model.ActiveBuff;
import model.EventLog;
import model.GameState;
import model.LogType;
import model.PathProgress;
import model.Progression;
import model.QiDeviation;
import model.SimulationContext;
import model.paths.PathRules;

import java.util.Iterator;

/** Advances a playing game by one second. Each step may end the tick early (travel does). */
public final class TickEngine {
    private final GameData data;
    private final PathRules rules;
    private final SimulationContext ctx;
    private final TravelSystem travel;
    private final ExplorationSystem exploration;
    private final UnlockSystem unlocks;

    public TickEngine(GameData data, PathRules rules, SimulationContext ctx,
                      TravelSystem travel, ExplorationSystem exploration, UnlockSystem unlocks) {
        this.data = data;
        this.rules = rules;
        this.ctx = ctx;
        this.travel = travel;
        this.exploration = exploration;
        this.unlocks = unlocks;
    }

    public void tick(GameState s, boolean clickBoosted) {
        s.setTickCount(s.getTickCount() + 1);
        s.setTotalPlayTime(s.getTotalPlayTime() + 1);

        // ---- travel suspends everything else ----
        if (s.getTravel().isTraveling()) {
            travel.advance(s, 1);
            return;
        }

        tickBuffs(s);
        tickDeviation(s);
        accrueXp(s, clickBoosted);

        if (s.getCurrentAction() == ActionType.EXPLORE) {
            exploration.explore(s);
        }

        if (!s.isKarmaVisible() && anyPathAtLeast(s, 5)) {
            s.setKarmaVisible(true);
            EventLog.add(s, ctx, "Your karma becomes visible to your inner eye...", LogType.LEGENDARY);
        }

        s.refreshHighestLevel();

        unlocks.specialUnlocks(s);
        unlocks.checkPathUnlocks(s);
    }

    /**
     * The path that would receive XP right now, or null. XP flows only when the action feeds
     * the active path; explore and idle never do.
     */
    public static PathProgress eligiblePath(GameState s, GameData data) {
        ActionType action = s.getCurrentAction();
        if (action == ActionType.IDLE || action == ActionType.EXPLORE) return null;

        PathProgress pp = s.activeProgress();
        if (pp == null || !pp.isUnlocked() || pp.isBreakthroughAvailable()) return null;
        if (pp.getCurrentLevel() >= Progression.MAX_LEVEL) return null;

        PathDef def = data.path(pp.getPathId());
        if (def == null || def.action() != action) return null;
        return pp;
    }

    /** Base per-second gain before buffs, click and scripture. */
    public static double baseRate(GameState s, PathRules rules, String pathId) {
        double deviation = s.getQiDeviation().isActive() ? 0.5 : 1.0;
        return rules.speed(pathId, s) * deviation * (1 + s.getCharacter().getLegacyBonus());
    }

    public double xpPerSecond(GameState s, boolean clickBoosted) {
        PathProgress pp = eligiblePath(s, data);
        if (pp == null) return 0;

        double buffMult = 1;
        for (ActiveBuff b : s.getBuffs()) buffMult *= b.getMultiplier();

        return baseRate(s, rules, pp.getPathId())
                * buffMult
                * (clickBoosted ? 2 : 1)
                * scriptureFactor(s);
    }

    private void accrueXp(GameState s, boolean clickBoosted) {
        PathProgress pp = eligiblePath(s, data);
        if (pp == null) return;

        if (pp.gainXp(xpPerSecond(s, clickBoosted))) {
            PathDef def = data.path(pp.getPathId());
            EventLog.add(s, ctx, def.levelName(pp.getCurrentLevel()) + " XP maxed! Attempt Breakthrough!", LogType.WARNING);
        }
    }

    private double scriptureFactor(GameState s) {
        if (s.getCurrentAction() != ActionType.CULTIVATE) return 1;
        ItemDef scripture = data.item(s.getEquippedScripture());
        if (scripture == null || scripture.effects().xpMultiplier() <= 0) return 1;
        return scripture.effects().xpMultiplier();
    }

    private void tickBuffs(GameState s) {
        Iterator<ActiveBuff> it = s.getBuffs().iterator();
        while (it.hasNext()) {
            ActiveBuff b = it.next();
            if (b.countDown(1)) {
                it.remove();
                EventLog.info(s, ctx, b.getName() + " has expired.");
            }
        }
    }

    private void tickDeviation(GameState s) {
        QiDeviation d = s.getQiDeviation();
        if (!d.isActive()) return;
        d.setRemainingSeconds(d.getRemainingSeconds() - 1);
        if (d.getRemainingSeconds() <= 0) {
            d.clear();
            EventLog.success(s, ctx, "Qi Deviation has cleared. Your mind is calm again.");
        }
    }

    private static boolean anyPathAtLeast(GameState s, int level) {
        for (PathProgress p : s.getPathProgress().values()) {
            if (p.getCurrentLevel() >= level) return true;
        }
        return false;
    }
}
