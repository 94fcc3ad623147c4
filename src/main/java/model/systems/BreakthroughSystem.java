package model.systems;

import config.GameData;
import config.GameDefs.PathDef;
import model.EventLog;
import model.Formats;
import model.GameState;
import model.Inventory;
import model.LogType;
import model.PathProgress;
import model.Progression;
import model.SimulationContext;

/**
 * Resolves a breakthrough attempt on the active path. A success moves up one level;
 * a failure draws a second roll to pick how badly it went.
 */
public final class BreakthroughSystem {
    public static final double MAX_CHANCE          = 0.95;
    public static final int    DEVIATION_SECONDS   = 1800;
    public static final String BREAKTHROUGH_PILL   = "breakthrough_pill";
    public static final double PILL_BONUS_PER_UNIT = 0.05;

    private final GameData data;
    private final SimulationContext ctx;

    public BreakthroughSystem(GameData data, SimulationContext ctx) {
        this.data = data;
        this.ctx = ctx;
    }

    public static double successChance(int level, double luck, double pillBonus) {
        double raw = Progression.breakthroughRate(level) + pillBonus + luck * 0.05;
        return Math.max(0, Math.min(MAX_CHANCE, raw));
    }

    /** True when the active path is ready and breaking through would cross a tier. */
    public static boolean needsTribulation(GameState s) {
        PathProgress pp = s.activeProgress();
        return pp != null && pp.isBreakthroughAvailable() && Progression.isTierTransition(pp.getCurrentLevel());
    }

    /** Bonus from every breakthrough pill held; the pills are consumed. */
    public static double consumePills(GameState s) {
        int pills = Inventory.count(s, BREAKTHROUGH_PILL);
        if (pills == 0) return 0;
        Inventory.remove(s, BREAKTHROUGH_PILL, pills);
        return PILL_BONUS_PER_UNIT * pills;
    }

    public BreakthroughResult attempt(GameState s, double pillBonus) {
        PathProgress pp = s.activeProgress();
        if (pp == null || !pp.isBreakthroughAvailable()) return BreakthroughResult.notReady();

        double chance = successChance(pp.getCurrentLevel(), s.getCharacter().getLuck(), pillBonus);
        if (ctx.dice.next() < chance) return succeed(s, pp);

        double f = ctx.dice.next();
        if (f < 0.05) {
            EventLog.danger(s, ctx, "CATASTROPHIC FAILURE! Your body shatters... Death claims you.");
            return new BreakthroughResult(false, BreakthroughOutcome.DEATH, "Death");
        }
        if (f < 0.15) {
            pp.resetTo(Math.max(1, pp.getCurrentLevel() - 1), 0.5);
            s.refreshHighestLevel();
            EventLog.danger(s, ctx, "CRIPPLING INJURY! Dropped back to Level " + pp.getCurrentLevel() + "!");
            return new BreakthroughResult(false, BreakthroughOutcome.CRIPPLING_INJURY, "Crippling injury");
        }
        if (f < 0.50) {
            pp.setCurrentXp(0);
            pp.setBreakthroughAvailable(false);
            s.getQiDeviation().start(DEVIATION_SECONDS);
            EventLog.danger(s, ctx, "QI DEVIATION! All progress lost and cultivation slowed for "
                    + Formats.duration(DEVIATION_SECONDS) + "!");
            return new BreakthroughResult(false, BreakthroughOutcome.QI_DEVIATION, "Qi deviation");
        }
        pp.setCurrentXp(pp.getXpRequired() * 0.7);
        pp.setBreakthroughAvailable(false);
        EventLog.warning(s, ctx, "Minor setback: lost 30% of your XP progress.");
        return new BreakthroughResult(false, BreakthroughOutcome.MINOR_SETBACK, "Minor setback");
    }

    /** Success branch without a roll; a survived tribulation lands here. */
    public BreakthroughResult forceSuccess(GameState s, String pathId) {
        PathProgress pp = s.progressOf(pathId);
        if (pp == null) return BreakthroughResult.notReady();
        return succeed(s, pp);
    }

    private BreakthroughResult succeed(GameState s, PathProgress pp) {
        int next = Math.min(Progression.MAX_LEVEL, pp.getCurrentLevel() + 1);
        pp.resetTo(next, 0);
        s.refreshHighestLevel();

        PathDef def = data.path(pp.getPathId());
        String levelName = def != null ? def.levelName(next) : "Level " + next;
        EventLog.add(s, ctx, "BREAKTHROUGH SUCCESS! Advanced to " + levelName + "!", LogType.LEGENDARY);
        if (next == Progression.MAX_LEVEL && def != null) {
            EventLog.add(s, ctx, "You have reached the pinnacle of " + def.name() + "! You are a true immortal!", LogType.LEGENDARY);
        }
        return new BreakthroughResult(true, BreakthroughOutcome.SUCCESS, "Advanced to " + levelName);
    }
}
