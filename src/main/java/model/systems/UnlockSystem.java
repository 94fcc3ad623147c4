package model.systems;

import config.ActionType;
import config.GameData;
import config.GameDefs.PathDef;
import model.EventLog;
import model.GameState;
import model.LogType;
import model.PathProgress;
import model.RandomTables;
import model.SimulationContext;
import model.paths.PathRules;

import java.util.ArrayList;
import java.util.List;

/** Opens new paths, either through their unlock predicate or through the per-tick special rolls. */
public final class UnlockSystem {
    static final String BEAST_GROUNDS = "spirit_beast_territory";

    private final GameData data;
    private final PathRules rules;
    private final SimulationContext ctx;

    public UnlockSystem(GameData data, PathRules rules, SimulationContext ctx) {
        this.data = data;
        this.rules = rules;
        this.ctx = ctx;
    }

    /** Re-evaluates every locked path. Returns the ids opened by this call. */
    public List<String> checkPathUnlocks(GameState s) {
        List<String> opened = new ArrayList<>();
        for (PathDef def : data.paths()) {
            if (s.hasUnlocked(def.id())) continue;
            if (!rules.canUnlock(def.id(), s)) continue;
            unlock(s, def.id());
            EventLog.add(s, ctx, "New Path Unlocked: " + def.name() + "!", LogType.LEGENDARY);
            opened.add(def.id());
        }
        return opened;
    }

    /** Idempotent; an already unlocked path keeps its progress. */
    public boolean unlock(GameState s, String pathId) {
        if (s.hasUnlocked(pathId)) return false;
        s.getPathProgress().put(pathId, PathProgress.unlockedAtStart(pathId));
        return true;
    }

    /** Tick step: rare rolls and karma/rogue thresholds that open paths outside the normal predicates. */
    public void specialUnlocks(GameState s) {
        ActionType action = s.getCurrentAction();
        double luck = s.getCharacter().getLuck();

        if (action == ActionType.EXPLORE && BEAST_GROUNDS.equals(s.getCurrentLocationId())
                && !s.hasUnlocked("beast_tamer")
                && RandomTables.chance(ctx.dice, 0.005 * luck)) {
            unlock(s, "beast_tamer");
            EventLog.add(s, ctx, "A spirit beast approaches! The Resonance Path is unlocked!", LogType.LEGENDARY);
        }

        if (action == ActionType.CULTIVATE && !s.hasUnlocked("dream")
                && RandomTables.chance(ctx.dice, 0.0002)) {
            unlock(s, "dream");
            EventLog.add(s, ctx, "A lucid dream overtakes you... The Illusion Path is unlocked!", LogType.LEGENDARY);
        }

        if (s.getCharacter().isRogueStatus() && !s.hasUnlocked("rogue") && rules.canUnlock("rogue", s)) {
            unlock(s, "rogue");
            EventLog.add(s, ctx, "The Wild Path opens before you!", LogType.LEGENDARY);
        }

        if (s.getCharacter().getKarma() <= PathRules.DEVIL_KARMA) {
            if (unlock(s, "devil_soul")) {
                s.getCharacter().setDevilMark(true);
                EventLog.add(s, ctx, "Soul Corruption path unlocked! You are marked as a Devil Cultivator!", LogType.DANGER);
            }
            if (unlock(s, "devil_body")) {
                EventLog.add(s, ctx, "Body Corruption path unlocked!", LogType.DANGER);
            }
        }
    }
}
