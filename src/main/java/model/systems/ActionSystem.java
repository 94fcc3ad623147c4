package model.systems;

import config.ActionType;
import config.GameData;
import config.GameDefs.PathDef;
import model.ActionResult;
import model.EventLog;
import model.GameState;
import model.SimulationContext;

import java.util.List;

/** What the character does each second, and which path that feeds. */
public final class ActionSystem {
    static final List<String> CULTIVATE_PATHS =
            List.of("spirit", "rogue", "devil_soul", "oracle", "harmonic", "bloodline", "dream", "necromancy");
    static final List<String> TRAIN_PATHS = List.of("martial", "devil_body");

    private final GameData data;
    private final SimulationContext ctx;

    public ActionSystem(GameData data, SimulationContext ctx) {
        this.data = data;
        this.ctx = ctx;
    }

    /** Choosing the current action again stops it. */
    public ActionResult setAction(GameState s, ActionType action) {
        if (action == null) return ActionResult.fail("Unknown action");
        if (s.getTravel().isTraveling()) return ActionResult.fail("Cannot change action while traveling");

        if (action == s.getCurrentAction() || action == ActionType.IDLE) {
            s.setCurrentAction(ActionType.IDLE);
            return ActionResult.ok("Idle");
        }

        switch (action) {
            case CULTIVATE -> {
                String path = firstUnlocked(s, CULTIVATE_PATHS);
                if (path == null) {
                    EventLog.warning(s, ctx, "You need a Cultivation Scripture to cultivate! Explore to find one.");
                    return ActionResult.fail("No cultivation path unlocked");
                }
                s.setActivePathId(path);
            }
            case TRAIN -> {
                String path = firstUnlocked(s, TRAIN_PATHS);
                if (path == null) return ActionResult.fail("No body path unlocked");
                s.setActivePathId(path);
            }
            case EXPLORE -> { /* keeps the active path */ }
            default -> {
                String path = singlePathFor(action);
                if (path == null || !s.hasUnlocked(path)) {
                    return ActionResult.fail("No unlocked path uses " + action.label());
                }
                s.setActivePathId(path);
            }
        }
        s.setCurrentAction(action);
        return ActionResult.ok(action.label());
    }

    /** Makes an unlocked path active and switches to the action that feeds it. */
    public ActionResult selectPath(GameState s, String pathId) {
        PathDef def = data.path(pathId);
        if (def == null) return ActionResult.fail("Unknown path: " + pathId);
        if (!s.hasUnlocked(pathId)) return ActionResult.fail(def.name() + " is locked");

        s.setActivePathId(pathId);
        if (!s.getTravel().isTraveling() && def.action() != ActionType.EXPLORE) {
            s.setCurrentAction(def.action());
        }
        return ActionResult.ok("Following " + def.name());
    }

    public ActionResult toggleRogue(GameState s) {
        boolean rogue = !s.getCharacter().isRogueStatus();
        s.getCharacter().setRogueStatus(rogue);
        if (rogue) {
            s.setGroupMembership(null);
            EventLog.warning(s, ctx, "You walk the path alone...");
        } else {
            EventLog.info(s, ctx, "You rejoin society.");
        }
        return ActionResult.ok(rogue ? "Rogue" : "Orthodox");
    }

    private static String firstUnlocked(GameState s, List<String> candidates) {
        for (String id : candidates) if (s.hasUnlocked(id)) return id;
        return null;
    }

    private String singlePathFor(ActionType action) {
        for (PathDef def : data.paths()) if (def.action() == action) return def.id();
        return null;
    }
}
