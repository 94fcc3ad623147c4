package model.systems;

import config.GameData;
import config.GameDefs.EventChoice;
import config.GameDefs.EventDef;
import model.ActionResult;
import model.EventLog;
import model.GameState;
import model.Inventory;
import model.LogType;
import model.SimulationContext;
import model.paths.PathRules;

/** Resolves the pending narrative event once the player picks a choice. */
public final class EventSystem {
    private final GameData data;
    private final UnlockSystem unlocks;
    private final SimulationContext ctx;

    public EventSystem(GameData data, UnlockSystem unlocks, SimulationContext ctx) {
        this.data = data;
        this.unlocks = unlocks;
        this.ctx = ctx;
    }

    public ActionResult chooseEventOption(GameState s, int choiceIndex) {
        EventDef ev = data.event(s.getPendingEventId());
        if (ev == null) return ActionResult.fail("No event is waiting for a decision");
        if (choiceIndex < 0 || choiceIndex >= ev.choices().size()) {
            return ActionResult.fail("Invalid choice " + choiceIndex + " for " + ev.title());
        }
        EventChoice choice = ev.choices().get(choiceIndex);

        s.getCharacter().shiftKarma(choice.karmaChange());
        s.addStones(choice.rewards().spiritStones() - choice.losses().spiritStones());
        for (String itemId : choice.rewards().items()) {
            Inventory.add(s, data.item(itemId), 1);
        }

        EventLog.add(s, ctx, ev.title() + ": " + choice.text(),
                choice.karmaChange() >= 0 ? LogType.SUCCESS : LogType.WARNING);
        unlocks.checkPathUnlocks(s);

        if (s.getCharacter().getKarma() <= PathRules.DEVIL_KARMA
                && (s.hasUnlocked("devil_soul") || s.hasUnlocked("devil_body"))) {
            s.getCharacter().setDevilMark(true);
        }
        s.setPendingEventId(null);
        return ActionResult.ok(choice.text());
    }
}
