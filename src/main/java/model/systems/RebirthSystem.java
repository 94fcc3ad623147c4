package model.systems;

import model.Character;
import model.EventLog;
import model.Formats;
import model.GameState;
import model.Inventory;
import model.InventoryItem;
import model.LogType;
import model.SimulationContext;

import java.util.ArrayList;
import java.util.List;

/** Death is not the end: a new life inherits legacy, and sometimes more. */
public final class RebirthSystem {
    static final String FATE_ANCHOR      = "fate_anchor";
    static final String DIMENSIONAL_RING = "dimensional_ring";

    private final CharacterCreation creation;
    private final SimulationContext ctx;

    public RebirthSystem(CharacterCreation creation, SimulationContext ctx) {
        this.creation = creation;
        this.ctx = ctx;
    }

    public GameState rebirth(GameState old) {
        Character prev = old.getCharacter();
        int rebirthCount = prev.getRebirthCount() + 1;
        double legacy = prev.getLegacyBonus() + old.getHighestPathLevel() * 0.01;

        Character next;
        if (Inventory.has(old, FATE_ANCHOR)) {
            next = new Character(prev.getName(), prev.getSpiritRoot(), prev.getBodyType(), prev.getBackground(), prev.getLuck());
        } else {
            next = creation.rollCharacter(prev.getName());
        }
        next.setRebirthCount(rebirthCount);
        next.setLegacyBonus(legacy);
        next.setDevilMark(prev.isDevilMark());

        List<InventoryItem> carried = new ArrayList<>();
        if (Inventory.has(old, DIMENSIONAL_RING)) {
            for (InventoryItem it : old.getInventory()) {
                if (!DIMENSIONAL_RING.equals(it.getItemId())) carried.add(it.copy());
            }
        }

        GameState fresh = creation.createInitialState(next);
        fresh.setInventory(carried);
        fresh.setTotalDeaths(old.getTotalDeaths() + 1);
        fresh.setAchievements(old.getAchievements());

        EventLog.add(fresh, ctx, "REBIRTH #" + rebirthCount + "! Legacy Bonus: +" + Formats.percent(legacy) + " XP", LogType.DANGER);
        return fresh;
    }
}
