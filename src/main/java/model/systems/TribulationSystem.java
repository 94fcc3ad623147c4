package model.systems;

import config.GameData;
import config.GameDefs.ItemDef;
import model.EventLog;
import model.GameState;
import model.InventoryItem;
import model.LogType;
import model.PathProgress;
import model.SimulationContext;

/** Starts tribulations at tier boundaries and applies each strike's result. */
public final class TribulationSystem {
    private final GameData data;
    private final SimulationContext ctx;

    public TribulationSystem(GameData data, SimulationContext ctx) {
        this.data = data;
        this.ctx = ctx;
    }

    /** @return the new tribulation, or null if the active path is not at a ready tier boundary */
    public Tribulation start(GameState s, long generation) {
        if (!BreakthroughSystem.needsTribulation(s)) return null;
        PathProgress pp = s.activeProgress();
        int level = pp.getCurrentLevel();

        int tier = level <= 4 ? 1 : 2;
        int strikes = (tier == 1 ? 3 : 6) * (s.getCharacter().isDevilMark() ? 2 : 1);
        int maxHp = (int) Math.floor((level * 10 + s.getCharacter().body() * 20) * (1 + hpBonus(s)));
        int window = tier == 1 ? 3 : 2;

        EventLog.add(s, ctx, "HEAVENLY TRIBULATION BEGINS! Survive " + strikes + " lightning strikes!", LogType.LEGENDARY);
        return new Tribulation(generation, pp.getPathId(), level, tier, strikes, maxHp, window);
    }

    /** Sum of the per-item bonus over held inventory entries. */
    public double hpBonus(GameState s) {
        double bonus = 0;
        for (InventoryItem it : s.getInventory()) {
            ItemDef def = data.item(it.getItemId());
            if (def != null) bonus += def.effects().tribulationHpBonus();
        }
        return bonus;
    }

    public boolean arm(Tribulation t) {
        if (t == null || !t.isActive() || t.strikeArmed()) return false;
        t.arm();
        return true;
    }

    /** @return false when no strike is armed */
    public boolean resist(GameState s, Tribulation t) {
        if (t == null || !t.isActive() || !t.strikeArmed()) return false;
        t.resisted();
        EventLog.success(s, ctx, "Strike " + t.currentStrike() + "/" + t.totalStrikes() + " resisted!");
        return true;
    }

    /** Window expired or the player gave in: the armed strike lands. */
    public boolean fail(GameState s, Tribulation t) {
        if (t == null || !t.isActive() || !t.strikeArmed()) return false;
        t.struck();
        if (t.phase() == Tribulation.Phase.FAILED) {
            EventLog.danger(s, ctx, "TRIBULATION FAILED! Your body is destroyed...");
        } else {
            EventLog.warning(s, ctx, "The lightning strikes you for " + t.strikeDamage() + " damage! ("
                    + t.hp() + "/" + t.maxHp() + " HP)");
        }
        return true;
    }
}
