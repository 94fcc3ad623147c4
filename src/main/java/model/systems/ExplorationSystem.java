package model.systems;

import config.GameData;
import config.GameDefs.BonusEffect;
import config.GameDefs.EventDef;
import config.GameDefs.ItemDef;
import config.GameDefs.LootEntry;
import config.GameDefs.RegionDef;
import config.Rarity;
import model.EventLog;
import model.GameState;
import model.Inventory;
import model.LogType;
import model.RandomTables;
import model.SimulationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * One second of exploring. Draws happen in a fixed order: stone trickle, item discovery,
 * fated encounter, then the scheduled event.
 */
public final class ExplorationSystem {
    public static final int    EVENT_INTERVAL_TICKS = 60;
    public static final double FATED_BASE_CHANCE    = 0.0001;

    static final String SMALL_POUCH = "spirit_stone_pouch_small";
    static final String LARGE_POUCH = "spirit_stone_pouch_large";

    private final GameData data;
    private final UnlockSystem unlocks;
    private final SimulationContext ctx;

    public ExplorationSystem(GameData data, UnlockSystem unlocks, SimulationContext ctx) {
        this.data = data;
        this.unlocks = unlocks;
        this.ctx = ctx;
    }

    public static double discoveryChance(GameState s) {
        BonusEffect bonus = s.getCharacter().getBackground().bonusEffect();
        return 0.005
                + s.getCharacter().getLuck() * 0.025
                + bonus.explorationBonus()
                + (s.getCharacter().isRogueStatus() ? 0.005 : 0);
    }

    public void explore(GameState s) {
        RegionDef region = data.region(s.getCurrentLocationId());

        // (a) trickle
        if (RandomTables.chance(ctx.dice, 0.033)) {
            int amount = RandomTables.between(ctx.dice, 1, 3);
            s.addStones(amount);
            if (RandomTables.chance(ctx.dice, 0.3)) {
                EventLog.info(s, ctx, "Found " + amount + " Spirit Stone" + (amount > 1 ? "s" : "") + " while exploring.");
            }
        }

        // (b) discovery
        if (region != null && RandomTables.chance(ctx.dice, discoveryChance(s))) {
            discover(s, region);
        }

        // (c) fated encounter
        double fatedChance = FATED_BASE_CHANCE * (1 + s.getCharacter().getLuck() * 5);
        if (RandomTables.chance(ctx.dice, fatedChance) && s.getPendingEventId() == null) {
            EventDef fated = pickFated(region);
            if (fated != null) s.setPendingEventId(fated.id());
        }

        // (d) scheduled event
        if (region != null && s.getTickCount() % EVENT_INTERVAL_TICKS == 0
                && s.getPendingEventId() == null && !region.eventPool().isEmpty()) {
            String id = RandomTables.pickUniform(region.eventPool(), ctx.dice);
            EventDef ev = data.event(id);
            if (ev != null && !ev.fated()) s.setPendingEventId(ev.id());
        }
    }

    private void discover(GameState s, RegionDef region) {
        List<LootEntry> eligible = new ArrayList<>();
        for (LootEntry le : region.lootTable()) {
            if (le.minDanger() <= region.dangerLevel()) eligible.add(le);
        }
        LootEntry hit = RandomTables.weightedPick(eligible, LootEntry::weight, ctx.dice);
        if (hit == null) return;

        if (SMALL_POUCH.equals(hit.itemId())) {
            int amount = RandomTables.between(ctx.dice, 5, 15);
            s.addStones(amount);
            EventLog.add(s, ctx, "Found " + amount + " Spirit Stones!", LogType.SUCCESS);
            return;
        }
        if (LARGE_POUCH.equals(hit.itemId())) {
            int amount = RandomTables.between(ctx.dice, 30, 80);
            s.addStones(amount);
            EventLog.add(s, ctx, "Found " + amount + " Spirit Stones!", LogType.LEGENDARY);
            return;
        }

        ItemDef item = data.item(hit.itemId());
        if (item == null) return;
        Inventory.add(s, item, 1);
        EventLog.add(s, ctx, "Found: " + item.name(), logTypeFor(item.rarity()));
        unlocks.checkPathUnlocks(s);
    }

    private EventDef pickFated(RegionDef region) {
        List<EventDef> local = new ArrayList<>();
        if (region != null) {
            for (String id : region.eventPool()) {
                EventDef ev = data.event(id);
                if (ev != null && ev.fated()) local.add(ev);
            }
        }
        List<EventDef> pool = local.isEmpty() ? data.fatedEvents() : local;
        return RandomTables.pickUniform(pool, ctx.dice);
    }

    static LogType logTypeFor(Rarity rarity) {
        return switch (rarity) {
            case LEGENDARY, MYTHIC -> LogType.LEGENDARY;
            case EPIC, RARE        -> LogType.SUCCESS;
            default                -> LogType.INFO;
        };
    }
}
