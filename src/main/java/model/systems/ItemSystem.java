package model.systems;

import config.GameData;
import config.GameDefs.ItemDef;
import config.GameDefs.ItemEffects;
import config.ItemCategory;
import model.ActionResult;
import model.ActiveBuff;
import model.EventLog;
import model.Formats;
import model.GameState;
import model.Inventory;
import model.SimulationContext;

/** Pills, purchased boosts and the equipped scripture. */
public final class ItemSystem {
    public static final String BOOST_ID       = "ss_boost";
    public static final double BOOST_MULT     = 5;
    public static final int    BOOST_SECONDS  = 600;

    private final GameData data;
    private final SimulationContext ctx;
    private long buffSeq;

    public ItemSystem(GameData data, SimulationContext ctx) {
        this.data = data;
        this.ctx = ctx;
    }

    public static long boostCost(GameState s) {
        long active = s.getBuffs().stream().filter(b -> BOOST_ID.equals(b.getId())).count();
        return 10 + active * 10;
    }

    public ActionResult buyBoost(GameState s) {
        long cost = boostCost(s);
        if (s.getSpiritStones() < cost) return ActionResult.fail("Need " + cost + " Spirit Stones");

        s.addStones(-cost);
        s.getBuffs().add(new ActiveBuff(BOOST_ID, "Spirit Stone Boost", BOOST_MULT, BOOST_SECONDS, "boost"));
        EventLog.success(s, ctx, "Activated 5x speed boost for " + Formats.duration(BOOST_SECONDS) + "! (Cost: " + cost + " SS)");
        return ActionResult.ok("Boost active");
    }

    public ActionResult useItem(GameState s, String itemId) {
        ItemDef item = data.item(itemId);
        if (item == null || !Inventory.has(s, itemId)) return ActionResult.fail("You do not hold " + itemId);
        if (item.category() != ItemCategory.PILL) return ActionResult.fail(item.name() + " cannot be consumed");

        ItemEffects fx = item.effects();
        if (fx.healQiDeviation() && s.getQiDeviation().isActive()) {
            s.getQiDeviation().clear();
            EventLog.success(s, ctx, "Qi Deviation cured!");
        }
        if (fx.xpMultiplier() > 0 && fx.xpMultiplierDuration() > 0) {
            String buffId = "pill_" + itemId + "_" + ctx.now() + "_" + (buffSeq++);
            s.getBuffs().add(new ActiveBuff(buffId, item.name(), fx.xpMultiplier(), fx.xpMultiplierDuration(), "pill"));
            EventLog.success(s, ctx, item.name() + " consumed! " + fx.xpMultiplier() + "x XP for "
                    + Formats.duration(fx.xpMultiplierDuration()));
        }
        Inventory.remove(s, itemId, 1);
        return ActionResult.ok("Used " + item.name());
    }

    public ActionResult equipScripture(GameState s, String itemId) {
        ItemDef item = data.item(itemId);
        if (item == null || !Inventory.has(s, itemId)) return ActionResult.fail("You do not hold " + itemId);
        if (item.category() != ItemCategory.SCRIPTURE) return ActionResult.fail(item.name() + " is not a scripture");

        s.setEquippedScripture(itemId);
        EventLog.info(s, ctx, "Equipped " + item.name() + ".");
        return ActionResult.ok("Equipped " + item.name());
    }
}
