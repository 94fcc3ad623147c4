package model.systems;

import config.GameData;
import config.GameDefs.ItemDef;
import config.GameDefs.RegionDef;
import config.GameDefs.ShopRealm;
import model.ActionResult;
import model.EventLog;
import model.GameState;
import model.Inventory;
import model.SimulationContext;

import java.util.ArrayList;
import java.util.List;

/** Buying from the local shop and selling anything with a value. */
public final class ShopSystem {
    static final int MARKUP = 3;

    private final GameData data;
    private final SimulationContext ctx;

    public ShopSystem(GameData data, SimulationContext ctx) {
        this.data = data;
        this.ctx = ctx;
    }

    public boolean isOpen(GameState s) {
        RegionDef r = data.region(s.getCurrentLocationId());
        return r != null && (r.hasShop() || r.city()) && !s.getTravel().isTraveling();
    }

    public List<ItemDef> stock(GameState s) {
        List<ItemDef> out = new ArrayList<>();
        if (!isOpen(s)) return out;
        ShopRealm shop = data.shop(data.region(s.getCurrentLocationId()).realm());
        if (shop == null) return out;
        for (String id : shop.items()) {
            ItemDef d = data.item(id);
            if (d != null) out.add(d);
        }
        return out;
    }

    public long price(GameState s, ItemDef item) {
        RegionDef r = data.region(s.getCurrentLocationId());
        ShopRealm shop = r == null ? null : data.shop(r.realm());
        double realmMult = shop == null ? 1 : shop.priceMultiplier();
        double discount = s.getCharacter().getBackground().bonusEffect().shopDiscount();
        return (long) Math.floor(item.sellValue() * MARKUP * realmMult * (1 - discount));
    }

    public ActionResult buy(GameState s, String itemId) {
        if (!isOpen(s)) return ActionResult.fail("There is no shop here");
        ItemDef item = null;
        for (ItemDef d : stock(s)) if (d.id().equals(itemId)) item = d;
        if (item == null) return ActionResult.fail("The shop does not sell " + itemId);

        long price = price(s, item);
        if (s.getSpiritStones() < price) return ActionResult.fail("Need " + price + " Spirit Stones");

        s.addStones(-price);
        Inventory.add(s, item, 1);
        EventLog.success(s, ctx, "Bought " + item.name() + " for " + price + " Spirit Stones.");
        return ActionResult.ok("Bought " + item.name());
    }

    public ActionResult sell(GameState s, String itemId) {
        if (!isOpen(s)) return ActionResult.fail("There is no shop here");
        ItemDef item = data.item(itemId);
        if (item == null || !Inventory.has(s, itemId)) return ActionResult.fail("You do not hold " + itemId);
        if (item.sellValue() <= 0) return ActionResult.fail(item.name() + " cannot be sold");

        Inventory.remove(s, itemId, 1);
        if (itemId.equals(s.getEquippedScripture()) && !Inventory.has(s, itemId)) s.setEquippedScripture(null);
        s.addStones(item.sellValue());
        EventLog.info(s, ctx, "Sold " + item.name() + " for " + item.sellValue() + " Spirit Stones.");
        return ActionResult.ok("Sold " + item.name());
    }
}
