package model;

import config.GameData;
import config.GameDefs.ItemDef;
import config.ItemCategory;

import java.util.Iterator;
import java.util.List;

/** Stack-aware helpers over {@link GameState#getInventory()}. */
public final class Inventory {
    private Inventory() {}

    /** Stackable items merge into one entry; others get one entry per unit. */
    public static void add(GameState state, ItemDef item, int quantity) {
        if (item == null || quantity <= 0) return;
        List<InventoryItem> inv = state.getInventory();
        if (item.stackable()) {
            for (InventoryItem it : inv) {
                if (it.getItemId().equals(item.id())) {
                    it.setQuantity(it.getQuantity() + quantity);
                    return;
                }
            }
            inv.add(new InventoryItem(item.id(), quantity));
        } else {
            for (int i = 0; i < quantity; i++) inv.add(new InventoryItem(item.id(), 1));
        }
    }

    /**
     * Removes up to {@code quantity} units, dropping entries that reach zero.
     * @return false if fewer than {@code quantity} units were held (nothing removed)
     */
    public static boolean remove(GameState state, String itemId, int quantity) {
        if (count(state, itemId) < quantity || quantity <= 0) return false;
        int left = quantity;
        Iterator<InventoryItem> it = state.getInventory().iterator();
        while (it.hasNext() && left > 0) {
            InventoryItem entry = it.next();
            if (!entry.getItemId().equals(itemId)) continue;
            int take = Math.min(left, entry.getQuantity());
            entry.setQuantity(entry.getQuantity() - take);
            left -= take;
            if (entry.getQuantity() <= 0) it.remove();
        }
        return true;
    }

    public static int count(GameState state, String itemId) {
        int n = 0;
        for (InventoryItem it : state.getInventory()) {
            if (it.getItemId().equals(itemId)) n += it.getQuantity();
        }
        return n;
    }

    public static boolean has(GameState state, String itemId) {
        return count(state, itemId) > 0;
    }

    public static boolean hasCategory(GameState state, GameData data, ItemCategory category) {
        for (InventoryItem it : state.getInventory()) {
            ItemDef def = data.item(it.getItemId());
            if (def != null && def.category() == category) return true;
        }
        return false;
    }
}
