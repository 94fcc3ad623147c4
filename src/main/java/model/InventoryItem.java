package model;

public class InventoryItem {
    private String itemId;
    private int    quantity;

    public InventoryItem() { }

    public InventoryItem(String itemId, int quantity) {
        this.itemId = itemId;
        this.quantity = quantity;
    }

    public String getItemId()          { return itemId; }
    public void   setItemId(String id) { this.itemId = id; }
    public int    getQuantity()        { return quantity; }
    public void   setQuantity(int q)   { this.quantity = q; }

    public InventoryItem copy() { return new InventoryItem(itemId, quantity); }
}
