package config;

import config.GameDefs.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Read-only registry of the static world: paths, regions, items, events,
 * groups, creation tables and shop stock. Loaded once on first use.
 */
public final class GameData {
    private static final Logger log = Logger.getLogger(GameData.class.getName());
    private static GameData instance;

    private final Map<String, PathDef>   paths   = new LinkedHashMap<>();
    private final Map<String, RegionDef> regions = new LinkedHashMap<>();
    private final Map<String, ItemDef>   items   = new LinkedHashMap<>();
    private final Map<String, EventDef>  events  = new LinkedHashMap<>();
    private final Map<String, GroupDef>  groups  = new LinkedHashMap<>();
    private final Map<Realm, ShopRealm>  shops   = new EnumMap<>(Realm.class);

    private final List<SpiritRoot> spiritRoots;
    private final List<BodyType>   bodyTypes;
    private final List<Background> backgrounds;

    private GameData() {
        this(DataLoader.load("paths.json",     PathPack.class),
             DataLoader.load("regions.json",   RegionPack.class),
             DataLoader.load("items.json",     ItemPack.class),
             DataLoader.load("events.json",    EventPack.class),
             DataLoader.load("groups.json",    GroupPack.class),
             DataLoader.load("character.json", CharacterPack.class),
             DataLoader.load("shops.json",     ShopPack.class));
    }

    GameData(PathPack p, RegionPack r, ItemPack i, EventPack e, GroupPack g, CharacterPack c, ShopPack s) {
        for (PathDef d : nonNull(p.paths()))     paths.put(d.id(), d);
        for (RegionDef d : nonNull(r.regions())) regions.put(d.id(), d);
        for (ItemDef d : nonNull(i.items()))     items.put(d.id(), d);
        for (EventDef d : nonNull(e.events()))   events.put(d.id(), d);
        for (GroupDef d : nonNull(g.groups()))   groups.put(d.id(), d);
        for (ShopRealm d : nonNull(s.realms()))  shops.put(d.realm(), d);

        spiritRoots = List.copyOf(nonNull(c.spiritRoots()));
        bodyTypes   = List.copyOf(nonNull(c.bodyTypes()));
        backgrounds = List.copyOf(nonNull(c.backgrounds()));

        if (paths.isEmpty() || regions.isEmpty() || spiritRoots.isEmpty()
                || bodyTypes.isEmpty() || backgrounds.isEmpty()) {
            throw new IllegalStateException("Static data is incomplete: paths, regions and creation tables are required");
        }
        checkReferences();
        log.info(() -> "[Data] Loaded " + paths.size() + " paths, " + regions.size() + " regions, "
                + items.size() + " items, " + events.size() + " events, " + groups.size() + " groups");
    }

    public static synchronized GameData getInstance() {
        if (instance == null) instance = new GameData();
        return instance;
    }

    // ---------- lookups (null when unknown) ----------

    public PathDef   path(String id)   { return id == null ? null : paths.get(id); }
    public RegionDef region(String id) { return id == null ? null : regions.get(id); }
    public ItemDef   item(String id)   { return id == null ? null : items.get(id); }
    public EventDef  event(String id)  { return id == null ? null : events.get(id); }
    public GroupDef  group(String id)  { return id == null ? null : groups.get(id); }
    public ShopRealm shop(Realm realm) { return realm == null ? null : shops.get(realm); }

    public List<PathDef>   paths()   { return List.copyOf(paths.values()); }
    public List<RegionDef> regions() { return List.copyOf(regions.values()); }
    public List<ItemDef>   items()   { return List.copyOf(items.values()); }
    public List<EventDef>  events()  { return List.copyOf(events.values()); }
    public List<GroupDef>  groups()  { return List.copyOf(groups.values()); }

    public List<SpiritRoot> spiritRoots() { return spiritRoots; }
    public List<BodyType>   bodyTypes()   { return bodyTypes; }
    public List<Background> backgrounds() { return backgrounds; }

    public List<EventDef> fatedEvents() {
        List<EventDef> out = new ArrayList<>();
        for (EventDef e : events.values()) if (e.fated()) out.add(e);
        return out;
    }

    public List<ItemDef> itemsIn(ItemCategory category) {
        List<ItemDef> out = new ArrayList<>();
        for (ItemDef d : items.values()) if (d.category() == category) out.add(d);
        return out;
    }

    public Background background(String id) {
        for (Background b : backgrounds) if (b.id().equals(id)) return b;
        return null;
    }

    // ---------- internals ----------

    /** Dangling ids are tolerated at runtime (lookups return null) but worth a warning. */
    private void checkReferences() {
        for (RegionDef r : regions.values()) {
            for (String c : r.connections()) {
                if (!regions.containsKey(c)) log.warning("[Data] Region " + r.id() + " connects to unknown region " + c);
            }
            for (LootEntry le : r.lootTable()) {
                if (!items.containsKey(le.itemId())) log.warning("[Data] Region " + r.id() + " drops unknown item " + le.itemId());
            }
            for (String ev : r.eventPool()) {
                if (!events.containsKey(ev)) log.warning("[Data] Region " + r.id() + " lists unknown event " + ev);
            }
        }
        for (Background b : backgrounds) {
            if (!regions.containsKey(b.startLocation())) {
                log.warning("[Data] Background " + b.id() + " starts in unknown region " + b.startLocation());
            }
        }
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? Collections.emptyList() : list;
    }
}
