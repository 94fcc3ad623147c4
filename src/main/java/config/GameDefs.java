package config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Static world definitions as they appear in the data/*.json resources. */
public final class GameDefs {
    private GameDefs() {}

    /** One cultivation path; speed and unlock rules live in model.paths.PathRules. */
    public static record PathDef(
            String id,
            String name,
            String subtitle,
            ActionType action,
            String unlockCondition,
            List<String> levels
    ) {
        public PathDef {
            if (levels == null) levels = List.of();
        }

        public String levelName(int level) {
            if (level < 1 || level > levels.size()) return "Unknown";
            return levels.get(level - 1);
        }
    }

    public static record LootEntry(String itemId, double weight, int minDanger) { }

    public static record RegionDef(
            String id,
            String name,
            Realm realm,
            int dangerLevel,
            String terrain,
            @JsonProperty("hasShop") boolean hasShop,
            @JsonProperty("isCity") boolean city,
            String description,
            List<String> connections,
            List<LootEntry> lootTable,
            List<String> eventPool
    ) {
        public RegionDef {
            if (connections == null) connections = List.of();
            if (lootTable == null) lootTable = List.of();
            if (eventPool == null) eventPool = List.of();
        }
    }

    /** Zero / false means "no such effect". */
    public static record ItemEffects(
            double breakthroughBonus,
            double xpMultiplier,
            int xpMultiplierDuration,
            boolean healQiDeviation,
            boolean preserveInventory,
            boolean preserveRolls,
            double tribulationHpBonus
    ) {
        public static final ItemEffects NONE = new ItemEffects(0, 0, 0, false, false, false, 0);
    }

    public static record ItemDef(
            String id,
            String name,
            ItemCategory category,
            Rarity rarity,
            String description,
            ItemEffects effects,
            long sellValue,
            boolean stackable
    ) {
        public ItemDef {
            if (effects == null) effects = ItemEffects.NONE;
            if (rarity == null) rarity = Rarity.COMMON;
        }
    }

    public static record EventRewards(long spiritStones, List<String> items) {
        public static final EventRewards NONE = new EventRewards(0, List.of());

        public EventRewards {
            if (items == null) items = List.of();
        }
    }

    public static record EventLosses(long spiritStones, int timePenalty) {
        public static final EventLosses NONE = new EventLosses(0, 0);
    }

    public static record EventChoice(String text, int karmaChange, EventRewards rewards, EventLosses losses) {
        public EventChoice {
            if (rewards == null) rewards = EventRewards.NONE;
            if (losses == null) losses = EventLosses.NONE;
        }
    }

    public static record EventDef(String id, String title, boolean fated, String description, List<EventChoice> choices) {
        public EventDef {
            if (choices == null) choices = List.of();
        }
    }

    public static record KarmaRange(int min, int max) {
        public boolean contains(int karma) { return karma >= min && karma <= max; }
    }

    public static record MissionOption(long reward, int karmaChange, String description) { }

    public static record MissionDef(
            String id,
            String name,
            String description,
            int duration,
            MissionOption helpOption,
            MissionOption exploitOption
    ) { }

    public static record GroupDef(
            String id,
            String name,
            String type,
            KarmaRange karmaRequirement,
            String description,
            String location,
            List<MissionDef> missions
    ) {
        public GroupDef {
            if (missions == null) missions = List.of();
        }
    }

    public static record SpiritRoot(String name, double qiMultiplier, double probability, String description) { }

    public static record BodyType(
            String name,
            double bodyMultiplier,
            double qiBonusMultiplier,
            double probability,
            String description
    ) { }

    public static record BonusEffect(
            double explorationBonus,
            long spiritStones,
            double luckBonus,
            boolean sectAccess,
            double shopDiscount,
            double hiddenLuck,
            boolean randomScripture
    ) {
        public static final BonusEffect NONE = new BonusEffect(0, 0, 0, false, 0, 0, false);
    }

    public static record Background(
            String id,
            String name,
            String startLocation,
            String bonus,
            String description,
            BonusEffect bonusEffect
    ) {
        public Background {
            if (bonusEffect == null) bonusEffect = BonusEffect.NONE;
        }
    }

    public static record ShopRealm(Realm realm, double priceMultiplier, List<String> items) {
        public ShopRealm {
            if (items == null) items = List.of();
        }
    }

    // ---- file wrappers ----
    public static record PathPack(List<PathDef> paths) { }
    public static record RegionPack(List<RegionDef> regions) { }
    public static record ItemPack(List<ItemDef> items) { }
    public static record EventPack(List<EventDef> events) { }
    public static record GroupPack(List<GroupDef> groups) { }
    public static record ShopPack(List<ShopRealm> realms) { }
    public static record CharacterPack(List<SpiritRoot> spiritRoots, List<BodyType> bodyTypes, List<Background> backgrounds) { }
}
