package model.paths;

import config.GameData;
import config.GameDefs.RegionDef;
import config.ItemCategory;
import config.Realm;
import model.Character;
import model.GameState;
import model.Inventory;

import java.util.HashMap;
import java.util.Map;

/** Dispatch table from path id to its speed function and unlock predicate. */
public final class PathRules {
    public static final int DEVIL_KARMA = -100;

    private final Map<String, PathRule> rules = new HashMap<>();

    public PathRules(GameData data) {
        rules.put("spirit", new PathRule(
                s -> ch(s).qi() + ch(s).qiBonus(),
                s -> s.getEquippedScripture() != null || Inventory.hasCategory(s, data, ItemCategory.SCRIPTURE)));
        rules.put("martial", new PathRule(
                s -> ch(s).body(),
                s -> true));
        rules.put("rogue", new PathRule(
                s -> (ch(s).qi() + ch(s).qiBonus()) * 0.8,
                s -> ch(s).isRogueStatus()));
        rules.put("devil_soul", new PathRule(
                s -> (ch(s).qi() + ch(s).qiBonus()) * 1.2,
                s -> ch(s).getKarma() <= DEVIL_KARMA));
        rules.put("devil_body", new PathRule(
                s -> ch(s).body() * 1.2,
                s -> ch(s).getKarma() <= DEVIL_KARMA));
        rules.put("alchemy", new PathRule(
                s -> ch(s).qi() * 0.5 + 0.5,
                s -> Inventory.has(s, "alchemy_manual")));
        rules.put("formations", new PathRule(
                s -> ch(s).qi() * 0.5 + 0.5,
                s -> Inventory.has(s, "formation_blueprint")));
        // only opened by the special roll in spirit_beast_territory
        rules.put("beast_tamer", new PathRule(
                s -> (ch(s).qi() + ch(s).body()) * 0.5,
                s -> false));
        rules.put("artificer", new PathRule(
                s -> ch(s).body() * 0.5 + 0.5,
                s -> Inventory.has(s, "artificer_blueprint")));
        rules.put("oracle", new PathRule(
                s -> ch(s).qi() * 0.7 + ch(s).getLuck() * 0.5,
                s -> s.isKarmaVisible() && Inventory.has(s, "divination_manual")));
        rules.put("harmonic", new PathRule(
                s -> ch(s).qi() * 0.8,
                s -> Inventory.has(s, "harmonic_scripture") && Inventory.has(s, "musical_instrument")));
        rules.put("scholar", new PathRule(
                s -> ch(s).qi() * 0.6 + 0.4,
                s -> Inventory.has(s, "ancient_text")));
        rules.put("bloodline", new PathRule(
                s -> ch(s).body() * 0.6,
                s -> ch(s).body() >= 1.5 || Inventory.has(s, "bloodline_elixir")));
        // only opened by the special roll while cultivating
        rules.put("dream", new PathRule(
                s -> ch(s).qi() * 0.7,
                s -> false));
        rules.put("necromancy", new PathRule(
                s -> ch(s).qi() * 0.9,
                s -> hasVisitedUnderworld(s, data) || Inventory.has(s, "book_of_the_dead")));
    }

    public PathRule of(String pathId) {
        return pathId == null ? PathRule.INERT : rules.getOrDefault(pathId, PathRule.INERT);
    }

    public double speed(String pathId, GameState state) {
        return of(pathId).speedFor(state);
    }

    public boolean canUnlock(String pathId, GameState state) {
        return of(pathId).canUnlock(state);
    }

    private static Character ch(GameState s) {
        return s.getCharacter();
    }

    private static boolean hasVisitedUnderworld(GameState s, GameData data) {
        for (String id : s.getDiscoveredRegions()) {
            RegionDef r = data.region(id);
            if (r != null && r.realm() == Realm.UNDERWORLD) return true;
        }
        return false;
    }
}
