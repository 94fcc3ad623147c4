package model;

import config.ActionType;
import config.GameData;
import config.GameDefs.BodyType;
import config.GameDefs.SpiritRoot;
import model.systems.CharacterCreation;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/** Deterministic characters and states for engine tests. */
public final class TestStates {
    public static final long NOW = 1_700_000_000_000L;

    private TestStates() {}

    public static GameData data() {
        return GameData.getInstance();
    }

    public static Clock clock() {
        return Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
    }

    public static SimulationContext ctx(Dice dice) {
        return new SimulationContext(dice, clock());
    }

    /** Earth Root (1.0 qi), Vajra Body (1.2 body), luck 0.5. */
    public static Character character(String backgroundId) {
        GameData data = data();
        SpiritRoot root = data.spiritRoots().get(2);
        BodyType body = data.bodyTypes().get(2);
        return new Character("Lin Feng", root, body, data.background(backgroundId), 0.5);
    }

    /** A fresh life in the village, martial active and idle. */
    public static GameState playing() {
        return playing("village_orphan");
    }

    public static GameState playing(String backgroundId) {
        CharacterCreation creation = new CharacterCreation(data(), ctx(ScriptedDice.quiet()));
        return creation.createInitialState(character(backgroundId));
    }

    /** Martial at {@code level} with a full bar, training. */
    public static GameState readyMartial(int level) {
        GameState s = playing();
        PathProgress pp = s.progressOf("martial");
        pp.resetTo(level, 0);
        pp.setCurrentXp(pp.getXpRequired());
        pp.setBreakthroughAvailable(true);
        s.setCurrentAction(ActionType.TRAIN);
        s.refreshHighestLevel();
        return s;
    }

    public static void give(GameState s, String itemId, int quantity) {
        Inventory.add(s, data().item(itemId), quantity);
    }

    public static boolean logContains(GameState s, String fragment) {
        for (LogEntry e : s.getLog()) if (e.text().contains(fragment)) return true;
        return false;
    }
}
