package model.systems;

import config.GameData;
import config.Rarity;
import model.GameState;
import model.Inventory;
import model.LogType;
import model.ScriptedDice;
import model.SimulationContext;
import model.TestStates;
import model.paths.PathRules;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExplorationSystemTest {

    private static ExplorationSystem system(ScriptedDice dice) {
        GameData data = TestStates.data();
        SimulationContext ctx = TestStates.ctx(dice);
        return new ExplorationSystem(data, new UnlockSystem(data, new PathRules(data), ctx), ctx);
    }

    /** Off the event schedule, in the village. */
    private static GameState explorer() {
        GameState s = TestStates.playing();
        s.setTickCount(1);
        return s;
    }

    @Test
    void discoveryChanceAddsLuckBackgroundAndRogue() {
        GameState s = explorer();
        assertEquals(0.005 + 0.5 * 0.025 + 0.10, ExplorationSystem.discoveryChance(s), 1e-9);
        s.getCharacter().setRogueStatus(true);
        assertEquals(0.005 + 0.5 * 0.025 + 0.10 + 0.005, ExplorationSystem.discoveryChance(s), 1e-9);
    }

    @Test
    void trickleFindsAFewStones() {
        GameState s = explorer();
        // trickle hit, amount 3, no log line
        system(ScriptedDice.quiet(0.0, 0.999, 0.999)).explore(s);
        assertEquals(3, s.getSpiritStones());
    }

    @Test
    void pouchesTurnIntoStones() {
        GameState s = explorer();
        // trickle miss, discovery hit, last loot entry (small pouch), top of 5..15
        system(ScriptedDice.quiet(0.999, 0.0, 0.999, 0.999)).explore(s);
        assertEquals(15, s.getSpiritStones());
        assertTrue(s.getInventory().isEmpty());
    }

    @Test
    void discoveredItemsGoToTheInventory() {
        GameState s = explorer();
        system(ScriptedDice.quiet(0.999, 0.0, 0.0)).explore(s);
        assertEquals(1, Inventory.count(s, "common_herb"));
        assertTrue(TestStates.logContains(s, "Found: Common Spirit Herb"));
    }

    @Test
    void eventsArriveOnSchedule() {
        GameState s = explorer();
        s.setTickCount(ExplorationSystem.EVENT_INTERVAL_TICKS);
        // trickle, discovery and fated miss; first entry of the village pool
        system(ScriptedDice.quiet(0.999, 0.999, 0.999, 0.0)).explore(s);
        assertEquals("traveler", s.getPendingEventId());
    }

    @Test
    void pendingEventIsNeverReplaced() {
        GameState s = explorer();
        s.setPendingEventId("herb_garden");
        s.setTickCount(ExplorationSystem.EVENT_INTERVAL_TICKS);
        system(ScriptedDice.quiet(0.999, 0.999, 0.0, 0.0)).explore(s);
        assertEquals("herb_garden", s.getPendingEventId());
    }

    @Test
    void fatedEncountersFallBackToTheGlobalPool() {
        GameState s = explorer();
        // fated hit; the village has no fated events of its own
        system(ScriptedDice.quiet(0.999, 0.999, 0.0, 0.0)).explore(s);
        assertEquals("dying_immortal", s.getPendingEventId());
    }

    @Test
    void rareFindsAreLoggedLouder() {
        assertEquals(LogType.LEGENDARY, ExplorationSystem.logTypeFor(Rarity.MYTHIC));
        assertEquals(LogType.SUCCESS, ExplorationSystem.logTypeFor(Rarity.RARE));
        assertEquals(LogType.INFO, ExplorationSystem.logTypeFor(Rarity.COMMON));
    }
}
