package model.systems;

import config.GameData;
import model.GameState;
import model.Inventory;
import model.ScriptedDice;
import model.SimulationContext;
import model.TestStates;
import model.paths.PathRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventSystemTest {
    private EventSystem events;

    @BeforeEach
    void setUp() {
        GameData data = TestStates.data();
        SimulationContext ctx = TestStates.ctx(ScriptedDice.quiet());
        events = new EventSystem(data, new UnlockSystem(data, new PathRules(data), ctx), ctx);
    }

    @Test
    void choiceAppliesKarmaAndRewards() {
        GameState s = TestStates.playing();
        s.setPendingEventId("traveler");

        assertTrue(events.chooseEventOption(s, 2).ok());
        assertEquals(-5, s.getCharacter().getKarma());
        assertEquals(20, s.getSpiritStones());
        assertNull(s.getPendingEventId());
    }

    @Test
    void rewardItemsStack() {
        GameState s = TestStates.playing();
        s.setPendingEventId("herb_garden");
        events.chooseEventOption(s, 0);
        assertEquals(2, Inventory.count(s, "common_herb"));
    }

    @Test
    void invalidChoiceKeepsTheEventWaiting() {
        GameState s = TestStates.playing();
        s.setPendingEventId("traveler");

        assertFalse(events.chooseEventOption(s, 3).ok());
        assertFalse(events.chooseEventOption(s, -1).ok());
        assertEquals("traveler", s.getPendingEventId());
        assertEquals(0, s.getCharacter().getKarma());
    }

    @Test
    void nothingToChooseWithoutAnEvent() {
        assertFalse(events.chooseEventOption(TestStates.playing(), 0).ok());
    }

    @Test
    void darkBargainOpensTheDevilPaths() {
        GameState s = TestStates.playing();
        s.setPendingEventId("voice_offers_power");
        events.chooseEventOption(s, 0);

        assertEquals(-200, s.getCharacter().getKarma());
        assertEquals(500, s.getSpiritStones());
        assertTrue(s.hasUnlocked("devil_soul"));
        assertTrue(s.hasUnlocked("devil_body"));
        assertTrue(s.getCharacter().isDevilMark());
    }

    @Test
    void scriptureRewardOpensSpirit() {
        GameState s = TestStates.playing();
        s.setPendingEventId("dying_immortal");
        events.chooseEventOption(s, 0);

        assertTrue(Inventory.has(s, "epic_scripture"));
        assertTrue(s.hasUnlocked("spirit"));
        assertEquals(10, s.getCharacter().getKarma());
    }
}
