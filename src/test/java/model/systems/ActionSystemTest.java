package model.systems;

import config.ActionType;
import model.GameState;
import model.PathProgress;
import model.ScriptedDice;
import model.TestStates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActionSystemTest {
    private ActionSystem actions;
    private GameState s;

    @BeforeEach
    void setUp() {
        actions = new ActionSystem(TestStates.data(), TestStates.ctx(ScriptedDice.quiet()));
        s = TestStates.playing();
    }

    @Test
    void cultivatingNeedsAnUnlockedQiPath() {
        assertFalse(actions.setAction(s, ActionType.CULTIVATE).ok());
        assertEquals(ActionType.IDLE, s.getCurrentAction());
        assertTrue(TestStates.logContains(s, "Cultivation Scripture"));

        s.getPathProgress().put("spirit", PathProgress.unlockedAtStart("spirit"));
        assertTrue(actions.setAction(s, ActionType.CULTIVATE).ok());
        assertEquals(ActionType.CULTIVATE, s.getCurrentAction());
        assertEquals("spirit", s.getActivePathId());
    }

    @Test
    void choosingTheSameActionAgainStops() {
        actions.setAction(s, ActionType.TRAIN);
        assertEquals(ActionType.TRAIN, s.getCurrentAction());
        actions.setAction(s, ActionType.TRAIN);
        assertEquals(ActionType.IDLE, s.getCurrentAction());
    }

    @Test
    void exploringKeepsTheActivePath() {
        s.setActivePathId("martial");
        assertTrue(actions.setAction(s, ActionType.EXPLORE).ok());
        assertEquals("martial", s.getActivePathId());
    }

    @Test
    void craftActionsNeedTheirPath() {
        assertFalse(actions.setAction(s, ActionType.REFINE).ok());
        s.getPathProgress().put("alchemy", PathProgress.unlockedAtStart("alchemy"));
        assertTrue(actions.setAction(s, ActionType.REFINE).ok());
        assertEquals("alchemy", s.getActivePathId());
    }

    @Test
    void travelersCannotChangeAction() {
        s.getTravel().depart("forest_path", 90);
        assertFalse(actions.setAction(s, ActionType.TRAIN).ok());
    }

    @Test
    void selectingAPathSwitchesToItsAction() {
        assertFalse(actions.selectPath(s, "spirit").ok(), "locked");
        assertFalse(actions.selectPath(s, "nowhere").ok());

        s.getPathProgress().put("spirit", PathProgress.unlockedAtStart("spirit"));
        assertTrue(actions.selectPath(s, "spirit").ok());
        assertEquals("spirit", s.getActivePathId());
        assertEquals(ActionType.CULTIVATE, s.getCurrentAction());
    }

    @Test
    void goingRogueLeavesTheGroup() {
        s.setGroupMembership("azure_cloud_sect");
        actions.toggleRogue(s);
        assertTrue(s.getCharacter().isRogueStatus());
        assertNull(s.getGroupMembership());

        actions.toggleRogue(s);
        assertFalse(s.getCharacter().isRogueStatus());
    }
}
