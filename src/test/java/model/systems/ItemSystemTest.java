package model.systems;

import model.ActiveBuff;
import model.GameState;
import model.Inventory;
import model.ScriptedDice;
import model.TestStates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ItemSystemTest {
    private ItemSystem items;

    @BeforeEach
    void setUp() {
        items = new ItemSystem(TestStates.data(), TestStates.ctx(ScriptedDice.quiet()));
    }

    @Test
    void boostsGetPricierWhileStacked() {
        GameState s = TestStates.playing();
        s.setSpiritStones(100);

        assertEquals(10, ItemSystem.boostCost(s));
        assertTrue(items.buyBoost(s).ok());
        assertEquals(20, ItemSystem.boostCost(s));
        assertTrue(items.buyBoost(s).ok());
        assertEquals(70, s.getSpiritStones());

        ActiveBuff b = s.getBuffs().get(0);
        assertEquals(ItemSystem.BOOST_MULT, b.getMultiplier());
        assertEquals(ItemSystem.BOOST_SECONDS, b.getRemainingSeconds());
    }

    @Test
    void boostNeedsStones() {
        GameState s = TestStates.playing();
        s.setSpiritStones(9);
        assertFalse(items.buyBoost(s).ok());
        assertTrue(s.getBuffs().isEmpty());
    }

    @Test
    void pillsGrantTimedMultipliers() {
        GameState s = TestStates.playing();
        TestStates.give(s, "basic_pill", 2);

        assertTrue(items.useItem(s, "basic_pill").ok());
        assertEquals(1, Inventory.count(s, "basic_pill"));
        assertEquals(1.5, s.getBuffs().get(0).getMultiplier(), 1e-9);
        assertEquals(300, s.getBuffs().get(0).getRemainingSeconds());

        items.useItem(s, "basic_pill");
        assertEquals(2, s.getBuffs().size());
        assertNotEquals(s.getBuffs().get(0).getId(), s.getBuffs().get(1).getId());
    }

    @Test
    void cureClearsDeviation() {
        GameState s = TestStates.playing();
        s.getQiDeviation().start(1800);
        TestStates.give(s, "deviation_cure", 1);

        assertTrue(items.useItem(s, "deviation_cure").ok());
        assertFalse(s.getQiDeviation().isActive());
        assertFalse(Inventory.has(s, "deviation_cure"));
    }

    @Test
    void onlyHeldPillsCanBeUsed() {
        GameState s = TestStates.playing();
        assertFalse(items.useItem(s, "basic_pill").ok());
        TestStates.give(s, "rare_herb", 1);
        assertFalse(items.useItem(s, "rare_herb").ok());
        assertEquals(1, Inventory.count(s, "rare_herb"));
    }

    @Test
    void onlyScripturesCanBeEquipped() {
        GameState s = TestStates.playing();
        TestStates.give(s, "basic_pill", 1);
        assertFalse(items.equipScripture(s, "basic_pill").ok());
        assertFalse(items.equipScripture(s, "epic_scripture").ok());

        TestStates.give(s, "epic_scripture", 1);
        assertTrue(items.equipScripture(s, "epic_scripture").ok());
        assertEquals("epic_scripture", s.getEquippedScripture());
    }
}
