package server;

import common.dto.CommandResult;
import common.dto.SnapshotDTO;
import common.dto.cmd.*;
import config.ActionType;
import config.SessionConfig;
import model.GamePhase;
import model.GameState;
import model.Inventory;
import model.ScriptedDice;
import model.TestStates;
import model.systems.OfflineReport;
import model.systems.Tribulation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class GameSessionTest {

    /** Collects strike tasks so the test decides when each one fires. */
    private static final class ManualTimer implements GameSession.StrikeTimer {
        final List<Runnable> tasks = new ArrayList<>();
        final List<Long> delays = new ArrayList<>();
        final List<CompletableFuture<Void>> futures = new ArrayList<>();

        @Override
        public Future<?> schedule(Runnable task, long delayMillis) {
            CompletableFuture<Void> f = new CompletableFuture<>();
            tasks.add(task);
            delays.add(delayMillis);
            futures.add(f);
            return f;
        }

        Runnable last() { return tasks.get(tasks.size() - 1); }

        void fireLast() { last().run(); }

        long lastDelay() { return delays.get(delays.size() - 1); }
    }

    private ManualTimer timer;
    private long seq;

    @BeforeEach
    void setUp() {
        timer = new ManualTimer();
        seq = 0;
    }

    private GameSession session(ScriptedDice dice, GameState state) {
        GameSession session = new GameSession(TestStates.data(), TestStates.ctx(dice), SessionConfig.DEFAULTS);
        session.attachTimer(timer);
        if (state != null) session.load(state);
        return session;
    }

    private long next() { return ++seq; }

    // ---- command gate ----

    @Test
    void nothingRunsWithoutAGame() {
        CommandResult r = session(ScriptedDice.quiet(), null).apply(new BuyBoostCmd(1));
        assertFalse(r.ok());
        assertEquals("No game loaded", r.message());
    }

    @Test
    void creationPhaseAcceptsOnlyCreationCommands() {
        GameSession session = session(ScriptedDice.quiet(), null);
        session.beginNewGame("Wei");
        assertEquals(GamePhase.CHARACTER_CREATION, session.state().getGamePhase());

        assertFalse(session.apply(new SetActionCmd(next(), ActionType.TRAIN)).ok());
        assertTrue(session.apply(new RerollCmd(next())).ok());
        assertTrue(session.apply(new ConfirmCharacterCmd(next())).ok());
        assertEquals(GamePhase.PLAYING, session.state().getGamePhase());

        CommandResult late = session.apply(new RerollCmd(next()));
        assertFalse(late.ok());
        assertEquals("Character already chosen", late.message());
        assertTrue(session.apply(new SetActionCmd(next(), ActionType.TRAIN)).ok());
    }

    @Test
    void repeatedSequenceNumbersAreDropped() {
        GameSession session = session(ScriptedDice.quiet(), TestStates.playing());
        session.state().setSpiritStones(100);

        assertTrue(session.apply(new BuyBoostCmd(7)).ok());
        CommandResult dup = session.apply(new BuyBoostCmd(7));
        assertFalse(dup.ok());
        assertTrue(dup.message().startsWith("Duplicate"));
        assertEquals(90, session.state().getSpiritStones());
    }

    @Test
    void creationPhaseDoesNotTick() {
        GameSession session = session(ScriptedDice.quiet(), null);
        session.beginNewGame("Wei");
        session.tick();
        assertEquals(0, session.state().getTickCount());
    }

    // ---- ticking ----

    @Test
    void clickBoostDoublesExactlyOneTick() {
        GameSession session = session(ScriptedDice.quiet(), TestStates.playing());
        session.apply(new SetActionCmd(next(), ActionType.TRAIN));
        session.apply(new ClickBoostCmd(next()));

        session.tick();
        assertEquals(2.4, session.state().progressOf("martial").getCurrentXp(), 1e-9);
        session.tick();
        assertEquals(3.6, session.state().progressOf("martial").getCurrentXp(), 1e-9);
    }

    @Test
    void catchUpRunsOnce() {
        GameState s = TestStates.playing();
        s.setLastSaveTimestamp(TestStates.NOW - 3_600_000);
        GameSession session = session(ScriptedDice.quiet(), s);

        OfflineReport first = session.catchUp();
        assertEquals(3600, first.elapsedSeconds());
        assertSame(OfflineReport.NONE, session.catchUp());
        assertEquals(6, session.state().getSpiritStones());
    }

    @Test
    void snapshotReflectsTheGame() {
        GameSession session = session(ScriptedDice.quiet(), TestStates.playing());
        SnapshotDTO snap = session.snapshot();

        assertEquals("playing", snap.phase());
        assertEquals("Lin Feng", snap.character().name());
        assertEquals("Peaceful Village", snap.location());
        assertEquals(12, snap.power());
        assertEquals(1, snap.paths().size());
        assertNull(snap.tribulation());
        assertFalse(snap.log().isEmpty());
    }

    // ---- breakthroughs ----

    @Test
    void breakthroughNeedsAFullBar() {
        GameSession session = session(ScriptedDice.quiet(), TestStates.playing());
        CommandResult r = session.apply(new AttemptBreakthroughCmd(next()));
        assertFalse(r.ok());
        assertEquals("Not ready", r.message());
    }

    @Test
    void pillsAreSpentOnTheAttempt() {
        GameState s = TestStates.readyMartial(1);
        TestStates.give(s, "breakthrough_pill", 2);
        GameSession session = session(ScriptedDice.quiet(0.0), s);

        CommandResult r = session.apply(new AttemptBreakthroughCmd(next()));
        assertTrue(r.ok());
        assertEquals("SUCCESS", r.outcome());
        assertEquals(2, session.state().progressOf("martial").getCurrentLevel());
        assertFalse(Inventory.has(session.state(), "breakthrough_pill"));
    }

    @Test
    void deathStartsANewLife() {
        GameState s = TestStates.readyMartial(3);
        GameSession session = session(ScriptedDice.quiet(0.99, 0.01), s);

        CommandResult r = session.apply(new AttemptBreakthroughCmd(next()));
        assertTrue(r.ok(), "the roll itself was accepted");
        assertEquals("DEATH", r.outcome());
        assertNotSame(s, session.state());
        assertEquals(1, session.state().getTotalDeaths());
        assertEquals(1, session.state().getCharacter().getRebirthCount());
    }

    // ---- tribulation ----

    @Test
    void tierBoundaryStartsATribulationInsteadOfRolling() {
        ScriptedDice dice = ScriptedDice.quiet();
        GameSession session = session(dice, TestStates.readyMartial(4));

        assertTrue(session.apply(new AttemptBreakthroughCmd(next())).ok());
        assertNotNull(session.tribulation());
        assertEquals(SessionConfig.DEFAULTS.strikeLeadInMillis(), timer.lastDelay());
        assertEquals(0, dice.draws());
        assertFalse(session.apply(new AttemptBreakthroughCmd(next())).ok(), "one at a time");
        assertNotNull(session.snapshot().tribulation());
    }

    @Test
    void resistingEveryStrikeBreaksThrough() {
        GameSession session = session(ScriptedDice.quiet(), TestStates.readyMartial(4));
        session.apply(new AttemptBreakthroughCmd(next()));

        for (int i = 0; i < 3; i++) {
            timer.fireLast();
            assertTrue(session.tribulation().strikeArmed());
            assertEquals(3000, timer.lastDelay(), "strike window");
            Future<?> expiry = timer.futures.get(timer.futures.size() - 1);
            assertTrue(session.apply(new ResistStrikeCmd(next())).ok());
            assertTrue(expiry.isCancelled());
        }

        assertNull(session.tribulation());
        assertEquals(5, session.state().progressOf("martial").getCurrentLevel());
    }

    @Test
    void resistingTooEarlyFails() {
        GameSession session = session(ScriptedDice.quiet(), TestStates.readyMartial(4));
        session.apply(new AttemptBreakthroughCmd(next()));
        assertFalse(session.apply(new ResistStrikeCmd(next())).ok());
    }

    @Test
    void missedWindowLandsTheStrike() {
        GameSession session = session(ScriptedDice.quiet(), TestStates.readyMartial(4));
        session.apply(new AttemptBreakthroughCmd(next()));

        timer.fireLast();
        timer.fireLast();
        Tribulation t = session.tribulation();
        assertEquals(45, t.hp());
        assertEquals(1, t.currentStrike());
        assertEquals(SessionConfig.DEFAULTS.strikeGapMillis(), timer.lastDelay());
    }

    @Test
    void givingInLandsTheArmedStrike() {
        GameSession session = session(ScriptedDice.quiet(), TestStates.readyMartial(4));
        session.apply(new AttemptBreakthroughCmd(next()));
        assertFalse(session.apply(new FailStrikeCmd(next())).ok(), "nothing armed yet");

        timer.fireLast();
        Future<?> expiry = timer.futures.get(timer.futures.size() - 1);
        assertTrue(session.apply(new FailStrikeCmd(next())).ok());

        Tribulation t = session.tribulation();
        assertTrue(expiry.isCancelled());
        assertEquals(t.maxHp() - (int) Math.floor(t.maxHp() * 0.3), t.hp());
        assertEquals(1, t.currentStrike());
        assertFalse(t.strikeArmed());
        assertEquals(SessionConfig.DEFAULTS.strikeGapMillis(), timer.lastDelay());
    }

    @Test
    void expiryAfterAResistIsIgnored() {
        GameSession session = session(ScriptedDice.quiet(), TestStates.readyMartial(4));
        session.apply(new AttemptBreakthroughCmd(next()));
        timer.fireLast();
        Runnable expiry = timer.last();
        session.apply(new ResistStrikeCmd(next()));

        expiry.run();
        assertEquals(session.tribulation().maxHp(), session.tribulation().hp());
    }

    @Test
    void abandonedTribulationIgnoresLeftoverTasks() {
        GameState s = TestStates.readyMartial(4);
        GameSession session = session(ScriptedDice.quiet(), s);
        session.apply(new AttemptBreakthroughCmd(next()));
        Runnable arm = timer.last();

        assertTrue(session.apply(new AbandonTribulationCmd(next())).ok());
        arm.run();
        assertNull(session.tribulation());
        assertTrue(s.progressOf("martial").isBreakthroughAvailable(), "the breakthrough waits");
        assertEquals(4, s.progressOf("martial").getCurrentLevel());
    }

    @Test
    void losingTheTribulationMeansRebirth() {
        GameState s = TestStates.readyMartial(8);
        GameSession session = session(ScriptedDice.quiet(), s);
        session.apply(new AttemptBreakthroughCmd(next()));

        for (int i = 0; i < 4; i++) {
            timer.fireLast();
            timer.fireLast();
        }
        assertNull(session.tribulation());
        assertNotSame(s, session.state());
        assertEquals(1, session.state().getCharacter().getRebirthCount());
    }

    @Test
    void loadingAnotherGameDropsTheTribulation() {
        GameSession session = session(ScriptedDice.quiet(), TestStates.readyMartial(4));
        session.apply(new AttemptBreakthroughCmd(next()));
        Future<?> pending = timer.futures.get(0);

        session.load(TestStates.playing());
        assertNull(session.tribulation());
        assertTrue(pending.isCancelled());
    }

    // ---- everything else routes to its system ----

    @Test
    void commandsReachTheirSystems() {
        GameSession session = session(ScriptedDice.quiet(), TestStates.playing());
        GameState s = session.state();
        s.setSpiritStones(200);

        assertTrue(session.apply(new BuyItemCmd(next(), "basic_pill")).ok());
        assertTrue(session.apply(new UseItemCmd(next(), "basic_pill")).ok());
        assertTrue(session.apply(new TravelToCmd(next(), "river_delta")).ok());
        assertFalse(session.apply(new SetActionCmd(next(), ActionType.TRAIN)).ok(), "on the road");
        assertTrue(session.apply(new ToggleRogueCmd(next())).ok());
        assertTrue(session.apply(new SetAutoSaveCmd(next(), false)).ok());

        assertEquals(1, s.getBuffs().size());
        assertTrue(s.getTravel().isTraveling());
        assertTrue(s.getCharacter().isRogueStatus());
        assertFalse(s.isAutoSaveEnabled());
    }
}
