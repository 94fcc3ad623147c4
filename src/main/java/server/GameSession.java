package server;

import common.dto.CommandResult;
import common.dto.SnapshotDTO;
import common.dto.cmd.*;
import common.dto.cmd.marker.CreationPhaseCmd;
import common.dto.cmd.marker.PlayingPhaseCmd;
import config.GameData;
import config.SessionConfig;
import mapper.Mapper;
import model.ActionResult;
import model.EventLog;
import model.GamePhase;
import model.GameState;
import model.SimulationContext;
import model.paths.PathRules;
import model.systems.*;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one game and every engine system acting on it. Not thread-safe: {@link SimServer}
 * calls it from a single scheduler thread only.
 */
public final class GameSession {
    private static final Logger log = Logger.getLogger(GameSession.class.getName());

    /** Schedules tribulation strike tasks; SimServer backs it with its executor. */
    @FunctionalInterface
    public interface StrikeTimer {
        Future<?> schedule(Runnable task, long delayMillis);
    }

    private final GameData data;
    private final SimulationContext ctx;
    private final SessionConfig cfg;

    // ---- engine ----
    private final UnlockSystem unlocks;
    private final TickEngine engine;
    private final BreakthroughSystem breakthrough;
    private final TribulationSystem tribulations;
    private final OfflineProgressSystem offline;
    private final CharacterCreation creation;
    private final RebirthSystem rebirth;
    private final ItemSystem items;
    private final ActionSystem actions;
    private final TravelSystem travel;
    private final EventSystem events;
    private final ShopSystem shop;
    private final GroupSystem groups;
    private final CombatSystem combat;

    // ---- session state ----
    private GameState state;
    private final Set<Long> seenSeqs = ConcurrentHashMap.newKeySet();
    private boolean clickBoostArmed;
    private boolean caughtUp;

    private Tribulation tribulation;
    private long tribulationGen;
    private Future<?> pendingStrike;
    private StrikeTimer timer;

    public GameSession(GameData data, SimulationContext ctx, SessionConfig cfg) {
        this.data = data;
        this.ctx = ctx;
        this.cfg = cfg;

        PathRules rules = new PathRules(data);
        this.unlocks      = new UnlockSystem(data, rules, ctx);
        this.travel       = new TravelSystem(data, ctx);
        ExplorationSystem exploration = new ExplorationSystem(data, unlocks, ctx);
        this.engine       = new TickEngine(data, rules, ctx, travel, exploration, unlocks);
        this.breakthrough = new BreakthroughSystem(data, ctx);
        this.tribulations = new TribulationSystem(data, ctx);
        this.offline      = new OfflineProgressSystem(data, rules, travel, ctx, cfg.offlineCapSeconds());
        this.creation     = new CharacterCreation(data, ctx);
        this.rebirth      = new RebirthSystem(creation, ctx);
        this.items        = new ItemSystem(data, ctx);
        this.actions      = new ActionSystem(data, ctx);
        this.events       = new EventSystem(data, unlocks, ctx);
        this.shop         = new ShopSystem(data, ctx);
        this.groups       = new GroupSystem(data, unlocks, ctx);
        this.combat       = new CombatSystem(data, rules, ctx);
    }

    public void attachTimer(StrikeTimer timer) { this.timer = timer; }

    public GameState state() { return state; }

    /** Adopts a loaded or imported game, abandoning anything in flight. */
    public void load(GameState loaded) {
        endTribulation();
        this.state = loaded;
        ctx.continueLogIds(loaded);
        log.info(() -> "[Session] Loaded " + loaded.getCharacter().getName() + " (" + loaded.getGamePhase() + ")");
    }

    public void beginNewGame(String name) {
        load(creation.beginCreation(name));
    }

    /** One-shot; later calls do nothing. */
    public OfflineReport catchUp() {
        if (caughtUp || state == null) return OfflineReport.NONE;
        caughtUp = true;
        if (state.getGamePhase() != GamePhase.PLAYING) return OfflineReport.NONE;
        return offline.catchUp(state, ctx.now());
    }

    public void tick() {
        if (state == null || state.getGamePhase() != GamePhase.PLAYING) return;
        boolean boosted = clickBoostArmed;
        clickBoostArmed = false;
        engine.tick(state, boosted);
    }

    public SnapshotDTO snapshot() {
        if (state == null) return null;
        return Mapper.toSnapshot(state, tribulation, data, combat.power(state));
    }

    public Tribulation tribulation() { return tribulation; }

    /** Cancels strike timers; the session stays usable. */
    public void shutdown() {
        if (tribulation != null) log.info("[Session] Abandoning tribulation on shutdown");
        endTribulation();
    }

    // ---------- commands ----------

    public CommandResult apply(PlayerCommand cmd) {
        if (cmd == null) return CommandResult.fail(-1, "Empty command");
        long seq = cmd.seq();
        if (!seenSeqs.add(seq)) return CommandResult.fail(seq, "Duplicate command " + seq);
        if (state == null) return CommandResult.fail(seq, "No game loaded");

        if (cmd instanceof CreationPhaseCmd && state.getGamePhase() != GamePhase.CHARACTER_CREATION) {
            return CommandResult.fail(seq, "Character already chosen");
        }
        if (cmd instanceof PlayingPhaseCmd && state.getGamePhase() != GamePhase.PLAYING) {
            return CommandResult.fail(seq, "Choose a character first");
        }

        try {
            ActionResult r = dispatch(cmd);
            return r.ok() ? CommandResult.ok(seq, r.message(), r.outcome()) : CommandResult.fail(seq, r.message());
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "[Session] Command " + cmd.getClass().getSimpleName() + " failed", e);
            return CommandResult.fail(seq, "Internal error");
        }
    }

    private ActionResult dispatch(PlayerCommand cmd) {
        if (cmd instanceof RerollCmd)              return creation.reroll(state);
        if (cmd instanceof ConfirmCharacterCmd) {
            load(creation.confirm(state));
            return ActionResult.ok("Your journey begins");
        }
        if (cmd instanceof SetActionCmd c)         return actions.setAction(state, c.action());
        if (cmd instanceof SelectPathCmd c)        return actions.selectPath(state, c.pathId());
        if (cmd instanceof AttemptBreakthroughCmd) return attemptBreakthrough();
        if (cmd instanceof ResistStrikeCmd)        return resistStrike();
        if (cmd instanceof FailStrikeCmd)          return failStrike();
        if (cmd instanceof AbandonTribulationCmd)  return abandonTribulation();
        if (cmd instanceof BuyBoostCmd)            return items.buyBoost(state);
        if (cmd instanceof UseItemCmd c)           return items.useItem(state, c.itemId());
        if (cmd instanceof EquipScriptureCmd c)    return items.equipScripture(state, c.itemId());
        if (cmd instanceof TravelToCmd c)          return travel.travelTo(state, c.regionId());
        if (cmd instanceof ChooseEventOptionCmd c) return events.chooseEventOption(state, c.choiceIndex());
        if (cmd instanceof BuyItemCmd c)           return shop.buy(state, c.itemId());
        if (cmd instanceof SellItemCmd c)          return shop.sell(state, c.itemId());
        if (cmd instanceof ToggleRogueCmd)         return actions.toggleRogue(state);
        if (cmd instanceof JoinGroupCmd c)         return groups.join(state, c.groupId());
        if (cmd instanceof CompleteMissionCmd c)   return groups.completeMission(state, c.missionId(), c.help());
        if (cmd instanceof ClickBoostCmd) {
            clickBoostArmed = true;
            return ActionResult.ok("Next tick boosted");
        }
        if (cmd instanceof SetAutoSaveCmd c) {
            state.setAutoSaveEnabled(c.enabled());
            return ActionResult.ok("Auto-save " + (c.enabled() ? "on" : "off"));
        }
        return ActionResult.fail("Unsupported command " + cmd.getClass().getSimpleName());
    }

    private ActionResult attemptBreakthrough() {
        if (tribulation != null) return ActionResult.fail("The tribulation is already under way");
        if (BreakthroughSystem.needsTribulation(state)) return startTribulation();

        if (state.activeProgress() == null || !state.activeProgress().isBreakthroughAvailable()) {
            return ActionResult.fail("Not ready");
        }
        double pillBonus = BreakthroughSystem.consumePills(state);
        BreakthroughResult r = breakthrough.attempt(state, pillBonus);
        if (r.outcome().isFailure()) {
            log.info(() -> "[Session] Breakthrough failed: " + r.outcome());
        }
        if (r.outcome() == BreakthroughOutcome.DEATH) {
            load(rebirth.rebirth(state));
        }
        return ActionResult.ok(r.message(), r.outcome().name());
    }

    // ---------- tribulation ----------

    private ActionResult startTribulation() {
        long gen = ++tribulationGen;
        tribulation = tribulations.start(state, gen);
        if (tribulation == null) return ActionResult.fail("Not ready");
        log.info(() -> "[Session] Tribulation " + gen + " started: " + tribulation.totalStrikes() + " strikes");
        schedule(() -> armStrike(gen), cfg.strikeLeadInMillis());
        return ActionResult.ok("Tribulation begins");
    }

    private ActionResult resistStrike() {
        if (tribulation == null) return ActionResult.fail("No tribulation in progress");
        if (!tribulations.resist(state, tribulation)) return ActionResult.fail("No strike to resist");
        cancelPendingStrike();
        afterStrike();
        return ActionResult.ok("Strike resisted");
    }

    private ActionResult failStrike() {
        if (tribulation == null) return ActionResult.fail("No tribulation in progress");
        if (!tribulations.fail(state, tribulation)) return ActionResult.fail("No strike to take");
        cancelPendingStrike();
        afterStrike();
        return ActionResult.ok("Strike taken");
    }

    private ActionResult abandonTribulation() {
        if (tribulation == null) return ActionResult.fail("No tribulation in progress");
        endTribulation();
        EventLog.warning(state, ctx, "You flee from the heavens' judgement. The breakthrough waits.");
        return ActionResult.ok("Tribulation abandoned");
    }

    private void armStrike(long gen) {
        if (isStale(gen)) return;
        tribulations.arm(tribulation);
        int strike = tribulation.currentStrike();
        schedule(() -> strikeExpired(gen, strike), tribulation.windowSeconds() * 1000L);
    }

    private void strikeExpired(long gen, int strike) {
        if (isStale(gen) || tribulation.currentStrike() != strike) return;
        if (tribulations.fail(state, tribulation)) afterStrike();
    }

    private void afterStrike() {
        switch (tribulation.phase()) {
            case SURVIVED -> {
                String pathId = tribulation.pathId();
                endTribulation();
                breakthrough.forceSuccess(state, pathId);
            }
            case FAILED -> {
                endTribulation();
                load(rebirth.rebirth(state));
            }
            case ACTIVE -> {
                long gen = tribulation.generation();
                schedule(() -> armStrike(gen), cfg.strikeGapMillis());
            }
        }
    }

    private boolean isStale(long gen) {
        return tribulation == null || tribulation.generation() != gen || !tribulation.isActive();
    }

    private void schedule(Runnable task, long delayMillis) {
        if (timer == null) return;
        pendingStrike = timer.schedule(task, delayMillis);
    }

    private void cancelPendingStrike() {
        if (pendingStrike != null) pendingStrike.cancel(false);
        pendingStrike = null;
    }

    private void endTribulation() {
        cancelPendingStrike();
        tribulation = null;
    }
}
