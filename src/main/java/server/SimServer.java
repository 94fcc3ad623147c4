// server/SimServer.java
package server;

import client.storage.SaveStore;
import common.dto.CommandResult;
import common.dto.SnapshotDTO;
import common.dto.cmd.PlayerCommand;
import config.SessionConfig;
import model.GamePhase;
import model.GameState;
import model.systems.OfflineReport;

import java.util.Optional;
import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives a {@link GameSession} on one scheduler thread: the 1 Hz tick, auto-save,
 * tribulation strike timers and every player command all run there.
 */
public final class SimServer implements AutoCloseable {
    private static final Logger log = Logger.getLogger(SimServer.class.getName());

    private final GameSession session;
    private final SaveStore store;
    private final SessionConfig cfg;
    private final ScheduledExecutorService exec =
            Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "SimTick");
                t.setDaemon(true);
                return t;
            });

    private volatile boolean running = false;
    private ScheduledFuture<?> tickTask;
    private ScheduledFuture<?> saveTask;

    public SimServer(GameSession session, SaveStore store, SessionConfig cfg) {
        this.session = session;
        this.store = store;
        this.cfg = cfg;
        session.attachTimer((task, delay) -> exec.schedule(task, delay, TimeUnit.MILLISECONDS));
    }

    /** Runs offline catch-up, then starts the tick and auto-save schedules. */
    public synchronized OfflineReport start() {
        if (running) return OfflineReport.NONE;
        OfflineReport report = session.catchUp();
        if (report.applied()) {
            log.info(() -> "[Server] Offline catch-up: " + report.elapsedSeconds() + "s, +"
                    + Math.round(report.xpGained()) + " XP, +" + report.stonesGained() + " stones");
        }
        running = true;
        tickTask = exec.scheduleAtFixedRate(this::safeTick, cfg.tickMillis(), cfg.tickMillis(), TimeUnit.MILLISECONDS);
        saveTask = exec.scheduleAtFixedRate(this::autoSave, cfg.autoSaveMillis(), cfg.autoSaveMillis(), TimeUnit.MILLISECONDS);
        log.info(() -> "[Server] Started (tick " + cfg.tickMillis() + " ms, auto-save " + cfg.autoSaveMillis() + " ms)");
        return report;
    }

    public boolean isRunning() { return running; }

    public CompletableFuture<CommandResult> submit(PlayerCommand cmd) {
        return CompletableFuture.supplyAsync(() -> session.apply(cmd), exec);
    }

    public CompletableFuture<SnapshotDTO> snapshot() {
        return CompletableFuture.supplyAsync(session::snapshot, exec);
    }

    public CompletableFuture<Boolean> saveNow() {
        return CompletableFuture.supplyAsync(this::saveState, exec);
    }

    public CompletableFuture<String> exportSave() {
        return CompletableFuture.supplyAsync(() -> store.exportText(session.state()), exec);
    }

    /** Replaces the running game when the text decodes to a valid save. */
    public CompletableFuture<Boolean> importSave(String text) {
        return CompletableFuture.supplyAsync(() -> {
            Optional<GameState> imported = store.importText(text);
            imported.ifPresent(session::load);
            return imported.isPresent();
        }, exec);
    }

    /** Cancels every schedule, saves once more and shuts the thread down. */
    public synchronized void stop() {
        if (!running) {
            exec.shutdownNow();
            return;
        }
        running = false;
        if (tickTask != null) tickTask.cancel(false);
        if (saveTask != null) saveTask.cancel(false);
        try {
            exec.submit(() -> {
                session.shutdown();
                saveState();
            }).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warning("[Server] Interrupted while saving on stop");
        } catch (ExecutionException | TimeoutException e) {
            log.log(Level.WARNING, "[Server] Final save did not complete", e);
        } finally {
            exec.shutdownNow();
        }
        log.info("[Server] Stopped");
    }

    @Override
    public void close() { stop(); }

    // ---------- internals ----------

    private void safeTick() {
        try {
            session.tick();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the fixed-rate schedule
            log.log(Level.SEVERE, "[Tick] Tick failed", e);
        }
    }

    private void autoSave() {
        GameState s = session.state();
        if (s == null || s.getGamePhase() != GamePhase.PLAYING || !s.isAutoSaveEnabled()) return;
        try {
            if (saveState()) log.fine("[Save] Auto-saved");
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "[Save] Auto-save failed", e);
        }
    }

    private boolean saveState() {
        GameState s = session.state();
        if (s == null || s.getGamePhase() != GamePhase.PLAYING) return false;
        return store.save(s);
    }
}
