// src/main/java/app/Main.java
package app;

import client.storage.SaveStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import common.dto.CommandResult;
import common.dto.Json;
import common.dto.cmd.PlayerCommand;
import config.GameData;
import config.SessionConfig;
import config.SessionConfigManager;
import model.SimulationContext;
import server.GameSession;
import server.SimServer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Headless console front end. Reads one command per line from stdin:
 * a JSON {@code PlayerCommand} ({@code seq} optional), or one of
 * {@code status}, {@code save}, {@code export}, {@code import <text>}, {@code quit}.
 */
public class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());
    private static final ObjectMapper M = Json.mapper();

    public static void main(String[] args) throws Exception {
        installLogging();

        // ----- Config & data -----
        SessionConfig cfg = SessionConfigManager.getInstance().getConfig();
        GameData data = GameData.getInstance();
        SimulationContext ctx = new SimulationContext(cfg.effectiveSeed());

        // ----- Session -----
        SaveStore store = new SaveStore(Paths.get(cfg.saveDir()), cfg.saveFile(), ctx.clock);
        GameSession session = new GameSession(data, ctx, cfg);
        String name = args.length > 0 ? String.join(" ", args) : "Nameless Wanderer";
        store.load().ifPresentOrElse(session::load, () -> session.beginNewGame(name));

        SimServer server = new SimServer(session, store, cfg);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "SaveOnExit"));
        server.start();
        printJson(server.snapshot().get());

        // ----- Console loop -----
        long autoSeq = 1;
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                if (line.equals("quit") || line.equals("exit")) break;

                try {
                    if (line.equals("status")) {
                        printJson(server.snapshot().get());
                    } else if (line.equals("save")) {
                        println(server.saveNow().get() ? "Saved to " + store.file() : "Save failed");
                    } else if (line.equals("export")) {
                        println(server.exportSave().get());
                    } else if (line.startsWith("import ")) {
                        println(server.importSave(line.substring(7)).get() ? "Imported" : "Import rejected");
                    } else {
                        JsonNode node = M.readTree(line);
                        if (node instanceof ObjectNode obj && !obj.has("seq")) obj.put("seq", autoSeq++);
                        PlayerCommand cmd = M.treeToValue(node, PlayerCommand.class);
                        CommandResult result = server.submit(cmd).get();
                        printJson(result);
                    }
                } catch (IOException e) {
                    println("Unreadable command: " + e.getMessage());
                } catch (ExecutionException e) {
                    log.log(Level.WARNING, "[Main] Command failed", e.getCause());
                }
            }
        }
        server.stop();
    }

    private static void installLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            log.log(Level.WARNING, "[Main] Could not read logging.properties", e);
        }
    }

    private static void printJson(Object value) throws IOException {
        println(M.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    private static void println(String text) {
        System.out.println(text);
    }
}
