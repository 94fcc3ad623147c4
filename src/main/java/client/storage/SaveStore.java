package client.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import common.dto.Json;
import model.GameState;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Base64;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One JSON save file per game. Writes go to a temp file first and replace the save
 * atomically; the previous save is kept as {@code .bak}. Corrupt input is rejected whole.
 */
public class SaveStore {
    private static final Logger log = Logger.getLogger(SaveStore.class.getName());
    private static final ObjectMapper M = Json.mapper();

    private final Path dir;
    private final Path file;        // .../grand-dao.json
    private final Path tmpFile;     // .../grand-dao.json.tmp
    private final Path bakFile;     // .../grand-dao.json.bak
    private final Clock clock;

    public SaveStore(Path dir, String fileName, Clock clock) {
        this.dir = dir;
        this.file = dir.resolve(fileName);
        this.tmpFile = dir.resolve(fileName + ".tmp");
        this.bakFile = dir.resolve(fileName + ".bak");
        this.clock = clock;
    }

    public Path file() { return file; }

    /** Stamps {@code lastSaveTimestamp} and writes the state. */
    public boolean save(GameState state) {
        long previous = state.getLastSaveTimestamp();
        state.setLastSaveTimestamp(clock.millis());
        try {
            Files.createDirectories(dir);
            byte[] json = M.writerWithDefaultPrettyPrinter().writeValueAsBytes(state);
            Files.write(tmpFile, json, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            if (Files.exists(file)) Files.copy(file, bakFile, StandardCopyOption.REPLACE_EXISTING);
            Files.move(tmpFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return true;
        } catch (IOException e) {
            state.setLastSaveTimestamp(previous);
            log.log(Level.WARNING, "[Save] Failed to write " + file, e);
            return false;
        }
    }

    /** The saved game, or empty when there is none or it cannot be read. */
    public Optional<GameState> load() {
        Path source = Files.exists(file) ? file : (Files.exists(bakFile) ? bakFile : null);
        if (source == null) return Optional.empty();
        try {
            return parse(Files.readAllBytes(source));
        } catch (IOException | IllegalArgumentException e) {
            log.log(Level.WARNING, "[Save] Failed to read " + source, e);
            return Optional.empty();
        }
    }

    public boolean delete() {
        try {
            Files.deleteIfExists(tmpFile);
            Files.deleteIfExists(bakFile);
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.log(Level.WARNING, "[Save] Failed to delete " + file, e);
            return false;
        }
    }

    /** Portable text form: Base64 of the UTF-8 JSON. */
    public String exportText(GameState state) {
        try {
            return Base64.getEncoder().encodeToString(M.writeValueAsBytes(state));
        } catch (IOException e) {
            throw new IllegalStateException("Game state is not serializable", e);
        }
    }

    /** Reverse of {@link #exportText}; a successful import counts as saved just now. */
    public Optional<GameState> importText(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        try {
            byte[] json = Base64.getDecoder().decode(text.trim());
            Optional<GameState> parsed = parse(json);
            parsed.ifPresent(s -> s.setLastSaveTimestamp(clock.millis()));
            return parsed;
        } catch (IllegalArgumentException | IOException e) {
            log.log(Level.WARNING, "[Save] Rejected imported save: " + e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<GameState> parse(byte[] json) throws IOException {
        JsonNode root = M.readTree(new String(json, StandardCharsets.UTF_8));
        if (root == null || !root.isObject() || missing(root, "character")
                || missing(root, "pathProgress") || missing(root, "gamePhase")) {
            log.warning("[Save] Save data is missing character, pathProgress or gamePhase");
            return Optional.empty();
        }
        return Optional.of(M.treeToValue(root, GameState.class));
    }

    private static boolean missing(JsonNode root, String field) {
        JsonNode n = root.get(field);
        return n == null || n.isNull();
    }
}
