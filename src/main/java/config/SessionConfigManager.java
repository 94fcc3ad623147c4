package config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/** Loads session.json: classpath first, then the working directory, then built-in defaults. */
public final class SessionConfigManager {
    private static final Logger log = Logger.getLogger(SessionConfigManager.class.getName());
    private static SessionConfigManager instance;

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new ParameterNamesModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final String fileName = "session.json";
    private final SessionConfig config;

    private SessionConfigManager() {
        try {
            SessionConfig loaded = null;
            try (InputStream in = getClass().getClassLoader().getResourceAsStream(fileName)) {
                if (in != null) {
                    loaded = mapper.readValue(in, SessionConfig.class);
                }
            }
            if (loaded == null) {
                Path p = Paths.get(fileName);
                if (Files.exists(p)) {
                    loaded = mapper.readValue(Files.readAllBytes(p), SessionConfig.class);
                }
            }
            if (loaded == null) {
                log.info("[Config] No " + fileName + " found, using defaults");
                loaded = SessionConfig.DEFAULTS;
            }
            this.config = loaded;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load " + fileName, e);
        }
    }

    public static synchronized SessionConfigManager getInstance() {
        if (instance == null) instance = new SessionConfigManager();
        return instance;
    }

    public SessionConfig getConfig() {
        return config;
    }
}
