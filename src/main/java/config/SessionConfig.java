package config;

/** Runtime knobs for one play session (session.json). */
public record SessionConfig(
        long tickMillis,
        long autoSaveMillis,
        String saveDir,
        String saveFile,
        int offlineCapSeconds,
        long strikeLeadInMillis,
        long strikeGapMillis,
        long seed
) {
    public static final SessionConfig DEFAULTS =
            new SessionConfig(1000, 30_000, "saves", "grand-dao.json", 8 * 3600, 1000, 800, 0);

    public SessionConfig {
        if (tickMillis <= 0)         tickMillis = 1000;
        if (autoSaveMillis <= 0)     autoSaveMillis = 30_000;
        if (saveDir == null)         saveDir = "saves";
        if (saveFile == null)        saveFile = "grand-dao.json";
        if (offlineCapSeconds <= 0)  offlineCapSeconds = 8 * 3600;
        if (strikeLeadInMillis <= 0) strikeLeadInMillis = 1000;
        if (strikeGapMillis <= 0)    strikeGapMillis = 800;
    }

    /** 0 means "seed from the wall clock". */
    public long effectiveSeed() {
        return seed != 0 ? seed : System.nanoTime();
    }
}
