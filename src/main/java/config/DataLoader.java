package config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads one data pack, preferring an editable copy on disk ({@code ./data/<name>})
 * over the one packed in resources ({@code data/<name>}).
 */
public final class DataLoader {
    private static final Logger log = Logger.getLogger(DataLoader.class.getName());

    private static final ObjectMapper M = new ObjectMapper()
            .registerModule(new ParameterNamesModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    static final String DATA_DIR = "data";

    public static <T> T load(String fileName, Class<T> packType) {
        Path disk = Paths.get(DATA_DIR, fileName);
        if (Files.exists(disk)) {
            try {
                return read(Files.readAllBytes(disk), packType);
            } catch (IOException e) {
                log.log(Level.WARNING, "[Data] Failed to load " + disk + ", falling back to classpath", e);
            }
        }

        String resourceName = DATA_DIR + "/" + fileName;
        try (InputStream in = resource(resourceName)) {
            if (in == null) {
                throw new IllegalStateException("Missing data resource " + resourceName);
            }
            return read(in.readAllBytes(), packType);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
    }

    static <T> T read(byte[] data, Class<T> packType) throws IOException {
        T pack = M.readValue(data, packType);
        if (pack == null) throw new IOException("Empty data pack for " + packType.getSimpleName());
        return pack;
    }

    private static InputStream resource(String name) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        InputStream in = (cl != null) ? cl.getResourceAsStream(name) : null;
        return (in != null) ? in : DataLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private DataLoader() {}
}
