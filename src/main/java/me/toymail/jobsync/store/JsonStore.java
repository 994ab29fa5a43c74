package me.toymail.jobsync.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.*;

/**
 * JSON files under the data home (~/.jobsync by default).
 */
public final class JsonStore {
    private static final ObjectMapper M = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path baseDir;

    public JsonStore() {
        this(Paths.get(System.getProperty("user.home"), ".jobsync"));
    }

    public JsonStore(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static ObjectMapper mapper() {
        return M;
    }

    public Path baseDir() { return baseDir; }

    public void ensure() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Write through a temp file and move it into place; readers never see a partial file.
     */
    public <T> void writeJson(String name, T obj) throws IOException {
        ensure();
        Path p = baseDir.resolve(name);
        Path tmp = baseDir.resolve(name + ".tmp");
        Files.write(tmp, M.writeValueAsBytes(obj), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        try {
            Files.move(tmp, p, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, p, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public <T> T readJson(String name, Class<T> clazz) throws IOException {
        Path p = baseDir.resolve(name);
        if (!Files.exists(p)) return null;
        return M.readValue(Files.readAllBytes(p), clazz);
    }

    public <T> T readJson(String name, TypeReference<T> type) throws IOException {
        Path p = baseDir.resolve(name);
        if (!Files.exists(p)) return null;
        return M.readValue(Files.readAllBytes(p), type);
    }

    public boolean exists(String name) {
        return Files.exists(baseDir.resolve(name));
    }

    public Path path(String name) {
        return baseDir.resolve(name);
    }
}
