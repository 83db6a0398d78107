package org.gudu0.starboardbot.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.io.IOException;
import java.nio.file.*;
import java.util.function.Supplier;

/**
 * Loads a config POJO from JSON, falling back to defaults. Never writes by itself;
 * call {@link #save()} after changing {@link #cfg()}.
 */
public class TypedConfigStore<T> {
    private final Path path;
    private final ObjectMapper om;
    private final Class<T> type;
    private final Supplier<T> defaults;

    private final T cfg;

    public TypedConfigStore(Path path, Class<T> type, Supplier<T> defaults) {
        this.path = path;
        this.type = type;
        this.defaults = defaults;
        this.om = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.cfg = loadOrNew();
    }

    public T cfg() { return cfg; }

    public boolean exists() {
        return Files.exists(path);
    }

    public synchronized void save() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        om.writeValue(tmp.toFile(), cfg);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        ConsoleLog.debug("TypedConfigStore", "Saved config to " + path);
    }

    private T loadOrNew() {
        try {
            if (Files.exists(path)) {
                ConsoleLog.info("TypedConfigStore", "Loaded config from " + path);
                return om.readValue(path.toFile(), type);
            }
        } catch (Exception e) {
            ConsoleLog.error("TypedConfigStore", "Failed to load " + path + ", using defaults: " + e.getMessage(), e);
        }
        ConsoleLog.warn("TypedConfigStore", "Config missing: " + path + " (will use defaults until saved)");
        return defaults.get();
    }
}
