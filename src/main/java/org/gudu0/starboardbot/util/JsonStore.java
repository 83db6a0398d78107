package org.gudu0.starboardbot.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.*;
import java.util.concurrent.*;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One JSON document held in memory and flushed to disk when dirty.
 * <p>
 * All access goes through {@link #read}, {@link #write} and {@link #update}, which hold {@link #lock}.
 * Writes go to a temp file first and are moved over the real one.
 */
public class JsonStore<T> {
    public final Object lock = new Object();

    private final Path path;
    private final ObjectMapper om;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "JsonStore-flush");
        t.setDaemon(true);
        return t;
    });

    private final Class<T> type;
    private final Supplier<T> defaultSupplier;
    private final String nameForLogs;

    private volatile boolean dirty = false;
    private final T value;

    public JsonStore(Path path, Class<T> type, Supplier<T> defaultSupplier, String nameForLogs) {
        this.path = path;
        this.type = type;
        this.defaultSupplier = defaultSupplier;
        this.nameForLogs = nameForLogs;

        this.om = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.value = loadOrNew();
        ConsoleLog.info("JsonStore", "Loaded " + nameForLogs + " from " + path);
    }

    public <R> R read(Function<T, R> reader) {
        synchronized (lock) {
            return reader.apply(value);
        }
    }

    public <R> R write(Function<T, R> writer) {
        synchronized (lock) {
            R out = writer.apply(value);
            dirty = true;
            return out;
        }
    }

    public void update(Consumer<T> writer) {
        synchronized (lock) {
            writer.accept(value);
            dirty = true;
        }
    }

    public boolean isDirty() {
        return dirty;
    }

    /**
     * Flushes every {@code periodSeconds} while dirty. There is no shutdown hook here:
     * the owner calls {@link #close()} once nothing else will write.
     */
    public void startAutoFlush(long periodSeconds) {
        scheduler.scheduleAtFixedRate(this::tryFlush, periodSeconds, periodSeconds, TimeUnit.SECONDS);
    }

    /** Stops the periodic flush and writes whatever is still dirty. */
    public void close() {
        scheduler.shutdown();
        try {
            flushNow();
        } catch (IOException e) {
            ConsoleLog.error("JsonStore", nameForLogs + " final flush failed: " + e.getMessage(), e);
        }
    }

    public void tryFlush() {
        if (!dirty) return;
        try {
            flushNow();
        } catch (Exception e) {
            ConsoleLog.error("JsonStore", nameForLogs + " flush failed: " + e.getMessage(), e);
        }
    }

    public void flushNow() throws IOException {
        synchronized (lock) {
            if (!dirty) return;

            ConsoleLog.debug("JsonStore", "Flushing " + nameForLogs + " -> " + path);

            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");

            om.writeValue(tmp.toFile(), value);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            dirty = false;

            ConsoleLog.debug("JsonStore", "Flushed " + nameForLogs);
        }
    }

    private T loadOrNew() {
        try {
            if (Files.exists(path)) {
                return om.readValue(path.toFile(), type);
            } else {
                ConsoleLog.warn("JsonStore", nameForLogs + " missing, creating default at " + path);
            }
        } catch (Exception e) {
            ConsoleLog.error("JsonStore", "Failed to load " + nameForLogs + ", starting fresh: " + e.getMessage(), e);
        }
        return defaultSupplier.get();
    }
}
