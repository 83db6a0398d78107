package org.gudu0.starboardbot.starboard;

import org.gudu0.starboardbot.remote.GuildNotifier;
import org.gudu0.starboardbot.remote.Severity;
import org.gudu0.starboardbot.starboard.event.StarboardEvent;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs starboard events off the gateway thread. A failing event is logged and reported
 * to the guild; the worker carries on with the next one.
 */
public class StarboardWorker {

    private static final String TAG = "StarboardWorker";

    private final StarboardEngine engine;
    private final GuildNotifier notifier;
    private final ExecutorService executor;

    public StarboardWorker(StarboardEngine engine, GuildNotifier notifier, int threads) {
        this.engine = engine;
        this.notifier = notifier;

        AtomicInteger n = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "starboard-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ConsoleLog.info(TAG, "Started with threads=" + Math.max(1, threads));
    }

    /**
     * Queues the event. The returned future completes when it has been processed,
     * exceptionally if processing failed (the failure has been reported by then).
     */
    public CompletableFuture<Void> submit(StarboardEvent event) {
        return CompletableFuture.runAsync(() -> process(event), executor);
    }

    /** Runs a one-off task on the worker pool (used by commands that touch remote state). */
    public <T> CompletableFuture<T> supply(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    private void process(StarboardEvent event) {
        ConsoleLog.debug(TAG, "Processing " + event);
        try {
            engine.handle(event);
        } catch (RuntimeException e) {
            ConsoleLog.error(TAG, "guildId=" + event.guildId() + " failed processing " + event + ": " + e.getMessage(), e);
            notifier.notify(event.guildId(), Severity.ERROR,
                    "Something went wrong while updating the starboard: `" + e.getClass().getSimpleName()
                            + (e.getMessage() == null ? "" : ": " + e.getMessage()) + "`");
            throw e;
        }
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                ConsoleLog.warn(TAG, "Events still running after 10s; forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
