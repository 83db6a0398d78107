package org.gudu0.starboardbot.starboard;

import org.gudu0.starboardbot.remote.GuildNotifier;
import org.gudu0.starboardbot.remote.Severity;
import org.gudu0.starboardbot.starboard.event.StarboardEvent;
import org.gudu0.starboardbot.store.JsonStarboardStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class StarboardWorkerTest {

    private static final long GUILD = 100;
    private static final long CHANNEL = 200;
    private static final long SB = 300;
    private static final long MSG = 1;

    @TempDir
    Path dir;

    private StarboardWorker worker;

    @AfterEach
    void tearDown() {
        if (worker != null) worker.shutdown();
    }

    @Test
    void parallelResyncsOfOnePairShouldPostOneMirror() throws Exception {
        JsonStarboardStore store = new JsonStarboardStore(dir.resolve("starboard.json"));
        FakeDiscord discord = new FakeDiscord();
        MirrorReconciler reconciler = new MirrorReconciler(store, discord, discord, discord, discord,
                new PointCalculator(), new EligibilityEvaluator(new RegexGuard(Duration.ofMillis(250))));
        StarboardEngine engine = new StarboardEngine(store, discord, reconciler);
        worker = new StarboardWorker(engine, discord, 8);

        store.createGuild(GUILD);
        store.createStarboard(GUILD, SB);
        store.createUser(10, false);
        store.createMessage(MSG, GUILD, CHANNEL, 10L, false);
        store.setForced(MSG, SB, true);
        discord.post(GUILD, CHANNEL, MSG, 10, "hi");

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            futures.add(worker.submit(new StarboardEvent.ExplicitResync(GUILD, MSG)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        assertEquals(1, discord.sends);
        assertEquals(1, discord.mirrors.size());
        assertTrue(store.getStarboardMessage(MSG, SB).isPresent());
    }

    @Test
    void shutdownThenCloseShouldPersistEveryQueuedEvent() {
        Path file = dir.resolve("starboard.json");
        JsonStarboardStore store = new JsonStarboardStore(file);
        FakeDiscord discord = new FakeDiscord();
        MirrorReconciler reconciler = new MirrorReconciler(store, discord, discord, discord, discord,
                new PointCalculator(), new EligibilityEvaluator(new RegexGuard(Duration.ofMillis(250))));
        StarboardWorker single = new StarboardWorker(new StarboardEngine(store, discord, reconciler), discord, 1);

        store.createGuild(GUILD);
        store.createStarboard(GUILD, SB);
        store.updateStarboard(SB, s -> s.required = 100);
        discord.post(GUILD, CHANNEL, MSG, 10, "hi");
        store.startAutoFlush(3600);

        for (long user = 20; user < 60; user++) {
            single.submit(new StarboardEvent.ReactionAdded(GUILD, CHANNEL, MSG, user, false, "⭐"));
        }
        single.shutdown();
        store.close();

        JsonStarboardStore reloaded = new JsonStarboardStore(file);
        assertEquals(40, reloaded.getReactions(MSG).get(0).userIds.size());
        assertEquals(40, reloaded.getMessage(MSG).orElseThrow().points);
    }

    @Test
    void failingEventShouldBeReportedAndNotStopTheWorker() throws Exception {
        StarboardEngine engine = mock(StarboardEngine.class);
        GuildNotifier notifier = mock(GuildNotifier.class);
        StarboardEvent bad = new StarboardEvent.ExplicitResync(GUILD, 1);
        StarboardEvent good = new StarboardEvent.ExplicitResync(GUILD, 2);
        doThrow(new IllegalStateException("boom")).when(engine).handle(bad);
        worker = new StarboardWorker(engine, notifier, 1);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> worker.submit(bad).get(10, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        verify(notifier).notify(eq(GUILD), eq(Severity.ERROR), contains("boom"));

        worker.submit(good).get(10, TimeUnit.SECONDS);
        verify(engine).handle(good);
    }
}
