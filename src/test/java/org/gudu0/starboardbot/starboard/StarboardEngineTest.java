package org.gudu0.starboardbot.starboard;

import org.gudu0.starboardbot.remote.MessageCache;
import org.gudu0.starboardbot.starboard.event.StarboardEvent.*;
import org.gudu0.starboardbot.store.JsonStarboardStore;
import org.gudu0.starboardbot.store.MemberRecord;
import org.gudu0.starboardbot.store.StarboardMessageRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class StarboardEngineTest {

    private static final long GUILD = 100;
    private static final long CHANNEL = 200;
    private static final long SB = 300;
    private static final long SB2 = 301;
    private static final long MSG = 1;
    private static final long AUTHOR = 10;

    @TempDir
    Path dir;

    private JsonStarboardStore store;
    private FakeDiscord discord;
    private StarboardEngine engine;

    @BeforeEach
    void setUp() {
        store = new JsonStarboardStore(dir.resolve("starboard.json"));
        discord = new FakeDiscord();
        engine = engineOver(discord);

        store.createGuild(GUILD);
        store.createStarboard(GUILD, SB);
        store.updateStarboard(SB, s -> s.required = 2);
        discord.post(GUILD, CHANNEL, MSG, AUTHOR, "hello");
    }

    private StarboardEngine engineOver(MessageCache cache) {
        MirrorReconciler reconciler = new MirrorReconciler(store, cache, discord, discord, discord,
                new PointCalculator(), new EligibilityEvaluator(new RegexGuard(Duration.ofMillis(250))));
        return new StarboardEngine(store, cache, reconciler);
    }

    private void star(long userId) {
        engine.handle(new ReactionAdded(GUILD, CHANNEL, MSG, userId, false, "⭐"));
    }

    private StarboardMessageRecord link(long starboardId) {
        return store.getStarboardMessage(MSG, starboardId).orElse(null);
    }

    @Test
    void firstStarShouldRecordMessageAuthorAndMembers() {
        star(20);

        assertTrue(store.getMessage(MSG).isPresent());
        assertEquals(AUTHOR, store.getMessage(MSG).orElseThrow().authorId);
        assertTrue(store.getUser(AUTHOR).isPresent());
        assertEquals(1, store.getMember(AUTHOR, GUILD).orElseThrow().starsReceived);
        assertEquals(1, store.getMember(20, GUILD).orElseThrow().starsGiven);
        assertNull(link(SB));
    }

    @Test
    void enoughStarsShouldMirrorAndRemovingThemShouldUnmirror() {
        star(20);
        star(21);
        assertNotNull(link(SB));
        assertEquals(2, link(SB).points);

        engine.handle(new ReactionRemoved(GUILD, CHANNEL, MSG, 20, false, "⭐"));
        engine.handle(new ReactionRemoved(GUILD, CHANNEL, MSG, 21, false, "⭐"));

        assertNull(link(SB));
        assertTrue(discord.mirrors.isEmpty());
        MemberRecord author = store.getMember(AUTHOR, GUILD).orElseThrow();
        assertEquals(0, author.starsReceived);
    }

    @Test
    void duplicateReactionEventShouldCountOnce() {
        star(20);
        star(20);

        assertEquals(1, store.getMember(AUTHOR, GUILD).orElseThrow().starsReceived);
        assertEquals(1, store.getMessage(MSG).orElseThrow().points);
    }

    @Test
    void botReactionsAndOtherEmojiShouldBeIgnored() {
        engine.handle(new ReactionAdded(GUILD, CHANNEL, MSG, 20, true, "⭐"));
        engine.handle(new ReactionAdded(GUILD, CHANNEL, MSG, 21, false, "👍"));

        assertTrue(store.getMessage(MSG).isEmpty());
    }

    @Test
    void selfStarShouldNotMoveMemberCounters() {
        engine.handle(new ReactionAdded(GUILD, CHANNEL, MSG, AUTHOR, false, "⭐"));

        MemberRecord author = store.getMember(AUTHOR, GUILD).orElseThrow();
        assertEquals(0, author.starsGiven);
        assertEquals(0, author.starsReceived);
    }

    @Test
    void reactionOnMirrorShouldCountTowardOriginal() {
        star(20);
        star(21);
        long mirrorId = link(SB).id;

        engine.handle(new ReactionAdded(GUILD, SB, mirrorId, 22, false, "⭐"));

        assertEquals(3, link(SB).points);
        assertEquals(mirrorId, link(SB).id);
        assertTrue(store.getMessage(mirrorId).isEmpty());
    }

    @Test
    void everyStarboardOfTheGuildShouldBeReconciled() {
        store.createStarboard(GUILD, SB2);
        store.updateStarboard(SB2, s -> s.required = 3);

        star(20);
        star(21);
        assertNotNull(link(SB));
        assertNull(link(SB2));

        star(22);
        assertNotNull(link(SB2));
        assertEquals(List.of(link(SB).id, link(SB2).id), engine.mirrorsOf(GUILD, MSG));
    }

    @Test
    void editShouldRerenderMirror() {
        star(20);
        star(21);

        discord.post(GUILD, CHANNEL, MSG, AUTHOR, "hello again");
        engine.handle(new MessageEdited(GUILD, CHANNEL, MSG));

        assertEquals("hello again", discord.onlyMirror().content.description());
    }

    @Test
    void editOfUnknownMessageShouldDoNothing() {
        engine.handle(new MessageEdited(GUILD, CHANNEL, 999));

        assertTrue(store.getMessage(999).isEmpty());
        assertEquals(0, discord.sends);
    }

    @Test
    void deletingSourceShouldRemoveMirrorOnlyWithLinkDeletes() {
        store.createStarboard(GUILD, SB2);
        store.updateStarboard(SB2, s -> {
            s.required = 2;
            s.linkDeletes = true;
        });
        star(20);
        star(21);

        discord.removeSource(MSG);
        engine.handle(new MessageDeleted(GUILD, CHANNEL, MSG));

        assertNotNull(link(SB));
        assertNull(link(SB2));
    }

    @Test
    void deletedMirrorShouldBeRecreatedWhileStillEligible() {
        star(20);
        star(21);
        long first = link(SB).id;

        discord.mirrors.remove(first);
        engine.handle(new MessageDeleted(GUILD, SB, first));

        assertNotNull(link(SB));
        assertNotEquals(first, link(SB).id);
    }

    @Test
    void trashedMessageShouldLoseMirrorsUntilUntrashed() {
        star(20);
        star(21);

        store.setTrashed(MSG, true);
        engine.handle(new ExplicitResync(GUILD, MSG));
        assertNull(link(SB));
        assertTrue(discord.mirrors.isEmpty());

        star(22);
        assertNull(link(SB));

        store.setTrashed(MSG, false);
        engine.handle(new ExplicitResync(GUILD, MSG));
        assertNotNull(link(SB));
    }

    @Test
    void explicitResyncOnMirrorShouldResolveOriginal() {
        star(20);
        star(21);
        long mirrorId = link(SB).id;
        store.updateStarboard(SB, s -> s.displayEmoji = "🌟");

        engine.handle(new ExplicitResync(GUILD, mirrorId));

        assertTrue(discord.onlyMirror().text.startsWith("**🌟 2"));
    }

    @Test
    void failureOnOneStarboardShouldNotStopTheOthers() {
        store.createStarboard(GUILD, SB2);
        store.updateStarboard(SB2, s -> s.required = 2);
        star(20);
        star(21);

        MessageCache flaky = mock(MessageCache.class);
        when(flaky.fetchMessage(anyLong(), anyLong(), anyLong()))
                .thenAnswer(inv -> discord.fetchMessage(inv.<Long>getArgument(0), inv.<Long>getArgument(1), inv.<Long>getArgument(2)));
        when(flaky.fetchMessage(anyLong(), eq(SB), anyLong()))
                .thenThrow(new IllegalStateException("gateway hiccup"));
        StarboardEngine flakyEngine = engineOver(flaky);

        discord.post(GUILD, CHANNEL, MSG, AUTHOR, "edited");
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> flakyEngine.updateMessage(GUILD, MSG));

        assertEquals("gateway hiccup", e.getMessage());
        FakeDiscord.Mirror second = discord.mirrors.get(link(SB2).id);
        assertEquals("edited", second.content.description());
    }

    @Test
    void clearingAllReactionsShouldUnmirrorAndTakeBackStars() {
        star(20);
        star(21);
        assertNotNull(link(SB));

        engine.handle(new ReactionsCleared(GUILD, CHANNEL, MSG, null));

        assertNull(link(SB));
        assertTrue(discord.mirrors.isEmpty());
        assertTrue(store.getReactions(MSG).isEmpty());
        assertEquals(0, store.getMember(AUTHOR, GUILD).orElseThrow().starsReceived);
        assertEquals(0, store.getMember(20, GUILD).orElseThrow().starsGiven);
    }

    @Test
    void clearingOtherEmojiShouldKeepStars() {
        store.updateStarboard(SB, s -> s.starEmojis = new java.util.ArrayList<>(List.of("⭐", "🌟")));
        star(20);
        star(21);
        engine.handle(new ReactionAdded(GUILD, CHANNEL, MSG, 22, false, "🌟"));
        assertEquals(3, link(SB).points);

        engine.handle(new ReactionsCleared(GUILD, CHANNEL, MSG, "🌟"));

        assertEquals(2, link(SB).points);
        assertEquals(2, store.getMember(AUTHOR, GUILD).orElseThrow().starsReceived);
    }

    @Test
    void clearingReactionsOnMirrorShouldKeepStoredStars() {
        star(20);
        star(21);
        long mirrorId = link(SB).id;

        engine.handle(new ReactionsCleared(GUILD, SB, mirrorId, null));

        assertEquals(mirrorId, link(SB).id);
        assertEquals(1, store.getReactions(MSG).size());
    }

    @Test
    void counterFlagsShouldDecideWhichCountersMove() {
        store.updateStarboard(SB, s -> {
            s.star = false;
            s.xp = false;
        });

        star(20);

        MemberRecord author = store.getMember(AUTHOR, GUILD).orElseThrow();
        assertEquals(1, author.starsReceived);
        assertEquals(0, author.xp);
        assertEquals(0, store.getMember(20, GUILD).orElseThrow().starsGiven);
    }

    @Test
    void unstarOffShouldKeepCountersWhenStarIsRemoved() {
        store.updateStarboard(SB, s -> s.unstar = false);
        star(20);

        engine.handle(new ReactionRemoved(GUILD, CHANNEL, MSG, 20, false, "⭐"));

        MemberRecord author = store.getMember(AUTHOR, GUILD).orElseThrow();
        assertEquals(1, author.starsReceived);
        assertEquals(1, author.xp);
        assertEquals(0, store.getMessage(MSG).orElseThrow().points);
    }

    @Test
    void reactionInUnreadableChannelShouldBeDroppedQuietly() {
        discord.unreadable.add(CHANNEL);

        assertDoesNotThrow(() -> star(20));

        assertTrue(store.getMessage(MSG).isEmpty());
        assertTrue(discord.notices.isEmpty());
    }
}
