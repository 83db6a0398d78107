package org.gudu0.starboardbot.discord;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.events.guild.GuildLeaveEvent;
import net.dv8tion.jda.api.exceptions.InsufficientPermissionException;
import net.dv8tion.jda.api.requests.RestAction;
import org.gudu0.starboardbot.remote.LiveMessage;
import org.gudu0.starboardbot.remote.PermissionDeniedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JdaMessageCacheTest {

    private static final long GUILD = 1;
    private static final long CHANNEL = 300;
    private static final long MSG = 555;

    private JDA jda;
    private GuildMessageChannel channel;
    private JdaMessageCache cache;

    @BeforeEach
    void setUp() {
        jda = mock(JDA.class);
        channel = mock(GuildMessageChannel.class);
        when(jda.getChannelById(GuildMessageChannel.class, CHANNEL)).thenReturn(channel);
        cache = new JdaMessageCache(jda, 10, 60);
    }

    @SuppressWarnings("unchecked")
    private RestAction<Message> retrieveReturning(Message message) {
        RestAction<Message> action = mock(RestAction.class);
        when(action.complete()).thenReturn(message);
        when(channel.retrieveMessageById(MSG)).thenReturn(action);
        return action;
    }

    private static Message message() {
        Message m = mock(Message.class, RETURNS_DEEP_STUBS);
        when(m.getIdLong()).thenReturn(MSG);
        when(m.getChannel().getIdLong()).thenReturn(CHANNEL);
        when(m.getAuthor().getIdLong()).thenReturn(10L);
        when(m.getAuthor().getName()).thenReturn("someone");
        when(m.getContentRaw()).thenReturn("hello");
        when(m.getJumpUrl()).thenReturn("https://discord.com/channels/1/300/555");
        when(m.getAttachments()).thenReturn(List.of());
        when(m.getTimeCreated()).thenReturn(OffsetDateTime.parse("2026-01-01T00:00:00Z"));
        return m;
    }

    @Test
    void missingHistoryPermissionShouldNotLookLikeADeletedMessage() {
        @SuppressWarnings("unchecked")
        RestAction<Message> action = mock(RestAction.class);
        InsufficientPermissionException denied = new InsufficientPermissionException(mock(Guild.class), Permission.MESSAGE_HISTORY);
        when(action.complete()).thenThrow(denied);
        when(channel.retrieveMessageById(MSG)).thenReturn(action);

        PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
                () -> cache.fetchMessage(GUILD, CHANNEL, MSG));
        assertEquals(Permission.MESSAGE_HISTORY.getName(), e.getPermission());
    }

    @Test
    void invisibleChannelShouldReadAsGone() {
        assertEquals(Optional.empty(), cache.fetchMessage(GUILD, 999, MSG));
    }

    @Test
    void secondFetchShouldComeFromTheCache() {
        RestAction<Message> action = retrieveReturning(message());

        LiveMessage first = cache.fetchMessage(GUILD, CHANNEL, MSG).orElseThrow();
        LiveMessage second = cache.fetchMessage(GUILD, CHANNEL, MSG).orElseThrow();

        assertSame(first, second);
        assertEquals("hello", first.content());
        verify(action, times(1)).complete();
    }

    @Test
    void invalidatedMessageShouldBeFetchedAgain() {
        RestAction<Message> action = retrieveReturning(message());

        cache.fetchMessage(GUILD, CHANNEL, MSG);
        cache.invalidate(GUILD, MSG);
        cache.fetchMessage(GUILD, CHANNEL, MSG);

        verify(action, times(2)).complete();
    }

    @Test
    void leavingGuildShouldDropItsCache() {
        retrieveReturning(message());
        cache.fetchMessage(GUILD, CHANNEL, MSG);
        assertEquals(1, cache.guildCount());

        GuildLeaveEvent event = mock(GuildLeaveEvent.class, RETURNS_DEEP_STUBS);
        when(event.getGuild().getIdLong()).thenReturn(GUILD);
        cache.onGuildLeave(event);

        assertEquals(0, cache.guildCount());
    }
}
