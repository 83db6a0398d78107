package org.gudu0.starboardbot.discord;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.channel.attribute.IAgeRestrictedChannel;
import net.dv8tion.jda.api.entities.channel.concrete.ThreadChannel;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.events.guild.GuildLeaveEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.starboardbot.remote.LiveMessage;
import org.gudu0.starboardbot.remote.MessageCache;
import org.gudu0.starboardbot.remote.RemoteNotFoundException;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-guild Caffeine cache of message snapshots in front of {@code retrieveMessageById}.
 * Each guild keeps at most {@code sizePerGuild} entries, each for at most the configured age.
 * Failed lookups are never cached. A guild's cache is dropped when the bot leaves it.
 */
public class JdaMessageCache extends ListenerAdapter implements MessageCache {

    private static final String TAG = "MessageCache";

    private final JDA jda;
    private final int sizePerGuild;
    private final Duration ttl;
    private final ConcurrentHashMap<Long, Cache<Long, LiveMessage>> guilds = new ConcurrentHashMap<>();

    public JdaMessageCache(JDA jda, int sizePerGuild, long ttlSeconds) {
        this.jda = jda;
        this.sizePerGuild = Math.max(1, sizePerGuild);
        this.ttl = Duration.ofSeconds(Math.max(1, ttlSeconds));
    }

    /**
     * @throws org.gudu0.starboardbot.remote.PermissionDeniedException when the channel is visible
     *         but its history cannot be read; the message may well still exist
     */
    @Override
    public Optional<LiveMessage> fetchMessage(long guildId, long channelId, long messageId) {
        Cache<Long, LiveMessage> cache = cacheOf(guildId);

        LiveMessage hit = cache.getIfPresent(messageId);
        if (hit != null && hit.channelId() == channelId) {
            ConsoleLog.debug(TAG, "hit guildId=" + guildId + " msg=" + messageId);
            return Optional.of(hit);
        }

        Optional<LiveMessage> fetched = retrieve(guildId, channelId, messageId);
        fetched.ifPresent(m -> cache.put(messageId, m));
        return fetched;
    }

    @Override
    public void invalidate(long guildId, long messageId) {
        Cache<Long, LiveMessage> cache = guilds.get(guildId);
        if (cache != null) cache.invalidate(messageId);
    }

    @Override
    public void onGuildLeave(GuildLeaveEvent event) {
        Cache<Long, LiveMessage> cache = guilds.remove(event.getGuild().getIdLong());
        if (cache != null) cache.invalidateAll();
    }

    /** Number of guilds with a live cache. */
    int guildCount() {
        return guilds.size();
    }

    private Cache<Long, LiveMessage> cacheOf(long guildId) {
        return guilds.computeIfAbsent(guildId, id -> Caffeine.newBuilder()
                .maximumSize(sizePerGuild)
                .expireAfterWrite(ttl)
                .build());
    }

    private Optional<LiveMessage> retrieve(long guildId, long channelId, long messageId) {
        GuildMessageChannel ch = jda.getChannelById(GuildMessageChannel.class, channelId);
        if (ch == null) {
            ConsoleLog.debug(TAG, "guildId=" + guildId + " channel " + channelId + " not visible");
            return Optional.empty();
        }

        try {
            Message m = JdaErrors.call("retrieve " + messageId, Permission.MESSAGE_HISTORY,
                    () -> ch.retrieveMessageById(messageId).complete());
            return Optional.of(toLive(guildId, m));
        } catch (RemoteNotFoundException e) {
            ConsoleLog.debug(TAG, "guildId=" + guildId + " msg=" + messageId + " not found");
            return Optional.empty();
        }
    }

    static LiveMessage toLive(long guildId, Message m) {
        List<LiveMessage.Attachment> attachments = m.getAttachments().stream()
                .map(a -> new LiveMessage.Attachment(a.getFileName(), a.getUrl(), a.isImage(), a.isSpoiler()))
                .toList();

        return new LiveMessage(
                m.getIdLong(),
                guildId,
                m.getChannel().getIdLong(),
                m.getAuthor().getIdLong(),
                m.getAuthor().isBot(),
                m.getAuthor().getName(),
                m.getAuthor().getEffectiveAvatarUrl(),
                m.getContentRaw(),
                m.getJumpUrl(),
                isNsfw(m),
                attachments,
                m.getTimeCreated()
        );
    }

    private static boolean isNsfw(Message m) {
        Object ch = m.getChannel();
        if (ch instanceof ThreadChannel thread) ch = thread.getParentChannel();
        return ch instanceof IAgeRestrictedChannel arc && arc.isNSFW();
    }
}
