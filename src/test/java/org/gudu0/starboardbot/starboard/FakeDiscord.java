package org.gudu0.starboardbot.starboard;

import org.gudu0.starboardbot.remote.*;
import org.gudu0.starboardbot.store.StarboardConfig;

import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory stand-in for the Discord side: source messages, posted mirrors and the guild log.
 * The cache reads straight from channel state, so a deleted mirror is gone from both.
 */
class FakeDiscord implements MessageCache, MirrorChannel, MirrorRenderer, GuildNotifier {

    static final class Mirror {
        final long channelId;
        String text;
        MirrorContent content;
        final List<String> reactions = new ArrayList<>();

        Mirror(long channelId, String text, MirrorContent content) {
            this.channelId = channelId;
            this.text = text;
            this.content = content;
        }
    }

    final Map<Long, LiveMessage> sources = new HashMap<>();
    final Map<Long, Mirror> mirrors = new LinkedHashMap<>();
    final List<String> notices = Collections.synchronizedList(new ArrayList<>());

    /** Operations ("send", "edit", "delete", "react") that fail with a missing permission. */
    final Set<String> denied = new HashSet<>();
    /** Emoji whose autoreact fails with a missing permission. */
    final Set<String> deniedEmojis = new HashSet<>();
    /** Channels whose history the bot may not read. */
    final Set<Long> unreadable = new HashSet<>();

    int sends;
    int edits;
    int deletes;
    int fetches;

    private final AtomicLong nextId = new AtomicLong(900_000);

    LiveMessage post(long guildId, long channelId, long messageId, long authorId, String content) {
        return post(guildId, channelId, messageId, authorId, false, content, false);
    }

    LiveMessage post(long guildId, long channelId, long messageId, long authorId, boolean authorBot,
                     String content, boolean nsfw) {
        LiveMessage m = new LiveMessage(messageId, guildId, channelId, authorId, authorBot, "user" + authorId,
                null, content, "https://discord.com/channels/" + guildId + "/" + channelId + "/" + messageId,
                nsfw, List.of(), OffsetDateTime.parse("2026-01-01T00:00:00Z"));
        sources.put(messageId, m);
        return m;
    }

    void removeSource(long messageId) {
        sources.remove(messageId);
    }

    Mirror onlyMirror() {
        if (mirrors.size() != 1) throw new AssertionError("expected one mirror, got " + mirrors.size());
        return mirrors.values().iterator().next();
    }

    // --- MessageCache ---

    @Override
    public synchronized Optional<LiveMessage> fetchMessage(long guildId, long channelId, long messageId) {
        fetches++;
        if (unreadable.contains(channelId)) {
            throw new PermissionDeniedException("Read Message History", "cannot read " + channelId);
        }
        LiveMessage src = sources.get(messageId);
        if (src != null && src.channelId() == channelId) return Optional.of(src);

        Mirror mirror = mirrors.get(messageId);
        if (mirror != null && mirror.channelId == channelId) {
            return Optional.of(new LiveMessage(messageId, guildId, channelId, 1L, true, "bot", null,
                    mirror.text, "", false, List.of(), OffsetDateTime.parse("2026-01-01T00:00:00Z")));
        }
        return Optional.empty();
    }

    @Override
    public void invalidate(long guildId, long messageId) {
        // reads are never stale here
    }

    // --- MirrorChannel ---

    @Override
    public synchronized long send(long channelId, String text, MirrorContent content) {
        if (denied.contains("send")) throw new PermissionDeniedException("Send Messages", "cannot send");
        sends++;
        long id = nextId.incrementAndGet();
        mirrors.put(id, new Mirror(channelId, text, content));
        return id;
    }

    @Override
    public synchronized void edit(long channelId, long messageId, String text, MirrorContent content) {
        if (denied.contains("edit")) throw new PermissionDeniedException("Manage Messages", "cannot edit");
        Mirror m = mirrors.get(messageId);
        if (m == null) throw new RemoteNotFoundException("Unknown message " + messageId);
        edits++;
        m.text = text;
        if (content != null) m.content = content;
    }

    @Override
    public synchronized void delete(long channelId, long messageId) {
        if (denied.contains("delete")) throw new PermissionDeniedException("Manage Messages", "cannot delete");
        if (mirrors.remove(messageId) == null) throw new RemoteNotFoundException("Unknown message " + messageId);
        deletes++;
    }

    @Override
    public synchronized void react(long channelId, long messageId, String emoji) {
        if (denied.contains("react") || deniedEmojis.contains(emoji)) {
            throw new PermissionDeniedException("Add Reactions", "cannot react");
        }
        Mirror m = mirrors.get(messageId);
        if (m == null) throw new RemoteNotFoundException("Unknown message " + messageId);
        m.reactions.add(emoji);
    }

    // --- MirrorRenderer ---

    @Override
    public MirrorContent render(LiveMessage message, StarboardConfig starboard) {
        return new MirrorContent(message.content(), message.authorName(), null,
                starboard.color == null ? 0xFFE19C : starboard.color, null, message.jumpUrl(), List.of(),
                message.createdAt());
    }

    @Override
    public String displayEmoji(long guildId, String token) {
        return token;
    }

    // --- GuildNotifier ---

    @Override
    public void notify(long guildId, Severity severity, String message) {
        notices.add(severity.title() + ": " + message);
    }
}
