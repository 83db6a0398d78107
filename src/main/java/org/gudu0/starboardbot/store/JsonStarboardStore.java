package org.gudu0.starboardbot.store;

import org.gudu0.starboardbot.util.ConsoleLog;
import org.gudu0.starboardbot.util.JsonStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * {@link StarboardStore} over a single JSON document (data/global/starboard.json).
 * <p>
 * Referential integrity is enforced here, the way the relational schema would:
 * guild -> starboards, members, messages (cascade); starboard -> links (cascade);
 * message -> links, reactions (cascade); user -> authors, reaction users (set null).
 * Two lookup indexes are kept in memory and rebuilt on load.
 */
public class JsonStarboardStore implements StarboardStore {

    private final JsonStore<StarboardData> store;

    // "origId:starboardId" -> mirror id
    private final Map<String, Long> linkIndex = new HashMap<>();
    // message id -> reaction ids
    private final Map<Long, Set<Long>> reactionIndex = new HashMap<>();

    public JsonStarboardStore(Path path) {
        this.store = new JsonStore<>(path, StarboardData.class, StarboardData::new, "starboard.json");
        store.read(d -> {
            rebuildIndexes(d);
            return null;
        });
    }

    public void startAutoFlush(long periodSeconds) { store.startAutoFlush(periodSeconds); }
    public void tryFlush() { store.tryFlush(); }
    public void flushNow() throws IOException { store.flushNow(); }
    public void close() { store.close(); }

    // ----------------------------
    // Guilds / users / members
    // ----------------------------

    @Override
    public GuildRecord createGuild(long guildId) {
        return store.write(d -> {
            GuildRecord g = d.guilds.computeIfAbsent(guildId, GuildRecord::new);
            return new GuildRecord(g.id);
        });
    }

    @Override
    public void deleteGuild(long guildId) {
        store.update(d -> {
            if (d.guilds.remove(guildId) == null) return;

            List<Long> starboardIds = d.starboards.values().stream()
                    .filter(s -> s.guildId == guildId)
                    .map(s -> s.id)
                    .collect(Collectors.toList());
            starboardIds.forEach(id -> removeStarboard(d, id));

            d.members.values().removeIf(m -> m.guildId == guildId);

            List<Long> messageIds = d.messages.values().stream()
                    .filter(m -> m.guildId == guildId)
                    .map(m -> m.id)
                    .collect(Collectors.toList());
            messageIds.forEach(id -> removeMessage(d, id));

            ConsoleLog.info("Store", "Deleted guildId=" + guildId + " starboards=" + starboardIds.size()
                    + " messages=" + messageIds.size());
        });
    }

    @Override
    public UserRecord createUser(long userId, boolean bot) {
        return store.write(d -> d.users.computeIfAbsent(userId, id -> new UserRecord(id, bot)).copy());
    }

    @Override
    public Optional<UserRecord> getUser(long userId) {
        return store.read(d -> Optional.ofNullable(d.users.get(userId)).map(UserRecord::copy));
    }

    @Override
    public void deleteUser(long userId) {
        store.update(d -> {
            if (d.users.remove(userId) == null) return;

            d.members.values().removeIf(m -> m.userId == userId);
            for (MessageRecord m : d.messages.values()) {
                if (m.authorId != null && m.authorId == userId) m.authorId = null;
            }
            for (ReactionRecord r : d.reactions.values()) {
                r.userIds.replaceAll(u -> (u != null && u == userId) ? null : u);
            }
        });
    }

    @Override
    public MemberRecord createMember(long userId, long guildId) {
        return store.write(d -> {
            requireGuild(d, guildId);
            requireUser(d, userId);
            return d.members.computeIfAbsent(MemberRecord.key(userId, guildId),
                    k -> new MemberRecord(userId, guildId)).copy();
        });
    }

    @Override
    public Optional<MemberRecord> getMember(long userId, long guildId) {
        return store.read(d -> Optional.ofNullable(d.members.get(MemberRecord.key(userId, guildId))).map(MemberRecord::copy));
    }

    @Override
    public void updateMember(long userId, long guildId, Consumer<MemberRecord> change) {
        store.update(d -> {
            MemberRecord m = d.members.get(MemberRecord.key(userId, guildId));
            if (m == null) throw new StoreException("Unknown member userId=" + userId + " guildId=" + guildId);
            change.accept(m);
        });
    }

    // ----------------------------
    // Starboards
    // ----------------------------

    @Override
    public StarboardConfig createStarboard(long guildId, long channelId) {
        return store.write(d -> {
            requireGuild(d, guildId);
            StarboardConfig existing = d.starboards.get(channelId);
            if (existing != null) {
                throw new StoreException("Channel " + channelId + " is already a starboard");
            }
            StarboardConfig s = new StarboardConfig(channelId, guildId);
            d.starboards.put(channelId, s);
            return s.copy();
        });
    }

    @Override
    public Optional<StarboardConfig> getStarboard(long starboardId) {
        return store.read(d -> Optional.ofNullable(d.starboards.get(starboardId)).map(StarboardConfig::copy));
    }

    @Override
    public List<StarboardConfig> getStarboards(long guildId) {
        return store.read(d -> d.starboards.values().stream()
                .filter(s -> s.guildId == guildId)
                .sorted(Comparator.comparingLong(s -> s.id))
                .map(StarboardConfig::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public void updateStarboard(long starboardId, Consumer<StarboardConfig> change) {
        store.update(d -> {
            StarboardConfig s = d.starboards.get(starboardId);
            if (s == null) throw new StoreException("Unknown starboard " + starboardId);
            long id = s.id;
            long guildId = s.guildId;
            change.accept(s);
            s.id = id;
            s.guildId = guildId;
        });
    }

    @Override
    public void deleteStarboard(long starboardId) {
        store.update(d -> removeStarboard(d, starboardId));
    }

    // ----------------------------
    // Messages
    // ----------------------------

    @Override
    public MessageRecord createMessage(long messageId, long guildId, long channelId, Long authorId, boolean nsfw) {
        return store.write(d -> {
            requireGuild(d, guildId);
            if (authorId != null) requireUser(d, authorId);
            return d.messages.computeIfAbsent(messageId,
                    id -> new MessageRecord(id, guildId, channelId, authorId, nsfw)).copy();
        });
    }

    @Override
    public Optional<MessageRecord> getMessage(long messageId) {
        return store.read(d -> Optional.ofNullable(d.messages.get(messageId)).map(MessageRecord::copy));
    }

    @Override
    public void deleteMessage(long messageId) {
        store.update(d -> removeMessage(d, messageId));
    }

    @Override
    public void setForced(long messageId, long starboardId, boolean forced) {
        store.update(d -> {
            MessageRecord m = requireMessage(d, messageId);
            if (forced) {
                if (!d.starboards.containsKey(starboardId)) throw new StoreException("Unknown starboard " + starboardId);
                m.forced.add(starboardId);
            } else {
                m.forced.remove(starboardId);
            }
        });
    }

    @Override
    public void setTrashed(long messageId, boolean trashed) {
        store.update(d -> requireMessage(d, messageId).trashed = trashed);
    }

    @Override
    public void setFrozen(long messageId, boolean frozen) {
        store.update(d -> requireMessage(d, messageId).frozen = frozen);
    }

    @Override
    public void setMessagePoints(long messageId, int points) {
        store.update(d -> requireMessage(d, messageId).points = points);
    }

    // ----------------------------
    // Starboard messages
    // ----------------------------

    @Override
    public Optional<StarboardMessageRecord> getStarboardMessage(long origId, long starboardId) {
        return store.read(d -> {
            Long mirrorId = linkIndex.get(linkKey(origId, starboardId));
            if (mirrorId == null) return Optional.<StarboardMessageRecord>empty();
            return Optional.ofNullable(d.starboardMessages.get(mirrorId)).map(StarboardMessageRecord::copy);
        });
    }

    @Override
    public Optional<StarboardMessageRecord> getStarboardMessageById(long mirrorId) {
        return store.read(d -> Optional.ofNullable(d.starboardMessages.get(mirrorId)).map(StarboardMessageRecord::copy));
    }

    @Override
    public StarboardMessageRecord createStarboardMessage(long mirrorId, long origId, long starboardId) {
        return store.write(d -> {
            requireMessage(d, origId);
            if (!d.starboards.containsKey(starboardId)) throw new StoreException("Unknown starboard " + starboardId);

            String key = linkKey(origId, starboardId);
            Long existing = linkIndex.get(key);
            if (existing != null) {
                throw new StoreException("Message " + origId + " already has mirror " + existing + " on starboard " + starboardId);
            }
            if (d.starboardMessages.containsKey(mirrorId)) {
                throw new StoreException("Mirror id " + mirrorId + " is already linked");
            }

            StarboardMessageRecord link = new StarboardMessageRecord(mirrorId, origId, starboardId);
            d.starboardMessages.put(mirrorId, link);
            linkIndex.put(key, mirrorId);
            return link.copy();
        });
    }

    @Override
    public void deleteStarboardMessage(long mirrorId) {
        store.update(d -> removeLink(d, mirrorId));
    }

    @Override
    public void setPoints(long mirrorId, int points) {
        store.update(d -> {
            StarboardMessageRecord link = d.starboardMessages.get(mirrorId);
            if (link == null) throw new StoreException("Unknown starboard message " + mirrorId);
            link.points = points;
        });
    }

    @Override
    public List<StarboardMessageRecord> getStarboardMessages(long starboardId) {
        return store.read(d -> d.starboardMessages.values().stream()
                .filter(l -> l.starboardId == starboardId)
                .sorted(Comparator.comparingLong(l -> l.id))
                .map(StarboardMessageRecord::copy)
                .collect(Collectors.toList()));
    }

    // ----------------------------
    // Reactions
    // ----------------------------

    @Override
    public boolean addReaction(long messageId, String emoji, long userId) {
        return store.write(d -> {
            requireMessage(d, messageId);
            requireUser(d, userId);

            ReactionRecord r = findReaction(d, messageId, emoji);
            if (r == null) {
                r = new ReactionRecord(d.nextReactionId++, messageId, emoji);
                d.reactions.put(r.id, r);
                reactionIndex.computeIfAbsent(messageId, k -> new HashSet<>()).add(r.id);
            }
            if (r.userIds.contains(userId)) return false;
            r.userIds.add(userId);
            return true;
        });
    }

    @Override
    public boolean removeReaction(long messageId, String emoji, long userId) {
        return store.write(d -> {
            ReactionRecord r = findReaction(d, messageId, emoji);
            if (r == null) return false;
            boolean removed = r.userIds.remove(Long.valueOf(userId));
            if (r.userIds.isEmpty()) {
                d.reactions.remove(r.id);
                Set<Long> ids = reactionIndex.get(messageId);
                if (ids != null) {
                    ids.remove(r.id);
                    if (ids.isEmpty()) reactionIndex.remove(messageId);
                }
            }
            return removed;
        });
    }

    @Override
    public List<ReactionRecord> getReactions(long messageId) {
        return store.read(d -> {
            Set<Long> ids = reactionIndex.getOrDefault(messageId, Set.of());
            List<ReactionRecord> out = new ArrayList<>(ids.size());
            for (long id : ids) {
                ReactionRecord r = d.reactions.get(id);
                if (r != null) out.add(r.copy());
            }
            out.sort(Comparator.comparingLong(r -> r.id));
            return out;
        });
    }

    @Override
    public List<ReactionRecord> clearReactions(long messageId, String emoji) {
        return store.write(d -> {
            Set<Long> ids = reactionIndex.get(messageId);
            if (ids == null) return List.<ReactionRecord>of();

            List<ReactionRecord> removed = new ArrayList<>();
            for (Iterator<Long> it = ids.iterator(); it.hasNext(); ) {
                ReactionRecord r = d.reactions.get(it.next());
                if (r == null || emoji == null || r.emoji.equals(emoji)) {
                    it.remove();
                    if (r != null) {
                        d.reactions.remove(r.id);
                        removed.add(r);
                    }
                }
            }
            if (ids.isEmpty()) reactionIndex.remove(messageId);
            removed.sort(Comparator.comparingLong(r -> r.id));
            return removed;
        });
    }

    // ----------------------------
    // Internals (caller holds the store lock)
    // ----------------------------

    private void removeStarboard(StarboardData d, long starboardId) {
        if (d.starboards.remove(starboardId) == null) return;

        List<Long> mirrors = d.starboardMessages.values().stream()
                .filter(l -> l.starboardId == starboardId)
                .map(l -> l.id)
                .collect(Collectors.toList());
        mirrors.forEach(id -> removeLink(d, id));

        for (MessageRecord m : d.messages.values()) {
            m.forced.remove(starboardId);
        }
    }

    private void removeMessage(StarboardData d, long messageId) {
        if (d.messages.remove(messageId) == null) return;

        List<Long> mirrors = d.starboardMessages.values().stream()
                .filter(l -> l.origId == messageId)
                .map(l -> l.id)
                .collect(Collectors.toList());
        mirrors.forEach(id -> removeLink(d, id));

        Set<Long> reactionIds = reactionIndex.remove(messageId);
        if (reactionIds != null) reactionIds.forEach(d.reactions::remove);
    }

    private void removeLink(StarboardData d, long mirrorId) {
        StarboardMessageRecord link = d.starboardMessages.remove(mirrorId);
        if (link != null) linkIndex.remove(linkKey(link.origId, link.starboardId));
    }

    private ReactionRecord findReaction(StarboardData d, long messageId, String emoji) {
        for (long id : reactionIndex.getOrDefault(messageId, Set.of())) {
            ReactionRecord r = d.reactions.get(id);
            if (r != null && r.emoji.equals(emoji)) return r;
        }
        return null;
    }

    private void rebuildIndexes(StarboardData d) {
        linkIndex.clear();
        reactionIndex.clear();
        for (StarboardMessageRecord link : d.starboardMessages.values()) {
            linkIndex.put(linkKey(link.origId, link.starboardId), link.id);
        }
        for (ReactionRecord r : d.reactions.values()) {
            reactionIndex.computeIfAbsent(r.messageId, k -> new HashSet<>()).add(r.id);
        }
        ConsoleLog.info("Store", "Indexed links=" + linkIndex.size() + " reactions=" + d.reactions.size());
    }

    private static String linkKey(long origId, long starboardId) {
        return origId + ":" + starboardId;
    }

    private static void requireGuild(StarboardData d, long guildId) {
        if (!d.guilds.containsKey(guildId)) throw new StoreException("Unknown guild " + guildId);
    }

    private static void requireUser(StarboardData d, long userId) {
        if (!d.users.containsKey(userId)) throw new StoreException("Unknown user " + userId);
    }

    private static MessageRecord requireMessage(StarboardData d, long messageId) {
        MessageRecord m = d.messages.get(messageId);
        if (m == null) throw new StoreException("Unknown message " + messageId);
        return m;
    }
}
