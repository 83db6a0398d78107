package org.gudu0.starboardbot.remote;

/**
 * Send/edit/delete/react primitives on starboard channels.
 * <p>
 * Every method may throw {@link PermissionDeniedException} or {@link RemoteNotFoundException};
 * anything else is an unexpected remote failure.
 */
public interface MirrorChannel {

    /** @return id of the new message */
    long send(long channelId, String text, MirrorContent content);

    /** Replaces the text; replaces the embed too when {@code content} is non-null. */
    void edit(long channelId, long messageId, String text, MirrorContent content);

    void delete(long channelId, long messageId);

    void react(long channelId, long messageId, String emoji);
}
