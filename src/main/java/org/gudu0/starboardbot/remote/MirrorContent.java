package org.gudu0.starboardbot.remote;

import java.time.OffsetDateTime;
import java.util.List;

/** Rendered body of a mirror, independent of how the gateway turns it into an embed. */
public record MirrorContent(
        String description,
        String authorName,
        String authorAvatarUrl,
        int color,
        String imageUrl,
        String jumpUrl,
        List<String> links,
        OffsetDateTime timestamp
) {
    public MirrorContent {
        links = links == null ? List.of() : List.copyOf(links);
    }
}
