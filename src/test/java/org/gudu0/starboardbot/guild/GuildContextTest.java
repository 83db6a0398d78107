package org.gudu0.starboardbot.guild;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GuildContextTest {

    @TempDir
    Path dir;

    @Test
    void logChannelShouldOnlyBeUsedWhenEnabled() {
        GuildContext ctx = new GuildContext(100, dir);
        assertEquals(0, ctx.logChannelIdOrZero());

        ctx.cfg.logChannelId = "555";
        assertEquals(0, ctx.logChannelIdOrZero());

        ctx.cfg.enableLogs = true;
        assertEquals(555, ctx.logChannelIdOrZero());

        ctx.cfg.logChannelId = "not-a-number";
        assertEquals(0, ctx.logChannelIdOrZero());
    }

    @Test
    void savedConfigShouldBeReloaded() throws Exception {
        GuildContext ctx = new GuildContext(100, dir);
        ctx.cfg.logChannelId = "555";
        ctx.cfg.enableLogs = true;
        ctx.save("test");

        assertTrue(Files.exists(dir.resolve("config.json")));
        assertEquals(555, new GuildContext(100, dir).logChannelIdOrZero());
    }

    @Test
    void managerShouldCacheContextsPerGuild() {
        GuildManager manager = new GuildManager(id -> dir.resolve(Long.toString(id)));

        GuildContext first = manager.get(1);
        assertSame(first, manager.get(1));
        assertNotSame(first, manager.get(2));
        assertEquals(2, manager.cachedCount());

        manager.evict(1);
        assertNotSame(first, manager.get(1));
    }
}
