package org.gudu0.starboardbot.console;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import org.gudu0.starboardbot.guild.GuildContext;
import org.gudu0.starboardbot.guild.GuildManager;
import org.gudu0.starboardbot.starboard.StarboardEngine;
import org.gudu0.starboardbot.starboard.StarboardWorker;
import org.gudu0.starboardbot.starboard.event.StarboardEvent;
import org.gudu0.starboardbot.store.JsonStarboardStore;
import org.gudu0.starboardbot.store.StarboardConfig;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

public final class ConsoleCommandService {

    private final GuildManager guilds;
    private final JsonStarboardStore store;
    private final StarboardEngine engine;
    private final StarboardWorker worker;
    private final JDA jda;

    private volatile boolean running = true;

    public ConsoleCommandService(GuildManager guilds, JsonStarboardStore store,
                                 StarboardEngine engine, StarboardWorker worker, JDA jda) {
        this.guilds = guilds;
        this.store = store;
        this.engine = engine;
        this.worker = worker;
        this.jda = jda;
    }

    public void start() {
        Thread t = new Thread(this::runLoop, "ConsoleCommandService");
        t.setDaemon(true); // don't prevent JVM shutdown
        t.start();

        ConsoleLog.info("Console", "Console commands enabled. Type 'help' for commands.");
    }

    public void stop() {
        running = false;
    }

    private void runLoop() {
        try (BufferedReader br = new BufferedReader(
                new InputStreamReader(System.in, StandardCharsets.UTF_8))) {

            while (running) {
                String line = br.readLine();
                if (line == null) {
                    ConsoleLog.warn("Console", "STDIN closed; console commands disabled.");
                    return;
                }

                line = line.trim();
                if (line.isEmpty()) continue;

                handle(line);
            }
        } catch (Exception e) {
            ConsoleLog.error("Console", "Console command loop crashed: " + e.getMessage(), e);
        }
    }

    void handle(String raw) {
        String[] parts = raw.trim().split("\\s+");
        String cmd = parts[0].toLowerCase(Locale.ROOT);

        switch (cmd) {
            case "help" -> printHelp();

            case "debug" -> {
                if (parts.length < 2) {
                    ConsoleLog.info("Console", "debug=" + ConsoleLog.DEBUG);
                    return;
                }
                ConsoleLog.DEBUG = parts[1].equalsIgnoreCase("on");
                ConsoleLog.info("Console", "debug=" + ConsoleLog.DEBUG);
            }

            case "flush" -> {
                try {
                    store.flushNow();
                    ConsoleLog.info("Console", "Starboard store flushed.");
                } catch (Exception e) {
                    ConsoleLog.error("Console", "Flush failed: " + e.getMessage(), e);
                }
            }

            case "listguilds", "guilds" -> listGuilds();

            case "guild" -> {
                Long guildId = parseId(parts, 1, "Usage: guild <guildId>");
                if (guildId != null) guildStatus(guildId);
            }

            case "resync" -> {
                Long guildId = parseId(parts, 1, "Usage: resync <guildId> <messageId>");
                if (guildId == null) return;
                Long messageId = parseId(parts, 2, "Usage: resync <guildId> <messageId>");
                if (messageId == null) return;

                worker.submit(new StarboardEvent.ExplicitResync(guildId, messageId))
                        .whenComplete((ok, err) -> {
                            if (err != null) {
                                ConsoleLog.warn("Console", "Resync failed guildId=" + guildId + " msg=" + messageId);
                            } else {
                                ConsoleLog.info("Console", "Resynced msg=" + messageId + " mirrors="
                                        + engine.mirrorsOf(guildId, messageId));
                            }
                        });
            }

            case "shutdown", "exit" -> {
                ConsoleLog.warn("Console", "Shutdown requested from console.");
                System.exit(0);
            }

            default -> ConsoleLog.warn("Console", "Unknown command: " + cmd + " (type 'help')");
        }
    }

    private static Long parseId(String[] parts, int index, String usage) {
        if (parts.length <= index) {
            ConsoleLog.warn("Console", usage);
            return null;
        }
        try {
            return Long.parseLong(parts[index]);
        } catch (NumberFormatException e) {
            ConsoleLog.warn("Console", "Invalid id: " + parts[index]);
            return null;
        }
    }

    private void printHelp() {
        ConsoleLog.info("Console", """
                Commands:
                  help                        - show this help
                  debug on|off                - toggle debug logging
                  flush                       - write the starboard store to disk now
                  listguilds|guilds           - list guilds the bot is in
                  guild <id>                  - show per-guild config and starboards
                  resync <guildId> <msgId>    - re-sync one message on every starboard
                  shutdown|exit               - terminate process
                """.trim());
    }

    private void listGuilds() {
        List<Guild> gs = jda.getGuilds();
        ConsoleLog.info("Console", "Guilds (" + gs.size() + "):");
        for (Guild g : gs) {
            ConsoleLog.info("Console", " - " + g.getName() + " | " + g.getId()
                    + " | starboards=" + store.getStarboards(g.getIdLong()).size());
        }
    }

    private void guildStatus(long guildId) {
        Guild g = jda.getGuildById(guildId);
        if (g == null) {
            ConsoleLog.warn("Console", "Bot is not in guildId=" + guildId);
            return;
        }

        GuildContext ctx = guilds.get(guildId);

        String logChannel = (ctx.cfg.logChannelId == null || ctx.cfg.logChannelId.isBlank())
                ? "(not set)"
                : ctx.cfg.logChannelId;

        ConsoleLog.info("Console", "Guild status: " + g.getName() + " (" + guildId + ")");
        ConsoleLog.info("Console", "  enableLogs=" + ctx.cfg.enableLogs);
        ConsoleLog.info("Console", "  logChannelId=" + logChannel);
        for (StarboardConfig sb : store.getStarboards(guildId)) {
            ConsoleLog.info("Console", "  starboard " + sb.id + " required=" + sb.required
                    + " requiredRemove=" + sb.requiredRemove + " emojis=" + sb.starEmojis);
        }
    }
}
