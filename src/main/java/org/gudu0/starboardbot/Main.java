package org.gudu0.starboardbot;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.interactions.commands.DefaultMemberPermissions;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.OptionData;
import net.dv8tion.jda.api.interactions.commands.build.SubcommandData;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.gudu0.starboardbot.commands.*;
import org.gudu0.starboardbot.config.GlobalConfig;
import org.gudu0.starboardbot.config.TypedConfigStore;
import org.gudu0.starboardbot.console.ConsoleCommandService;
import org.gudu0.starboardbot.discord.EmbedRenderer;
import org.gudu0.starboardbot.discord.GuildMembershipListener;
import org.gudu0.starboardbot.discord.JdaMessageCache;
import org.gudu0.starboardbot.discord.JdaMirrorChannel;
import org.gudu0.starboardbot.discord.StarboardListener;
import org.gudu0.starboardbot.guild.GuildManager;
import org.gudu0.starboardbot.logging.LogService;
import org.gudu0.starboardbot.starboard.*;
import org.gudu0.starboardbot.store.JsonStarboardStore;
import org.gudu0.starboardbot.util.BotPaths;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Random;

public class Main {

    public static void main(String[] args) throws Exception {
        ConsoleLog.info("Main", "Starting Bot");
        BotPaths.ensureBaseDirs();

        // 1) Token (env)
        String token = reqEnv("DISCORD_TOKEN");

        // 2) Global config (data/global/config.json)
        GlobalConfig globalCfg = loadOrCreateGlobalConfig();
        ConsoleLog.info("Main", "GlobalConfig: workerThreads=" + globalCfg.workerThreads
                + " regexTimeoutMillis=" + globalCfg.regexTimeoutMillis
                + " cacheSizePerGuild=" + globalCfg.cacheSizePerGuild
                + " purgeOnGuildLeave=" + globalCfg.purgeOnGuildLeave);

        // 3) Starboard store (data/global/starboard.json)
        ConsoleLog.info("Main", "Initializing starboard store at " + BotPaths.STARBOARD_DB);
        JsonStarboardStore store = new JsonStarboardStore(BotPaths.STARBOARD_DB);
        store.startAutoFlush(globalCfg.flushPeriodSeconds);

        // 4) Guild router + services that don't need JDA yet
        GuildManager guilds = new GuildManager();
        LogService logs = new LogService(guilds);
        SafetyChecks safety = new SafetyChecks(store, logs);

        // 5) Build JDA
        ConsoleLog.info("Main", "Building JDA (MESSAGE_CONTENT enabled)");
        JDA jda = JDABuilder.createDefault(token)
                .enableIntents(
                        GatewayIntent.GUILD_MESSAGES,
                        GatewayIntent.GUILD_MESSAGE_REACTIONS,
                        GatewayIntent.MESSAGE_CONTENT
                )
                .addEventListeners(
                        new StarboardCommandListener(store, safety),
                        new SetupListener(guilds, store),
                        new GuildMembershipListener(guilds, store, safety, globalCfg.purgeOnGuildLeave,
                                (j, guild) -> registerGuildCommandsOne(guild))
                )
                .build();

        jda.awaitReady();
        ConsoleLog.info("Main", "JDA ready as " + jda.getSelfUser().getName());

        // 6) Attach services that need JDA
        ConsoleLog.info("Main", "Attaching services");
        logs.attach(jda);

        EmbedRenderer renderer = new EmbedRenderer();
        renderer.attach(jda);

        JdaMessageCache cache = new JdaMessageCache(jda, globalCfg.cacheSizePerGuild, globalCfg.cacheTtlSeconds);
        JdaMirrorChannel mirrors = new JdaMirrorChannel(jda);

        MirrorReconciler reconciler = new MirrorReconciler(
                store, cache, mirrors, renderer, logs,
                new PointCalculator(),
                new EligibilityEvaluator(new RegexGuard(Duration.ofMillis(globalCfg.regexTimeoutMillis)))
        );
        StarboardEngine engine = new StarboardEngine(store, cache, reconciler);
        StarboardWorker worker = new StarboardWorker(engine, logs, globalCfg.workerThreads);
        StarboardExplorer explorer = new StarboardExplorer(store, cache, renderer, reconciler, new Random());

        // Event listeners go in only once the engine exists
        jda.addEventListener(
                new StarboardListener(worker),
                new ResyncListener(engine, worker),
                new UtilsListener(store, engine, worker),
                new ExploreCommandListener(explorer, worker),
                cache
        );

        ConsoleCommandService console = new ConsoleCommandService(guilds, store, engine, worker, jda);
        console.start();

        // 7) Safety checks + guild rows
        ConsoleLog.info("Main", "Running safety checks (per guild)");
        for (Guild g : jda.getGuilds()) {
            store.createGuild(g.getIdLong());
            safety.runForGuild(jda, g.getIdLong());
        }

        // 8) Register commands (guild-scoped, for every guild)
        ConsoleLog.info("Main", "Registering guild commands (all guilds)");
        registerGuildCommandsAll(jda);

        // One hook, in order: events still queued must reach the store before its final flush.
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            ConsoleLog.info("Main", "Shutting down");
            console.stop();
            jda.removeEventListener(jda.getRegisteredListeners().toArray());
            worker.shutdown();
            store.close();
            jda.shutdown();
        }, "starboard-shutdown"));

        ConsoleLog.info("Main", "Startup complete");
    }

    private static GlobalConfig loadOrCreateGlobalConfig() {
        try {
            Path p = BotPaths.GLOBAL_CONFIG;
            TypedConfigStore<GlobalConfig> s = new TypedConfigStore<>(p, GlobalConfig.class, GlobalConfig::new);

            // TypedConfigStore loads defaults but does not write by itself.
            if (!s.exists()) {
                ConsoleLog.warn("Main", "Global config missing; creating default at " + p);
                s.save();
            }

            return s.cfg();
        } catch (Exception e) {
            ConsoleLog.error("Main", "Failed to load GlobalConfig; using defaults. " + e.getMessage(), e);
            return new GlobalConfig();
        }
    }

    // ----------------------------
    // Commands registration
    // ----------------------------

    private static void registerGuildCommandsAll(JDA jda) {
        for (Guild g : jda.getGuilds()) {
            registerGuildCommandsOne(g);
        }
    }

    private static void registerGuildCommandsOne(Guild g) {
        OptionData settingOption = new OptionData(OptionType.STRING, "option", "Setting to change", true);
        for (String key : StarboardSettings.KEYS) {
            settingOption.addChoice(key, key);
        }

        OptionData messageId = new OptionData(OptionType.STRING, "message_id", "Message id or link", true);

        g.updateCommands()
                .addCommands(
                        Commands.slash("starboard", "Manage starboards (admin only)")
                                .setDefaultPermissions(DefaultMemberPermissions.enabledFor(Permission.MANAGE_SERVER))
                                .addSubcommands(
                                        new SubcommandData("add", "Turn a channel into a starboard")
                                                .addOption(OptionType.CHANNEL, "channel", "Where mirrors are posted", true),
                                        new SubcommandData("remove", "Stop using a channel as a starboard")
                                                .addOption(OptionType.CHANNEL, "channel", "The starboard channel", true),
                                        new SubcommandData("view", "Show starboards or one starboard's settings")
                                                .addOption(OptionType.CHANNEL, "channel", "The starboard channel", false),
                                        new SubcommandData("set", "Change one starboard setting")
                                                .addOption(OptionType.CHANNEL, "channel", "The starboard channel", true)
                                                .addOptions(settingOption)
                                                .addOption(OptionType.STRING, "value", "New value", true)
                                ),

                        Commands.slash("resync", "Re-sync a message on every starboard")
                                .setDefaultPermissions(DefaultMemberPermissions.enabledFor(Permission.MESSAGE_MANAGE))
                                .addOptions(messageId),

                        Commands.slash("utils", "Force, trash or freeze a message")
                                .setDefaultPermissions(DefaultMemberPermissions.enabledFor(Permission.MESSAGE_MANAGE))
                                .addSubcommands(
                                        utilsSub("force", "Always show a message on a starboard", true),
                                        utilsSub("unforce", "Undo force", true),
                                        utilsSub("trash", "Hide a message from every starboard", false),
                                        utilsSub("untrash", "Undo trash", false),
                                        utilsSub("freeze", "Stop a message's score from changing", false),
                                        utilsSub("unfreeze", "Undo freeze", false)
                                ),

                        Commands.slash("random", "Show a random starred message")
                                .addOption(OptionType.USER, "by", "Only messages by this member", false)
                                .addOption(OptionType.CHANNEL, "in", "Only messages from this channel", false)
                                .addOption(OptionType.CHANNEL, "starboard", "Only this starboard", false)
                                .addOption(OptionType.INTEGER, "points", "Minimum points", false),

                        Commands.slash("save", "Save a copy of a message to your DMs")
                                .addOption(OptionType.STRING, "message_id", "Message id or link", true)
                                .addOption(OptionType.CHANNEL, "channel", "Where the message is, if it was never starred", false),

                        Commands.slash("setup", "Configure this bot for this server (admin only)")
                                .setDefaultPermissions(DefaultMemberPermissions.enabledFor(Permission.MANAGE_SERVER))
                                .addSubcommands(
                                        new SubcommandData("status", "Show current config for this server"),

                                        new SubcommandData("setenablelogs", "Enable/disable per-guild logging")
                                                .addOption(OptionType.BOOLEAN, "enabled", "true=send logs to the log channel", true),

                                        new SubcommandData("setlogchannel", "Set the log channel/thread to send logs to")
                                                .addOption(OptionType.CHANNEL, "channel", "A thread or text channel", true)
                                )
                )
                .queue(
                        ok -> ConsoleLog.info("Main", "Guild commands updated: " + g.getName() + " (" + g.getId() + ")"),
                        err -> ConsoleLog.error("Main", "Failed registering commands in guildId=" + g.getId() + ": " + err.getMessage(), err)
                );
    }

    private static SubcommandData utilsSub(String name, String description, boolean withStarboard) {
        SubcommandData sub = new SubcommandData(name, description)
                .addOption(OptionType.STRING, "message_id", "Message id or link", true)
                .addOption(OptionType.CHANNEL, "channel", "Channel the message is in (defaults to here)", false);
        if (withStarboard) {
            sub.addOption(OptionType.CHANNEL, "starboard", "Only this starboard (defaults to all)", false);
        }
        return sub;
    }

    // ----------------------------
    // Utils
    // ----------------------------

    private static String reqEnv(String key) {
        String v = System.getenv(key);
        if (v == null || v.isBlank()) throw new IllegalStateException("Missing environment variable: " + key);
        return v;
    }
}
