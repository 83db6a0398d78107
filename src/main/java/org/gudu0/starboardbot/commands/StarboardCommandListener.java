package org.gudu0.starboardbot.commands;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.Channel;
import net.dv8tion.jda.api.entities.channel.middleman.StandardGuildMessageChannel;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import org.gudu0.starboardbot.SafetyChecks;
import org.gudu0.starboardbot.store.StarboardConfig;
import org.gudu0.starboardbot.store.StarboardStore;
import org.gudu0.starboardbot.store.StoreException;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * /starboard add|remove|view|set
 */
public class StarboardCommandListener extends ListenerAdapter implements CommandGuards {

    private final StarboardStore store;
    private final SafetyChecks safety;

    public StarboardCommandListener(StarboardStore store, SafetyChecks safety) {
        this.store = store;
        this.safety = safety;
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        if (!event.getName().equals("starboard")) return;

        logCommand(event);

        Guild guild = requireGuild(event);
        if (guild == null) return;
        if (!requireAdmin(event)) return;

        String sub = event.getSubcommandName();
        if (sub == null) {
            event.reply("Missing subcommand. Use /starboard add, remove, view or set.")
                    .setEphemeral(true).queue();
            return;
        }

        switch (sub) {
            case "add" -> add(event, guild);
            case "remove" -> remove(event, guild);
            case "view" -> view(event, guild);
            case "set" -> set(event, guild);
            default -> event.reply("Unknown subcommand: " + sub).setEphemeral(true).queue();
        }
    }

    private void add(SlashCommandInteractionEvent event, Guild guild) {
        Channel ch = Objects.requireNonNull(event.getOption("channel")).getAsChannel();
        if (!(ch instanceof StandardGuildMessageChannel)) {
            event.reply("Please choose a normal text channel (not a voice/category).")
                    .setEphemeral(true).queue();
            return;
        }

        StarboardConfig sb;
        try {
            store.createGuild(guild.getIdLong());
            sb = store.createStarboard(guild.getIdLong(), ch.getIdLong());
        } catch (StoreException e) {
            event.reply("<#" + ch.getId() + "> is already a starboard.").setEphemeral(true).queue();
            return;
        }
        ConsoleLog.info("Starboard", "Created starboard guildId=" + guild.getId() + " channelId=" + ch.getId());

        Set<Permission> missing = safety.check(event.getJDA(), guild, sb);
        String warn = missing.isEmpty() ? "" : "\nHeads up, I'm missing: **"
                + missing.stream().map(Permission::getName).collect(Collectors.joining(", ")) + "**";

        event.reply("Created starboard <#" + ch.getId() + "> (required=" + sb.required + ")." + warn)
                .setEphemeral(true).queue();
    }

    private void remove(SlashCommandInteractionEvent event, Guild guild) {
        long channelId = Objects.requireNonNull(event.getOption("channel")).getAsChannel().getIdLong();
        Optional<StarboardConfig> sb = ownStarboard(guild, channelId);
        if (sb.isEmpty()) {
            event.reply("<#" + channelId + "> is not a starboard.").setEphemeral(true).queue();
            return;
        }

        store.deleteStarboard(channelId);
        ConsoleLog.info("Starboard", "Deleted starboard guildId=" + guild.getId() + " channelId=" + channelId);
        event.reply("Deleted starboard <#" + channelId + ">. Existing mirrors were left in place.")
                .setEphemeral(true).queue();
    }

    private void view(SlashCommandInteractionEvent event, Guild guild) {
        OptionMapping opt = event.getOption("channel");
        if (opt == null) {
            List<StarboardConfig> all = store.getStarboards(guild.getIdLong());
            if (all.isEmpty()) {
                event.reply("This server has no starboards. Create one with `/starboard add`.")
                        .setEphemeral(true).queue();
                return;
            }
            String lines = all.stream()
                    .map(s -> "- <#" + s.id + "> required=" + s.required + " required-remove=" + s.requiredRemove)
                    .collect(Collectors.joining("\n"));
            event.reply("**Starboards in " + guild.getName() + "**\n" + lines).setEphemeral(true).queue();
            return;
        }

        long channelId = opt.getAsChannel().getIdLong();
        Optional<StarboardConfig> sb = ownStarboard(guild, channelId);
        if (sb.isEmpty()) {
            event.reply("<#" + channelId + "> is not a starboard.").setEphemeral(true).queue();
            return;
        }

        StringBuilder out = new StringBuilder("**Starboard <#" + channelId + ">**\n");
        for (String key : StarboardSettings.KEYS) {
            out.append("- ").append(key).append(": ").append(StarboardSettings.describe(sb.get(), key)).append('\n');
        }
        event.reply(out.toString()).setEphemeral(true).queue();
    }

    private void set(SlashCommandInteractionEvent event, Guild guild) {
        long channelId = Objects.requireNonNull(event.getOption("channel")).getAsChannel().getIdLong();
        String key = Objects.requireNonNull(event.getOption("option")).getAsString();
        String value = Objects.requireNonNull(event.getOption("value")).getAsString();

        Optional<StarboardConfig> sb = ownStarboard(guild, channelId);
        if (sb.isEmpty()) {
            event.reply("<#" + channelId + "> is not a starboard.").setEphemeral(true).queue();
            return;
        }

        // validate on a scratch copy first so a bad value changes nothing
        String summary;
        try {
            summary = StarboardSettings.apply(sb.get().copy(), key, value);
        } catch (IllegalArgumentException e) {
            event.reply(e.getMessage()).setEphemeral(true).queue();
            return;
        }

        store.updateStarboard(channelId, s -> StarboardSettings.apply(s, key, value));
        ConsoleLog.info("Starboard", "Updated starboard guildId=" + guild.getId() + " channelId=" + channelId + " " + summary);

        if (key.equals("autoreact")) {
            store.getStarboard(channelId).ifPresent(s -> safety.check(event.getJDA(), guild, s));
        }

        event.reply("Updated <#" + channelId + ">: " + summary).setEphemeral(true).queue();
    }

    private Optional<StarboardConfig> ownStarboard(Guild guild, long channelId) {
        return store.getStarboard(channelId).filter(s -> s.guildId == guild.getIdLong());
    }
}
