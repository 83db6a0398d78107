package org.gudu0.starboardbot.commands;

import org.gudu0.starboardbot.starboard.RegexGuard;
import org.gudu0.starboardbot.store.StarboardConfig;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parses one "/starboard set" option onto a {@link StarboardConfig}.
 * Invalid input throws {@link IllegalArgumentException} with a message fit for the user.
 */
public final class StarboardSettings {
    private StarboardSettings() {}

    public static final List<String> KEYS = List.of(
            "required", "required-remove", "self-star", "allow-bots", "allow-nsfw",
            "link-edits", "link-deletes", "autoreact", "emojis", "display-emoji",
            "color", "regex", "exclude-regex", "star", "recv-star", "xp", "unstar", "explore"
    );

    private static final Pattern CUSTOM_EMOJI = Pattern.compile("<a?:\\w+:(\\d+)>");
    private static final Pattern HEX_COLOR = Pattern.compile("#?([0-9a-fA-F]{6})");

    /** Applies the option and returns a short "key=value" summary of the new state. */
    public static String apply(StarboardConfig cfg, String key, String value) {
        String v = value == null ? "" : value.trim();

        switch (key) {
            case "required" -> cfg.required = parseInt(key, v, -1, 500);
            case "required-remove" -> cfg.requiredRemove = parseInt(key, v, -1, 500);
            case "self-star" -> cfg.selfStar = parseBool(key, v);
            case "allow-bots" -> cfg.allowBots = parseBool(key, v);
            case "allow-nsfw" -> cfg.allowNsfw = parseBool(key, v);
            case "link-edits" -> cfg.linkEdits = parseBool(key, v);
            case "link-deletes" -> cfg.linkDeletes = parseBool(key, v);
            case "autoreact" -> cfg.autoreact = parseBool(key, v);
            case "emojis" -> cfg.starEmojis = parseEmojis(v);
            case "display-emoji" -> {
                List<String> one = parseEmojis(v);
                if (one.size() != 1) throw new IllegalArgumentException("display-emoji takes exactly one emoji.");
                cfg.displayEmoji = one.get(0);
            }
            case "color" -> cfg.color = parseColor(v);
            case "regex" -> cfg.regex = parseRegex(key, v);
            case "exclude-regex" -> cfg.excludeRegex = parseRegex(key, v);
            case "star" -> cfg.star = parseBool(key, v);
            case "recv-star" -> cfg.recvStar = parseBool(key, v);
            case "xp" -> cfg.xp = parseBool(key, v);
            case "unstar" -> cfg.unstar = parseBool(key, v);
            case "explore" -> cfg.explore = parseBool(key, v);
            default -> throw new IllegalArgumentException("Unknown setting `" + key + "`. Options: " + String.join(", ", KEYS));
        }
        return key + "=" + describe(cfg, key);
    }

    public static String describe(StarboardConfig cfg, String key) {
        return switch (key) {
            case "required" -> Integer.toString(cfg.required);
            case "required-remove" -> Integer.toString(cfg.requiredRemove);
            case "self-star" -> Boolean.toString(cfg.selfStar);
            case "allow-bots" -> Boolean.toString(cfg.allowBots);
            case "allow-nsfw" -> Boolean.toString(cfg.allowNsfw);
            case "link-edits" -> Boolean.toString(cfg.linkEdits);
            case "link-deletes" -> Boolean.toString(cfg.linkDeletes);
            case "autoreact" -> Boolean.toString(cfg.autoreact);
            case "emojis" -> String.join(" ", cfg.starEmojis);
            case "display-emoji" -> cfg.displayEmoji;
            case "color" -> cfg.color == null ? "default" : String.format("#%06X", cfg.color);
            case "regex" -> cfg.regex.isEmpty() ? "none" : "`" + cfg.regex + "`";
            case "exclude-regex" -> cfg.excludeRegex.isEmpty() ? "none" : "`" + cfg.excludeRegex + "`";
            case "star" -> Boolean.toString(cfg.star);
            case "recv-star" -> Boolean.toString(cfg.recvStar);
            case "xp" -> Boolean.toString(cfg.xp);
            case "unstar" -> Boolean.toString(cfg.unstar);
            case "explore" -> Boolean.toString(cfg.explore);
            default -> "?";
        };
    }

    private static int parseInt(String key, String v, int min, int max) {
        int n;
        try {
            n = Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number, got `" + v + "`.");
        }
        if (n < min || n > max) {
            throw new IllegalArgumentException(key + " must be between " + min + " and " + max + ".");
        }
        return n;
    }

    private static boolean parseBool(String key, String v) {
        switch (v.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on", "1" -> {
                return true;
            }
            case "false", "no", "off", "0" -> {
                return false;
            }
            default -> throw new IllegalArgumentException(key + " must be true or false, got `" + v + "`.");
        }
    }

    /** Space separated emoji; custom emoji mentions are stored by id. */
    static List<String> parseEmojis(String v) {
        Set<String> out = new LinkedHashSet<>();
        for (String part : v.split("\\s+")) {
            if (part.isEmpty()) continue;
            Matcher m = CUSTOM_EMOJI.matcher(part);
            out.add(m.matches() ? m.group(1) : part);
        }
        if (out.isEmpty()) throw new IllegalArgumentException("Give at least one emoji.");
        if (out.size() > 20) throw new IllegalArgumentException("A starboard can have at most 20 emojis.");
        return new ArrayList<>(out);
    }

    private static Integer parseColor(String v) {
        if (v.isEmpty() || v.equalsIgnoreCase("default")) return null;
        Matcher m = HEX_COLOR.matcher(v);
        if (!m.matches()) throw new IllegalArgumentException("color must look like #FFE19C, got `" + v + "`.");
        return Integer.parseInt(m.group(1), 16);
    }

    private static String parseRegex(String key, String v) {
        if (v.isEmpty() || v.equalsIgnoreCase("none")) return "";
        try {
            RegexGuard.validate(v);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException(key + " is not a valid pattern: " + e.getDescription());
        }
        return v;
    }
}
