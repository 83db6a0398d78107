package org.gudu0.starboardbot.util;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

/**
 * Console logging with a timestamp, level, thread and tag on every line.
 * Worker threads are named, so the thread column shows which event pool a line came from.
 */
public final class ConsoleLog {
    private ConsoleLog() {}

    /** Starts from STARBOARD_DEBUG=true; toggled at runtime by the console "debug on|off" command. */
    @SuppressWarnings("CanBeFinal")
    public static volatile boolean DEBUG = Boolean.parseBoolean(System.getenv("STARBOARD_DEBUG"));

    private enum Level {
        INFO(null),
        WARN("93m"),
        DEBUG("32m"),
        ERROR("31m");

        private final String ansi;

        Level(String ansi) {
            this.ansi = ansi;
        }

        String label() {
            return ansi == null ? name() : "\u001B[" + ansi + name() + "\u001B[0m";
        }
    }

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")
                    .withZone(ZoneId.systemDefault());

    private static void print(PrintStream out, Level level, String tag, String msg) {
        out.println("[" + TS.format(Instant.now()) + "] [" + level.label() + "] ["
                + Thread.currentThread().getName() + "] [" + tag + "] " + msg);
    }

    public static void info(String tag, String msg) {
        print(System.out, Level.INFO, tag, msg);
    }

    public static void warn(String tag, String msg) {
        print(System.out, Level.WARN, tag, msg);
    }

    /** Warning with the cause summarized on the same line (no stack trace). */
    public static void warn(String tag, String msg, Throwable t) {
        warn(tag, msg + (t == null ? "" : " (" + t.getClass().getSimpleName() + ": " + t.getMessage() + ")"));
    }

    public static void debug(String tag, String msg) {
        if (DEBUG) print(System.out, Level.DEBUG, tag, msg);
    }

    /** For messages that are costly to build; the supplier only runs with debug on. */
    public static void debug(String tag, Supplier<String> msg) {
        if (DEBUG) print(System.out, Level.DEBUG, tag, msg.get());
    }

    public static void error(String tag, String msg) {
        print(System.err, Level.ERROR, tag, msg);
    }

    public static void error(String tag, String msg, Throwable t) {
        print(System.err, Level.ERROR, tag, msg);
        if (t != null) t.printStackTrace(System.err);
    }
}
