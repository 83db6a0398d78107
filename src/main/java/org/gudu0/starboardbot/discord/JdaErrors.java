package org.gudu0.starboardbot.discord;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.exceptions.InsufficientPermissionException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import org.gudu0.starboardbot.remote.PermissionDeniedException;
import org.gudu0.starboardbot.remote.RemoteNotFoundException;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Supplier;

/** Maps JDA failures onto the starboard's remote error types. */
final class JdaErrors {
    private JdaErrors() {}

    static final Set<ErrorResponse> NOT_FOUND = EnumSet.of(
            ErrorResponse.UNKNOWN_MESSAGE,
            ErrorResponse.UNKNOWN_CHANNEL
    );

    static final Set<ErrorResponse> DENIED = EnumSet.of(
            ErrorResponse.MISSING_PERMISSIONS,
            ErrorResponse.MISSING_ACCESS
    );

    /**
     * Runs a blocking JDA call.
     *
     * @param fallbackPermission permission named when Discord only says "missing permissions"
     */
    static <T> T call(String what, Permission fallbackPermission, Supplier<T> action) {
        try {
            return action.get();
        } catch (InsufficientPermissionException e) {
            throw new PermissionDeniedException(e.getPermission().getName(), what + ": " + e.getMessage(), e);
        } catch (ErrorResponseException e) {
            if (NOT_FOUND.contains(e.getErrorResponse())) {
                throw new RemoteNotFoundException(what + ": " + e.getMeaning(), e);
            }
            if (DENIED.contains(e.getErrorResponse())) {
                throw new PermissionDeniedException(fallbackPermission.getName(), what + ": " + e.getMeaning(), e);
            }
            throw e;
        }
    }

    static void run(String what, Permission fallbackPermission, Runnable action) {
        call(what, fallbackPermission, () -> {
            action.run();
            return null;
        });
    }
}
