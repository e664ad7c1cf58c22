package com.socdash.reconciler.merge;

import java.util.Locale;

/**
 * How a patch's log lines combine with the lines already on a step.
 *
 * REPLACE matches the backends that resend the full log on every poll;
 * APPEND suits backends that only send lines produced since the last poll.
 */
public enum LogMergeMode {
    REPLACE,
    APPEND;

    public static LogMergeMode fromConfig(String value) {
        return value == null || value.isBlank()
                ? REPLACE
                : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
