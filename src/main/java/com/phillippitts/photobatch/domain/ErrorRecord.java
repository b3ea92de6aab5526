package com.phillippitts.photobatch.domain;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * One error-log entry, rendered as {@code [HH:MM:SS] error: <filename> - <message>}.
 *
 * @param timestamp wall-clock time the error was recorded
 * @param filename  base name of the failed input
 * @param message   failure description
 */
public record ErrorRecord(LocalTime timestamp, String filename, String message) {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    public ErrorRecord {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(filename, "filename must not be null");
        message = message == null ? "" : message;
    }

    public String format() {
        return "[" + TIME.format(timestamp) + "] error: " + filename + " - " + message;
    }
}
