package com.phillippitts.photobatch.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link RawDecodeException} carrying decoder process context.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw RawDecodeExceptionBuilder.create("Non-zero exit: 1")
 *         .file("IMG_0001.CR2")
 *         .exitCode(1)
 *         .durationMs(830)
 *         .metadata("binaryPath", "dcraw")
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class RawDecodeExceptionBuilder {

    private final String message;
    private String fileName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private RawDecodeExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static RawDecodeExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new RawDecodeExceptionBuilder(message);
    }

    public RawDecodeExceptionBuilder file(String fileName) {
        this.fileName = fileName;
        return this;
    }

    public RawDecodeExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public RawDecodeExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public RawDecodeExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a context pair; null keys or values are ignored.
     *
     * @param key metadata key (binaryPath, stderr, ...)
     * @param value metadata value
     * @return this builder for chaining
     */
    public RawDecodeExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (file: {file})
     * </pre>
     *
     * @return constructed RawDecodeException
     */
    public RawDecodeException build() {
        String detailedMessage = buildDetailedMessage();
        String file = fileName != null ? fileName : "unknown";

        if (cause != null) {
            return new RawDecodeException(detailedMessage, file, cause);
        }
        return new RawDecodeException(detailedMessage, file);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
