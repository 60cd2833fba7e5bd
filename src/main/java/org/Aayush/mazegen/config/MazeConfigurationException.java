package org.Aayush.mazegen.config;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Maze configuration contract failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with {@code [REASON_CODE]}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class MazeConfigurationException extends RuntimeException {
    private final String reasonCode;

    /**
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public MazeConfigurationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
