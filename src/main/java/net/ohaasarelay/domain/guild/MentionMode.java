package net.ohaasarelay.domain.guild;

import java.util.Locale;

/**
 * Who gets pinged when a guild's daily post goes out.
 */
public enum MentionMode {
    NONE("none"),
    EVERYONE("everyone"),
    ROLE("role");

    private final String configValue;

    MentionMode(String configValue) {
        this.configValue = configValue;
    }

    /**
     * Value stored in the guild configuration document.
     */
    public String configValue() {
        return configValue;
    }

    /**
     * Parses a stored value; unknown or missing values fall back to {@link #NONE}.
     */
    public static MentionMode fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MentionMode mode : values()) {
            if (mode.configValue.equals(normalized)) {
                return mode;
            }
        }
        return NONE;
    }
}
