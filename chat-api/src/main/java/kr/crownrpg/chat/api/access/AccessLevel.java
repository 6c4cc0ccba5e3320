package kr.crownrpg.chat.api.access;

import java.util.Locale;

/**
 * Privilege ladder used to gate reading from and writing to channels.
 * <p>
 * Levels are ordered; a session holding a level may do everything a lower level may do.
 * {@link #NORMAL} is the baseline granted to every verified player.
 */
public enum AccessLevel {

    RESTRICTED("restricted"),
    NORMAL("normal"),
    SUPPORTER("supporter"),
    NOMINATOR("nominator"),
    MODERATOR("moderator"),
    ADMINISTRATOR("administrator"),
    DEVELOPER("developer");

    private final String configName;

    AccessLevel(String configName) {
        this.configName = configName;
    }

    /**
     * Returns {@code true} when this level satisfies the given minimum requirement.
     */
    public boolean isAtLeast(AccessLevel required) {
        return compareTo(required) >= 0;
    }

    /**
     * Resolves a configuration value such as {@code "moderator"}. Blank or unknown names fall back
     * to {@code defaultLevel}.
     */
    public static AccessLevel fromConfigName(String name, AccessLevel defaultLevel) {
        if (name == null || name.isBlank()) {
            return defaultLevel;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (AccessLevel level : values()) {
            if (level.configName.equals(normalized)) {
                return level;
            }
        }
        return defaultLevel;
    }
}
