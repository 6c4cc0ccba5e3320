package kr.crownrpg.chat.api.channel;

import kr.crownrpg.chat.api.Preconditions;

/**
 * Single source of truth for channel naming.
 * <p>
 * Instance channels are addressed internally as {@code #spec_{id}} or {@code #multi_{id}} so that each
 * game session gets its own channel, while clients only ever see the shared aliases
 * {@code #spectator} and {@code #multiplayer}:
 * <ul>
 *     <li>{@code #spec_42} → {@code #spectator}</li>
 *     <li>{@code #multi_7} → {@code #multiplayer}</li>
 *     <li>{@code #general} → {@code #general}</li>
 * </ul>
 */
public final class ChannelNames {

    public static final String SPECTATOR_PREFIX = "#spec_";
    public static final String SPECTATOR_ALIAS = "#spectator";
    public static final String MULTIPLAYER_PREFIX = "#multi_";
    public static final String MULTIPLAYER_ALIAS = "#multiplayer";

    private ChannelNames() {
    }

    /**
     * Maps an internal channel name to the name shown to clients. Pure function of its input.
     */
    public static String displayName(String internalName) {
        Preconditions.checkNotNull(internalName, "internalName");
        for (InstanceKind kind : InstanceKind.values()) {
            if (internalName.startsWith(kind.prefix())) {
                return kind.alias();
            }
        }
        return internalName;
    }

    public static String instanceName(InstanceKind kind, long id) {
        Preconditions.checkNotNull(kind, "kind");
        Preconditions.checkArgument(id >= 0, "instance id must not be negative");
        return kind.prefix() + id;
    }

    public static boolean isInstanceName(String internalName) {
        if (internalName == null) {
            return false;
        }
        return internalName.startsWith(SPECTATOR_PREFIX) || internalName.startsWith(MULTIPLAYER_PREFIX);
    }
}
