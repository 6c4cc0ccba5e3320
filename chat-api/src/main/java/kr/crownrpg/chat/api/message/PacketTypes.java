package kr.crownrpg.chat.api.message;

import kr.crownrpg.chat.api.Preconditions;

/**
 * Packet type names in the {@code <domain>.<action>} form.
 */
public final class PacketTypes {

    public static final String CHAT_MESSAGE = compose("chat", "message");
    public static final String CHANNEL_INFO = compose("channel", "info");
    public static final String CHANNEL_JOIN = compose("channel", "join");
    public static final String CHANNEL_KICK = compose("channel", "kick");

    private PacketTypes() {
    }

    public static String compose(String domain, String action) {
        Preconditions.checkNotBlank(domain, "domain");
        Preconditions.checkNotBlank(action, "action");
        return domain + "." + action;
    }
}
