package kr.crownrpg.chat.api.channel;

/**
 * Kinds of ephemeral channels created per game session.
 */
public enum InstanceKind {

    SPECTATOR(ChannelNames.SPECTATOR_PREFIX, ChannelNames.SPECTATOR_ALIAS),
    MULTIPLAYER(ChannelNames.MULTIPLAYER_PREFIX, ChannelNames.MULTIPLAYER_ALIAS);

    private final String prefix;
    private final String alias;

    InstanceKind(String prefix, String alias) {
        this.prefix = prefix;
        this.alias = alias;
    }

    /**
     * Internal name prefix, e.g. {@code #spec_}.
     */
    public String prefix() {
        return prefix;
    }

    /**
     * Name shown to clients for every instance of this kind, e.g. {@code #spectator}.
     */
    public String alias() {
        return alias;
    }
}
