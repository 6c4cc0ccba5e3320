package kr.crownrpg.chat.api.channel;

import kr.crownrpg.chat.api.Preconditions;
import kr.crownrpg.chat.api.access.AccessLevel;

/**
 * Construction parameters of a channel.
 * <p>
 * {@code readLevel} and {@code writeLevel} default to {@link AccessLevel#NORMAL}, {@code autoJoin}
 * to {@code true} and {@code instance} to {@code false}.
 */
public record ChannelDefinition(
        String name,
        String topic,
        AccessLevel readLevel,
        AccessLevel writeLevel,
        boolean autoJoin,
        boolean instance
) {

    public ChannelDefinition {
        Preconditions.checkNotBlank(name, "name");
        topic = topic == null ? "" : topic;
        readLevel = readLevel == null ? AccessLevel.NORMAL : readLevel;
        writeLevel = writeLevel == null ? AccessLevel.NORMAL : writeLevel;
    }

    public static ChannelDefinition of(String name, String topic) {
        return new ChannelDefinition(name, topic, AccessLevel.NORMAL, AccessLevel.NORMAL, true, false);
    }

    /**
     * Definition of an ephemeral channel: never auto-joined, deleted once its last member leaves.
     */
    public static ChannelDefinition instance(InstanceKind kind, long id, String topic) {
        return new ChannelDefinition(ChannelNames.instanceName(kind, id), topic,
                AccessLevel.NORMAL, AccessLevel.NORMAL, false, true);
    }

    public ChannelDefinition withLevels(AccessLevel read, AccessLevel write) {
        return new ChannelDefinition(name, topic, read, write, autoJoin, instance);
    }
}
