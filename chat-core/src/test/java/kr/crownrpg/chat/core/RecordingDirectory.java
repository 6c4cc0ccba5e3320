package kr.crownrpg.chat.core;

import kr.crownrpg.chat.api.channel.ChannelDefinition;
import kr.crownrpg.chat.api.channel.ChatChannel;
import kr.crownrpg.chat.api.channel.InstanceKind;
import kr.crownrpg.chat.api.directory.ChannelDirectory;
import kr.crownrpg.chat.api.session.ChatSession;
import kr.crownrpg.chat.core.channel.DefaultChatChannel;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Directory that counts removal requests coming from channels.
 */
public final class RecordingDirectory implements ChannelDirectory {

    private final Map<String, ChatChannel> channels = new ConcurrentHashMap<>();
    private final AtomicInteger removeCalls = new AtomicInteger();

    public int removeCalls() {
        return removeCalls.get();
    }

    /**
     * Builds a channel that reports to this directory without registering it.
     */
    public DefaultChatChannel unregistered(ChannelDefinition definition) {
        return new DefaultChatChannel(definition, this);
    }

    @Override
    public Optional<ChatChannel> find(String internalName) {
        return Optional.ofNullable(channels.get(internalName));
    }

    @Override
    public ChatChannel create(ChannelDefinition definition) {
        DefaultChatChannel channel = new DefaultChatChannel(definition, this);
        channels.put(definition.name(), channel);
        return channel;
    }

    @Override
    public ChatChannel createInstance(InstanceKind kind, long id, String topic) {
        return create(ChannelDefinition.instance(kind, id, topic));
    }

    @Override
    public boolean removeChannel(ChatChannel channel) {
        removeCalls.incrementAndGet();
        return channels.remove(channel.internalName(), channel);
    }

    @Override
    public List<ChatSession> delete(String internalName) {
        ChatChannel channel = channels.remove(internalName);
        return channel == null ? List.of() : channel.destroy();
    }

    @Override
    public Collection<ChatChannel> channels() {
        return List.copyOf(channels.values());
    }

    @Override
    public List<ChatChannel> autoJoinChannels() {
        return List.of();
    }
}
