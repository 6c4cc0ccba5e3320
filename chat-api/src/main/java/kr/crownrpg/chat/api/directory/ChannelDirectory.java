package kr.crownrpg.chat.api.directory;

import kr.crownrpg.chat.api.channel.ChannelDefinition;
import kr.crownrpg.chat.api.channel.ChatChannel;
import kr.crownrpg.chat.api.channel.InstanceKind;
import kr.crownrpg.chat.api.session.ChatSession;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Registry of live channels keyed by internal name.
 */
public interface ChannelDirectory {

    Optional<ChatChannel> find(String internalName);

    /**
     * @throws kr.crownrpg.chat.api.channel.ChannelException {@code CHANNEL_EXISTS} if the name is taken
     */
    ChatChannel create(ChannelDefinition definition);

    /**
     * Returns the live instance channel for the given game session, creating it when absent.
     * A registered channel that is already destroyed but not yet unregistered is replaced.
     */
    ChatChannel createInstance(InstanceKind kind, long id, String topic);

    /**
     * Called by an instance channel at the moment its last member leaves.
     *
     * @return {@code false} if this exact channel was not registered
     */
    boolean removeChannel(ChatChannel channel);

    /**
     * Administrative removal. Tears the channel down and returns its former members.
     */
    List<ChatSession> delete(String internalName);

    Collection<ChatChannel> channels();

    List<ChatChannel> autoJoinChannels();
}
