package kr.crownrpg.chat.api.message;

import kr.crownrpg.chat.api.channel.ChannelSummary;

/**
 * Turns chat events into the opaque byte payloads handed to {@link kr.crownrpg.chat.api.session.ChatSession#enqueue}.
 */
public interface ChatPacketEncoder {

    byte[] message(ChatMessage message);

    byte[] channelInfo(ChannelSummary summary);

    /**
     * Confirms to a client that it joined the channel shown as {@code displayName}.
     */
    byte[] channelJoined(String displayName);

    /**
     * Tells a client it is no longer in the channel shown as {@code displayName}.
     */
    byte[] channelRevoked(String displayName);
}
