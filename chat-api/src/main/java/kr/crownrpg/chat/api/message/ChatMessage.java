package kr.crownrpg.chat.api.message;

import kr.crownrpg.chat.api.Preconditions;

/**
 * A text message as relayed to clients. {@code target} is the display name of the channel.
 */
public record ChatMessage(String senderName, String text, String target, int senderId) {

    public ChatMessage {
        Preconditions.checkNotBlank(senderName, "senderName");
        Preconditions.checkNotBlank(target, "target");
        text = text == null ? "" : text;
    }
}
