package kr.crownrpg.chat.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.crownrpg.chat.api.channel.ChannelSummary;
import kr.crownrpg.chat.api.message.ChatMessage;
import kr.crownrpg.chat.api.message.ChatPacketEncoder;
import kr.crownrpg.chat.api.message.PacketTypes;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 채팅 이벤트 → UTF-8 JSON 패킷 변환만 담당.
 */
public final class JsonChatPacketEncoder implements ChatPacketEncoder {

    private final ObjectMapper mapper;

    public JsonChatPacketEncoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] message(ChatMessage message) {
        Objects.requireNonNull(message, "message");
        Map<String, Object> packet = packet(PacketTypes.CHAT_MESSAGE);
        packet.put("sender", message.senderName());
        packet.put("senderId", message.senderId());
        packet.put("target", message.target());
        packet.put("text", message.text());
        return write(packet);
    }

    @Override
    public byte[] channelInfo(ChannelSummary summary) {
        Objects.requireNonNull(summary, "summary");
        Map<String, Object> packet = packet(PacketTypes.CHANNEL_INFO);
        packet.put("channel", summary.displayName());
        packet.put("topic", summary.topic());
        packet.put("members", summary.memberCount());
        return write(packet);
    }

    @Override
    public byte[] channelJoined(String displayName) {
        Map<String, Object> packet = packet(PacketTypes.CHANNEL_JOIN);
        packet.put("channel", Objects.requireNonNull(displayName, "displayName"));
        return write(packet);
    }

    @Override
    public byte[] channelRevoked(String displayName) {
        Map<String, Object> packet = packet(PacketTypes.CHANNEL_KICK);
        packet.put("channel", Objects.requireNonNull(displayName, "displayName"));
        return write(packet);
    }

    private static Map<String, Object> packet(String type) {
        Map<String, Object> packet = new LinkedHashMap<>();
        packet.put("type", type);
        return packet;
    }

    private byte[] write(Map<String, Object> packet) {
        try {
            return mapper.writeValueAsBytes(packet);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode chat packet " + packet.get("type"), e);
        }
    }
}
