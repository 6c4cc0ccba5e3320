package kr.crownrpg.chat.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import junit.framework.TestCase;
import kr.crownrpg.chat.api.channel.ChannelSummary;
import kr.crownrpg.chat.api.message.ChatMessage;
import kr.crownrpg.chat.api.message.PacketTypes;

/**
 * Test case for {@link JsonChatPacketEncoder}.
 */
public class TestJsonChatPacketEncoder extends TestCase {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonChatPacketEncoder encoder = new JsonChatPacketEncoder(mapper);

    public void testMessagePacket() throws Exception {
        JsonNode node = mapper.readTree(encoder.message(new ChatMessage("alice", "안녕 world", "#multiplayer", 7)));
        assertEquals(PacketTypes.CHAT_MESSAGE, node.get("type").asText());
        assertEquals("alice", node.get("sender").asText());
        assertEquals(7, node.get("senderId").asInt());
        assertEquals("#multiplayer", node.get("target").asText());
        assertEquals("안녕 world", node.get("text").asText());
    }

    public void testChannelInfoPacket() throws Exception {
        JsonNode node = mapper.readTree(encoder.channelInfo(new ChannelSummary("#osu", "General", 3)));
        assertEquals("channel.info", node.get("type").asText());
        assertEquals("#osu", node.get("channel").asText());
        assertEquals("General", node.get("topic").asText());
        assertEquals(3, node.get("members").asInt());
    }

    public void testPresencePackets() throws Exception {
        assertEquals("channel.join", mapper.readTree(encoder.channelJoined("#osu")).get("type").asText());
        JsonNode kick = mapper.readTree(encoder.channelRevoked("#spectator"));
        assertEquals("channel.kick", kick.get("type").asText());
        assertEquals("#spectator", kick.get("channel").asText());
    }
}
