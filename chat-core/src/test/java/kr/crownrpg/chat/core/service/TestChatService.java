package kr.crownrpg.chat.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import junit.framework.TestCase;
import kr.crownrpg.chat.api.access.AccessLevel;
import kr.crownrpg.chat.api.channel.ChannelDefinition;
import kr.crownrpg.chat.api.channel.ChannelException;
import kr.crownrpg.chat.api.channel.ChannelSummary;
import kr.crownrpg.chat.api.channel.ChatChannel;
import kr.crownrpg.chat.api.channel.InstanceKind;
import kr.crownrpg.chat.api.channel.LeaveOutcome;
import kr.crownrpg.chat.api.session.ChatSession;
import kr.crownrpg.chat.core.RecordingSession;
import kr.crownrpg.chat.core.codec.JsonChatPacketEncoder;
import kr.crownrpg.chat.core.directory.InMemoryChannelDirectory;
import kr.crownrpg.chat.core.directory.SessionChannelIndex;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Test case for {@link ChatService}.
 */
public class TestChatService extends TestCase {

    private final ObjectMapper mapper = new ObjectMapper();

    private InMemoryChannelDirectory directory;
    private ChatService service;
    private RecordingSession alice;
    private RecordingSession bob;
    private RecordingSession mod;

    @Override
    protected void setUp() {
        directory = new InMemoryChannelDirectory();
        directory.create(ChannelDefinition.of("#osu", "General"));
        directory.create(ChannelDefinition.of("#announce", "News").withLevels(AccessLevel.NORMAL, AccessLevel.ADMINISTRATOR));
        directory.create(new ChannelDefinition("#staff", "Staff", AccessLevel.MODERATOR, AccessLevel.MODERATOR, true, false));
        directory.create(new ChannelDefinition("#lobby", "Lobby", AccessLevel.NORMAL, AccessLevel.NORMAL, false, false));
        service = new ChatService(directory, new JsonChatPacketEncoder(mapper), new SessionChannelIndex(), "CrownBot", 1);
        alice = new RecordingSession(10, "alice");
        bob = new RecordingSession(11, "bob");
        mod = new RecordingSession(12, "mod", AccessLevel.MODERATOR);
    }

    public void testJoinNotifiesJoinerAndMembers() throws IOException {
        service.join(bob, "#osu");
        bob.clear();
        service.join(alice, "#osu");

        List<String> aliceTypes = types(alice);
        assertEquals(List.of("channel.join", "channel.info"), aliceTypes);
        JsonNode info = packets(bob).get(0);
        assertEquals("channel.info", info.get("type").asText());
        assertEquals(2, info.get("members").asInt());
        assertEquals(List.of("#osu"), service.channelsOf(alice));
    }

    public void testJoinChecksReadLevel() {
        try {
            service.join(alice, "#staff");
            fail("read level ignored");
        } catch (ChannelException e) {
            assertEquals(ChannelException.Reason.ACCESS_DENIED, e.reason());
        }
        assertFalse(directory.find("#staff").orElseThrow().contains(alice));
        service.join(mod, "#staff");
        assertTrue(directory.find("#staff").orElseThrow().contains(mod));
    }

    public void testJoinUnknownChannel() {
        try {
            service.join(alice, "#nowhere");
            fail("unknown channel accepted");
        } catch (ChannelException e) {
            assertEquals(ChannelException.Reason.UNKNOWN_CHANNEL, e.reason());
        }
    }

    public void testSendBroadcastsToOthers() throws IOException {
        service.join(alice, "#osu");
        service.join(bob, "#osu");
        alice.clear();
        bob.clear();

        assertEquals(1, service.send(alice, "#osu", "  hello  "));
        assertTrue(alice.received().isEmpty());
        JsonNode message = packets(bob).get(0);
        assertEquals("chat.message", message.get("type").asText());
        assertEquals("alice", message.get("sender").asText());
        assertEquals("hello", message.get("text").asText());
        assertEquals("#osu", message.get("target").asText());
        assertEquals(10, message.get("senderId").asInt());
    }

    public void testSendIgnoresBlankText() {
        service.join(alice, "#osu");
        service.join(bob, "#osu");
        bob.clear();
        assertEquals(0, service.send(alice, "#osu", "   "));
        assertTrue(bob.received().isEmpty());
    }

    public void testSendRequiresMembershipAndWriteLevel() {
        try {
            service.send(alice, "#osu", "hi");
            fail("non-member send accepted");
        } catch (ChannelException e) {
            assertEquals(ChannelException.Reason.NOT_A_MEMBER, e.reason());
        }
        service.join(alice, "#announce");
        try {
            service.send(alice, "#announce", "hi");
            fail("write level ignored");
        } catch (ChannelException e) {
            assertEquals(ChannelException.Reason.ACCESS_DENIED, e.reason());
        }
    }

    public void testInstanceMessagesUseAlias() throws IOException {
        service.joinInstance(alice, InstanceKind.MULTIPLAYER, 7, "match");
        service.joinInstance(bob, InstanceKind.MULTIPLAYER, 7, "match");
        bob.clear();
        service.send(alice, "#multi_7", "gl hf");
        assertEquals("#multiplayer", packets(bob).get(0).get("target").asText());
    }

    public void testLeavingInstanceTearsItDown() throws IOException {
        ChatChannel channel = service.joinInstance(alice, InstanceKind.SPECTATOR, 42, "");
        alice.clear();
        assertEquals(LeaveOutcome.DESTROYED, service.leave(alice, "#spec_42"));
        assertTrue(channel.isDestroyed());
        assertTrue(directory.find("#spec_42").isEmpty());
        assertEquals(List.of("channel.kick"), types(alice));
        assertTrue(service.channelsOf(alice).isEmpty());
    }

    public void testJoinInstanceAfterTeardownGetsFreshChannel() {
        ChatChannel first = service.joinInstance(alice, InstanceKind.SPECTATOR, 1, "");
        service.leave(alice, "#spec_1");
        ChatChannel second = service.joinInstance(bob, InstanceKind.SPECTATOR, 1, "");
        assertNotSame(first, second);
        assertTrue(second.contains(bob));
    }

    public void testJoinInstanceRedirectedWhenTeardownWinsRace() {
        ChatChannel first = service.joinInstance(alice, InstanceKind.MULTIPLAYER, 5, "");
        AtomicBoolean raced = new AtomicBoolean();
        // the last member leaves between the instance lookup and the join itself
        ChatSession late = new ChatSession() {
            @Override
            public int id() {
                return 20;
            }

            @Override
            public String name() {
                return "late";
            }

            @Override
            public AccessLevel accessLevel() {
                if (raced.compareAndSet(false, true)) {
                    assertEquals(LeaveOutcome.DESTROYED, service.leave(alice, "#multi_5"));
                }
                return AccessLevel.NORMAL;
            }

            @Override
            public void enqueue(byte[] payload) {
            }
        };

        ChatChannel joined = service.joinInstance(late, InstanceKind.MULTIPLAYER, 5, "");

        assertTrue(raced.get());
        assertTrue(first.isDestroyed());
        assertNotSame(first, joined);
        assertTrue(joined.contains(late));
        assertSame(joined, directory.find("#multi_5").orElseThrow());
        assertEquals(List.of("#multi_5"), service.channelsOf(late));
    }

    public void testLeaveUpdatesRemainingMembers() throws IOException {
        service.join(alice, "#osu");
        service.join(bob, "#osu");
        bob.clear();
        assertEquals(LeaveOutcome.REMOVED, service.leave(alice, "#osu"));
        JsonNode info = packets(bob).get(0);
        assertEquals(1, info.get("members").asInt());
        assertEquals(LeaveOutcome.NOT_MEMBER, service.leave(alice, "#osu"));
        assertEquals(LeaveOutcome.NOT_MEMBER, service.leave(alice, "#nowhere"));
    }

    public void testReplyGoesOnlyToTargets() throws IOException {
        service.join(alice, "#osu");
        service.join(bob, "#osu");
        RecordingSession outsider = new RecordingSession(99, "outsider");
        bob.clear();
        assertEquals(1, service.reply(alice, "#osu", "psst", List.of(outsider)));
        assertTrue(bob.received().isEmpty());
        assertEquals("psst", packets(outsider).get(0).get("text").asText());
    }

    public void testAnnounceReachesEveryMember() throws IOException {
        service.join(alice, "#osu");
        service.join(bob, "#osu");
        alice.clear();
        bob.clear();
        assertEquals(2, service.announce("#osu", "restart in 5 minutes"));
        JsonNode message = packets(alice).get(0);
        assertEquals("CrownBot", message.get("sender").asText());
        assertEquals(1, message.get("senderId").asInt());
        assertEquals(1, bob.received().size());
    }

    public void testSetTopicRequiresModerator() throws IOException {
        service.join(alice, "#osu");
        try {
            service.setTopic(alice, "#osu", "mine");
            fail("topic change by normal user accepted");
        } catch (ChannelException e) {
            assertEquals(ChannelException.Reason.ACCESS_DENIED, e.reason());
        }
        alice.clear();
        service.setTopic(mod, "#osu", "Be nice.");
        assertEquals("Be nice.", directory.find("#osu").orElseThrow().topic());
        assertEquals("Be nice.", packets(alice).get(0).get("topic").asText());
    }

    public void testJoinAutoChannelsRespectsReadLevel() {
        assertEquals(List.of("#announce", "#osu"), service.joinAutoChannels(alice));
        assertEquals(List.of("#announce", "#osu", "#staff"), service.joinAutoChannels(mod));
        // already joined channels are skipped
        assertTrue(service.joinAutoChannels(alice).isEmpty());
    }

    public void testListChannels() {
        service.join(alice, "#osu");
        service.openInstance(InstanceKind.MULTIPLAYER, 3, "");
        List<ChannelSummary> listing = service.listChannels(alice);
        List<String> names = new ArrayList<>();
        for (ChannelSummary summary : listing) {
            names.add(summary.displayName());
        }
        assertEquals(List.of("#announce", "#lobby", "#osu"), names);
        assertEquals(1, listing.get(2).memberCount());
        assertEquals(4, service.listChannels(mod).size());
    }

    public void testDisconnectLeavesEverything() {
        service.join(alice, "#osu");
        service.join(alice, "#lobby");
        ChatChannel instance = service.joinInstance(alice, InstanceKind.MULTIPLAYER, 4, "");
        service.join(bob, "#osu");

        service.disconnect(alice);

        assertFalse(directory.find("#osu").orElseThrow().contains(alice));
        assertFalse(directory.find("#lobby").orElseThrow().contains(alice));
        assertTrue(instance.isDestroyed());
        assertTrue(service.channelsOf(alice).isEmpty());
        assertTrue(directory.find("#osu").orElseThrow().contains(bob));
    }

    public void testDeleteChannelKicksMembers() throws IOException {
        service.join(alice, "#lobby");
        service.join(bob, "#lobby");
        alice.clear();
        bob.clear();

        assertEquals(2, service.deleteChannel("#lobby").size());
        assertTrue(directory.find("#lobby").isEmpty());
        assertEquals(List.of("channel.kick"), types(alice));
        assertEquals(List.of("channel.kick"), types(bob));
        assertTrue(service.channelsOf(alice).isEmpty());
    }

    private List<JsonNode> packets(RecordingSession session) throws IOException {
        List<JsonNode> out = new ArrayList<>();
        for (byte[] payload : session.received()) {
            out.add(mapper.readTree(payload));
        }
        return out;
    }

    private List<String> types(RecordingSession session) throws IOException {
        List<String> out = new ArrayList<>();
        for (JsonNode node : packets(session)) {
            out.add(node.get("type").asText());
        }
        return out;
    }
}
