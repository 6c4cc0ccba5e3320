package kr.crownrpg.chat.core.service;

import kr.crownrpg.chat.api.Preconditions;
import kr.crownrpg.chat.api.access.AccessLevel;
import kr.crownrpg.chat.api.channel.ChannelException;
import kr.crownrpg.chat.api.channel.ChannelSummary;
import kr.crownrpg.chat.api.channel.ChatChannel;
import kr.crownrpg.chat.api.channel.InstanceKind;
import kr.crownrpg.chat.api.channel.LeaveOutcome;
import kr.crownrpg.chat.api.directory.ChannelDirectory;
import kr.crownrpg.chat.api.message.ChatMessage;
import kr.crownrpg.chat.api.message.ChatPacketEncoder;
import kr.crownrpg.chat.api.session.ChatSession;
import kr.crownrpg.chat.core.directory.SessionChannelIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point used by session handlers: enforces channel access levels, keeps the session-to-channel
 * index, encodes packets and relays presence changes.
 */
public final class ChatService {

    /** Minimum level allowed to change a channel topic. */
    public static final AccessLevel TOPIC_LEVEL = AccessLevel.MODERATOR;

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    private final ChannelDirectory directory;
    private final ChatPacketEncoder encoder;
    private final SessionChannelIndex index;
    private final String botName;
    private final int botId;

    public ChatService(ChannelDirectory directory,
                       ChatPacketEncoder encoder,
                       SessionChannelIndex index,
                       String botName,
                       int botId) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.index = Objects.requireNonNull(index, "index");
        this.botName = Preconditions.checkNotBlank(botName, "botName");
        this.botId = botId;
    }

    public ChannelDirectory directory() {
        return directory;
    }

    public List<String> channelsOf(ChatSession session) {
        Preconditions.checkNotNull(session, "session");
        return index.channelsOf(session.id());
    }

    /**
     * Joins a named channel after checking the read level.
     *
     * @throws ChannelException {@code UNKNOWN_CHANNEL}, {@code ACCESS_DENIED}, {@code DUPLICATE_MEMBER}
     *                          or {@code CHANNEL_DESTROYED}
     */
    public ChatChannel join(ChatSession session, String internalName) {
        Preconditions.checkNotNull(session, "session");
        ChatChannel channel = require(internalName);
        joinChannel(session, channel);
        return channel;
    }

    /**
     * Joins the instance channel of a game session, creating it when needed. A join that loses the race
     * against the previous instance's teardown is redirected to a fresh instance.
     */
    public ChatChannel joinInstance(ChatSession session, InstanceKind kind, long id, String topic) {
        Preconditions.checkNotNull(session, "session");
        ChatChannel channel = directory.createInstance(kind, id, topic);
        try {
            joinChannel(session, channel);
            return channel;
        } catch (ChannelException e) {
            if (e.reason() != ChannelException.Reason.CHANNEL_DESTROYED) {
                throw e;
            }
            LOGGER.debug("인스턴스 채널 {}이(가) 제거되는 중이어서 새 인스턴스로 재시도합니다", channel.internalName());
            ChatChannel fresh = directory.createInstance(kind, id, topic);
            joinChannel(session, fresh);
            return fresh;
        }
    }

    private void joinChannel(ChatSession session, ChatChannel channel) {
        if (!session.accessLevel().isAtLeast(channel.readLevel())) {
            throw new ChannelException(ChannelException.Reason.ACCESS_DENIED, channel.internalName(),
                    session.name() + " may not read " + channel.internalName());
        }
        channel.join(session);
        index.add(session.id(), channel.internalName());
        notify(session, encoder.channelJoined(channel.displayName()));
        publishInfo(channel);
    }

    /**
     * Leaves a channel. Leaving a channel the session is not in is a no-op reported as
     * {@link LeaveOutcome#NOT_MEMBER}.
     */
    public LeaveOutcome leave(ChatSession session, String internalName) {
        Preconditions.checkNotNull(session, "session");
        ChatChannel channel = directory.find(internalName).orElse(null);
        if (channel == null) {
            index.remove(session.id(), internalName);
            LOGGER.warn("존재하지 않는 채널 {}에서 세션 {}({})의 퇴장 요청을 무시합니다", internalName, session.name(), session.id());
            return LeaveOutcome.NOT_MEMBER;
        }
        LeaveOutcome outcome;
        try {
            outcome = channel.leave(session);
        } finally {
            index.remove(session.id(), channel.internalName());
        }
        if (outcome == LeaveOutcome.NOT_MEMBER) {
            return outcome;
        }
        notify(session, encoder.channelRevoked(channel.displayName()));
        if (outcome == LeaveOutcome.REMOVED) {
            publishInfo(channel);
        }
        return outcome;
    }

    /**
     * Sends a chat message from a member to everyone else in the channel.
     *
     * @return number of recipients the message was queued for
     */
    public int send(ChatSession session, String internalName, String text) {
        Preconditions.checkNotNull(session, "session");
        ChatChannel channel = requireWritable(session, internalName);
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        byte[] payload = encoder.message(new ChatMessage(session.name(), trimmed, channel.displayName(), session.id()));
        return channel.broadcast(session, payload, false);
    }

    /**
     * Sends a message framed for the channel to the given targets only, members or not.
     */
    public int reply(ChatSession session, String internalName, String text, Collection<? extends ChatSession> targets) {
        Preconditions.checkNotNull(session, "session");
        Preconditions.checkNotNull(targets, "targets");
        ChatChannel channel = requireWritable(session, internalName);
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        byte[] payload = encoder.message(new ChatMessage(session.name(), trimmed, channel.displayName(), session.id()));
        return channel.selectiveSend(session, payload, targets);
    }

    /**
     * Posts a system message, attributed to the bot, to every member of the channel.
     */
    public int announce(String internalName, String text) {
        Preconditions.checkNotBlank(text, "text");
        ChatChannel channel = require(internalName);
        byte[] payload = encoder.message(new ChatMessage(botName, text, channel.displayName(), botId));
        return channel.enqueueRaw(payload, Set.of());
    }

    public void setTopic(ChatSession actor, String internalName, String topic) {
        Preconditions.checkNotNull(actor, "actor");
        Preconditions.checkNotNull(topic, "topic");
        ChatChannel channel = require(internalName);
        if (!actor.accessLevel().isAtLeast(TOPIC_LEVEL)) {
            throw new ChannelException(ChannelException.Reason.ACCESS_DENIED, internalName,
                    actor.name() + " may not change the topic of " + internalName);
        }
        channel.setTopic(topic);
        LOGGER.info("{}이(가) 채널 {}의 토픽을 변경했습니다", actor.name(), internalName);
        publishInfo(channel);
    }

    /**
     * Joins every auto-join channel the session is allowed to read.
     *
     * @return internal names of the channels joined
     */
    public List<String> joinAutoChannels(ChatSession session) {
        Preconditions.checkNotNull(session, "session");
        List<String> joined = new ArrayList<>();
        for (ChatChannel channel : directory.autoJoinChannels()) {
            if (!session.accessLevel().isAtLeast(channel.readLevel()) || channel.contains(session)) {
                continue;
            }
            try {
                joinChannel(session, channel);
                joined.add(channel.internalName());
            } catch (ChannelException e) {
                LOGGER.warn("세션 {}({})의 자동 입장 실패: {} ({})", session.name(), session.id(), channel.internalName(), e.reason());
            }
        }
        return joined;
    }

    /**
     * Summaries of the persistent channels the session may read, sorted by name.
     */
    public List<ChannelSummary> listChannels(ChatSession session) {
        Preconditions.checkNotNull(session, "session");
        return directory.channels().stream()
                .filter(channel -> !channel.isInstance())
                .filter(channel -> session.accessLevel().isAtLeast(channel.readLevel()))
                .sorted(Comparator.comparing(ChatChannel::internalName))
                .map(ChatChannel::summary)
                .toList();
    }

    /**
     * Removes a disconnected session from every channel it joined. A failure in one channel is logged
     * and does not stop the others.
     */
    public void disconnect(ChatSession session) {
        Preconditions.checkNotNull(session, "session");
        for (String internalName : index.removeSession(session.id())) {
            ChatChannel channel = directory.find(internalName).orElse(null);
            if (channel == null) {
                continue;
            }
            try {
                if (channel.leave(session) == LeaveOutcome.REMOVED) {
                    publishInfo(channel);
                }
            } catch (ChannelException e) {
                LOGGER.warn("세션 {}({}) 접속 종료 중 채널 {} 퇴장 실패 ({})", session.name(), session.id(), internalName, e.reason(), e);
            }
        }
    }

    public ChatChannel openInstance(InstanceKind kind, long id, String topic) {
        return directory.createInstance(kind, id, topic);
    }

    /**
     * Administrative delete. Former members are told they were removed.
     *
     * @return the former members
     */
    public List<ChatSession> deleteChannel(String internalName) {
        ChatChannel channel = require(internalName);
        List<ChatSession> former = directory.delete(internalName);
        index.removeChannel(internalName);
        byte[] revoked = encoder.channelRevoked(channel.displayName());
        for (ChatSession member : former) {
            notify(member, revoked);
        }
        return former;
    }

    private void publishInfo(ChatChannel channel) {
        try {
            channel.enqueueRaw(encoder.channelInfo(channel.summary()), Set.of());
        } catch (ChannelException e) {
            LOGGER.debug("채널 {} 정보 갱신을 건너뜁니다 ({})", channel.internalName(), e.reason());
        }
    }

    private void notify(ChatSession session, byte[] payload) {
        try {
            session.enqueue(payload);
        } catch (RuntimeException e) {
            LOGGER.warn("세션 {}({})에게 알림을 전달하지 못했습니다", session.name(), session.id(), e);
        }
    }

    private ChatChannel require(String internalName) {
        return directory.find(internalName).orElseThrow(() -> new ChannelException(
                ChannelException.Reason.UNKNOWN_CHANNEL, internalName, "unknown channel " + internalName));
    }

    private ChatChannel requireWritable(ChatSession session, String internalName) {
        ChatChannel channel = require(internalName);
        if (!channel.contains(session)) {
            throw new ChannelException(ChannelException.Reason.NOT_A_MEMBER, internalName,
                    session.name() + " is not in " + internalName);
        }
        if (!session.accessLevel().isAtLeast(channel.writeLevel())) {
            throw new ChannelException(ChannelException.Reason.ACCESS_DENIED, internalName,
                    session.name() + " may not write to " + internalName);
        }
        return channel;
    }
}
