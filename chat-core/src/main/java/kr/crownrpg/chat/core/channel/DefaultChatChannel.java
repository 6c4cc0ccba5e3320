package kr.crownrpg.chat.core.channel;

import kr.crownrpg.chat.api.Preconditions;
import kr.crownrpg.chat.api.access.AccessLevel;
import kr.crownrpg.chat.api.channel.ChannelDefinition;
import kr.crownrpg.chat.api.channel.ChannelException;
import kr.crownrpg.chat.api.channel.ChannelState;
import kr.crownrpg.chat.api.channel.ChannelSummary;
import kr.crownrpg.chat.api.channel.ChatChannel;
import kr.crownrpg.chat.api.channel.LeaveOutcome;
import kr.crownrpg.chat.api.directory.ChannelDirectory;
import kr.crownrpg.chat.api.session.ChatSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Lock-guarded channel implementation.
 * <p>
 * Membership changes take the write lock; queries and the member snapshot used for fan-out take the
 * read lock. Delivery to sessions always happens after the lock is released so a slow recipient can
 * never stall joins or leaves. Lock order is channel lock first, directory second.
 */
public class DefaultChatChannel implements ChatChannel {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultChatChannel.class);

    private final String internalName;
    private final AccessLevel readLevel;
    private final AccessLevel writeLevel;
    private final boolean autoJoin;
    private final boolean instance;
    private final ChannelDirectory directory;
    private final Map<Integer, ChatSession> members = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong failedDeliveries = new AtomicLong(0);

    private volatile String topic;
    private volatile ChannelState state = ChannelState.ACTIVE;

    public DefaultChatChannel(ChannelDefinition definition, ChannelDirectory directory) {
        Objects.requireNonNull(definition, "definition");
        this.internalName = definition.name();
        this.topic = definition.topic();
        this.readLevel = definition.readLevel();
        this.writeLevel = definition.writeLevel();
        this.autoJoin = definition.autoJoin();
        this.instance = definition.instance();
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public String internalName() {
        return internalName;
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public void setTopic(String topic) {
        this.topic = Preconditions.checkNotNull(topic, "topic");
    }

    @Override
    public AccessLevel readLevel() {
        return readLevel;
    }

    @Override
    public AccessLevel writeLevel() {
        return writeLevel;
    }

    @Override
    public boolean autoJoin() {
        return autoJoin;
    }

    @Override
    public boolean isInstance() {
        return instance;
    }

    @Override
    public ChannelState state() {
        return state;
    }

    @Override
    public ChannelSummary summary() {
        lock.readLock().lock();
        try {
            return new ChannelSummary(displayName(), topic, members.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean contains(ChatSession session) {
        Preconditions.checkNotNull(session, "session");
        lock.readLock().lock();
        try {
            return members.containsKey(session.id());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int memberCount() {
        lock.readLock().lock();
        try {
            return members.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ChatSession> members() {
        lock.readLock().lock();
        try {
            return List.copyOf(members.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Total number of per-recipient delivery failures seen by this channel.
     */
    public long failedDeliveries() {
        return failedDeliveries.get();
    }

    @Override
    public void join(ChatSession session) {
        Preconditions.checkNotNull(session, "session");
        lock.writeLock().lock();
        try {
            ensureActive("join");
            if (members.containsKey(session.id())) {
                throw new ChannelException(ChannelException.Reason.DUPLICATE_MEMBER, internalName,
                        "session " + session.id() + " already joined " + internalName);
            }
            members.put(session.id(), session);
            LOGGER.debug("세션 {}({})이(가) 채널 {}에 입장했습니다 (현재 {}명)", session.name(), session.id(), internalName, members.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public LeaveOutcome leave(ChatSession session) {
        Preconditions.checkNotNull(session, "session");
        lock.writeLock().lock();
        try {
            ensureActive("leave");
            if (members.remove(session.id()) == null) {
                LOGGER.warn("채널 {}에 속하지 않은 세션 {}({})의 퇴장 요청을 무시합니다", internalName, session.name(), session.id());
                return LeaveOutcome.NOT_MEMBER;
            }
            LOGGER.debug("세션 {}({})이(가) 채널 {}에서 퇴장했습니다 (남은 인원 {}명)", session.name(), session.id(), internalName, members.size());
            if (!instance || !members.isEmpty()) {
                return LeaveOutcome.REMOVED;
            }
            return teardownEmptyInstance();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock
    private LeaveOutcome teardownEmptyInstance() {
        boolean removed;
        try {
            removed = directory.removeChannel(this);
        } catch (RuntimeException e) {
            state = ChannelState.DESTROYED;
            throw new ChannelException(ChannelException.Reason.DIRECTORY_INCONSISTENT, internalName,
                    "directory failed to remove instance channel " + internalName, e);
        }
        state = ChannelState.DESTROYED;
        if (!removed) {
            LOGGER.error("인스턴스 채널 {}이(가) 디렉터리에 등록되어 있지 않습니다", internalName);
            throw new ChannelException(ChannelException.Reason.DIRECTORY_INCONSISTENT, internalName,
                    "instance channel " + internalName + " was not registered in the directory");
        }
        LOGGER.info("마지막 멤버가 떠나 인스턴스 채널 {}을(를) 제거했습니다", internalName);
        return LeaveOutcome.DESTROYED;
    }

    @Override
    public int broadcast(ChatSession sender, byte[] payload, boolean includeSender) {
        Preconditions.checkNotNull(sender, "sender");
        Set<Integer> immune = includeSender ? Set.of() : Set.of(sender.id());
        return enqueueRaw(payload, immune);
    }

    @Override
    public int selectiveSend(ChatSession sender, byte[] payload, Collection<? extends ChatSession> targets) {
        Preconditions.checkNotNull(sender, "sender");
        Preconditions.checkNotNull(payload, "payload");
        Preconditions.checkNotNull(targets, "targets");
        ensureActive("selectiveSend");
        return deliver(List.copyOf(targets), payload, Set.of());
    }

    @Override
    public int enqueueRaw(byte[] payload, Set<Integer> immune) {
        Preconditions.checkNotNull(payload, "payload");
        Set<Integer> skipped = immune == null ? Set.of() : immune;
        List<ChatSession> recipients;
        lock.readLock().lock();
        try {
            ensureActive("enqueueRaw");
            recipients = new ArrayList<>(members.values());
        } finally {
            lock.readLock().unlock();
        }
        return deliver(recipients, payload, skipped);
    }

    private int deliver(List<? extends ChatSession> recipients, byte[] payload, Set<Integer> immune) {
        int delivered = 0;
        for (ChatSession recipient : recipients) {
            if (immune.contains(recipient.id())) {
                continue;
            }
            try {
                recipient.enqueue(payload);
                delivered++;
            } catch (RuntimeException e) {
                long failures = failedDeliveries.incrementAndGet();
                LOGGER.warn("채널 {}의 세션 {}({})에게 전달하지 못했습니다 (누적 실패 {}회)",
                        internalName, recipient.name(), recipient.id(), failures, e);
            }
        }
        return delivered;
    }

    @Override
    public List<ChatSession> destroy() {
        lock.writeLock().lock();
        try {
            if (state == ChannelState.DESTROYED) {
                return List.of();
            }
            List<ChatSession> former = List.copyOf(members.values());
            members.clear();
            state = ChannelState.DESTROYED;
            LOGGER.info("채널 {}을(를) 종료했습니다 (퇴장 처리 {}명)", internalName, former.size());
            return former;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void ensureActive(String operation) {
        if (state == ChannelState.DESTROYED) {
            throw new ChannelException(ChannelException.Reason.CHANNEL_DESTROYED, internalName,
                    operation + " on destroyed channel " + internalName);
        }
    }

    @Override
    public String toString() {
        return "<" + internalName + ">";
    }
}
