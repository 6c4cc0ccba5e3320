package kr.crownrpg.chat.core.session;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.EventLoop;
import kr.crownrpg.chat.api.Preconditions;
import kr.crownrpg.chat.api.access.AccessLevel;
import kr.crownrpg.chat.api.session.ChatSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Chat session bound to a client's Netty channel.
 * <p>
 * Packets go into a bounded outbound deque and are drained on the channel's event loop, so callers of
 * {@link #enqueue} never wait on socket I/O. When the deque is full the oldest packet is dropped.
 */
public final class NettyChatSession implements ChatSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyChatSession.class);

    private final int id;
    private final String name;
    private final Channel channel;
    private final ChatSessionSettings settings;
    private final BlockingDeque<byte[]> outboundQueue;
    private final AtomicLong droppedOutboundCount = new AtomicLong(0);

    private volatile AccessLevel accessLevel;

    public NettyChatSession(int id, String name, AccessLevel accessLevel, Channel channel, ChatSessionSettings settings) {
        this.id = id;
        this.name = Preconditions.checkNotBlank(name, "name");
        this.accessLevel = Objects.requireNonNull(accessLevel, "accessLevel");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.outboundQueue = new LinkedBlockingDeque<>(settings.outboundQueueCapacity());
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public AccessLevel accessLevel() {
        return accessLevel;
    }

    public void setAccessLevel(AccessLevel accessLevel) {
        this.accessLevel = Objects.requireNonNull(accessLevel, "accessLevel");
    }

    public boolean isConnected() {
        return channel.isActive();
    }

    public int pendingCount() {
        return outboundQueue.size();
    }

    public long droppedCount() {
        return droppedOutboundCount.get();
    }

    @Override
    public void enqueue(byte[] payload) {
        Preconditions.checkNotNull(payload, "payload");
        if (!channel.isActive()) {
            throw new IllegalStateException("session " + name + "(" + id + ") is not connected");
        }
        if (!outboundQueue.offer(payload)) {
            if (outboundQueue.poll() != null) {
                logOutboundDrop("outbound 큐 포화로 가장 오래된 패킷 드롭");
            }
            if (!outboundQueue.offer(payload)) {
                logOutboundDrop("outbound 큐 포화로 신규 패킷 드롭");
                return;
            }
        }
        EventLoop loop = channel.eventLoop();
        if (loop.inEventLoop()) {
            drainQueue();
        } else {
            loop.execute(this::drainQueue);
        }
    }

    private void drainQueue() {
        if (!channel.isActive()) {
            return;
        }
        byte[] payload;
        while ((payload = outboundQueue.poll()) != null) {
            channel.write(Unpooled.wrappedBuffer(payload));
        }
        channel.flush();
    }

    private void logOutboundDrop(String reason) {
        long totalDrops = droppedOutboundCount.incrementAndGet();
        if (totalDrops % settings.dropWarnThreshold() == 0) {
            LOGGER.warn("세션 {}({}) outbound 드롭 {}회 발생 ({}).", name, id, totalDrops, reason);
        } else {
            LOGGER.debug("세션 {}({}) outbound 드롭 {}회 발생 ({}).", name, id, totalDrops, reason);
        }
    }

    @Override
    public String toString() {
        return "<" + name + "(" + id + ")>";
    }
}
