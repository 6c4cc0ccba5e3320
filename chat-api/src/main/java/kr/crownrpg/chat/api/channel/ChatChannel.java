package kr.crownrpg.chat.api.channel;

import kr.crownrpg.chat.api.access.AccessLevel;
import kr.crownrpg.chat.api.session.ChatSession;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 하나의 채팅/브로드캐스트 범위에 대한 멤버십과 메시지 팬아웃 계약.
 * <p>
 * Read and write levels are enforced by the caller before join and send operations; the channel
 * itself never re-checks them. Membership is unique by {@link ChatSession#id()} and iterated in join
 * order.
 */
public interface ChatChannel {

    String internalName();

    /**
     * Name shown to clients, derived from {@link #internalName()} through {@link ChannelNames#displayName}.
     */
    default String displayName() {
        return ChannelNames.displayName(internalName());
    }

    String topic();

    void setTopic(String topic);

    AccessLevel readLevel();

    AccessLevel writeLevel();

    boolean autoJoin();

    boolean isInstance();

    ChannelState state();

    default boolean isDestroyed() {
        return state() == ChannelState.DESTROYED;
    }

    ChannelSummary summary();

    boolean contains(ChatSession session);

    int memberCount();

    /**
     * Snapshot of the current members in join order.
     */
    List<ChatSession> members();

    /**
     * Appends the session to the membership.
     *
     * @throws ChannelException {@code DUPLICATE_MEMBER} if already joined,
     *                          {@code CHANNEL_DESTROYED} if the channel has been torn down
     */
    void join(ChatSession session);

    /**
     * Removes the session. For an instance channel losing its last member this also tears the channel
     * down and asks the directory to forget it, atomically with the removal.
     *
     * @throws ChannelException {@code CHANNEL_DESTROYED} if already torn down,
     *                          {@code DIRECTORY_INCONSISTENT} if the directory did not know the channel
     */
    LeaveOutcome leave(ChatSession session);

    /**
     * Delivers an encoded packet from {@code sender} to every member, skipping the sender unless
     * {@code includeSender} is set.
     *
     * @return number of members the payload was handed to
     */
    int broadcast(ChatSession sender, byte[] payload, boolean includeSender);

    /**
     * Delivers an encoded packet to exactly {@code targets}, members or not.
     *
     * @return number of targets the payload was handed to
     */
    int selectiveSend(ChatSession sender, byte[] payload, Collection<? extends ChatSession> targets);

    /**
     * Delivers a packet to every member whose id is not in {@code immune}.
     *
     * @return number of members the payload was handed to
     */
    int enqueueRaw(byte[] payload, Set<Integer> immune);

    /**
     * Administrative teardown. Clears the membership and returns the former members.
     * Calling it again returns an empty list.
     */
    List<ChatSession> destroy();
}
