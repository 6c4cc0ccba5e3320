package kr.crownrpg.chat.api.session;

import kr.crownrpg.chat.api.access.AccessLevel;

/**
 * 채널이 참조하는 접속 세션.
 * <p>
 * Channels hold sessions by reference only; the session's lifetime belongs to whoever accepted the
 * connection. Identity is {@link #id()}: two sessions with the same id are the same member.
 */
public interface ChatSession {

    int id();

    String name();

    AccessLevel accessLevel();

    /**
     * Queues an already encoded packet for later delivery. Must not block the caller; a saturated or
     * closed queue is the session's problem (drop, disconnect) and may be reported with an unchecked
     * exception.
     */
    void enqueue(byte[] payload);
}
