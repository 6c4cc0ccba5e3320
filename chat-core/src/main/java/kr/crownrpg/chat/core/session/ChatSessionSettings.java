package kr.crownrpg.chat.core.session;

/**
 * 세션 outbound 큐 정책을 외부 설정으로 전달하기 위한 옵션.
 */
public final class ChatSessionSettings {

    private final int outboundQueueCapacity;
    private final int dropWarnThreshold;

    public ChatSessionSettings(int outboundQueueCapacity, int dropWarnThreshold) {
        this.outboundQueueCapacity = Math.max(1, outboundQueueCapacity);
        this.dropWarnThreshold = Math.max(1, dropWarnThreshold);
    }

    public static ChatSessionSettings defaults() {
        return new ChatSessionSettings(512, 10);
    }

    public int outboundQueueCapacity() {
        return outboundQueueCapacity;
    }

    public int dropWarnThreshold() {
        return dropWarnThreshold;
    }
}
