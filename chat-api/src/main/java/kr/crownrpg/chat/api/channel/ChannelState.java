package kr.crownrpg.chat.api.channel;

/**
 * 채널 수명주기 상태 머신.
 * <p>
 * {@code ACTIVE -> DESTROYED} only. No operation other than queries is valid once destroyed.
 */
public enum ChannelState {
    ACTIVE,
    DESTROYED
}
