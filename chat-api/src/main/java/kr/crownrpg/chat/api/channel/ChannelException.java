package kr.crownrpg.chat.api.channel;

/**
 * Raised when a channel operation breaks channel bookkeeping. The operation leaves the channel state
 * unchanged unless documented otherwise; callers are expected to fix their bookkeeping, not retry.
 */
public class ChannelException extends RuntimeException {

    public enum Reason {
        /** The session is already a member. */
        DUPLICATE_MEMBER,
        /** The channel has been torn down. */
        CHANNEL_DESTROYED,
        /** The directory did not know a channel that asked to be removed. */
        DIRECTORY_INCONSISTENT,
        /** A live channel with the same internal name already exists. */
        CHANNEL_EXISTS,
        /** No live channel with the requested name. */
        UNKNOWN_CHANNEL,
        /** The session's access level is below what the channel requires. */
        ACCESS_DENIED,
        /** The session must be a member to do this. */
        NOT_A_MEMBER
    }

    private final Reason reason;
    private final String channelName;

    public ChannelException(Reason reason, String channelName, String message) {
        super(message);
        this.reason = reason;
        this.channelName = channelName;
    }

    public ChannelException(Reason reason, String channelName, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.channelName = channelName;
    }

    public Reason reason() {
        return reason;
    }

    public String channelName() {
        return channelName;
    }
}
