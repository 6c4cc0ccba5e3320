package kr.crownrpg.chat.api.channel;

/**
 * Result of {@link ChatChannel#leave}.
 */
public enum LeaveOutcome {

    /** The session was a member and has been removed; the channel stays alive. */
    REMOVED,

    /** The session was not a member. Nothing changed. */
    NOT_MEMBER,

    /** The session was the last member of an instance channel, which has been torn down. */
    DESTROYED
}
