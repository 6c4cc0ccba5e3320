package kr.crownrpg.chat.api.channel;

/**
 * Listing view of a channel as shown to clients. {@code memberCount} is read at the time the summary
 * is built and is not kept up to date afterwards.
 */
public record ChannelSummary(String displayName, String topic, int memberCount) {
}
