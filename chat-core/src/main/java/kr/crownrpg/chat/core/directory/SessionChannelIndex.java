package kr.crownrpg.chat.core.directory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Non-owning index of which channels each session has joined, keyed by session id.
 * Lets a disconnect walk every joined channel without the session keeping channel references.
 */
public final class SessionChannelIndex {

    private final Map<Integer, Set<String>> channelsBySession = new ConcurrentHashMap<>();

    public void add(int sessionId, String internalName) {
        channelsBySession.computeIfAbsent(sessionId, key -> new CopyOnWriteArraySet<>()).add(internalName);
    }

    public void remove(int sessionId, String internalName) {
        channelsBySession.computeIfPresent(sessionId, (key, names) -> {
            names.remove(internalName);
            return names.isEmpty() ? null : names;
        });
    }

    /**
     * Forgets the channel for every session, e.g. after an administrative delete.
     */
    public void removeChannel(String internalName) {
        for (Integer sessionId : List.copyOf(channelsBySession.keySet())) {
            remove(sessionId, internalName);
        }
    }

    public List<String> channelsOf(int sessionId) {
        Set<String> names = channelsBySession.get(sessionId);
        return names == null ? List.of() : List.copyOf(names);
    }

    /**
     * Drops every entry of the session and returns the channel names it was in, in join order.
     */
    public List<String> removeSession(int sessionId) {
        Set<String> names = channelsBySession.remove(sessionId);
        return names == null ? List.of() : List.copyOf(names);
    }
}
