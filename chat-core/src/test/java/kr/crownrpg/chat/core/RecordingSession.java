package kr.crownrpg.chat.core;

import kr.crownrpg.chat.api.access.AccessLevel;
import kr.crownrpg.chat.api.session.ChatSession;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Session that keeps every payload it is handed. Once closed, enqueue fails.
 */
public final class RecordingSession implements ChatSession {

    private final int id;
    private final String name;
    private final AccessLevel accessLevel;
    private final List<byte[]> received = new ArrayList<>();
    private volatile boolean closed;

    public RecordingSession(int id, String name) {
        this(id, name, AccessLevel.NORMAL);
    }

    public RecordingSession(int id, String name, AccessLevel accessLevel) {
        this.id = id;
        this.name = name;
        this.accessLevel = accessLevel;
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

    @Override
    public synchronized void enqueue(byte[] payload) {
        if (closed) {
            throw new IllegalStateException(name + " is closed");
        }
        received.add(payload);
    }

    public void close() {
        closed = true;
    }

    public synchronized List<byte[]> received() {
        return new ArrayList<>(received);
    }

    public synchronized List<String> receivedText() {
        List<String> out = new ArrayList<>();
        for (byte[] payload : received) {
            out.add(new String(payload, StandardCharsets.UTF_8));
        }
        return out;
    }

    public synchronized void clear() {
        received.clear();
    }
}
