package me.golemcore.agent.domain.session;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded conversation history. When full, the oldest entry is evicted.
 * Thread-safe.
 */
public class MessageHistory {

    private final int maxSize;
    private final Clock clock;
    private final Deque<SerializedMessage> messages = new ArrayDeque<>();

    public MessageHistory(int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.clock = clock;
    }

    public SerializedMessage add(String role, String content) {
        SerializedMessage message = new SerializedMessage(role, content, clock.instant());
        add(message);
        return message;
    }

    public synchronized void add(SerializedMessage message) {
        if (messages.size() >= maxSize) {
            messages.pollFirst();
        }
        messages.addLast(message);
    }

    public synchronized List<SerializedMessage> getAll() {
        return List.copyOf(messages);
    }

    /**
     * Replaces the content with the newest {@code maxSize} entries of
     * {@code source}.
     */
    public synchronized void replaceWith(List<SerializedMessage> source) {
        messages.clear();
        int from = Math.max(0, source.size() - maxSize);
        messages.addAll(source.subList(from, source.size()));
    }

    public synchronized void clear() {
        messages.clear();
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized boolean isEmpty() {
        return messages.isEmpty();
    }

    public int getMaxSize() {
        return maxSize;
    }
}
