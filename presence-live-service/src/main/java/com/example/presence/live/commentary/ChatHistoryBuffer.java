package com.example.presence.live.commentary;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity rolling chat log; the oldest entry is evicted when full.
 */
public class ChatHistoryBuffer {

    private final int capacity;
    private final Deque<ChatEntry> entries;

    public ChatHistoryBuffer(int capacity) {
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public synchronized void append(ChatEntry entry) {
        if (entries.size() >= capacity) {
            entries.pollFirst();
        }
        entries.addLast(entry);
    }

    /** Oldest first. */
    public synchronized List<ChatEntry> snapshot() {
        return new ArrayList<>(entries);
    }

    public synchronized List<ChatEntry> lastEntries(int count) {
        List<ChatEntry> all = new ArrayList<>(entries);
        return all.subList(Math.max(0, all.size() - count), all.size());
    }

    public synchronized int size() {
        return entries.size();
    }
}
