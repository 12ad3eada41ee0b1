package com.amqpmock.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

public class Queue {
    private final String name;
    private final Map<String, Object> arguments;
    private final Deque<Message> messages;

    public Queue(String name) {
        this(name, null);
    }

    public Queue(String name, Map<String, Object> arguments) {
        this.name = name;
        this.arguments = arguments != null ? new HashMap<>(arguments) : new HashMap<>();
        this.messages = new ArrayDeque<>();
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getQueueArguments() {
        return new HashMap<>(arguments);
    }

    public void enqueue(Message message) {
        messages.addLast(message);
    }

    /**
     * @return the oldest message, or {@code null} if the queue is empty
     */
    public Message dequeue() {
        return messages.pollFirst();
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public int purge() {
        int purged = messages.size();
        messages.clear();
        return purged;
    }

    @Override
    public String toString() {
        return String.format("Queue{name='%s', size=%d}", name, size());
    }
}
