package com.amqpmock.model;

import java.util.*;

/**
 * A named routing point. Bindings are unique per binding key: binding the same key
 * again replaces its destination queue.
 */
public class Exchange {
    private final String name;
    private final Map<String, Object> arguments;
    private final Map<String, Binding> bindings; // binding key -> binding, in bind order

    public Exchange(String name) {
        this(name, null);
    }

    public Exchange(String name, Map<String, Object> arguments) {
        this.name = name;
        this.arguments = arguments != null ? new HashMap<>(arguments) : new HashMap<>();
        this.bindings = new LinkedHashMap<>();
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getArguments() {
        return new HashMap<>(arguments);
    }

    /**
     * @return the binding previously registered under {@code bindingKey}, if any
     */
    public Optional<Binding> addBinding(String bindingKey, String queueName) {
        Binding binding = new Binding(name, bindingKey, queueName);
        return Optional.ofNullable(bindings.put(bindingKey, binding));
    }

    public Optional<Binding> removeBinding(String bindingKey) {
        return Optional.ofNullable(bindings.remove(bindingKey));
    }

    public boolean hasBinding(String bindingKey) {
        return bindings.containsKey(bindingKey);
    }

    /**
     * Remove all bindings to a specific queue (used when deleting a queue).
     */
    public int removeAllBindingsToQueue(String queueName) {
        int before = bindings.size();
        bindings.values().removeIf(binding -> binding.getQueueName().equals(queueName));
        return before - bindings.size();
    }

    public List<Binding> getBindings() {
        return new ArrayList<>(bindings.values());
    }

    /**
     * Every binding whose key matches, in bind order. Two bindings targeting the same
     * queue both appear, so the queue receives one copy per binding.
     */
    public List<Binding> route(String routingKey) {
        List<Binding> matched = new ArrayList<>();
        for (Binding binding : bindings.values()) {
            if (binding.matches(routingKey)) {
                matched.add(binding);
            }
        }
        return matched;
    }

    @Override
    public String toString() {
        return String.format("Exchange{name='%s', bindings=%d}", name, bindings.size());
    }
}
