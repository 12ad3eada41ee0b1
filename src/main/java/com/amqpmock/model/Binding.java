package com.amqpmock.model;

import java.util.Objects;

/**
 * Association of a compiled binding key on an exchange with its destination queue.
 */
public class Binding {
    private final String exchangeName;
    private final BindingPattern pattern;
    private final String queueName;

    public Binding(String exchangeName, String bindingKey, String queueName) {
        this.exchangeName = exchangeName;
        this.pattern = BindingPattern.compile(bindingKey);
        this.queueName = queueName;
    }

    public String getExchangeName() {
        return exchangeName;
    }

    public String getBindingKey() {
        return pattern.getSource();
    }

    public String getQueueName() {
        return queueName;
    }

    public boolean matches(String routingKey) {
        return pattern.matches(routingKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Binding that = (Binding) o;
        return Objects.equals(exchangeName, that.exchangeName) &&
               Objects.equals(getBindingKey(), that.getBindingKey()) &&
               Objects.equals(queueName, that.queueName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exchangeName, getBindingKey(), queueName);
    }

    @Override
    public String toString() {
        return String.format("Binding{exchange='%s', bindingKey='%s', queue='%s'}",
                           exchangeName, getBindingKey(), queueName);
    }
}
