package com.amqpmock.exception;

public class UnknownQueueException extends MockBrokerException {
    private final String queueName;

    public UnknownQueueException(String queueName) {
        super(ErrorKind.UNKNOWN_QUEUE, "Unknown queue: " + queueName);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
