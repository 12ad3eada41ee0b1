package com.amqpmock.exception;

/**
 * Raised by {@code recv()} before any {@code consume} call selected a queue.
 */
public class NoQueueSelectedException extends MockBrokerException {

    public NoQueueSelectedException() {
        super(ErrorKind.NO_QUEUE_SELECTED, "No queue selected, call consume first");
    }
}
