package com.amqpmock.exception;

/**
 * Raised by {@code connect()} when the broker is configured as not connectable.
 */
public class ConnectionFailedException extends MockBrokerException {

    public ConnectionFailedException() {
        super(ErrorKind.CONNECTION, "Unable to connect");
    }
}
