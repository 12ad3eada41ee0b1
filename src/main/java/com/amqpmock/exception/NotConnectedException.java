package com.amqpmock.exception;

public class NotConnectedException extends MockBrokerException {
    private final String operation;

    public NotConnectedException(String operation) {
        super(ErrorKind.NOT_CONNECTED, "Not connected: " + operation);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
