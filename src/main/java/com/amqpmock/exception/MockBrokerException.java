package com.amqpmock.exception;

/**
 * Base class for every failure raised by the mock broker.
 * Callers can catch the concrete subclass or branch on {@link #getKind()}.
 */
public abstract class MockBrokerException extends RuntimeException {
    private final ErrorKind kind;

    protected MockBrokerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + getMessage() + " [kind " + kind + "]";
    }
}
