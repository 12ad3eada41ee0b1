package com.amqpmock.exception;

public class NoTransactionException extends MockBrokerException {
    private final int channel;

    public NoTransactionException(int channel) {
        super(ErrorKind.NO_TRANSACTION, "No transaction in progress on channel " + channel);
        this.channel = channel;
    }

    public int getChannel() {
        return channel;
    }
}
