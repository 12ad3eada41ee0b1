package com.amqpmock.exception;

public class TransactionAlreadyStartedException extends MockBrokerException {
    private final int channel;

    public TransactionAlreadyStartedException(int channel) {
        super(ErrorKind.TRANSACTION_ALREADY_STARTED, "Transaction already started on channel " + channel);
        this.channel = channel;
    }

    public int getChannel() {
        return channel;
    }
}
