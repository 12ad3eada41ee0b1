package com.amqpmock.exception;

public class UnknownChannelException extends MockBrokerException {
    private final int channel;

    public UnknownChannelException(int channel) {
        super(ErrorKind.UNKNOWN_CHANNEL, "Unknown channel: " + channel);
        this.channel = channel;
    }

    public int getChannel() {
        return channel;
    }
}
