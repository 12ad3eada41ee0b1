package com.amqpmock.exception;

public class UnknownExchangeException extends MockBrokerException {
    private final String exchangeName;

    public UnknownExchangeException(String exchangeName) {
        super(ErrorKind.UNKNOWN_EXCHANGE, "Unknown exchange: " + exchangeName);
        this.exchangeName = exchangeName;
    }

    public String getExchangeName() {
        return exchangeName;
    }
}
