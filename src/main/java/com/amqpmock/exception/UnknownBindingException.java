package com.amqpmock.exception;

/**
 * Raised by {@code queueUnbind} when the exchange has no binding for the given pattern.
 */
public class UnknownBindingException extends MockBrokerException {
    private final String exchangeName;
    private final String routingKey;

    public UnknownBindingException(String exchangeName, String routingKey) {
        super(ErrorKind.UNKNOWN_BINDING,
              String.format("Unknown binding: exchange '%s', routing key '%s'", exchangeName, routingKey));
        this.exchangeName = exchangeName;
        this.routingKey = routingKey;
    }

    public String getExchangeName() {
        return exchangeName;
    }

    public String getRoutingKey() {
        return routingKey;
    }
}
