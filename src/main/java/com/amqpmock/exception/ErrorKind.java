package com.amqpmock.exception;

/**
 * Closed set of failure kinds a {@link MockBrokerException} can carry.
 */
public enum ErrorKind {
    CONNECTION,
    NOT_CONNECTED,
    UNKNOWN_CHANNEL,
    UNKNOWN_QUEUE,
    UNKNOWN_EXCHANGE,
    UNKNOWN_BINDING,
    TRANSACTION_ALREADY_STARTED,
    NO_TRANSACTION,
    NO_QUEUE_SELECTED,
    UNSUPPORTED_OPTION
}
