package com.amqpmock.exception;

public class UnsupportedOptionException extends MockBrokerException {
    private final String option;
    private final Object value;

    public UnsupportedOptionException(String option, Object value) {
        super(ErrorKind.UNSUPPORTED_OPTION, String.format("Unsupported option: %s=%s", option, value));
        this.option = option;
        this.value = value;
    }

    public String getOption() {
        return option;
    }

    public Object getValue() {
        return value;
    }
}
