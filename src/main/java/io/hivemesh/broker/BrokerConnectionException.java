package io.hivemesh.broker;

public class BrokerConnectionException extends RuntimeException {
    public BrokerConnectionException(String message) {
        super(message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
