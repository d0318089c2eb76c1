package com.ryuqq.lifecycle.core.spi;

/**
 * Signals that a call to the remote service failed at the transport level.
 *
 * <p>Handlers throw this for connectivity faults, HTTP errors and any other
 * failure of the call itself, as opposed to the remote entity reporting a
 * FAILED status. The task runner never retries the mutating call that raised it.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
