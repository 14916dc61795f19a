package com.stocksync.transfer;

import java.io.IOException;

/**
 * Session-level transport failure: the remaining work of the cycle cannot continue.
 */
public class TransportException extends IOException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
