package com.stocksync.sync;

import com.stocksync.transfer.FileTransport;
import com.stocksync.transfer.TransportException;
import com.stocksync.transfer.TransportFactory;

/**
 * Transport session opened on first use and shared until {@link #close()}.
 */
final class CycleTransport implements AutoCloseable {
    private final TransportFactory factory;
    private FileTransport current;

    CycleTransport(TransportFactory factory) {
        this.factory = factory;
    }

    FileTransport get() throws TransportException {
        if (current == null) {
            current = factory.open();
        }
        return current;
    }

    /**
     * Closes a session that failed so the next {@link #get()} reconnects.
     */
    void discard() {
        close();
    }

    @Override
    public void close() {
        if (current != null) {
            try {
                current.close();
            } finally {
                current = null;
            }
        }
    }
}
