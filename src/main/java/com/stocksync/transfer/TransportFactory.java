package com.stocksync.transfer;

@FunctionalInterface
public interface TransportFactory {
    FileTransport open() throws TransportException;
}
