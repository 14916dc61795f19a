package com.stocksync.core;

public enum TaskStatus {
    OK,
    SKIPPED,
    FAILED
}
