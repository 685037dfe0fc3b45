package com.company.querylog.exception;

public class CapacityExceededException extends RuntimeException {
    public CapacityExceededException(long capacity) {
        super("Query record store is full (capacity " + capacity + ") and eviction is disabled");
    }
}
