package com.cinegraph.collab.service;

/**
 * Thrown when a single-flight operation (rebuild, trend refresh) is invoked
 * while a previous invocation is still in flight.
 */
public class AlreadyRunningException extends RuntimeException {

    public AlreadyRunningException(String operation) {
        super(operation + " is already running");
    }
}
