package com.cinegraph.collab.service;

public class UnknownPersonException extends RuntimeException {

    public UnknownPersonException(long personId) {
        super("Unknown person: " + personId);
    }
}
