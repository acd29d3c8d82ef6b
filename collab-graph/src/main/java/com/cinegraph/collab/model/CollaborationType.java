package com.cinegraph.collab.model;

import java.util.Arrays;

/**
 * Kinds of collaboration an edge can carry.
 * Declaration order is precedence: when one work qualifies a pair under several
 * types, the earliest constant is the one stored.
 */
public enum CollaborationType {

    DIRECTOR_DIRECTOR("director-director"),
    PERFORMER_DIRECTOR("performer-director"),
    DIRECTOR_CREW("director-crew"),
    PERFORMER_PERFORMER("performer-performer"),
    CREW_CREW("crew-crew");

    private final String code;

    CollaborationType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static CollaborationType fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code) || t.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown collaboration type: " + code));
    }
}
