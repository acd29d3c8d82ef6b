package com.cinegraph.collab.model;

public record Collaborator(long personId, int collaborationCount) {
}
