package com.openforge.meetingmemory;

/**
 * A call to an external collaborator failed or timed out.
 *
 * Always propagated to the caller: an empty result would be indistinguishable
 * from "found nothing".
 */
public class CollaboratorException extends RuntimeException {

    public enum Collaborator {
        EXTRACTION,
        RETRIEVAL,
        STORAGE,
        ANSWER_GENERATION
    }

    private final Collaborator collaborator;

    public CollaboratorException(Collaborator collaborator, String message) {
        super(message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(Collaborator collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    public Collaborator collaborator() {
        return collaborator;
    }
}
