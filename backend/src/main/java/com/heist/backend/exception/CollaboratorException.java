package com.heist.backend.exception;

/**
 * A call to an external collaborator failed, timed out or was refused by an open circuit.
 */
public class CollaboratorException extends RuntimeException {

    private final String collaborator;

    public CollaboratorException(String collaborator, String message) {
        super(message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
