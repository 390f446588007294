package com.ai.assistant.client;

/**
 * Raised by the remote collaborator adapters on transport, HTTP or payload failures.
 * The message is meant for operators only.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
