package io.hivemesh.voting;

public class SessionClosedException extends RuntimeException {
    private final String sessionId;

    public SessionClosedException(String sessionId, String reason) {
        super("Voting session " + sessionId + " is closed: " + reason);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
