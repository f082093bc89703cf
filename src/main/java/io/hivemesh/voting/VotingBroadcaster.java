package io.hivemesh.voting;

/**
 * Where the engine announces new sessions and publishes closed results. Optional; an
 * engine without one runs purely in-process.
 */
public interface VotingBroadcaster {
    boolean isAvailable();

    void announce(SessionView session);

    void publishResult(VotingResult result);
}
