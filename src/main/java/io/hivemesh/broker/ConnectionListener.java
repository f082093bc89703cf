package io.hivemesh.broker;

/**
 * Lifecycle callbacks. Invoked in registration order on the thread that observed the
 * event.
 */
public interface ConnectionListener {
    default void onConnected() {
    }

    default void onDisconnected(Throwable cause) {
    }

    default void onError(Throwable error) {
    }

    /**
     * Automatic reconnection has given up. Someone has to restart the process or call
     * {@link ConnectionManager#connect()} by hand.
     */
    default void onMaxReconnectReached(int attempts) {
    }
}
