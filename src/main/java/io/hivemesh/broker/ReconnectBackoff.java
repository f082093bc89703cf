package io.hivemesh.broker;

public final class ReconnectBackoff {
    public static final long BASE_DELAY_MS = 1_000L;
    public static final long MAX_DELAY_MS = 30_000L;

    private ReconnectBackoff() {
    }

    /**
     * Delay before reconnect attempt {@code attempt} (1-based).
     */
    public static long delayMs(int attempt) {
        if (attempt <= 0) {
            return BASE_DELAY_MS;
        }
        if (attempt >= 15) {
            return MAX_DELAY_MS;
        }
        return Math.min(BASE_DELAY_MS << attempt, MAX_DELAY_MS);
    }
}
