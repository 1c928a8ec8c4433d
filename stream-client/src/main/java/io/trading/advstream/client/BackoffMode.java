package io.trading.advstream.client;

/**
 * How the reconnect attempt counter behaves across disconnect cycles.
 */
public enum BackoffMode {
    /** Every reconnect cycle starts again at the initial delay. */
    RESET_EACH_CYCLE,
    /** Attempts accumulate across cycles so a flapping connection keeps backing off. */
    CARRY_OVER;

    public static BackoffMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return RESET_EACH_CYCLE;
        }
        return switch (value.trim().toLowerCase()) {
            case "reset_each_cycle", "reset" -> RESET_EACH_CYCLE;
            case "carry_over", "carry" -> CARRY_OVER;
            default -> throw new IllegalArgumentException("Unknown backoff mode: " + value);
        };
    }
}
