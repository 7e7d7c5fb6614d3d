package io.svparse;

/**
 * A value paired with a short explanation of how it was derived.
 * Used to make heuristic decisions traceable in logs and tests.
 */
public final class WithReason<T> {
    private final T value;
    private final String reason;

    public WithReason(T value, String reason) {
        this.value = value;
        this.reason = reason;
    }

    public static <T> WithReason<T> of(T value, String reason) {
        return new WithReason<>(value, reason);
    }

    public T getValue() { return value; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return value + " (" + reason + ")";
    }
}
