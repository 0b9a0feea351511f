package com.myorg.cafe.eventing.context;

/**
 * Thread-local marker used by inner dispatcher wrappers (idempotency, dead-letter sequencing)
 * to communicate non-standard outcomes to outer layers (observability).
 */
public final class DispatchOutcome {

    public static final String DUPLICATE = "duplicate";
    public static final String REPLAYED = "replayed";
    public static final String UNTRACKED = "untracked";
    public static final String DEAD_LETTERED = "dead_lettered";

    private static final ThreadLocal<String> OUTCOME = new ThreadLocal<>();

    private DispatchOutcome() {}

    public static void markDuplicate() {
        OUTCOME.set(DUPLICATE);
    }

    public static void markReplayed() {
        OUTCOME.set(REPLAYED);
    }

    public static void markUntracked() {
        OUTCOME.set(UNTRACKED);
    }

    public static void markDeadLettered() {
        OUTCOME.set(DEAD_LETTERED);
    }

    /** Re-applies an outcome consumed on another thread; null clears. */
    public static void restore(String outcome) {
        if (outcome == null) OUTCOME.remove();
        else OUTCOME.set(outcome);
    }

    /** Read and clear. */
    public static String consume() {
        String v = OUTCOME.get();
        OUTCOME.remove();
        return v;
    }

    /** Clear without reading (safety net). */
    public static void clear() {
        OUTCOME.remove();
    }
}
