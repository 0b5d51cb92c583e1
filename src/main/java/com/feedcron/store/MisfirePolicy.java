package com.feedcron.store;

/**
 * What the engine does with a fire time it missed while it was not running.
 */
public enum MisfirePolicy {
    /** Catch up exactly one missed fire, then resume the normal cadence. */
    FIRE_NOW("FireNow"),
    /** Skip missed fires silently. */
    DO_NOTHING("DoNothing"),
    /** Ignore misfire bookkeeping entirely. */
    RESCHEDULE_IGNORING_MISFIRES("RescheduleIgnoringMisfires", "RescheduleNextWithRemainingCount");

    private final String[] aliases;

    MisfirePolicy(String... aliases) {
        this.aliases = aliases;
    }

    /**
     * Parses a persisted policy name. Accepts the constant names as well as the
     * camel-case names written by older releases.
     *
     * @throws IllegalArgumentException if the name matches no policy
     */
    public static MisfirePolicy parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Misfire policy is required");
        }
        for (MisfirePolicy p : values()) {
            if (p.name().equalsIgnoreCase(name)) {
                return p;
            }
            for (String alias : p.aliases) {
                if (alias.equalsIgnoreCase(name)) {
                    return p;
                }
            }
        }
        throw new IllegalArgumentException("Unknown misfire policy: " + name);
    }
}
