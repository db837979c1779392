package docbro.recreate;

/**
 * Outcome of a recreation request.
 */
public enum RecreationState {
    /** Caller did not confirm; nothing was read or written */
    NOT_CONFIRMED,
    /** Project is already compatible and recreation was not forced */
    NOT_REQUIRED,
    /** Project was rebuilt at the current schema version */
    REBUILT,
    /** Rebuild failed; the stored record is unchanged */
    FAILED
}
