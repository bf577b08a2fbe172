package by.radioegor146.unflatten.pattern;

public enum DecoyKind {
    /** {@code ILOAD k; const c; IF_ICMPEQ} where {@code k} may hold {@code c}: always taken. */
    CONSTANT_COMPARE_BRANCH,
    /** {@code ILOAD k; switch} fed by predecessors that store a known constant to {@code k}. */
    DISPATCH_SWITCH,
    /** Compare against the sentinel value, a fabricated early exit. */
    SENTINEL_RETURN_COMPARE,
    /** Stores to a state variable that is never read. */
    INITIALIZATION_NOOP
}
