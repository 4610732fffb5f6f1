package com.jreinhal.annotator.ownership;

public enum ClaimOutcome {
    CLAIMED,
    ALREADY_OWNED,
    /** Another annotator got there first; expected under concurrency. */
    DENIED,
    NOT_FOUND;

    public boolean grantsAccess() {
        return this == CLAIMED || this == ALREADY_OWNED;
    }
}
