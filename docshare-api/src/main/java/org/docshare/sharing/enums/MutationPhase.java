package org.docshare.sharing.enums;

public enum MutationPhase {
    IDLE,
    PREDICTING, // Optimistic state shown, authority call pending
    CONFIRMED, // Authoritative response applied
    ROLLED_BACK // Pre-attempt snapshot restored after a failure
}
