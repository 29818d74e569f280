package com.intenovation.mailsync.mutation;

/**
 * Lifecycle of a mutation request. Local state only changes once a request
 * reaches one of the confirmed states.
 */
public enum MutationState {
    REQUESTED,
    SENT_TO_SERVER,
    CONFIRMED,
    /**
     * The server carried out a move without telling the new UID
     */
    CONFIRMED_UID_UNKNOWN,
    FAILED;

    public boolean isConfirmed() {
        return this == CONFIRMED || this == CONFIRMED_UID_UNKNOWN;
    }

    public boolean isFinal() {
        return isConfirmed() || this == FAILED;
    }
}
