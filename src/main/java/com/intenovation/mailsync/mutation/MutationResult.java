package com.intenovation.mailsync.mutation;

import com.intenovation.mailsync.SyncErrorKind;

/**
 * Outcome of {@link MutationCoordinator#applyMutation}.
 */
public final class MutationResult {
    private final MutationAction action;
    private final MutationState state;
    private final String newFolder;
    private final Long newUid;
    private final Long newUidValidity;
    private final String message;
    private final SyncErrorKind errorKind;
    private boolean noop;

    private MutationResult(MutationAction action, MutationState state, String newFolder, Long newUid,
                           Long newUidValidity, String message, SyncErrorKind errorKind) {
        this.action = action;
        this.state = state;
        this.newFolder = newFolder;
        this.newUid = newUid;
        this.newUidValidity = newUidValidity;
        this.message = message;
        this.errorKind = errorKind;
    }

    static MutationResult confirmed(MutationAction action, String folder, String message) {
        return new MutationResult(action, MutationState.CONFIRMED, folder, null, null, message, null);
    }

    static MutationResult noop(MutationAction action, String message) {
        MutationResult result = new MutationResult(action, MutationState.CONFIRMED, null, null, null, message, null);
        result.noop = true;
        return result;
    }

    static MutationResult moved(MutationAction action, String folder, long uidValidity, long uid) {
        return new MutationResult(action, MutationState.CONFIRMED, folder, uid, uidValidity,
                "Moved to " + folder + " as UID " + uid, null);
    }

    static MutationResult movedUidUnknown(MutationAction action, String folder) {
        return new MutationResult(action, MutationState.CONFIRMED_UID_UNKNOWN, folder, null, null,
                "Moved to " + folder + ", new UID not reported", null);
    }

    static MutationResult failed(MutationAction action, SyncErrorKind kind, String message) {
        return new MutationResult(action, MutationState.FAILED, null, null, null, message, kind);
    }

    public boolean isSuccess() {
        return state.isConfirmed();
    }

    /**
     * Whether the server had nothing to change, as for a delete of a UID that is already gone
     */
    public boolean isNoop() {
        return noop;
    }

    public MutationAction getAction() {
        return action;
    }

    public MutationState getState() {
        return state;
    }

    /**
     * The folder the message is in after the mutation
     */
    public String getNewFolder() {
        return newFolder;
    }

    /**
     * The UID in the target folder, or null if the server did not report it
     */
    public Long getNewUid() {
        return newUid;
    }

    public Long getNewUidValidity() {
        return newUidValidity;
    }

    public String getMessage() {
        return message;
    }

    /**
     * The kind of failure, or null on success
     */
    public SyncErrorKind getErrorKind() {
        return errorKind;
    }

    @Override
    public String toString() {
        return action + " " + state + (message != null ? ": " + message : "");
    }
}
