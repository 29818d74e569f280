package com.intenovation.mailsync.mutation;

import javax.mail.Flags;

/**
 * The changes a client can request for a single message on the server.
 */
public enum MutationAction {
    /**
     * Flag the message deleted and expunge it
     */
    DELETE("Removes the message from its folder.", false, false, null, false),

    /**
     * Copy to the target folder, then remove from the source
     */
    MOVE("Moves the message to the given target folder.", true, true, null, false),

    /**
     * Move to the folder carrying the \Trash special-use attribute
     */
    MOVE_TO_TRASH("Moves the message to the trash folder announced by the server.", false, true, null, false),

    MARK_READ("Sets the \\Seen flag.", false, false, Flags.Flag.SEEN, true),

    MARK_UNREAD("Clears the \\Seen flag.", false, false, Flags.Flag.SEEN, false),

    FLAG("Sets the \\Flagged flag.", false, false, Flags.Flag.FLAGGED, true),

    UNFLAG("Clears the \\Flagged flag.", false, false, Flags.Flag.FLAGGED, false);

    private final String description;
    private final boolean targetRequired;
    private final boolean move;
    private final Flags.Flag flag;
    private final boolean flagValue;

    /**
     * @param description What the action does
     * @param targetRequired Whether the caller has to name a target folder
     * @param move Whether the message changes folder
     * @param flag The flag a flag action changes, or null
     * @param flagValue Whether a flag action sets or clears its flag
     */
    MutationAction(String description, boolean targetRequired, boolean move, Flags.Flag flag, boolean flagValue) {
        this.description = description;
        this.targetRequired = targetRequired;
        this.move = move;
        this.flag = flag;
        this.flagValue = flagValue;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTargetRequired() {
        return targetRequired;
    }

    public boolean isMove() {
        return move;
    }

    public boolean isFlagChange() {
        return flag != null;
    }

    /**
     * The flag changed by a flag action
     *
     * @return The flag, or null for DELETE and the moves
     */
    public Flags.Flag getFlag() {
        return flag;
    }

    public boolean getFlagValue() {
        return flagValue;
    }
}
