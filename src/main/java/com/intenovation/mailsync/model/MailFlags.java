package com.intenovation.mailsync.model;

import javax.mail.Flags;
import java.util.Locale;

/**
 * The five boolean system flags the local store tracks, parsed from the
 * flag string kept on a server mirror row.
 */
public final class MailFlags {
    public static final String SEEN = "\\Seen";
    public static final String ANSWERED = "\\Answered";
    public static final String FLAGGED = "\\Flagged";
    public static final String DELETED = "\\Deleted";
    public static final String DRAFT = "\\Draft";

    private final boolean seen;
    private final boolean answered;
    private final boolean flagged;
    private final boolean deleted;
    private final boolean draft;

    public MailFlags(boolean seen, boolean answered, boolean flagged, boolean deleted, boolean draft) {
        this.seen = seen;
        this.answered = answered;
        this.flagged = flagged;
        this.deleted = deleted;
        this.draft = draft;
    }

    /**
     * Parse a flag string such as {@code "\Seen \Flagged"}. Matching is case-insensitive.
     *
     * @param flagString The flag string, may be null
     * @return The parsed flags
     */
    public static MailFlags parse(String flagString) {
        String lower = flagString == null ? "" : flagString.toLowerCase(Locale.ROOT);
        return new MailFlags(
                lower.contains("\\seen"),
                lower.contains("\\answered"),
                lower.contains("\\flagged"),
                lower.contains("\\deleted"),
                lower.contains("\\draft"));
    }

    /**
     * Render JavaMail flags as a space separated flag string, user flags included
     *
     * @param flags The JavaMail flags, may be null
     * @return The flag string, empty if there are no flags
     */
    public static String toFlagString(Flags flags) {
        if (flags == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Flags.Flag flag : flags.getSystemFlags()) {
            String name = systemFlagName(flag);
            if (name != null) {
                append(sb, name);
            }
        }
        for (String userFlag : flags.getUserFlags()) {
            append(sb, userFlag);
        }
        return sb.toString();
    }

    /**
     * Whether a flag string contains the given flag, ignoring case
     */
    public static boolean contains(String flagString, String flag) {
        if (flagString == null) {
            return false;
        }
        return flagString.toLowerCase(Locale.ROOT).contains(flag.toLowerCase(Locale.ROOT));
    }

    private static String systemFlagName(Flags.Flag flag) {
        if (flag == Flags.Flag.SEEN) {
            return SEEN;
        } else if (flag == Flags.Flag.ANSWERED) {
            return ANSWERED;
        } else if (flag == Flags.Flag.FLAGGED) {
            return FLAGGED;
        } else if (flag == Flags.Flag.DELETED) {
            return DELETED;
        } else if (flag == Flags.Flag.DRAFT) {
            return DRAFT;
        } else if (flag == Flags.Flag.RECENT) {
            return "\\Recent";
        }
        return null;
    }

    private static void append(StringBuilder sb, String value) {
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(value);
    }

    public boolean isSeen() {
        return seen;
    }

    public boolean isAnswered() {
        return answered;
    }

    public boolean isFlagged() {
        return flagged;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public boolean isDraft() {
        return draft;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MailFlags)) {
            return false;
        }
        MailFlags other = (MailFlags) o;
        return seen == other.seen && answered == other.answered && flagged == other.flagged
                && deleted == other.deleted && draft == other.draft;
    }

    @Override
    public int hashCode() {
        return (seen ? 1 : 0) | (answered ? 2 : 0) | (flagged ? 4 : 0) | (deleted ? 8 : 0) | (draft ? 16 : 0);
    }

    @Override
    public String toString() {
        return "MailFlags[seen=" + seen + ", answered=" + answered + ", flagged=" + flagged
                + ", deleted=" + deleted + ", draft=" + draft + "]";
    }
}
