package com.intenovation.mailsync;

/**
 * The server lacks an optional capability (UIDPLUS, THREAD, ...).
 * Callers fall back to the documented alternative instead of failing the operation.
 */
public class ProtocolCapabilityMissingException extends MailSyncException {
    private final String capability;

    public ProtocolCapabilityMissingException(String capability) {
        super("Server does not support " + capability);
        this.capability = capability;
    }

    /**
     * Get the name of the missing capability
     *
     * @return The capability name, e.g. "THREAD=REFERENCES"
     */
    public String getCapability() {
        return capability;
    }

    @Override
    public SyncErrorKind getKind() {
        return SyncErrorKind.PROTOCOL_CAPABILITY_MISSING;
    }
}
