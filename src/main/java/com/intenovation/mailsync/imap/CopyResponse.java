package com.intenovation.mailsync.imap;

import java.util.Optional;

/**
 * The outcome of a COPY. A server with UIDPLUS gives a structured remap;
 * otherwise only the raw response text is available and may or may not
 * carry a COPYUID code.
 */
public final class CopyResponse {
    private final UidRemap remap;
    private final String rawResponse;

    private CopyResponse(UidRemap remap, String rawResponse) {
        this.remap = remap;
        this.rawResponse = rawResponse;
    }

    public static CopyResponse structured(UidRemap remap) {
        return new CopyResponse(remap, null);
    }

    public static CopyResponse raw(String rawResponse) {
        return new CopyResponse(null, rawResponse);
    }

    public static CopyResponse empty() {
        return new CopyResponse(null, null);
    }

    public Optional<UidRemap> getRemap() {
        return Optional.ofNullable(remap);
    }

    public Optional<String> getRawResponse() {
        return Optional.ofNullable(rawResponse);
    }
}
