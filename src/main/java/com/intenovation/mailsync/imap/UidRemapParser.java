package com.intenovation.mailsync.imap;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the UID remap of a COPY from raw server response text.
 * <p>
 * Understands the bracketed response code {@code [COPYUID 1 437 6]}, the same
 * without brackets, and a bare line of three numbers {@code 1 437 6} as some
 * client libraries report it. Source and destination may be UID sets such as
 * {@code 4:6,9}; the n-th source UID maps to the n-th destination UID.
 */
public final class UidRemapParser {
    private static final Logger LOGGER = Logger.getLogger(UidRemapParser.class.getName());

    private static final String UID_SET = "([0-9]+(?:[:,][0-9]+)*)";
    private static final Pattern BRACKETED = Pattern.compile(
            "\\[COPYUID\\s+([0-9]+)\\s+" + UID_SET + "\\s+" + UID_SET + "\\s*\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNBRACKETED = Pattern.compile(
            "COPYUID\\s+([0-9]+)\\s+" + UID_SET + "\\s+" + UID_SET, Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE = Pattern.compile(
            "^\\s*([0-9]+)\\s+([0-9]+)\\s+([0-9]+)\\s*$", Pattern.MULTILINE);

    // larger sets are not expanded
    private static final int MAX_SET_SIZE = 10000;

    private UidRemapParser() {
    }

    /**
     * Parse the first remap found in the response
     *
     * @param raw The raw response text, may be null
     * @return The remap of the first source UID, or empty if the text carries none
     */
    static Optional<UidRemap> parse(String raw) {
        List<UidRemap> remaps = parseAll(raw);
        return remaps.isEmpty() ? Optional.empty() : Optional.of(remaps.get(0));
    }

    /**
     * Parse the remap of one particular source UID
     *
     * @param raw The raw response text, may be null
     * @param sourceUid The UID that was copied
     * @return The remap for that UID, or empty if the text carries none for it
     */
    public static Optional<UidRemap> parse(String raw, long sourceUid) {
        for (UidRemap remap : parseAll(raw)) {
            if (remap.getSourceUid() == sourceUid) {
                return Optional.of(remap);
            }
        }
        return Optional.empty();
    }

    /**
     * Parse every source to destination pair the response carries
     *
     * @param raw The raw response text, may be null
     * @return The remaps in source set order, empty if none were found
     */
    public static List<UidRemap> parseAll(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return new ArrayList<>();
        }
        for (Pattern pattern : new Pattern[]{BRACKETED, UNBRACKETED, BARE}) {
            Matcher matcher = pattern.matcher(raw);
            if (matcher.find()) {
                List<UidRemap> remaps = toRemaps(matcher.group(1), matcher.group(2), matcher.group(3));
                if (!remaps.isEmpty()) {
                    return remaps;
                }
            }
        }
        return new ArrayList<>();
    }

    private static List<UidRemap> toRemaps(String uidValidity, String sourceSet, String targetSet) {
        List<UidRemap> remaps = new ArrayList<>();
        List<Long> sources = expand(sourceSet);
        List<Long> targets = expand(targetSet);
        if (sources.isEmpty() || sources.size() != targets.size()) {
            LOGGER.warning("Ignoring COPYUID with mismatched sets: " + sourceSet + " / " + targetSet);
            return remaps;
        }
        long validity;
        try {
            validity = Long.parseLong(uidValidity);
        } catch (NumberFormatException e) {
            LOGGER.warning("Ignoring COPYUID with invalid UIDVALIDITY: " + uidValidity);
            return remaps;
        }
        for (int i = 0; i < sources.size(); i++) {
            remaps.add(new UidRemap(validity, sources.get(i), targets.get(i)));
        }
        return remaps;
    }

    /**
     * Expand a UID set like "4:6,9" into its UIDs, empty if it is malformed or too large
     */
    static List<Long> expand(String uidSet) {
        List<Long> uids = new ArrayList<>();
        try {
            for (String part : uidSet.split(",")) {
                int colon = part.indexOf(':');
                if (colon < 0) {
                    uids.add(Long.parseLong(part));
                } else {
                    long a = Long.parseLong(part.substring(0, colon));
                    long b = Long.parseLong(part.substring(colon + 1));
                    long low = Math.min(a, b);
                    long high = Math.max(a, b);
                    if (high - low + uids.size() >= MAX_SET_SIZE) {
                        return new ArrayList<>();
                    }
                    for (long uid = low; uid <= high; uid++) {
                        uids.add(uid);
                    }
                }
                if (uids.size() > MAX_SET_SIZE) {
                    return new ArrayList<>();
                }
            }
        } catch (NumberFormatException e) {
            return new ArrayList<>();
        }
        return uids;
    }
}
