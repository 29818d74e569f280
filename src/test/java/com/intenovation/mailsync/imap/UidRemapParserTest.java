package com.intenovation.mailsync.imap;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for UidRemapParser
 */
public class UidRemapParserTest {

    @Test
    public void testBracketedResponseCode() {
        Optional<UidRemap> remap = UidRemapParser.parse("A003 OK [COPYUID 38505 304 3956] Done");
        assertTrue(remap.isPresent());
        assertEquals(new UidRemap(38505, 304, 3956), remap.get());
    }

    @Test
    public void testUnbracketed() {
        Optional<UidRemap> remap = UidRemapParser.parse("OK COPYUID 7 12 40 completed");
        assertEquals(Optional.of(new UidRemap(7, 12, 40)), remap);
    }

    @Test
    public void testBareTriple() {
        Optional<UidRemap> remap = UidRemapParser.parse("1 437 6");
        assertEquals(Optional.of(new UidRemap(1, 437, 6)), remap);
    }

    @Test
    public void testBareTripleOnItsOwnLine() {
        String raw = "* 3 EXISTS\n1 437 6\nA001 OK done";
        assertEquals(Optional.of(new UidRemap(1, 437, 6)), UidRemapParser.parse(raw));
    }

    @Test
    public void testCaseInsensitive() {
        assertEquals(Optional.of(new UidRemap(5, 1, 2)), UidRemapParser.parse("a1 ok [copyuid 5 1 2] done"));
    }

    @Test
    public void testBracketedWinsOverBareNumbers() {
        String raw = "1 2 3\nA002 OK [COPYUID 9 10 11] Done";
        assertEquals(Optional.of(new UidRemap(9, 10, 11)), UidRemapParser.parse(raw));
    }

    @Test
    public void testNoRemap() {
        assertFalse(UidRemapParser.parse("A003 OK COPY completed").isPresent());
        assertFalse(UidRemapParser.parse("").isPresent());
        assertFalse(UidRemapParser.parse(null).isPresent());
        // two numbers are not a remap
        assertFalse(UidRemapParser.parse("12 13").isPresent());
    }

    @Test
    public void testUidSets() {
        List<UidRemap> remaps = UidRemapParser.parseAll("A1 OK [COPYUID 100 4:6,9 20:23] Done");
        assertEquals(Arrays.asList(
                new UidRemap(100, 4, 20),
                new UidRemap(100, 5, 21),
                new UidRemap(100, 6, 22),
                new UidRemap(100, 9, 23)), remaps);
    }

    @Test
    public void testParseForSourceUid() {
        String raw = "A1 OK [COPYUID 100 4:6 20:22] Done";
        assertEquals(Optional.of(new UidRemap(100, 5, 21)), UidRemapParser.parse(raw, 5));
        assertFalse(UidRemapParser.parse(raw, 7).isPresent());
    }

    @Test
    public void testMismatchedSetsAreIgnored() {
        assertTrue(UidRemapParser.parseAll("A1 OK [COPYUID 100 4:6 20:21] Done").isEmpty());
    }

    @Test
    public void testDescendingRangeIsNormalized() {
        assertEquals(Arrays.asList(3L, 4L, 5L), UidRemapParser.expand("5:3"));
    }

    @Test
    public void testHugeSetIsNotExpanded() {
        assertTrue(UidRemapParser.expand("1:4000000000").isEmpty());
        assertTrue(UidRemapParser.parseAll("OK [COPYUID 1 1:4000000000 1:4000000000]").isEmpty());
    }
}
