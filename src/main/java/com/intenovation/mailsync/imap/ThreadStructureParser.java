package com.intenovation.mailsync.imap;

import com.intenovation.mailsync.MailSyncException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses an RFC 5256 THREAD response into a forest of {@link ThreadNode}.
 * <p>
 * In {@code (3 6 (4 23)(44 7 96))} message 6 replies to 3, and 6 has two
 * branches: 4 with reply 23, and 44 with 7 and 96 below it. A list that opens
 * with nested lists, as in {@code ((3)(5))}, has a missing root and becomes a
 * placeholder node.
 */
public final class ThreadStructureParser {

    private final String text;
    private int pos;

    private ThreadStructureParser(String text) {
        this.text = text;
    }

    /**
     * Parse a THREAD response
     *
     * @param response The response, with or without the leading "* THREAD"
     * @return The thread roots in response order
     * @throws MailSyncException If the response is malformed
     */
    public static List<ThreadNode> parse(String response) throws MailSyncException {
        if (response == null) {
            return new ArrayList<>();
        }
        String body = response;
        int keyword = body.toUpperCase(Locale.ROOT).indexOf("THREAD");
        if (keyword >= 0) {
            body = body.substring(keyword + "THREAD".length());
        }
        return new ThreadStructureParser(body).parseThreads();
    }

    private List<ThreadNode> parseThreads() throws MailSyncException {
        List<ThreadNode> roots = new ArrayList<>();
        skipWhitespace();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c != '(') {
                if (c == '\r' || c == '\n') {
                    break;
                }
                throw malformed("expected '('");
            }
            ThreadNode root = parseList();
            if (root != null) {
                roots.add(root);
            }
            skipWhitespace();
        }
        return roots;
    }

    private ThreadNode parseList() throws MailSyncException {
        pos++; // '('
        ThreadNode head = null;
        ThreadNode tail = null;
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                throw malformed("unterminated thread list");
            }
            char c = text.charAt(pos);
            if (c == ')') {
                pos++;
                return head;
            } else if (c == '(') {
                if (head == null) {
                    head = ThreadNode.placeholder();
                    tail = head;
                }
                ThreadNode branch = parseList();
                if (branch != null) {
                    tail.addChild(branch);
                }
            } else if (Character.isDigit(c)) {
                ThreadNode node = ThreadNode.of(parseNumber());
                if (head == null) {
                    head = node;
                } else {
                    tail.addChild(node);
                }
                tail = node;
            } else {
                throw malformed("unexpected '" + c + "'");
            }
        }
    }

    private long parseNumber() throws MailSyncException {
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        try {
            return Long.parseLong(text.substring(start, pos));
        } catch (NumberFormatException e) {
            throw malformed("invalid number");
        }
    }

    private void skipWhitespace() {
        while (pos < text.length() && text.charAt(pos) == ' ') {
            pos++;
        }
    }

    private MailSyncException malformed(String reason) {
        return new MailSyncException("Malformed THREAD response at position " + pos + ": " + reason);
    }
}
