package com.phillippitts.messagebridge.domain;

import com.phillippitts.messagebridge.exception.InvalidMessageException;

/**
 * Immutable outbound message: a recipient handle (phone number or e-mail) and a text body.
 *
 * <p>Validation happens at construction so an invalid message can never be admitted to the
 * delivery queue. Values are stored as given; trimming is the submitter's job.
 *
 * @param recipient non-blank recipient handle
 * @param body non-blank text, at most {@link #MAX_BODY_LENGTH} code points
 */
public record OutboundMessage(String recipient, String body) {

    /** Maximum body length accepted for delivery, in Unicode code points. */
    public static final int MAX_BODY_LENGTH = 10_000;

    public OutboundMessage {
        if (recipient == null || trim(recipient).isEmpty()) {
            throw new InvalidMessageException("recipient", "must not be empty");
        }
        if (body == null || trim(body).isEmpty()) {
            throw new InvalidMessageException("body", "must not be empty");
        }
        int length = body.codePointCount(0, body.length());
        if (length > MAX_BODY_LENGTH) {
            throw new InvalidMessageException("body",
                    "must be at most " + MAX_BODY_LENGTH + " characters (was " + length + ")");
        }
    }

    /**
     * Creates a message from untrusted input, trimming surrounding whitespace from both fields.
     * Unicode space separators such as U+00A0 count as whitespace here.
     *
     * @throws InvalidMessageException if either field is empty after trimming or the body is too long
     */
    public static OutboundMessage trimmed(String recipient, String body) {
        return new OutboundMessage(recipient == null ? null : trim(recipient),
                body == null ? null : trim(body));
    }

    private static String trim(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isSpace(value.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    @Override
    public String toString() {
        // Body omitted: message text is user content
        return "OutboundMessage[recipient=" + recipient + ", chars=" + body.codePointCount(0, body.length()) + "]";
    }
}
