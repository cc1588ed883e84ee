package com.solapi.sdk.messages;

/**
 * A single outbound message. Only {@code to}, {@code from} and {@code text} are required for SMS; the type is detected
 * by SOLAPI when omitted.
 *
 * @param to             recipient number.
 * @param from           registered sender number.
 * @param text           message body.
 * @param type           explicit message type, or {@code null} for auto detection.
 * @param subject        LMS/MMS subject line.
 * @param imageId        storage file id for MMS.
 * @param country        country calling code, {@code 82} when unset.
 * @param autoTypeDetect whether SOLAPI should pick the type from the body length.
 */
public record Message(
    String to,
    String from,
    String text,
    MessageType type,
    String subject,
    String imageId,
    String country,
    Boolean autoTypeDetect
) {

    public static Message text(String to, String from, String text) {
        return new Message(to, from, text, null, null, null, null, null);
    }

    public Message withType(MessageType type) {
        return new Message(to, from, text, type, subject, imageId, country, autoTypeDetect);
    }

    public Message withSubject(String subject) {
        return new Message(to, from, text, type, subject, imageId, country, autoTypeDetect);
    }

    public Message withImageId(String imageId) {
        return new Message(to, from, text, type, subject, imageId, country, autoTypeDetect);
    }

    public Message withCountry(String country) {
        return new Message(to, from, text, type, subject, imageId, country, autoTypeDetect);
    }
}
