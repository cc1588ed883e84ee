package com.solapi.sdk.messages;

/**
 * Acceptance record for a sent message. A {@code statusCode} of {@code 2000} means queued; delivery is reported later
 * through the message list.
 */
public record SendResult(
    String groupId,
    String messageId,
    String accountId,
    String to,
    String from,
    MessageType type,
    String country,
    String statusCode,
    String statusMessage
) {
}
