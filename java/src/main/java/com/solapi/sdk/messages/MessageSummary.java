package com.solapi.sdk.messages;

import java.time.Instant;

/**
 * Message as reported by the history listing.
 */
public record MessageSummary(
    String messageId,
    String groupId,
    String accountId,
    MessageType type,
    String to,
    String from,
    String text,
    String subject,
    String country,
    String status,
    String statusCode,
    String reason,
    Instant dateCreated,
    Instant dateUpdated,
    Instant dateProcessed,
    Instant dateReported
) {
}
