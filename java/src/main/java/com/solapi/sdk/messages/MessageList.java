package com.solapi.sdk.messages;

import java.util.Map;

/**
 * One page of message history keyed by message id.
 */
public record MessageList(
    String startKey,
    String nextKey,
    Integer limit,
    Map<String, MessageSummary> messageList
) {
    public MessageList {
        messageList = messageList == null ? Map.of() : Map.copyOf(messageList);
    }
}
