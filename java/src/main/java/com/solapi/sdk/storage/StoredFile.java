package com.solapi.sdk.storage;

import java.time.Instant;

/**
 * File record kept by SOLAPI storage, returned on upload and in listings.
 */
public record StoredFile(
    String fileId,
    String type,
    String accountId,
    String name,
    String originalName,
    String link,
    String url,
    Instant dateCreated,
    Instant dateUpdated
) {
}
