package com.solapi.sdk.storage;

/**
 * Upload categories accepted by SOLAPI storage.
 */
public enum FileType {
    MMS,
    DOCUMENT,
    RCS,
    KAKAO,
    FAX
}
