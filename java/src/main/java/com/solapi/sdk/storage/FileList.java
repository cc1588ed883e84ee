package com.solapi.sdk.storage;

import java.util.Map;

/**
 * One page of the storage listing. {@code fileList} is keyed by file id; pass {@code nextKey} back as
 * {@code startKey} to fetch the following page.
 */
public record FileList(
    String startKey,
    String nextKey,
    Integer limit,
    Map<String, StoredFile> fileList
) {
    public FileList {
        fileList = fileList == null ? Map.of() : Map.copyOf(fileList);
    }
}
