package com.solapi.sdk.storage;

import com.solapi.sdk.SignedRequestClient;
import com.solapi.sdk.SolapiException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * SOLAPI storage resource: uploads images and documents referenced later by messages.
 */
public final class Storage {

    private static final Logger LOGGER = Logger.getLogger(Storage.class.getName());

    static final String FILES_PATH = "storage/v1/files";

    private final SignedRequestClient requests;

    public Storage(SignedRequestClient requests) {
        this.requests = Objects.requireNonNull(requests, "requests");
    }

    /**
     * Reads the file, base64-encodes it and uploads it.
     *
     * @throws SolapiException when the file is missing or unreadable, or when the upload call fails.
     */
    public StoredFile uploadFile(FileUploadRequest request) throws SolapiException {
        Objects.requireNonNull(request, "request");
        Path file = request.getFile();
        if (file == null) {
            throw new SolapiException("file is required");
        }

        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException ex) {
            throw new SolapiException("file not found: " + file, ex);
        } catch (IOException ex) {
            throw new SolapiException("failed to read file " + file + ": " + ex.getMessage(), ex);
        }

        LOGGER.fine(() -> "[solapi-sdk] uploading " + content.length + " bytes from " + file.getFileName());
        UploadBody body = new UploadBody(
            Base64.getEncoder().encodeToString(content),
            request.getName(),
            request.getType() == null ? null : request.getType().name(),
            request.getLink()
        );
        return requests.post(FILES_PATH, body, StoredFile.class);
    }

    /**
     * @param params optional filters such as {@code type}, {@code startKey} and {@code limit}.
     */
    public FileList getFileList(Map<String, String> params) throws SolapiException {
        return requests.get(FILES_PATH, params, FileList.class);
    }

    private record UploadBody(String file, String name, String type, String link) {
    }
}
