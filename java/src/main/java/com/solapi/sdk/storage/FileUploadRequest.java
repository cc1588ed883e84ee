package com.solapi.sdk.storage;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Describes a local file to upload.
 */
public final class FileUploadRequest {

    private final Path file;
    private final String name;
    private final FileType type;
    private final String link;

    private FileUploadRequest(Builder builder) {
        this.file = builder.file;
        this.name = builder.name;
        this.type = builder.type;
        this.link = builder.link;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return display name; defaults to the file name when unset.
     */
    public String getName() {
        if (name == null || name.isBlank()) {
            return file == null || file.getFileName() == null ? null : file.getFileName().toString();
        }
        return name;
    }

    public FileType getType() {
        return type;
    }

    public String getLink() {
        return link;
    }

    public static final class Builder {
        private Path file;
        private String name;
        private FileType type = FileType.MMS;
        private String link;

        public Builder file(Path file) {
            this.file = file;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(FileType type) {
            this.type = Objects.requireNonNull(type, "type");
            return this;
        }

        public Builder link(String link) {
            this.link = link;
            return this;
        }

        public FileUploadRequest build() {
            return new FileUploadRequest(this);
        }
    }
}
