package com.initialone.jthemify.backup;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted record of one snapshot, stored as {@code .backup_manifest.json} next to the copies.
 * Keys of {@code file_hashes} are project-relative paths with '/' separators.
 */
public final class BackupManifest {
    @JsonProperty("id")
    private final String id;
    @JsonProperty("created_at")
    private final String createdAt;
    @JsonProperty("file_count")
    private final int fileCount;
    @JsonProperty("location")
    private final String location;
    @JsonProperty("file_hashes")
    private final Map<String, String> fileHashes;

    @JsonCreator
    public BackupManifest(@JsonProperty("id") String id,
                          @JsonProperty("created_at") String createdAt,
                          @JsonProperty("file_count") int fileCount,
                          @JsonProperty("location") String location,
                          @JsonProperty("file_hashes") Map<String, String> fileHashes) {
        this.id = id;
        this.createdAt = createdAt;
        this.fileCount = fileCount;
        this.location = location;
        this.fileHashes = Collections.unmodifiableMap(new LinkedHashMap<>(fileHashes == null ? Map.of() : fileHashes));
    }

    public String id() { return id; }

    /** ISO-8601 instant */
    public String createdAt() { return createdAt; }

    public Instant createdAtInstant() { return Instant.parse(createdAt); }

    public int fileCount() { return fileCount; }

    /** Absolute backup directory at creation time */
    public String location() { return location; }

    public Map<String, String> fileHashes() { return fileHashes; }

    @Override
    public String toString() {
        return id + " (" + createdAt + ", files=" + fileCount + ")";
    }
}
