package com.initialone.jthemify.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.initialone.jthemify.model.FileFailure;
import com.initialone.jthemify.util.Tools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Snapshots project files before they are overwritten and puts them back on request.
 *
 * Layout:
 *   &lt;project&gt;/.jthemify_backups/&lt;id&gt;/.backup_manifest.json
 *   &lt;project&gt;/.jthemify_backups/&lt;id&gt;/&lt;relative path of each file&gt;
 *
 * Ids are millisecond timestamps, bumped until unused, so they are unique and increase.
 * The directory name can be changed with -Djthemify.backup.dir.
 */
public class BackupManager {
    public static final String DEFAULT_DIR = ".jthemify_backups";
    public static final String MANIFEST_FILE = ".backup_manifest.json";

    private final Path projectRoot;
    private final Path backupRoot;
    private final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private long lastId;

    public BackupManager(Path projectRoot) {
        this(projectRoot, projectRoot.resolve(System.getProperty("jthemify.backup.dir", DEFAULT_DIR)));
    }

    public BackupManager(Path projectRoot, Path backupRoot) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.backupRoot = backupRoot.toAbsolutePath().normalize();
    }

    public Path projectRoot() { return projectRoot; }
    public Path backupRoot() { return backupRoot; }

    /**
     * Copies every existing file of {@code paths} under a fresh backup id and writes the manifest.
     * Either the whole snapshot is written or nothing is left behind.
     *
     * @throws BackupException when a file lies outside the project or any copy/hash/write fails
     */
    public BackupManifest createBackup(Collection<Path> paths) throws BackupException {
        Set<Path> files = new LinkedHashSet<>();
        for (Path p : paths) files.add(p.toAbsolutePath().normalize());

        String id;
        Path dir;
        try {
            Files.createDirectories(backupRoot);
            id = nextId();
            dir = backupRoot.resolve(id);
            Files.createDirectory(dir);
        } catch (IOException e) {
            throw new BackupException("Cannot create backup directory under " + backupRoot, e);
        }
        System.out.println("[backup] creating " + id + " files=" + files.size());

        try {
            Map<String, String> hashes = new LinkedHashMap<>();
            for (Path file : files) {
                if (!file.startsWith(projectRoot)) {
                    throw new BackupException("File outside project root: " + file);
                }
                if (!Files.isRegularFile(file)) {
                    System.err.println("[backup] skip missing file: " + file);
                    continue;
                }
                Path rel = projectRoot.relativize(file);
                Path copy = dir.resolve(rel);
                Files.createDirectories(copy.getParent());
                Files.copy(file, copy, StandardCopyOption.COPY_ATTRIBUTES);
                hashes.put(Tools.unixPath(rel), hash(copy));
            }
            BackupManifest manifest = new BackupManifest(id, Instant.now().toString(), hashes.size(),
                    dir.toString(), hashes);
            om.writeValue(dir.resolve(MANIFEST_FILE).toFile(), manifest);
            System.out.println("[backup] created " + id + " files=" + hashes.size() + " at " + dir);
            return manifest;
        } catch (IOException | RuntimeException e) {
            BackupException failure = e instanceof BackupException
                    ? (BackupException) e
                    : new BackupException("Backup " + id + " failed: " + e.getMessage(), e);
            try {
                Tools.deleteTree(dir);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    /** 重新计算每个副本的哈希并与 manifest 比对 */
    public BackupVerification verifyBackup(String id) throws BackupException {
        Path dir = backupDir(id);
        BackupManifest manifest = readManifest(dir);
        int verified = 0;
        int missing = 0;
        int corrupted = 0;
        for (Map.Entry<String, String> e : manifest.fileHashes().entrySet()) {
            Path copy = dir.resolve(e.getKey());
            if (!Files.isRegularFile(copy)) {
                missing++;
                continue;
            }
            String actual;
            try {
                actual = hash(copy);
            } catch (IOException ex) {
                // 读不出来的副本同样不能用来恢复，算损坏
                System.err.println("[backup] cannot hash " + e.getKey() + ": " + ex.getMessage());
                corrupted++;
                continue;
            }
            if (e.getValue().equals(actual)) {
                verified++;
            } else {
                corrupted++;
            }
        }
        return new BackupVerification(verified, missing, corrupted);
    }

    /**
     * Copies every intact backup file back over its live file. Missing or corrupted copies
     * are reported and skipped; a failure on one file does not stop the others.
     */
    public RestoreReport restoreBackup(String id) throws BackupException {
        Path dir = backupDir(id);
        BackupManifest manifest = readManifest(dir);
        RestoreReport report = new RestoreReport(id);
        System.out.println("[backup] restoring " + id + " files=" + manifest.fileHashes().size());

        for (Map.Entry<String, String> e : manifest.fileHashes().entrySet()) {
            String rel = e.getKey();
            Path copy = dir.resolve(rel);
            Path target = projectRoot.resolve(rel).normalize();
            try {
                if (!Files.isRegularFile(copy)) {
                    System.err.println("[backup] backup file missing: " + rel);
                    report.missing(rel);
                    continue;
                }
                if (!e.getValue().equals(hash(copy))) {
                    System.err.println("[backup] hash mismatch, not restored: " + rel);
                    report.corrupted(rel);
                    continue;
                }
                if (!target.startsWith(projectRoot)) {
                    throw new IOException("manifest entry escapes project root");
                }
                if (target.getParent() != null) Files.createDirectories(target.getParent());
                Files.copy(copy, target, StandardCopyOption.REPLACE_EXISTING);
                report.restored(rel);
            } catch (IOException ex) {
                System.err.println("[backup] failed to restore " + rel + ": " + ex.getMessage());
                report.failed(new FileFailure(target, ex.getMessage()));
            }
        }
        System.out.println("[backup] restore " + id + ": " + report);
        return report;
    }

    /** 新的在前 */
    public List<BackupManifest> listBackups() throws BackupException {
        List<BackupManifest> out = new ArrayList<>();
        if (!Files.isDirectory(backupRoot)) return out;
        List<Path> dirs = new ArrayList<>();
        try (Stream<Path> s = Files.list(backupRoot)) {
            s.filter(Files::isDirectory).forEach(dirs::add);
        } catch (IOException e) {
            throw new BackupException("Cannot read backup root " + backupRoot, e);
        }
        for (Path d : dirs) {
            if (!Files.isRegularFile(d.resolve(MANIFEST_FILE))) continue;
            try {
                out.add(readManifest(d));
            } catch (BackupException e) {
                System.err.println("[backup] skip unreadable backup " + d.getFileName() + ": " + e.getMessage());
            }
        }
        out.sort(Comparator.comparing(BackupManifest::createdAtInstant)
                .thenComparing(m -> idNumber(m.id()))
                .reversed());
        return out;
    }

    public Optional<BackupManifest> latestBackup() throws BackupException {
        List<BackupManifest> all = listBackups();
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    public BackupManifest manifest(String id) throws BackupException {
        return readManifest(backupDir(id));
    }

    /** Irreversibly removes the manifest and every copy of the backup. */
    public void deleteBackup(String id) throws BackupException {
        Path dir = backupDir(id);
        try {
            Tools.deleteTree(dir);
        } catch (IOException e) {
            throw new BackupException("Failed to delete backup " + id, e);
        }
        System.out.println("[backup] deleted " + id);
    }

    /* ======================= internals ======================= */

    private synchronized String nextId() {
        long id = Math.max(System.currentTimeMillis(), lastId + 1);
        while (Files.exists(backupRoot.resolve(Long.toString(id)))) id++;
        lastId = id;
        return Long.toString(id);
    }

    private Path backupDir(String id) throws BackupException {
        if (id == null || id.isBlank() || id.contains("/") || id.contains("\\") || id.contains("..")) {
            throw new BackupException("Invalid backup id: " + id);
        }
        Path dir = backupRoot.resolve(id);
        if (!Files.isDirectory(dir)) {
            throw new BackupException("Backup not found: " + id);
        }
        return dir;
    }

    private BackupManifest readManifest(Path dir) throws BackupException {
        Path f = dir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(f)) {
            throw new BackupException("Backup manifest not found: " + f);
        }
        BackupManifest m;
        try {
            m = om.readValue(f.toFile(), BackupManifest.class);
        } catch (IOException e) {
            throw new BackupException("Unreadable backup manifest " + f + ": " + e.getMessage(), e);
        }
        if (m.id() == null || m.createdAt() == null) {
            throw new BackupException("Incomplete backup manifest " + f);
        }
        try {
            m.createdAtInstant();
        } catch (DateTimeParseException e) {
            throw new BackupException("Bad created_at in " + f + ": " + m.createdAt(), e);
        }
        return m;
    }

    /** SHA-256 hex of a file's bytes */
    protected String hash(Path file) throws IOException {
        return Tools.sha256Hex(file);
    }

    private static long idNumber(String id) {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            return -1L;
        }
    }
}
