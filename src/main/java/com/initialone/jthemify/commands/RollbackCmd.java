package com.initialone.jthemify.commands;

import com.initialone.jthemify.backup.BackupException;
import com.initialone.jthemify.backup.BackupManager;
import com.initialone.jthemify.backup.BackupManifest;
import com.initialone.jthemify.backup.BackupVerification;
import com.initialone.jthemify.backup.RestoreReport;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

@CommandLine.Command(
        name = "rollback",
        description = "List backups or restore project files from one"
)
public class RollbackCmd implements Runnable {

    @CommandLine.Parameters(index = "0", description = "Project root")
    String projectDir;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    Target target;

    static class Target {
        @CommandLine.Option(names = "--list", required = true, description = "List available backups, newest first")
        boolean list;

        @CommandLine.Option(names = {"-b", "--backup-id"}, required = true, description = "Backup id to restore")
        String backupId;

        @CommandLine.Option(names = "--latest", required = true, description = "Restore the newest backup")
        boolean latest;
    }

    @CommandLine.Option(names = "--force", defaultValue = "false",
            description = "Restore the intact files even when the backup fails its integrity check")
    boolean force;

    @Override
    public void run() {
        Path root = Paths.get(projectDir);
        if (!Files.isDirectory(root)) {
            throw new CommandLine.ParameterException(new CommandLine(this), "project not a directory: " + root.toAbsolutePath());
        }
        BackupManager backups = new BackupManager(root);
        try {
            if (target.list) {
                list(backups);
                return;
            }
            String id = target.backupId;
            if (target.latest) {
                id = backups.latestBackup()
                        .map(BackupManifest::id)
                        .orElseThrow(() -> new BackupException("No backups under " + backups.backupRoot()));
            }
            restore(backups, id);
        } catch (BackupException e) {
            throw new CommandLine.ExecutionException(new CommandLine(this), "[rollback] " + e.getMessage(), e);
        }
    }

    private void list(BackupManager backups) throws BackupException {
        List<BackupManifest> all = backups.listBackups();
        if (all.isEmpty()) {
            System.out.println("[rollback] no backups found under " + backups.backupRoot());
            return;
        }
        for (BackupManifest m : all) {
            System.out.println("ID: " + m.id());
            System.out.println("   Created:  " + m.createdAt());
            System.out.println("   Files:    " + m.fileCount());
            System.out.println("   Location: " + m.location());
        }
        System.out.println("[rollback] restore with: jthemify rollback " + projectDir + " -b <ID>");
    }

    private void restore(BackupManager backups, String id) throws BackupException {
        System.out.println("[rollback] verifying backup " + id);
        BackupVerification v = backups.verifyBackup(id);
        if (!v.isValid()) {
            System.err.println("[rollback] integrity check failed: missing=" + v.missing() + " corrupted=" + v.corrupted());
            if (!force) {
                throw new CommandLine.ExecutionException(new CommandLine(this),
                        "backup " + id + " failed its integrity check; re-run with --force to restore the intact files");
            }
        } else {
            System.out.println("[rollback] backup verified (" + v.verified() + " files)");
        }

        RestoreReport report = backups.restoreBackup(id);
        report.missing().forEach(rel -> System.err.println("[rollback] not restored (missing copy): " + rel));
        report.corrupted().forEach(rel -> System.err.println("[rollback] not restored (hash mismatch): " + rel));
        report.failed().forEach(f -> System.err.println("[rollback] not restored: " + f));
        if (!report.failed().isEmpty()) {
            throw new CommandLine.ExecutionException(new CommandLine(this),
                    report.failed().size() + " files could not be restored from " + id);
        }
        System.out.println("[rollback] restored " + report.restored().size() + " files from " + id);
    }
}
