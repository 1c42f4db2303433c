package com.initialone.jthemify.commands;

import com.initialone.jthemify.backup.BackupException;
import com.initialone.jthemify.backup.BackupManager;
import com.initialone.jthemify.backup.BackupVerification;
import picocli.CommandLine;

import java.nio.file.Paths;

@CommandLine.Command(
        name = "verify-backup",
        description = "Recompute the hashes of a backup and compare them with its manifest"
)
public class VerifyBackupCmd implements Runnable {

    @CommandLine.Parameters(index = "0", description = "Project root")
    String projectDir;

    @CommandLine.Parameters(index = "1", description = "Backup id")
    String backupId;

    @Override
    public void run() {
        BackupVerification v;
        try {
            v = new BackupManager(Paths.get(projectDir)).verifyBackup(backupId);
        } catch (BackupException e) {
            throw new CommandLine.ExecutionException(new CommandLine(this), e.getMessage(), e);
        }
        System.out.println("[backup] " + backupId + ": " + v);
        if (!v.isValid()) {
            throw new CommandLine.ExecutionException(new CommandLine(this), "backup " + backupId + " is not intact");
        }
    }
}
