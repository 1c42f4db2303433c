package com.initialone.jthemify.commands;

import com.initialone.jthemify.backup.BackupException;
import com.initialone.jthemify.backup.BackupManager;
import picocli.CommandLine;

import java.nio.file.Paths;

@CommandLine.Command(
        name = "delete-backup",
        description = "Irreversibly remove a backup and its file copies"
)
public class DeleteBackupCmd implements Runnable {

    @CommandLine.Parameters(index = "0", description = "Project root")
    String projectDir;

    @CommandLine.Parameters(index = "1", description = "Backup id")
    String backupId;

    @Override
    public void run() {
        try {
            new BackupManager(Paths.get(projectDir)).deleteBackup(backupId);
        } catch (BackupException e) {
            throw new CommandLine.ExecutionException(new CommandLine(this), e.getMessage(), e);
        }
    }
}
