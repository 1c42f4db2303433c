package com.initialone.jthemify;

import com.initialone.jthemify.commands.*;
import picocli.CommandLine;

@CommandLine.Command(
        name = "jthemify",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Migrate static color constants to theme lookups in Java sources. Typical flow:",
                "  map-validate -> refactor --dry-run -> refactor --apply -> (rollback)",
                "",
                "Every --apply run snapshots the files it changes under <project>/.jthemify_backups.",
                "System properties: jthemify.backup.dir, jthemify.refactor.batch"
        },
        subcommands = {
                MapValidateCmd.class, RefactorCmd.class, RollbackCmd.class,
                VerifyBackupCmd.class, DeleteBackupCmd.class
        }
)
public class Main implements Runnable {
    public void run() { System.out.println("Use a subcommand. Try --help."); }
    public static void main(String[] args) {
        int code = new CommandLine(new Main()).execute(args);
        System.exit(code);
    }
}
