package com.initialone.jthemify.commands;

import com.initialone.jthemify.backup.BackupException;
import com.initialone.jthemify.mapping.MappingValidator;
import com.initialone.jthemify.model.FileFailure;
import com.initialone.jthemify.model.MappingTable;
import com.initialone.jthemify.model.RefactorRun;
import com.initialone.jthemify.model.RunOutcome;
import com.initialone.jthemify.model.UnmappedConstant;
import com.initialone.jthemify.model.ValidationReport;
import com.initialone.jthemify.refactor.CodeRefactorer;
import com.initialone.jthemify.refactor.DiffGenerator;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Rewrites mapped constant references of a project.
 * --dry-run only plans and reports; --apply validates, snapshots the files about to change and writes them.
 * An apply with validation errors is refused unless --force is given.
 */
@CommandLine.Command(
        name = "refactor",
        description = "Rewrite mapped constant references to theme lookups (dry-run or apply)"
)
public class RefactorCmd implements Runnable {

    @CommandLine.Parameters(index = "0", description = "Project root")
    String projectDir;

    @CommandLine.Option(names = {"-m", "--mapping"}, required = true,
            description = "Mapping file (.yaml, .yml or .json)")
    String mappingFile;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    Mode mode;

    static class Mode {
        @CommandLine.Option(names = "--dry-run", required = true, description = "Plan and report, write nothing")
        boolean dryRun;

        @CommandLine.Option(names = "--apply", required = true, description = "Back up, then write the rewritten files")
        boolean apply;
    }

    @CommandLine.Option(names = "--force", defaultValue = "false",
            description = "Apply even when validation reports errors")
    boolean force;

    @CommandLine.Option(names = "--batch", defaultValue = "${sys:jthemify.refactor.batch:-50}",
            description = "Files per batch (default: ${DEFAULT-VALUE})")
    int batch;

    @CommandLine.Option(names = "--exclude", split = ",",
            description = "Comma-separated globs of project-relative paths to skip")
    List<String> excludes;

    @CommandLine.Option(names = "--diff", defaultValue = "false", description = "Print a unified diff of the plan")
    boolean printDiff;

    @CommandLine.Option(names = "--diff-html", description = "Write an HTML review page to this file")
    String diffHtml;

    @Override
    public void run() {
        Path root = Paths.get(projectDir).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new CommandLine.ParameterException(new CommandLine(this), "project not a directory: " + root);
        }
        Path mapPath = Paths.get(mappingFile);
        MappingTable mapping = MapValidateCmd.loadMapping(new CommandLine(this), mapPath);
        ValidationReport mapReport = new MappingValidator().validate(mapping, mapPath.getFileName().toString());
        if (!mapReport.isClean()) mapReport.print(System.out, "[map-validate]");
        if (!mapReport.isValid()) {
            throw new CommandLine.ExecutionException(new CommandLine(this),
                    "mapping has " + mapReport.errors().size() + " errors; fix it before refactoring");
        }

        boolean dryRun = mode.dryRun;
        RefactorRun run;
        try {
            run = new CodeRefactorer()
                    .batchSize(batch)
                    .excludes(excludes)
                    .refactor(root, mapping, dryRun, force);
        } catch (BackupException e) {
            throw new CommandLine.ExecutionException(new CommandLine(this),
                    "backup failed, no file was written: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new CommandLine.ExecutionException(new CommandLine(this), e.getMessage(), e);
        }

        run.validation().print(System.out, "[validate]");
        for (FileFailure f : run.failures()) {
            System.err.println("[refactor] failed: " + f);
        }

        printUnmapped(run);

        DiffGenerator diff = new DiffGenerator();
        if (printDiff) System.out.print(diff.unifiedDiff(run));
        if (diffHtml != null && !diffHtml.isBlank()) {
            try {
                diff.writeHtmlReport(run, Paths.get(diffHtml));
            } catch (IOException e) {
                throw new CommandLine.ExecutionException(new CommandLine(this), "cannot write " + diffHtml + ": " + e.getMessage(), e);
            }
        }

        if (run.outcome() == RunOutcome.BLOCKED) {
            throw new CommandLine.ExecutionException(new CommandLine(this),
                    "apply blocked by " + run.validation().errors().size() + " validation errors");
        }
        if (dryRun) {
            System.out.println("[refactor] to apply these changes, re-run with --apply");
        }
        run.backupId().ifPresent(id ->
                System.out.println("[refactor] backup " + id + "; undo with: jthemify rollback " + projectDir + " -b " + id));
    }

    /** 未映射的常量只提示，不算错误 */
    private static void printUnmapped(RefactorRun run) {
        List<UnmappedConstant> unmapped = run.unmapped();
        if (unmapped.isEmpty()) return;
        System.out.println("[unmapped] " + unmapped.size() + " constants have no mapping and were left as is:");
        for (UnmappedConstant u : unmapped) {
            System.out.println("[unmapped]   " + u.level() + " " + u.qualifiedName() + " x" + u.usageCount()
                    + " first at " + u.locations().get(0));
        }
        System.out.println("[unmapped] add them to strict_mappings, extensions or preserved to silence this");
    }
}
